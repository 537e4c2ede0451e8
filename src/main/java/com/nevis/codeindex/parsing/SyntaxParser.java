package com.nevis.codeindex.parsing;

import com.nevis.codeindex.exception.SourceParseException;

public interface SyntaxParser {

    SyntaxTree parse(String filePath, String source);
}
