package com.nevis.codeindex.model;

import java.util.List;
import java.util.Map;

public record StructuralIndex(Map<String, FileOutline> files) {

    public record FileOutline(
        String language,
        List<String> functions,
        List<String> classes,
        List<String> constants
    ) {}
}
