package com.nevis.codeindex.parsing;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
public class LanguageRegistry {

    private final Map<String, LanguageGrammar> byLanguage = new LinkedHashMap<>();
    private final Map<String, LanguageGrammar> byExtension = new LinkedHashMap<>();

    public LanguageRegistry(List<LanguageGrammar> grammars) {
        for (LanguageGrammar grammar : grammars) {
            byLanguage.put(grammar.language(), grammar);
            grammar.extensions().forEach(ext -> byExtension.put(ext.toLowerCase(Locale.ROOT), grammar));
        }
        log.info("Registered grammars: {} (extensions {})", byLanguage.keySet(), byExtension.keySet());
    }

    public Optional<LanguageGrammar> forLanguage(String language) {
        return Optional.ofNullable(byLanguage.get(language));
    }

    public Optional<LanguageGrammar> forPath(String path) {
        String extension = extensionOf(path);
        return extension.isEmpty() ? Optional.empty() : Optional.ofNullable(byExtension.get(extension));
    }

    public Optional<String> detectLanguage(String path) {
        Optional<String> language = forPath(path).map(LanguageGrammar::language);
        return language.isPresent() ? language : DocumentChunker.detectLanguage(path);
    }

    private static String extensionOf(String path) {
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        int dot = path.lastIndexOf('.');
        if (dot <= slash + 1) {
            return "";
        }
        return path.substring(dot).toLowerCase(Locale.ROOT);
    }
}
