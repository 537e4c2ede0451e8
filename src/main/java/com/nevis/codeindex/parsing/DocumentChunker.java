package com.nevis.codeindex.parsing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.codeindex.model.ChunkKind;
import com.nevis.codeindex.model.ChunkNode;
import com.nevis.codeindex.model.SourceFile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Chunks prose and project configuration: Markdown by H1-H3 section, reStructuredText as one
 * chunk, plain text by paragraph, and a whitelist of configuration files as one chunk each.
 * {@code package.json} is condensed to its name, version, description, scripts and dependencies.
 */
@Slf4j
@Component
public class DocumentChunker {

    public static final String MARKDOWN = "markdown";
    public static final String RESTRUCTURED_TEXT = "restructuredtext";
    public static final String TEXT = "text";

    static final String SECTION_NODE_TYPE = "document_section";
    static final String CONFIG_NODE_TYPE = "config_file";
    static final String PACKAGE_JSON = "package.json";

    static final int MAX_SECTION_CHARS = 8000;
    static final int MAX_CONFIG_CHARS = 5000;
    static final int MAX_PACKAGE_JSON_CHARS = 3000;
    static final int MIN_SECTION_CHARS = 50;
    static final int MIN_PARAGRAPH_CHARS = 100;
    static final int PARAGRAPH_OVERLAP_CHARS = 200;

    private static final Map<String, String> DOC_EXTENSIONS = Map.of(
            ".md", MARKDOWN,
            ".markdown", MARKDOWN,
            ".rst", RESTRUCTURED_TEXT,
            ".txt", TEXT);

    private static final Map<String, String> CONFIG_FILES = Map.of(
            PACKAGE_JSON, "json",
            "pyproject.toml", "toml",
            "docker-compose.yml", "yaml",
            "docker-compose.yaml", "yaml",
            ".env.example", TEXT);

    private static final Pattern HEADING = Pattern.compile("^(#{1,3})\\s+(.+)$", Pattern.MULTILINE);
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n{2,}");

    private final ObjectMapper objectMapper;

    public DocumentChunker(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static Optional<String> detectLanguage(String path) {
        String name = fileName(path);
        String config = CONFIG_FILES.get(name);
        if (config != null) {
            return Optional.of(config);
        }
        int dot = name.lastIndexOf('.');
        if (dot <= 0) {
            return Optional.empty();
        }
        return Optional.ofNullable(DOC_EXTENSIONS.get(name.substring(dot).toLowerCase(Locale.ROOT)));
    }

    public static boolean isDocument(String path) {
        return detectLanguage(path).isPresent();
    }

    public static boolean isConfigFile(String path) {
        return CONFIG_FILES.containsKey(fileName(path));
    }

    public List<ChunkNode> chunk(UUID repositoryId, SourceFile file, String source) {
        if (source.isBlank()) {
            return List.of();
        }
        Chunks chunks = new Chunks(repositoryId, file, source);
        String path = file.relativePath();
        if (PACKAGE_JSON.equals(fileName(path))) {
            chunks.packageJson();
        } else if (isConfigFile(path)) {
            chunks.whole(ChunkKind.CONFIG, fileName(path), MAX_CONFIG_CHARS);
        } else if (MARKDOWN.equals(file.language())) {
            chunks.markdown();
        } else if (RESTRUCTURED_TEXT.equals(file.language())) {
            chunks.whole(ChunkKind.DOCUMENT, fileName(path), MAX_SECTION_CHARS);
        } else {
            chunks.paragraphs();
        }
        log.debug("Chunked document {} into {} sections", path, chunks.result.size());
        return chunks.result;
    }

    private final class Chunks {

        private final UUID repositoryId;
        private final SourceFile file;
        private final String source;
        private final LineIndex lines;
        private final List<ChunkNode> result = new ArrayList<>();

        Chunks(UUID repositoryId, SourceFile file, String source) {
            this.repositoryId = repositoryId;
            this.file = file;
            this.source = source;
            this.lines = new LineIndex(source);
        }

        void markdown() {
            List<Heading> headings = new ArrayList<>();
            Matcher matcher = HEADING.matcher(source);
            while (matcher.find()) {
                headings.add(new Heading(matcher.start(), matcher.group(2).strip()));
            }
            if (headings.isEmpty()) {
                whole(ChunkKind.DOCUMENT, stem(file.relativePath()), MAX_SECTION_CHARS);
                return;
            }
            for (int i = 0; i < headings.size(); i++) {
                Heading heading = headings.get(i);
                int end = i + 1 < headings.size() ? headings.get(i + 1).start() : source.length();
                String section = source.substring(heading.start(), end).strip();
                if (section.length() < MIN_SECTION_CHARS) {
                    continue;
                }
                int startLine = lines.lineOf(heading.start());
                int endLine = lines.lineOf(end);
                if (section.length() > MAX_SECTION_CHARS) {
                    splitSection(section, heading, startLine, endLine);
                } else {
                    add(ChunkKind.DOCUMENT, SECTION_NODE_TYPE, truncate(heading.title(), 100),
                        heading.start(), startLine, endLine, section);
                }
            }
        }

        void paragraphs() {
            Matcher breaks = PARAGRAPH_BREAK.matcher(source);
            int start = 0;
            boolean more = true;
            while (more) {
                more = breaks.find();
                int end = more ? breaks.start() : source.length();
                String paragraph = source.substring(start, end).strip();
                if (paragraph.length() >= MIN_PARAGRAPH_CHARS) {
                    add(ChunkKind.DOCUMENT, SECTION_NODE_TYPE, truncate(paragraph, 60), start,
                        lines.lineOf(start), lines.lineOf(Math.max(start, end - 1)), truncate(paragraph, MAX_SECTION_CHARS));
                }
                if (more) {
                    start = breaks.end();
                }
            }
        }

        void whole(ChunkKind kind, String name, int maxChars) {
            add(kind, SECTION_NODE_TYPE, name, 0, 1, lines.lineCount(), truncate(source, maxChars));
        }

        void packageJson() {
            String content;
            try {
                content = truncate(summarizePackage(objectMapper.readTree(source)), MAX_PACKAGE_JSON_CHARS);
            } catch (JsonProcessingException e) {
                log.debug("{} is not valid JSON, indexing it verbatim: {}", file.relativePath(), e.getOriginalMessage());
                content = truncate(source, MAX_PACKAGE_JSON_CHARS);
            }
            if (content.isBlank()) {
                content = truncate(source, MAX_PACKAGE_JSON_CHARS);
            }
            add(ChunkKind.CONFIG, CONFIG_NODE_TYPE, PACKAGE_JSON, 0, 1, lines.lineCount(), content);
        }

        private void splitSection(String section, Heading heading, int startLine, int endLine) {
            String base = truncate(heading.title(), 80);
            List<String> parts = new ArrayList<>();
            String current = "";
            for (String paragraph : PARAGRAPH_BREAK.split(section)) {
                if (current.length() + paragraph.length() > MAX_SECTION_CHARS && !current.isBlank()) {
                    parts.add(current.strip());
                    current = current.substring(Math.max(0, current.length() - PARAGRAPH_OVERLAP_CHARS)) + "\n\n" + paragraph;
                } else {
                    current = current.isEmpty() ? paragraph : current + "\n\n" + paragraph;
                }
            }
            if (!current.isBlank()) {
                parts.add(current.strip());
            }
            for (int part = 0; part < parts.size(); part++) {
                String name = parts.size() > 1 ? base + " (part " + (part + 1) + ")" : truncate(heading.title(), 100);
                add(ChunkKind.DOCUMENT, SECTION_NODE_TYPE, name, heading.start(), startLine, endLine, parts.get(part));
            }
        }

        private void add(ChunkKind kind, String nodeType, String name, int startOffset, int startLine, int endLine,
                         String content) {
            result.add(new ChunkNode(
                ChunkNode.deriveId(repositoryId, file.relativePath(), file.contentHash(), nodeType, name,
                    startLine, startOffset),
                repositoryId,
                file.relativePath(),
                file.contentHash(),
                kind,
                nodeType,
                name,
                null,
                file.language(),
                startLine,
                Math.max(startLine, endLine),
                content,
                List.of(),
                List.of(),
                null,
                false,
                List.of(),
                null
            ));
        }
    }

    private record Heading(int start, String title) {}

    private static String summarizePackage(JsonNode root) {
        List<String> lines = new ArrayList<>();
        text(root, "name").ifPresent(name -> lines.add("Package: " + name));
        text(root, "version").ifPresent(version -> lines.add("Version: " + version));
        text(root, "description").ifPresent(description -> lines.add("Description: " + description));
        JsonNode scripts = root.path("scripts");
        if (scripts.isObject() && !scripts.isEmpty()) {
            List<String> entries = scripts.properties().stream()
                    .limit(20)
                    .map(script -> script.getKey() + ": " + script.getValue().asText())
                    .toList();
            lines.add("Scripts: " + String.join(", ", entries));
        }
        JsonNode dependencies = root.path("dependencies");
        if (dependencies.isObject() && !dependencies.isEmpty()) {
            List<String> names = dependencies.properties().stream().limit(30).map(Map.Entry::getKey).toList();
            lines.add("Dependencies: " + String.join(", ", names));
        }
        return String.join("\n", lines);
    }

    private static Optional<String> text(JsonNode root, String field) {
        JsonNode value = root.path(field);
        return value.isValueNode() && !value.asText().isBlank() ? Optional.of(value.asText()) : Optional.empty();
    }

    private static String truncate(String text, int maxChars) {
        return text.length() > maxChars ? text.substring(0, maxChars) : text;
    }

    private static String fileName(String path) {
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    private static String stem(String path) {
        String name = fileName(path);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
