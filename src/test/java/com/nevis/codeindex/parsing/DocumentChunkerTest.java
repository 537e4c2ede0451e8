package com.nevis.codeindex.parsing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.codeindex.model.ChunkKind;
import com.nevis.codeindex.model.ChunkNode;
import com.nevis.codeindex.model.SourceFile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class DocumentChunkerTest {

    private final UUID repoId = UUID.randomUUID();
    private final DocumentChunker chunker = new DocumentChunker(new ObjectMapper());

    private List<ChunkNode> chunk(String path, String source) {
        String language = DocumentChunker.detectLanguage(path).orElseThrow();
        return chunker.chunk(repoId, new SourceFile(path, Path.of("/tmp", path), language, "hash-1", 100), source);
    }

    @Test
    @DisplayName("Markdown is cut at H1-H3 headings and short sections are dropped")
    void markdownSections() {
        String source = """
            # Title
            short

            ## Install
            Run the installer with the default options and restart the service afterwards.

            ## Usage
            Call the endpoint with a repository url and wait for the indexing task to finish.
            """;

        List<ChunkNode> chunks = chunk("docs/README.md", source);

        assertThat(chunks).extracting(ChunkNode::symbolName).containsExactly("Install", "Usage");
        ChunkNode install = chunks.get(0);
        assertThat(install.kind()).isEqualTo(ChunkKind.DOCUMENT);
        assertThat(install.nodeType()).isEqualTo("document_section");
        assertThat(install.language()).isEqualTo("markdown");
        assertThat(install.startLine()).isEqualTo(4);
        assertThat(install.content()).startsWith("## Install").doesNotContain("## Usage");
    }

    @Test
    @DisplayName("Markdown without headings is one chunk named after the file")
    void markdownWithoutHeadings() {
        List<ChunkNode> chunks = chunk("notes.md", "Just a few words about the project.\n");

        assertThat(chunks).singleElement().extracting(ChunkNode::symbolName).isEqualTo("notes");
    }

    @Test
    @DisplayName("Oversized Markdown sections are split on paragraph boundaries")
    void longSectionSplit() {
        String paragraph = "word ".repeat(400).strip();
        String source = "# Big\n\n" + String.join("\n\n", List.of(paragraph, paragraph, paragraph, paragraph, paragraph));

        List<ChunkNode> chunks = chunk("big.md", source);

        assertThat(chunks).hasSizeGreaterThan(1);
        assertThat(chunks).extracting(ChunkNode::symbolName).startsWith("Big (part 1)", "Big (part 2)");
        assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.content().length()).isLessThanOrEqualTo(8000 + 202));
        assertThat(chunks).extracting(ChunkNode::id).doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("Plain text keeps only substantial paragraphs with their line numbers")
    void textParagraphs() {
        String longParagraph = "This paragraph explains how incremental synchronisation compares content hashes "
            + "instead of revision ids.";
        String source = "Intro\n\n" + longParagraph + "\n";

        List<ChunkNode> chunks = chunk("NOTES.txt", source);

        assertThat(chunks).singleElement().satisfies(chunk -> {
            assertThat(chunk.content()).isEqualTo(longParagraph);
            assertThat(chunk.symbolName()).isEqualTo(longParagraph.substring(0, 60));
            assertThat(chunk.startLine()).isEqualTo(3);
        });
    }

    @Test
    @DisplayName("reStructuredText is indexed as a single chunk")
    void restructuredText() {
        List<ChunkNode> chunks = chunk("docs/guide.rst", "Guide\n=====\n\nSome text.\n");

        assertThat(chunks).singleElement().satisfies(chunk -> {
            assertThat(chunk.symbolName()).isEqualTo("guide.rst");
            assertThat(chunk.language()).isEqualTo("restructuredtext");
            assertThat(chunk.endLine()).isEqualTo(5);
        });
    }

    @Test
    @DisplayName("package.json is condensed to its key fields")
    void packageJson() {
        String source = """
            {"name": "web", "version": "1.2.0", "private": true,
             "scripts": {"build": "vite build", "test": "vitest"},
             "dependencies": {"vue": "^3.4.0", "pinia": "^2.1.0"}}
            """;

        List<ChunkNode> chunks = chunk("frontend/package.json", source);

        assertThat(chunks).singleElement().satisfies(chunk -> {
            assertThat(chunk.kind()).isEqualTo(ChunkKind.CONFIG);
            assertThat(chunk.nodeType()).isEqualTo("config_file");
            assertThat(chunk.language()).isEqualTo("json");
            assertThat(chunk.content()).isEqualTo("""
                Package: web
                Version: 1.2.0
                Scripts: build: vite build, test: vitest
                Dependencies: vue, pinia""");
        });
    }

    @Test
    @DisplayName("Malformed package.json is indexed verbatim")
    void malformedPackageJson() {
        List<ChunkNode> chunks = chunk("package.json", "{\"name\": ");

        assertThat(chunks).singleElement().extracting(ChunkNode::content).isEqualTo("{\"name\": ");
    }

    @Test
    @DisplayName("Whitelisted configuration files are single chunks and other names are not documents")
    void configurationFiles() {
        List<ChunkNode> chunks = chunk("docker-compose.yml", "services:\n  db:\n    image: postgres\n");

        assertThat(chunks).singleElement().satisfies(chunk -> {
            assertThat(chunk.kind()).isEqualTo(ChunkKind.CONFIG);
            assertThat(chunk.language()).isEqualTo("yaml");
        });
        assertThat(DocumentChunker.detectLanguage("config/settings.json")).isEmpty();
        assertThat(DocumentChunker.detectLanguage(".env")).isEmpty();
        assertThat(DocumentChunker.detectLanguage(".env.example")).contains("text");
    }

    @Test
    @DisplayName("Blank documents yield no chunks")
    void blank() {
        assertThat(chunk("empty.md", "\n  \n")).isEmpty();
    }
}
