package com.nevis.codeindex.service;

import com.nevis.codeindex.config.IndexingProperties;
import com.nevis.codeindex.model.ChangeSet;
import com.nevis.codeindex.model.FileCheckpoint;
import com.nevis.codeindex.model.SourceFile;
import com.nevis.codeindex.parsing.DocumentChunker;
import com.nevis.codeindex.parsing.LanguageRegistry;
import com.nevis.codeindex.repository.ChunkVectorStore;
import com.nevis.codeindex.repository.FileCheckpointRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
public class ChangeDetector {

    static final Set<String> SKIP_DIRS = Set.of(
        "node_modules", ".git", "__pycache__", ".venv", "venv", "dist", "build", ".next", ".nuxt",
        "target", "vendor", ".idea", ".vscode", ".pytest_cache", ".mypy_cache", ".gradle", ".tox");

    static final Set<String> SKIP_FILES = Set.of(
        "package-lock.json", "yarn.lock", "pnpm-lock.yaml", "Pipfile.lock", "poetry.lock", "go.sum",
        "composer.lock", "Gemfile.lock");

    private static final int LOOKUP_BATCH = 1_000;

    private final LanguageRegistry languageRegistry;
    private final FileCheckpointRepository checkpointRepository;
    private final ChunkVectorStore vectorStore;
    private final long maxFileSizeBytes;
    private final long maxDocumentSizeBytes;

    public ChangeDetector(LanguageRegistry languageRegistry,
                          FileCheckpointRepository checkpointRepository,
                          ChunkVectorStore vectorStore,
                          IndexingProperties properties) {
        this.languageRegistry = languageRegistry;
        this.checkpointRepository = checkpointRepository;
        this.vectorStore = vectorStore;
        this.maxFileSizeBytes = properties.maxFileSizeBytes();
        this.maxDocumentSizeBytes = properties.maxDocumentSizeBytes();
    }

    public ChangeSet detect(UUID repositoryId, Path root, boolean forceFull) {
        List<SourceFile> files = scan(root);
        Map<String, FileCheckpoint> checkpoints = checkpointRepository.findByRepositoryId(repositoryId).stream()
            .collect(Collectors.toMap(FileCheckpoint::filePath, Function.identity(), (a, b) -> a, LinkedHashMap::new));

        List<SourceFile> added = new ArrayList<>();
        List<SourceFile> modified = new ArrayList<>();
        List<SourceFile> unchanged = new ArrayList<>();
        Set<String> onDisk = new HashSet<>();

        for (SourceFile file : files) {
            onDisk.add(file.relativePath());
            FileCheckpoint checkpoint = checkpoints.get(file.relativePath());
            if (forceFull) {
                modified.add(file);
            } else if (checkpoint == null) {
                added.add(file);
            } else if (!checkpoint.contentHash().equals(file.contentHash())) {
                modified.add(file);
            } else {
                unchanged.add(file);
            }
        }

        List<FileCheckpoint> deleted = checkpoints.values().stream()
            .filter(checkpoint -> !onDisk.contains(checkpoint.filePath()))
            .toList();

        if (!unchanged.isEmpty()) {
            Set<String> inconsistent = findMissingChunks(repositoryId, unchanged, checkpoints);
            if (!inconsistent.isEmpty()) {
                log.warn("{} unchanged files reference chunks missing from the vector store, re-embedding them", inconsistent.size());
                unchanged.stream().filter(file -> inconsistent.contains(file.relativePath())).forEach(modified::add);
                unchanged.removeIf(file -> inconsistent.contains(file.relativePath()));
            }
        }

        ChangeSet changeSet = new ChangeSet(added, modified, unchanged, deleted);
        log.info("Change detection for {}: {} added, {} modified, {} unchanged, {} deleted",
            repositoryId, added.size(), modified.size(), unchanged.size(), deleted.size());
        return changeSet;
    }

    public List<SourceFile> scan(Path root) {
        List<SourceFile> files = new ArrayList<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && SKIP_DIRS.contains(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile()) {
                        toSourceFile(root, file, attrs.size()).ifPresent(files::add);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    log.warn("Skipping unreadable path {}: {}", file, e.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot walk " + root, e);
        }
        files.sort(Comparator.comparing(SourceFile::relativePath));
        return files;
    }

    public static String sha256(Path file) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        try (InputStream in = Files.newInputStream(file)) {
            byte[] buffer = new byte[8192];
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private Optional<SourceFile> toSourceFile(Path root, Path file, long size) {
        String name = file.getFileName().toString();
        if (SKIP_FILES.contains(name) || (name.startsWith(".env") && !DocumentChunker.isConfigFile(name))) {
            return Optional.empty();
        }
        String relativePath = root.relativize(file).toString().replace('\\', '/');
        Optional<String> language = languageRegistry.detectLanguage(relativePath);
        if (language.isEmpty()) {
            return Optional.empty();
        }
        long limit = DocumentChunker.isDocument(relativePath) ? maxDocumentSizeBytes : maxFileSizeBytes;
        if (size > limit) {
            log.warn("Skipping {}: {} bytes exceeds the {} byte limit", relativePath, size, limit);
            return Optional.empty();
        }
        try {
            return Optional.of(new SourceFile(relativePath, file, language.get(), sha256(file), size));
        } catch (IOException e) {
            log.warn("Skipping {}: {}", relativePath, e.getMessage());
            return Optional.empty();
        }
    }

    private Set<String> findMissingChunks(UUID repositoryId, List<SourceFile> unchanged, Map<String, FileCheckpoint> checkpoints) {
        List<UUID> referenced = new ArrayList<>();
        unchanged.forEach(file -> referenced.addAll(checkpoints.get(file.relativePath()).chunkIds()));
        Set<UUID> present = new HashSet<>();
        for (int from = 0; from < referenced.size(); from += LOOKUP_BATCH) {
            present.addAll(vectorStore.existingIds(repositoryId, referenced.subList(from, Math.min(referenced.size(), from + LOOKUP_BATCH))));
        }
        Set<String> inconsistent = new HashSet<>();
        for (SourceFile file : unchanged) {
            FileCheckpoint checkpoint = checkpoints.get(file.relativePath());
            if (!present.containsAll(checkpoint.chunkIds())) {
                inconsistent.add(file.relativePath());
            }
        }
        return inconsistent;
    }
}
