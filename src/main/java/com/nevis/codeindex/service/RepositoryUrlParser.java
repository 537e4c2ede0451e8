package com.nevis.codeindex.service;

import com.nevis.codeindex.exception.InvalidRepositoryReferenceException;
import com.nevis.codeindex.model.RepositoryReference;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class RepositoryUrlParser {

    private static final Pattern REMOTE =
        Pattern.compile("^(https?)://([^/@\\s]+)/([^/\\s]+)/([^/\\s]+?)(?:\\.git)?$");

    public RepositoryReference parse(String reference) {
        if (reference == null || reference.isBlank()) {
            throw new InvalidRepositoryReferenceException("Repository reference must not be blank");
        }
        String value = reference.strip();
        if (value.startsWith("http://") || value.startsWith("https://")) {
            return parseRemote(value);
        }
        if (value.startsWith("file:")) {
            return parseLocal(toPath(value), value);
        }
        try {
            Path path = Path.of(value);
            if (path.isAbsolute()) {
                return parseLocal(path, value);
            }
        } catch (InvalidPathException e) {
            throw new InvalidRepositoryReferenceException("Malformed repository path: " + value);
        }
        throw new InvalidRepositoryReferenceException(
            "Unsupported repository reference, expected https://host/owner/repo or an absolute directory: " + value);
    }

    private RepositoryReference parseRemote(String value) {
        if (value.substring(value.indexOf("://") + 3).split("/", 2)[0].contains("@")) {
            throw new InvalidRepositoryReferenceException("Credentials must not be embedded in the repository URL");
        }
        String trimmed = value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
        Matcher matcher = REMOTE.matcher(trimmed);
        if (!matcher.matches()) {
            throw new InvalidRepositoryReferenceException("Malformed repository URL: " + value);
        }
        String owner = matcher.group(3);
        String repo = matcher.group(4);
        if (repo.isEmpty() || repo.startsWith(".")) {
            throw new InvalidRepositoryReferenceException("Malformed repository URL: " + value);
        }
        String url = matcher.group(1) + "://" + matcher.group(2) + "/" + owner + "/" + repo;
        return new RepositoryReference(url, owner + "/" + repo, null);
    }

    private RepositoryReference parseLocal(Path path, String original) {
        Path directory = path.toAbsolutePath().normalize();
        if (!Files.isDirectory(directory)) {
            throw new InvalidRepositoryReferenceException("Local repository directory does not exist: " + original);
        }
        Path fileName = directory.getFileName();
        String name = fileName != null ? fileName.toString() : directory.toString();
        return new RepositoryReference(directory.toString(), name, directory);
    }

    private Path toPath(String fileUri) {
        try {
            return Path.of(URI.create(fileUri));
        } catch (IllegalArgumentException e) {
            throw new InvalidRepositoryReferenceException("Malformed file URI: " + fileUri);
        }
    }
}
