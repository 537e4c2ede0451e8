package com.nevis.codeindex.service;

import com.nevis.codeindex.config.IndexingProperties;
import com.nevis.codeindex.exception.RepositoryAcquisitionException;
import com.nevis.codeindex.exception.TransientProviderException;
import com.nevis.codeindex.infra.SecretScrubber;
import com.nevis.codeindex.model.RepositorySnapshot;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.api.CloneCommand;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.ResetCommand;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.api.errors.TransportException;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.transport.CredentialsProvider;
import org.eclipse.jgit.transport.UsernamePasswordCredentialsProvider;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

@Slf4j
@Service
public class RepositoryAcquirer {

    private static final List<String> PERMANENT_TRANSPORT_ERRORS =
        List.of("not authorized", "authentication is required", "not found", "repository not found");

    private final Path workspaceRoot;

    public RepositoryAcquirer(IndexingProperties properties) {
        this.workspaceRoot = Path.of(properties.workspaceDir()).toAbsolutePath().normalize();
    }

    public record AcquiredRepository(Path root, String revision) {}

    public AcquiredRepository acquire(RepositorySnapshot repository, String accessToken) {
        if (repository.isLocal()) {
            Path root = Path.of(repository.localPath() != null ? repository.localPath() : repository.url());
            if (!Files.isDirectory(root)) {
                throw new RepositoryAcquisitionException("Local repository directory is missing: " + root);
            }
            return new AcquiredRepository(root, headRevision(root));
        }

        Path target = workspaceFor(repository.id());
        CredentialsProvider credentials = accessToken == null || accessToken.isBlank()
            ? null
            : new UsernamePasswordCredentialsProvider("oauth2", accessToken);

        if (Files.isDirectory(target.resolve(".git"))) {
            fetch(repository, target, credentials);
        } else {
            clone(repository, target, credentials);
        }
        return new AcquiredRepository(target, headRevision(target));
    }

    public Path workspaceFor(UUID repositoryId) {
        return workspaceRoot.resolve(repositoryId.toString());
    }

    public void deleteWorkspace(UUID repositoryId) {
        Path target = workspaceFor(repositoryId);
        try {
            if (FileSystemUtils.deleteRecursively(target)) {
                log.info("Deleted workspace {}", target);
            }
        } catch (IOException e) {
            log.warn("Could not delete workspace {}: {}", target, e.getMessage());
        }
    }

    private void clone(RepositorySnapshot repository, Path target, CredentialsProvider credentials) {
        log.info("Cloning {} into {}", repository.url(), target);
        try {
            FileSystemUtils.deleteRecursively(target);
            Files.createDirectories(target.getParent());
        } catch (IOException e) {
            throw new RepositoryAcquisitionException("Cannot prepare workspace " + target, e);
        }

        CloneCommand command = Git.cloneRepository()
            .setURI(repository.url())
            .setDirectory(target.toFile())
            .setDepth(1)
            .setCloneAllBranches(false);
        if (repository.defaultBranch() != null && !repository.defaultBranch().isBlank()) {
            command.setBranch(repository.defaultBranch())
                .setBranchesToClone(List.of("refs/heads/" + repository.defaultBranch()));
        }
        if (credentials != null) {
            command.setCredentialsProvider(credentials);
        }

        try (Git ignored = command.call()) {
            log.info("Cloned {}", repository.url());
        } catch (TransportException e) {
            deleteQuietly(target);
            throw transportFailure("clone", repository, e);
        } catch (GitAPIException e) {
            deleteQuietly(target);
            throw new RepositoryAcquisitionException(
                "Git clone failed for " + repository.url() + ": " + SecretScrubber.scrub(e.getMessage()), e);
        }
    }

    private void fetch(RepositorySnapshot repository, Path target, CredentialsProvider credentials) {
        log.info("Fetching {} in {}", repository.url(), target);
        try (Git git = Git.open(target.toFile())) {
            var fetch = git.fetch().setRemote("origin").setDepth(1);
            if (credentials != null) {
                fetch.setCredentialsProvider(credentials);
            }
            fetch.call();

            String branch = git.getRepository().getBranch();
            String remoteRef = "refs/remotes/origin/" + branch;
            if (git.getRepository().resolve(remoteRef) == null) {
                throw new RepositoryAcquisitionException("Remote branch " + branch + " not found for " + repository.url());
            }
            git.reset().setMode(ResetCommand.ResetType.HARD).setRef(remoteRef).call();
        } catch (TransportException e) {
            throw transportFailure("fetch", repository, e);
        } catch (GitAPIException | IOException e) {
            log.warn("Fetch failed for {}, cloning again: {}", repository.url(), SecretScrubber.scrub(e.getMessage()));
            clone(repository, target, credentials);
        }
    }

    private RuntimeException transportFailure(String operation, RepositorySnapshot repository, TransportException e) {
        String message = "Git " + operation + " failed for " + repository.url() + ": " + SecretScrubber.scrub(e.getMessage());
        String lower = String.valueOf(e.getMessage()).toLowerCase(Locale.ROOT);
        if (PERMANENT_TRANSPORT_ERRORS.stream().anyMatch(lower::contains)) {
            return new RepositoryAcquisitionException(message, e);
        }
        return new TransientProviderException(message, e);
    }

    private String headRevision(Path root) {
        if (!Files.exists(root.resolve(".git"))) {
            return "";
        }
        try (Git git = Git.open(root.toFile())) {
            ObjectId head = git.getRepository().resolve("HEAD");
            return head == null ? "" : head.getName();
        } catch (IOException e) {
            log.warn("Cannot resolve HEAD of {}: {}", root, e.getMessage());
            return "";
        }
    }

    private void deleteQuietly(Path target) {
        try {
            FileSystemUtils.deleteRecursively(target);
        } catch (IOException e) {
            log.warn("Could not clean up {}: {}", target, e.getMessage());
        }
    }
}
