package com.helix.scopecheck.util;

import com.helix.scopecheck.configuration.AppProperties;
import com.helix.scopecheck.exception.InputException;
import com.helix.scopecheck.exception.RepoUnavailableException;
import com.helix.scopecheck.model.change.RepoRef;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves repository references against {@code app.workspace-dir} and validates ref names.
 *
 * <p>Repository references are workspace-relative; a reference resolving outside the workspace
 * is rejected.
 */
@Slf4j
@Component
public class WorkspaceRepositoryResolver {

    private static final int MAX_REF_LENGTH = 200;

    private final Path workspace;

    public WorkspaceRepositoryResolver(AppProperties properties) {
        this(Paths.get(properties.getWorkspaceDir()));
    }

    public WorkspaceRepositoryResolver(Path workspace) {
        this.workspace = workspace.toAbsolutePath().normalize();
    }

    public Path workspace() {
        return workspace;
    }

    /**
     * @return absolute path of the repository working tree
     * @throws InputException if the reference escapes the workspace
     * @throws RepoUnavailableException if the directory is not a git repository
     */
    public Path resolve(RepoRef repo) {
        Path resolved = locate(repo);
        if (!Files.isDirectory(resolved)) {
            throw new RepoUnavailableException("Repository directory does not exist: " + resolved);
        }
        if (!Files.exists(resolved.resolve(".git"))) {
            throw new RepoUnavailableException("Not a git repository: " + resolved);
        }
        return resolved;
    }

    /**
     * Maps the reference to a directory under the workspace without checking that it exists.
     *
     * @throws InputException if the reference escapes the workspace
     */
    public Path locate(RepoRef repo) {
        Path resolved = workspace.resolve(repo.location()).toAbsolutePath().normalize();
        if (!resolved.startsWith(workspace) || resolved.equals(workspace)) {
            log.warn("Rejected repository reference outside workspace: {}", repo);
            throw new InputException("Repository '" + repo + "' resolves outside the workspace " + workspace);
        }
        return resolved;
    }

    /**
     * Ref names may be branches, tags or commit ids with {@code ~}/{@code ^} suffixes.
     *
     * @throws InputException for blank, overlong or unsafe names
     */
    public static String validateRef(String ref, String label) {
        if (ref == null || ref.isBlank()) {
            throw new InputException(label + " ref is required");
        }
        String trimmed = ref.trim();
        if (trimmed.length() > MAX_REF_LENGTH) {
            throw new InputException(label + " ref too long (max " + MAX_REF_LENGTH + " characters)");
        }
        if (!trimmed.matches("^[a-zA-Z0-9/_.~^-]+$") || trimmed.contains("..") || trimmed.startsWith("-")) {
            log.warn("Rejected {} ref: {}", label, ExternalCallLogger.truncate(trimmed, 60));
            throw new InputException("Invalid " + label + " ref '" + trimmed + "'");
        }
        return trimmed;
    }
}
