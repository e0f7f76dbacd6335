package com.helix.scopecheck.diff;

import com.helix.scopecheck.configuration.AppProperties;
import com.helix.scopecheck.exception.ScopeCheckException;
import com.helix.scopecheck.model.CallContext;
import com.helix.scopecheck.model.ServiceType;
import com.helix.scopecheck.model.change.RepoRef;
import com.helix.scopecheck.model.change.RepositoryMap;
import com.helix.scopecheck.util.ExternalCallLogger;
import com.helix.scopecheck.util.WorkspaceRepositoryResolver;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.errors.RevisionSyntaxException;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Lists the head tree of a repository under the workspace directory. Hidden paths
 * ({@code .github/}, {@code .gitignore}) are skipped.
 *
 * <p>Pull request checks pass the source branch name, which is looked up locally and then as
 * {@code origin/<branch>}.
 */
@Slf4j
@Service
public class JGitRepositoryMapProvider implements RepositoryMapProvider {

    private final WorkspaceRepositoryResolver repositoryResolver;
    private final int maxFiles;

    public JGitRepositoryMapProvider(WorkspaceRepositoryResolver repositoryResolver, AppProperties properties) {
        this.repositoryResolver = repositoryResolver;
        this.maxFiles = properties.getSummary().getRepoMapMaxFiles();
    }

    @Override
    public RepositoryMap getRepositoryMap(RepoRef repo, String ref) {
        if (maxFiles == 0) {
            return RepositoryMap.EMPTY;
        }
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.GIT, "ListTree", log);
        ctx.logRequest("Listing repository tree", "repo", repo, "ref", ref);
        try {
            Path repoDir = repositoryResolver.resolve(repo);
            try (Git git = Git.open(repoDir.toFile())) {
                Repository repository = git.getRepository();
                ObjectId commitId = resolveCommit(repository, ref);
                if (commitId == null) {
                    ctx.logResponse("Ref not available locally, no repository map", "ref", ref);
                    return RepositoryMap.EMPTY;
                }
                RepositoryMap map = listFiles(repository, commitId);
                ctx.logResponse("Tree listed", "listed", map.paths().size(), "total", map.totalFiles());
                return map;
            }
        } catch (ScopeCheckException e) {
            log.warn("No repository map for {}: {}", repo, e.getMessage());
            return RepositoryMap.EMPTY;
        } catch (IOException e) {
            ctx.logError("Failed to list repository tree", e);
            return RepositoryMap.EMPTY;
        }
    }

    private static ObjectId resolveCommit(Repository repository, String ref) throws IOException {
        if (ref == null || ref.isBlank()) {
            return repository.resolve("HEAD^{commit}");
        }
        for (String candidate : List.of(ref, "origin/" + ref)) {
            try {
                ObjectId id = repository.resolve(candidate + "^{commit}");
                if (id != null) {
                    return id;
                }
            } catch (RevisionSyntaxException e) {
                log.debug("Unresolvable ref '{}': {}", candidate, e.getMessage());
                return null;
            }
        }
        return null;
    }

    private RepositoryMap listFiles(Repository repository, ObjectId commitId) throws IOException {
        List<String> paths = new ArrayList<>();
        int total = 0;
        try (RevWalk walk = new RevWalk(repository); TreeWalk treeWalk = new TreeWalk(repository)) {
            RevCommit commit = walk.parseCommit(commitId);
            treeWalk.addTree(commit.getTree());
            treeWalk.setRecursive(true);
            while (treeWalk.next()) {
                String path = treeWalk.getPathString();
                if (isHidden(path)) {
                    continue;
                }
                total++;
                if (paths.size() < maxFiles) {
                    paths.add(path);
                }
            }
        }
        return new RepositoryMap(paths, total);
    }

    private static boolean isHidden(String path) {
        return path.startsWith(".") || path.contains("/.");
    }
}
