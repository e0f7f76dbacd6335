package com.helix.scopecheck.diff;

import com.helix.scopecheck.exception.InputException;
import com.helix.scopecheck.exception.RefNotFoundException;
import com.helix.scopecheck.exception.RepoUnavailableException;
import com.helix.scopecheck.model.CallContext;
import com.helix.scopecheck.model.ServiceType;
import com.helix.scopecheck.model.change.BranchMetadata;
import com.helix.scopecheck.model.change.ChangeKind;
import com.helix.scopecheck.model.change.ChangeSet;
import com.helix.scopecheck.model.change.FileChange;
import com.helix.scopecheck.model.change.Hunk;
import com.helix.scopecheck.model.change.RepoRef;
import com.helix.scopecheck.util.ExternalCallLogger;
import com.helix.scopecheck.util.WorkspaceRepositoryResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.diff.DiffEntry;
import org.eclipse.jgit.diff.DiffFormatter;
import org.eclipse.jgit.errors.RepositoryNotFoundException;
import org.eclipse.jgit.errors.RevisionSyntaxException;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevTree;
import org.eclipse.jgit.revwalk.RevWalk;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Compares two refs of a local repository under the workspace directory
 * ({@code git diff base..head} plus the {@code base..head} commit log).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JGitDiffProvider implements DiffProvider {

    private final WorkspaceRepositoryResolver repositoryResolver;

    @Override
    public ChangeSet getChangeSet(RepoRef repo, String base, String head) {
        String baseRef = WorkspaceRepositoryResolver.validateRef(base, "base");
        Path repoDir = repositoryResolver.resolve(repo);

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.GIT, "DiffBranches", log);
        ctx.logRequest("Comparing branches", "repo", repo, "base", baseRef, "head", head);

        try (Git git = Git.open(repoDir.toFile())) {
            Repository repository = git.getRepository();
            String headRef = head == null || head.isBlank()
                    ? currentBranch(repository, repo)
                    : WorkspaceRepositoryResolver.validateRef(head, "head");
            if (baseRef.equals(headRef)) {
                throw new InputException("Base and head refs are identical: " + baseRef);
            }

            ObjectId baseId = resolveCommit(repository, repo, baseRef);
            ObjectId headId = resolveCommit(repository, repo, headRef);

            List<FileChange> files = changedFiles(repository, baseId, headId);
            BranchMetadata metadata = branchSummary(git, baseId, headId);

            ctx.logResponse("Diff computed", "files", files.size(), "commits", metadata.commitCount());
            return new ChangeSet(repo, baseRef, headRef, metadata, files);

        } catch (RepositoryNotFoundException e) {
            ctx.logError("Repository not found", e);
            throw new RepoUnavailableException("Not a git repository: " + repoDir, e);
        } catch (IOException | GitAPIException e) {
            ctx.logError("Failed to compute diff", e);
            throw new RepoUnavailableException("Failed to read repository " + repo + ": " + e.getMessage(), e);
        }
    }

    private String currentBranch(Repository repository, RepoRef repo) throws IOException {
        String branch = repository.getBranch();
        if (branch == null) {
            throw new RefNotFoundException(repo.location(), "HEAD");
        }
        log.debug("No head ref given, using current branch '{}'", branch);
        return branch;
    }

    private ObjectId resolveCommit(Repository repository, RepoRef repo, String ref) throws IOException {
        ObjectId id;
        try {
            id = repository.resolve(ref + "^{commit}");
        } catch (RevisionSyntaxException e) {
            throw new RefNotFoundException(repo.location(), ref);
        }
        if (id == null) {
            throw new RefNotFoundException(repo.location(), ref);
        }
        return id;
    }

    /**
     * Paths and change kinds come from the scanned {@link DiffEntry}s. Each entry is formatted
     * separately for its hunks.
     */
    private List<FileChange> changedFiles(Repository repository, ObjectId baseId, ObjectId headId) throws IOException {
        List<FileChange> files = new ArrayList<>();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (RevWalk walk = new RevWalk(repository); DiffFormatter formatter = new DiffFormatter(out)) {
            formatter.setRepository(repository);
            formatter.setDetectRenames(true);
            RevTree baseTree = walk.parseCommit(baseId).getTree();
            RevTree headTree = walk.parseCommit(headId).getTree();
            for (DiffEntry entry : formatter.scan(baseTree, headTree)) {
                out.reset();
                formatter.format(entry);
                formatter.flush();
                List<Hunk> hunks = UnifiedDiffParser.parseHunks(out.toString(StandardCharsets.UTF_8));
                files.add(toFileChange(entry, hunks));
            }
        }
        return files;
    }

    private static FileChange toFileChange(DiffEntry entry, List<Hunk> hunks) {
        switch (entry.getChangeType()) {
            case ADD:
            case COPY:
                return FileChange.of(entry.getNewPath(), ChangeKind.ADDED, hunks);
            case DELETE:
                return FileChange.of(entry.getOldPath(), ChangeKind.DELETED, hunks);
            case RENAME:
                return new FileChange(entry.getNewPath(), ChangeKind.RENAMED, entry.getOldPath(), hunks);
            default:
                return FileChange.of(entry.getNewPath(), ChangeKind.MODIFIED, hunks);
        }
    }

    private BranchMetadata branchSummary(Git git, ObjectId baseId, ObjectId headId) throws IOException, GitAPIException {
        List<String> subjects = new ArrayList<>();
        for (RevCommit commit : git.log().addRange(baseId, headId).call()) {
            String subject = commit.getShortMessage().strip();
            if (!subject.isEmpty()) {
                subjects.add(subject);
            }
        }
        if (subjects.isEmpty()) {
            return BranchMetadata.EMPTY;
        }
        // log is newest first
        return new BranchMetadata(subjects.get(0), String.join("\n", subjects), subjects.size());
    }
}
