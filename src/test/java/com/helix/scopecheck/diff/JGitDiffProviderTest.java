package com.helix.scopecheck.diff;

import com.helix.scopecheck.exception.InputException;
import com.helix.scopecheck.exception.RefNotFoundException;
import com.helix.scopecheck.exception.RepoUnavailableException;
import com.helix.scopecheck.model.change.ChangeKind;
import com.helix.scopecheck.model.change.ChangeSet;
import com.helix.scopecheck.model.change.FileChange;
import com.helix.scopecheck.model.change.RepoRef;
import com.helix.scopecheck.util.WorkspaceRepositoryResolver;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.lib.PersonIdent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Runs against a throwaway repository: {@code main} with one commit, {@code feature} with two more.
 */
@DisplayName("JGit Diff Provider Tests")
class JGitDiffProviderTest {

    private static final RepoRef REPO = new RepoRef("payments-svc");
    private static final PersonIdent AUTHOR = new PersonIdent("Dev", "dev@example.com");

    @TempDir
    Path workspace;

    private JGitDiffProvider provider;

    @BeforeEach
    void setUp() throws Exception {
        Path repoDir = Files.createDirectories(workspace.resolve(REPO.location()));
        try (Git git = Git.init().setDirectory(repoDir.toFile()).setInitialBranch("main").call()) {
            write(repoDir, "src/payments/api.py", "def charge(req):\n    return process(req.amount)\n");
            write(repoDir, "README.md", "Payments service\n");
            commit(git, "Initial REST API");

            git.checkout().setCreateBranch(true).setName("feature").call();
            write(repoDir, "src/payments/fraud.py", "def score(txn):\n    return 0.5\n");
            write(repoDir, "src/payments/api.py",
                    "def charge(req):\n    checked = fraud.score(req)\n    return process(req.amount, checked)\n");
            commit(git, "Add fraud scoring");

            git.rm().addFilepattern("README.md").call();
            commit(git, "Drop stale readme");
        }
        provider = new JGitDiffProvider(new WorkspaceRepositoryResolver(workspace));
    }

    @Test
    @DisplayName("Should list changed files with kinds, hunks and branch metadata")
    void comparesBranches() {
        // When
        ChangeSet changeSet = provider.getChangeSet(REPO, "main", "feature");

        // Then
        assertThat(changeSet.files()).extracting(FileChange::path)
                .containsExactlyInAnyOrder("README.md", "src/payments/api.py", "src/payments/fraud.py");
        assertThat(kindOf(changeSet, "src/payments/fraud.py")).isEqualTo(ChangeKind.ADDED);
        assertThat(kindOf(changeSet, "src/payments/api.py")).isEqualTo(ChangeKind.MODIFIED);
        assertThat(kindOf(changeSet, "README.md")).isEqualTo(ChangeKind.DELETED);

        FileChange api = changeSet.files().stream().filter(f -> f.path().equals("src/payments/api.py")).findFirst().orElseThrow();
        assertThat(api.hunks()).isNotEmpty();
        assertThat(api.hunks().get(0).text()).contains("+    checked = fraud.score(req)");

        assertEquals("main", changeSet.baseRef());
        assertEquals("feature", changeSet.headRef());
        assertEquals(2, changeSet.metadata().commitCount());
        assertEquals("Drop stale readme", changeSet.metadata().title());
        assertThat(changeSet.metadata().description()).contains("Add fraud scoring");
    }

    @Test
    @DisplayName("Should keep files whose paths git quotes and give each file only its own hunks")
    void keepsQuotedPaths() throws Exception {
        // Given
        RepoRef repo = new RepoRef("quoted-svc");
        Path repoDir = Files.createDirectories(workspace.resolve(repo.location()));
        try (Git git = Git.init().setDirectory(repoDir.toFile()).setInitialBranch("main").call()) {
            write(repoDir, "a.py", "x = 1\n");
            commit(git, "Initial");

            git.checkout().setCreateBranch(true).setName("feature").call();
            write(repoDir, "a.py", "x = 2\n");
            write(repoDir, "say\"hi.py", "print('hi')\n");
            write(repoDir, "z.py", "z = 0\n");
            commit(git, "Add greetings");
        }

        // When
        ChangeSet changeSet = provider.getChangeSet(repo, "main", "feature");

        // Then
        assertThat(changeSet.fileInventory())
                .containsExactlyInAnyOrder("a.py", "say\"hi.py", "z.py");
        FileChange modified = changeSet.files().stream().filter(f -> f.path().equals("a.py")).findFirst().orElseThrow();
        assertThat(modified.hunks()).hasSize(1);
        assertThat(modified.hunks().get(0).text()).contains("+x = 2").doesNotContain("hi");
        assertThat(kindOf(changeSet, "say\"hi.py")).isEqualTo(ChangeKind.ADDED);
        FileChange quoted = changeSet.files().stream().filter(f -> f.path().equals("say\"hi.py")).findFirst().orElseThrow();
        assertThat(quoted.hunks()).hasSize(1);
        assertThat(quoted.hunks().get(0).text()).contains("+print('hi')");
    }

    @Test
    @DisplayName("Should use the current branch when no head ref is given")
    void defaultsToCurrentBranch() {
        ChangeSet changeSet = provider.getChangeSet(REPO, "main", null);

        assertEquals("feature", changeSet.headRef());
        assertThat(changeSet.fileInventory()).contains("src/payments/fraud.py");
    }

    @Test
    @DisplayName("Should report unknown refs as RefNotFound")
    void unknownRef() {
        assertThatThrownBy(() -> provider.getChangeSet(REPO, "main", "does-not-exist"))
                .isInstanceOf(RefNotFoundException.class)
                .hasMessageContaining("does-not-exist");
    }

    @Test
    @DisplayName("Should reject identical and unsafe refs")
    void invalidRefs() {
        assertThatThrownBy(() -> provider.getChangeSet(REPO, "main", "main"))
                .isInstanceOf(InputException.class);
        assertThatThrownBy(() -> provider.getChangeSet(REPO, "main..feature", "feature"))
                .isInstanceOf(InputException.class);
        assertThatThrownBy(() -> provider.getChangeSet(REPO, "--output=/tmp/x", "feature"))
                .isInstanceOf(InputException.class);
    }

    @Test
    @DisplayName("Should report missing repositories and paths outside the workspace")
    void unavailableRepository() throws Exception {
        Files.createDirectories(workspace.resolve("not-a-repo"));

        assertThatThrownBy(() -> provider.getChangeSet(new RepoRef("not-a-repo"), "main", "feature"))
                .isInstanceOf(RepoUnavailableException.class);
        assertThatThrownBy(() -> provider.getChangeSet(new RepoRef("../elsewhere"), "main", "feature"))
                .isInstanceOf(InputException.class)
                .hasMessageContaining("outside the workspace");
    }

    private static ChangeKind kindOf(ChangeSet changeSet, String path) {
        return changeSet.files().stream()
                .filter(f -> f.path().equals(path))
                .map(FileChange::changeKind)
                .findFirst()
                .orElseThrow();
    }

    private static void write(Path repoDir, String relative, String content) throws Exception {
        Path file = repoDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private static void commit(Git git, String message) throws Exception {
        git.add().addFilepattern(".").call();
        git.commit().setMessage(message).setAuthor(AUTHOR).setCommitter(AUTHOR).setSign(false).call();
    }
}
