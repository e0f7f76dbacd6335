package com.helix.scopecheck.summary;

import com.helix.scopecheck.configuration.AppProperties;
import com.helix.scopecheck.configuration.SummaryProperties;
import com.helix.scopecheck.model.change.ChangeSet;
import com.helix.scopecheck.model.change.FileChange;
import com.helix.scopecheck.model.change.Hunk;
import com.helix.scopecheck.model.cicd.WorkflowJob;
import com.helix.scopecheck.model.cicd.WorkflowSpec;
import com.helix.scopecheck.model.summary.DiffFlag;
import com.helix.scopecheck.model.summary.DiffSummary;
import com.helix.scopecheck.model.summary.FileInventoryEntry;
import com.helix.scopecheck.model.summary.HunkExcerpt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reduces a change set and its CI workflows to a bounded summary.
 *
 * <p>The file inventory is complete: hunks may be elided, files never are. Excerpts are ranked
 * with files that trigger a workflow first, then by number of changed lines.
 */
@Slf4j
@Service
public class DiffSummarizer {

    static final Comparator<HunkExcerpt> SIGNIFICANCE = Comparator
            .comparing(HunkExcerpt::referencedByCi).reversed()
            .thenComparing(Comparator.comparingInt(HunkExcerpt::changedLines).reversed())
            .thenComparing(HunkExcerpt::path)
            .thenComparingInt(HunkExcerpt::startLine);

    private static final String HUNK_TRUNCATED = "\n...(hunk truncated)";

    private static final Pattern TEST_FILE = Pattern.compile(
            "(^|/)(tests?|__tests__|spec)/"
                    + "|(^|/)test_[^/]+\\.py$"
                    + "|_test\\.(py|go)$"
                    + "|(Test|Tests|IT)\\.(java|kt)$"
                    + "|\\.(test|spec)\\.[jt]sx?$");

    private static final Pattern CI_CONFIG = Pattern.compile(
            "^\\.github/workflows/|^\\.gitlab-ci\\.yml$|(^|/)Jenkinsfile$|^\\.circleci/|^azure-pipelines\\.yml$");

    private static final Set<String> DEPENDENCY_MANIFESTS = Set.of(
            "pom.xml", "build.gradle", "build.gradle.kts", "settings.gradle", "package.json", "package-lock.json",
            "yarn.lock", "pyproject.toml", "setup.py", "setup.cfg", "pipfile", "poetry.lock", "go.mod", "go.sum",
            "cargo.toml", "gemfile", "composer.json");

    private final SummaryProperties props;

    public DiffSummarizer(AppProperties appProperties) {
        this.props = appProperties.getSummary();
    }

    public DiffSummary summarize(ChangeSet changeSet, List<WorkflowSpec> workflows) {
        List<FileInventoryEntry> inventory = new ArrayList<>();
        List<HunkExcerpt> candidates = new ArrayList<>();
        Set<DiffFlag> flags = EnumSet.noneOf(DiffFlag.class);

        for (FileChange file : changeSet.files()) {
            boolean referenced = workflows.stream().anyMatch(w -> w.references(file.path()))
                    || (file.previousPath() != null && workflows.stream().anyMatch(w -> w.references(file.previousPath())));
            inventory.add(new FileInventoryEntry(file.path(), file.changeKind(), file.previousPath(),
                    file.addedLines(), file.removedLines(), referenced));

            if (referenced) {
                flags.add(DiffFlag.HAS_CI_TRIGGER);
            }
            if (isTestFile(file.path())) {
                flags.add(DiffFlag.HAS_TEST_FILE_CHANGE);
            }
            if (CI_CONFIG.matcher(file.path()).find()) {
                flags.add(DiffFlag.HAS_CI_CONFIG_CHANGE);
            }
            if (isDependencyManifest(file.path())) {
                flags.add(DiffFlag.HAS_DEPENDENCY_MANIFEST_CHANGE);
            }
            for (Hunk hunk : file.hunks()) {
                candidates.add(excerpt(file.path(), hunk, referenced));
            }
        }

        candidates.sort(SIGNIFICANCE);
        List<HunkExcerpt> excerpts = candidates.size() > props.getMaxExcerpts()
                ? List.copyOf(candidates.subList(0, props.getMaxExcerpts()))
                : List.copyOf(candidates);
        int elided = candidates.size() - excerpts.size();

        log.info("Diff summary: {} files, {} of {} hunks excerpted, flags={}",
                inventory.size(), excerpts.size(), candidates.size(), flags);

        return new DiffSummary(changeSet.metadata().title(), changeSet.metadata().commitCount(),
                inventory, excerpts, flags, renderWorkflows(workflows), elided);
    }

    /**
     * Compact text block of the workflows: name, triggers, path filters and jobs.
     */
    public static String renderWorkflows(List<WorkflowSpec> workflows) {
        if (workflows.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("CI/CD Workflows:");
        for (WorkflowSpec workflow : workflows) {
            sb.append("\n  - ").append(workflow.name()).append(" (").append(workflow.file()).append(')');
            sb.append("\n    Triggers: ")
                    .append(workflow.triggerEvents().isEmpty() ? "none" : String.join(", ", workflow.triggerEvents()));
            if (!workflow.pathGlobs().isEmpty()) {
                sb.append("\n    Path filters: ").append(String.join(", ", workflow.pathGlobs()));
            }
            for (WorkflowJob job : workflow.jobs()) {
                sb.append("\n    Job: ").append(job.name())
                        .append(" (").append(job.steps().size()).append(" steps, runs-on: ").append(job.runsOn()).append(')');
            }
        }
        return sb.toString();
    }

    static boolean isTestFile(String path) {
        return TEST_FILE.matcher(path).find();
    }

    static boolean isDependencyManifest(String path) {
        String fileName = path.substring(path.lastIndexOf('/') + 1).toLowerCase(Locale.ROOT);
        return DEPENDENCY_MANIFESTS.contains(fileName)
                || (fileName.startsWith("requirements") && fileName.endsWith(".txt"));
    }

    private HunkExcerpt excerpt(String path, Hunk hunk, boolean referenced) {
        String text = hunk.text();
        boolean truncated = false;
        int max = props.getMaxHunkChars();
        if (text.length() > max) {
            int cut = Math.max(0, max - HUNK_TRUNCATED.length());
            String head = text.substring(0, cut);
            int lastNewline = head.lastIndexOf('\n');
            if (lastNewline > cut / 2) {
                head = head.substring(0, lastNewline);
            }
            text = head + HUNK_TRUNCATED;
            truncated = true;
        }
        return new HunkExcerpt(path, hunk.startLine(), hunk.endLine(), text, hunk.changedLineCount(), referenced, truncated);
    }
}
