package com.helix.scopecheck.cicd;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.helix.scopecheck.exception.WorkflowParseException;
import com.helix.scopecheck.model.change.RepoRef;
import com.helix.scopecheck.model.cicd.WorkflowJob;
import com.helix.scopecheck.model.cicd.WorkflowSpec;
import com.helix.scopecheck.util.WorkspaceRepositoryResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Parses GitHub Actions workflows from {@code .github/workflows/*.yml|yaml}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GithubActionsWorkflowParser implements CiConfigParser {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final List<String> PATH_FILTER_EVENTS = List.of("push", "pull_request");

    private final WorkspaceRepositoryResolver repositoryResolver;

    @Override
    public List<WorkflowSpec> parseWorkflows(RepoRef repo) {
        return parseWorkflows(repositoryResolver.locate(repo));
    }

    public List<WorkflowSpec> parseWorkflows(Path repoDir) {
        Path workflowsDir = repoDir.resolve(".github").resolve("workflows");
        if (!Files.isDirectory(workflowsDir)) {
            log.debug("No .github/workflows directory in {}", repoDir);
            return List.of();
        }

        List<Path> files;
        try (Stream<Path> listing = Files.list(workflowsDir)) {
            files = listing
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".yml") || p.getFileName().toString().endsWith(".yaml"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new WorkflowParseException(workflowsDir.toString(), e);
        }

        List<WorkflowSpec> workflows = new ArrayList<>();
        for (Path file : files) {
            String relative = repoDir.relativize(file).toString().replace('\\', '/');
            JsonNode root;
            try {
                root = YAML.readTree(file.toFile());
            } catch (JsonProcessingException e) {
                log.warn("Unparseable workflow {}: {}", relative, e.getOriginalMessage());
                throw new WorkflowParseException(relative, e);
            } catch (IOException e) {
                throw new WorkflowParseException(relative, e);
            }
            if (root == null || !root.isObject()) {
                log.debug("Skipping workflow {} without a mapping at the top level", relative);
                continue;
            }
            workflows.add(toSpec(root, file, relative));
        }
        log.info("Parsed {} workflow(s) from {}", workflows.size(), workflowsDir);
        return workflows;
    }

    private WorkflowSpec toSpec(JsonNode root, Path file, String relative) {
        String fileName = file.getFileName().toString();
        String stem = fileName.substring(0, fileName.lastIndexOf('.'));
        String name = root.path("name").asText(stem);

        // YAML 1.1 readers may turn the "on" key into a boolean
        JsonNode on = root.has("on") ? root.get("on") : root.path("true");

        List<WorkflowJob> jobs = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> jobEntries = root.path("jobs").fields();
        while (jobEntries.hasNext()) {
            Map.Entry<String, JsonNode> entry = jobEntries.next();
            JsonNode job = entry.getValue();
            if (!job.isObject()) {
                continue;
            }
            jobs.add(new WorkflowJob(
                    job.path("name").asText(entry.getKey()),
                    runsOn(job.get("runs-on")),
                    steps(job.path("steps"))));
        }
        return new WorkflowSpec(name, relative, triggers(on), pathFilters(on), jobs);
    }

    private static List<String> triggers(JsonNode on) {
        List<String> triggers = new ArrayList<>();
        if (on == null || on.isMissingNode() || on.isNull()) {
            return triggers;
        }
        if (on.isTextual()) {
            triggers.add(on.asText());
        } else if (on.isArray()) {
            on.forEach(t -> triggers.add(t.asText()));
        } else if (on.isObject()) {
            on.fieldNames().forEachRemaining(triggers::add);
        }
        return triggers;
    }

    private static List<String> pathFilters(JsonNode on) {
        List<String> paths = new ArrayList<>();
        if (on == null || !on.isObject()) {
            return paths;
        }
        for (String event : PATH_FILTER_EVENTS) {
            JsonNode eventPaths = on.path(event).path("paths");
            if (eventPaths.isArray()) {
                eventPaths.forEach(p -> paths.add(p.asText()));
            } else if (eventPaths.isTextual()) {
                paths.add(eventPaths.asText());
            }
        }
        return paths;
    }

    private static String runsOn(JsonNode runsOn) {
        if (runsOn == null || runsOn.isNull()) {
            return null;
        }
        if (runsOn.isArray()) {
            List<String> labels = new ArrayList<>();
            runsOn.forEach(l -> labels.add(l.asText()));
            return String.join(", ", labels);
        }
        return runsOn.isValueNode() ? runsOn.asText() : runsOn.toString();
    }

    private static List<String> steps(JsonNode steps) {
        List<String> descriptors = new ArrayList<>();
        if (!steps.isArray()) {
            return descriptors;
        }
        for (JsonNode step : steps) {
            if (step.hasNonNull("name")) {
                descriptors.add(step.get("name").asText());
            } else if (step.hasNonNull("uses")) {
                descriptors.add(step.get("uses").asText());
            } else if (step.hasNonNull("run")) {
                descriptors.add(step.get("run").asText().strip().lines().findFirst().orElse("run"));
            } else {
                descriptors.add("step");
            }
        }
        return descriptors;
    }
}
