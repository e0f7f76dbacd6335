package com.helix.scopecheck.model.retrieval;

import com.helix.scopecheck.model.change.ChangeSet;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Query for the hybrid retriever, derived from a change set.
 *
 * @param projectId project scope of the document corpus
 * @param changedPaths paths of the changed files
 * @param moduleNames directory names touched by the change (graph start nodes)
 * @param description natural-language description of the change
 */
public record RetrievalQuery(String projectId,
                             List<String> changedPaths,
                             List<String> moduleNames,
                             String description) {

    public RetrievalQuery {
        changedPaths = changedPaths == null ? List.of() : List.copyOf(changedPaths);
        moduleNames = moduleNames == null ? List.of() : List.copyOf(moduleNames);
        description = description == null ? "" : description;
    }

    public static RetrievalQuery from(ChangeSet changeSet, String projectId, String description) {
        Set<String> modules = new LinkedHashSet<>();
        for (String path : changeSet.changedPaths()) {
            String[] segments = path.split("/");
            // every directory segment is a candidate module name; the file name is not
            for (int i = 0; i < segments.length - 1; i++) {
                if (!segments[i].isBlank()) {
                    modules.add(segments[i]);
                }
            }
        }
        String text = description;
        if (text == null || text.isBlank()) {
            text = changeSet.metadata().title() + "\n" + changeSet.metadata().description();
        }
        return new RetrievalQuery(projectId, changeSet.changedPaths(), List.copyOf(modules), text.trim());
    }

    /**
     * Text embedded for the vector lookup: description followed by the changed paths.
     */
    public String searchText() {
        StringBuilder sb = new StringBuilder(description);
        if (!changedPaths.isEmpty()) {
            sb.append("\nChanged files: ").append(String.join(", ", changedPaths));
        }
        return sb.toString().trim();
    }
}
