package com.helix.scopecheck.cicd;

import com.helix.scopecheck.model.cicd.WorkflowSpec;
import com.helix.scopecheck.model.change.RepoRef;

import java.util.List;

/**
 * Reads CI/CD workflow definitions of a repository.
 */
public interface CiConfigParser {

    /**
     * @return parsed workflows; empty when the repository defines none
     * @throws com.helix.scopecheck.exception.WorkflowParseException if a workflow file is unparseable
     */
    List<WorkflowSpec> parseWorkflows(RepoRef repo);
}
