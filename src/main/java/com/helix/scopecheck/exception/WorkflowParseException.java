package com.helix.scopecheck.exception;

import lombok.Getter;

@Getter
public class WorkflowParseException extends InputException {

    private final String workflowFile;

    public WorkflowParseException(String workflowFile, Throwable cause) {
        super("Unparseable workflow file " + workflowFile + ": " + cause.getMessage(), cause);
        this.workflowFile = workflowFile;
    }
}
