package com.helix.scopecheck.exception;

import lombok.Getter;

@Getter
public class RefNotFoundException extends InputException {

    private final String ref;

    public RefNotFoundException(String repo, String ref) {
        super("Ref '" + ref + "' not found in " + repo);
        this.ref = ref;
    }
}
