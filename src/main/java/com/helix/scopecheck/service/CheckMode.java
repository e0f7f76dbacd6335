package com.helix.scopecheck.service;

public enum CheckMode {
    /** Two branches of a repository under the workspace directory. */
    LOCAL,
    /** A Bitbucket pull request. */
    PULL_REQUEST
}
