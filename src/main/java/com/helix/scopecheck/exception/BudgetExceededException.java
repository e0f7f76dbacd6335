package com.helix.scopecheck.exception;

import lombok.Getter;

@Getter
public class BudgetExceededException extends ScopeCheckException {

    private final int requiredTokens;
    private final int totalTokens;

    public BudgetExceededException(int requiredTokens, int totalTokens) {
        super(ErrorCategory.BUDGET_EXCEEDED,
                "Fixed prompt sections need " + requiredTokens + " tokens but only " + totalTokens + " are available");
        this.requiredTokens = requiredTokens;
        this.totalTokens = totalTokens;
    }
}
