package com.helix.scopecheck.model.summary;

import com.helix.scopecheck.model.change.ChangeKind;

/**
 * One line of the changed-file inventory. Every file of the change set has one.
 */
public record FileInventoryEntry(String path,
                                 ChangeKind changeKind,
                                 String previousPath,
                                 int addedLines,
                                 int removedLines,
                                 boolean referencedByCi) {

    public String render() {
        StringBuilder sb = new StringBuilder("- ").append(changeKind.label()).append(' ');
        if (previousPath != null && !previousPath.equals(path)) {
            sb.append(previousPath).append(" -> ");
        }
        sb.append(path).append(" (+").append(addedLines).append("/-").append(removedLines).append(')');
        if (referencedByCi) {
            sb.append(" [ci-trigger]");
        }
        return sb.toString();
    }
}
