package com.helix.scopecheck.model;

/**
 * External collaborators whose calls are logged through {@link com.helix.scopecheck.util.ExternalCallLogger}.
 */
public enum ServiceType {
    GIT("🔷", "Git"),
    BITBUCKET("🟦", "Bitbucket"),
    PINECONE("🔵", "Pinecone"),
    NEO4J("🟢", "Neo4j"),
    DOCUMENT_DB("🟠", "DocumentDB"),
    MODEL("🔴", "Model");

    private final String emoji;
    private final String displayName;

    ServiceType(String emoji, String displayName) {
        this.emoji = emoji;
        this.displayName = displayName;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getDisplayName() {
        return displayName;
    }
}
