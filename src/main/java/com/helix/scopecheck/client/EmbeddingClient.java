package com.helix.scopecheck.client;

import java.util.List;

/**
 * Turns query text into an embedding vector for similarity search.
 */
public interface EmbeddingClient {

    List<Float> embed(String text);
}
