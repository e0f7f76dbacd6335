package com.helix.scopecheck.prompt;

import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * JSON Schema of the verdict the model must return, passed to the model service for constrained
 * decoding and embedded in the prompt's schema section.
 */
@Component
public class VerdictSchema {

    static final String LOCATION = "schema/alignment-verdict.schema.json";

    private final String json;

    public VerdictSchema() {
        try (InputStream in = new ClassPathResource(LOCATION).getInputStream()) {
            this.json = new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + LOCATION, e);
        }
    }

    public String json() {
        return json;
    }
}
