package com.webparser.prettify;

/**
 * Layout configuration.
 *
 * @param fullWidth column budget of every output line
 * @param scopes    style scopes to tag output with
 */
public record PrettifierConfig(int fullWidth, ScopeTable scopes) {
    public static final int DEFAULT_WIDTH = 60;

    public PrettifierConfig {
        if (fullWidth < 8) {
            throw new IllegalArgumentException("fullWidth must be at least 8, got " + fullWidth);
        }
        if (scopes == null) {
            scopes = ScopeTable.defaults();
        }
    }

    public static PrettifierConfig defaults() {
        return new PrettifierConfig(DEFAULT_WIDTH, ScopeTable.defaults());
    }

    public PrettifierConfig withFullWidth(int width) {
        return new PrettifierConfig(width, scopes);
    }
}
