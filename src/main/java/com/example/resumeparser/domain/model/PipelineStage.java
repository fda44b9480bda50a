package com.example.resumeparser.domain.model;

import java.util.Locale;

/**
 * Named units of work of a pipeline run, in dependency order.
 */
public enum PipelineStage {
    EXTRACTION(true),
    PARSING(true),
    ENHANCEMENT(false),
    MATCHING(false),
    VALIDATION(false);

    private final boolean critical;

    PipelineStage(boolean critical) {
        this.critical = critical;
    }

    /**
     * @return {@code true} when a failure of this stage aborts the whole run
     */
    public boolean isCritical() {
        return critical;
    }

    public String displayName() {
        String lower = name().toLowerCase(Locale.ROOT);
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }
}
