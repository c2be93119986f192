package org.carball.motif.config;

public enum OutputFormat {
    JSON,
    MARKDOWN;

    public static OutputFormat fromOption(String value) {
        for (OutputFormat format : values()) {
            if (format.name().equalsIgnoreCase(value)) {
                return format;
            }
        }
        if ("md".equalsIgnoreCase(value)) {
            return MARKDOWN;
        }
        throw new IllegalArgumentException("Invalid format: " + value + ". Use json or markdown");
    }
}
