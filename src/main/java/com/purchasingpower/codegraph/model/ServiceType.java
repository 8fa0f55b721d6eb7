package com.purchasingpower.codegraph.model;

/**
 * Enumeration of collaborator types for unified call logging.
 *
 * Used by ExternalCallLogger to categorize and log calls to the
 * entity store and the file system with consistent formatting.
 *
 * @see com.purchasingpower.codegraph.util.ExternalCallLogger
 */
public enum ServiceType {
    DATABASE("🟠", "EntityStore"),
    FILESYSTEM("🔷", "FileSystem");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
