package eu.virtualparadox.ragqa.ingest.model;

import java.util.Locale;
import java.util.Optional;

public enum EFileType {
    PDF(".pdf"),
    TXT(".txt");

    private final String extension;

    EFileType(final String extension) {
        this.extension = extension;
    }

    /** Lower-case name as stored in chunk metadata. */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<EFileType> fromFilename(final String filename) {
        if (filename == null) {
            return Optional.empty();
        }
        final String lower = filename.trim().toLowerCase(Locale.ROOT);
        for (final EFileType type : values()) {
            if (lower.endsWith(type.extension)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
