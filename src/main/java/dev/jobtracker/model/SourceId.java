package dev.jobtracker.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Provenance tag of a job listing.
 */
public enum SourceId {
    LINKEDIN("linkedin"),
    INDEED("indeed"),
    GREENHOUSE("greenhouse"),
    WELLFOUND("wellfound"),
    WEWORKREMOTELY("weworkremotely"),
    EXTENSION("extension");

    private final String id;

    SourceId(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * Resolve a source from its identifier, case-insensitively.
     */
    public static Optional<SourceId> fromId(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(source -> source.id.equals(normalized))
                .findFirst();
    }

    @Override
    public String toString() {
        return id;
    }
}
