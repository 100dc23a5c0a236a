package dev.jobtracker.source;

import dev.jobtracker.model.RawContent;
import reactor.core.publisher.Flux;

/**
 * Supplier of already-fetched content for the ingestion pipeline (feeds, saved
 * emails). Each implementation owns its transport; the pipeline only sees
 * {@link RawContent}.
 */
public interface RawContentSource {

    /**
     * Get the name of this source (e.g., "WeWorkRemotely", "Mailbox")
     */
    String getName();

    /**
     * Fetch all content from this source. A target that fails yields nothing
     * instead of failing the stream.
     */
    Flux<RawContent> fetch();

    default boolean isEnabled() {
        return true;
    }
}
