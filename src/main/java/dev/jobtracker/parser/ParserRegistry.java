package dev.jobtracker.parser;

import dev.jobtracker.model.SourceId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable lookup from source id to its parser, built once from the parser beans.
 */
@Slf4j
@Component
public class ParserRegistry {

    private final Map<SourceId, JobParser> parsers;

    public ParserRegistry(List<JobParser> parsers) {
        Map<SourceId, JobParser> bySource = new EnumMap<>(SourceId.class);
        for (JobParser parser : parsers) {
            JobParser previous = bySource.put(parser.sourceId(), parser);
            if (previous != null) {
                throw new IllegalStateException("Duplicate parser for source " + parser.sourceId()
                        + ": " + previous.getClass().getSimpleName() + " and " + parser.getClass().getSimpleName());
            }
        }
        this.parsers = Collections.unmodifiableMap(bySource);
        log.info("Registered parsers: {}", this.parsers.keySet());
    }

    public Optional<JobParser> get(SourceId sourceId) {
        return Optional.ofNullable(parsers.get(sourceId));
    }

    public Optional<JobParser> get(String sourceId) {
        return SourceId.fromId(sourceId).flatMap(this::get);
    }

    public Set<SourceId> listSources() {
        return parsers.keySet();
    }
}
