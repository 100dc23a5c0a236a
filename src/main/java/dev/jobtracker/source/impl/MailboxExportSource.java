package dev.jobtracker.source.impl;

import dev.jobtracker.config.IngestionProperties;
import dev.jobtracker.metrics.IngestionMetrics;
import dev.jobtracker.model.RawContent;
import dev.jobtracker.model.SourceId;
import dev.jobtracker.source.RawContentSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Alert email bodies saved as {@code .html} files by an external mail export.
 * The file's modification time stands in for the receipt time.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MailboxExportSource implements RawContentSource {

    private static final String HINT_SEPARATOR = "__";

    private final IngestionProperties properties;
    private final IngestionMetrics metrics;

    @Override
    public String getName() {
        return "Mailbox";
    }

    @Override
    public boolean isEnabled() {
        return properties.getMailbox().isEnabled();
    }

    @Override
    public Flux<RawContent> fetch() {
        Path directory = Paths.get(properties.getMailbox().getDirectory());
        return Mono.fromCallable(() -> listEmailFiles(directory))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(files -> log.info("Reading {} saved emails from {}", files.size(), directory))
                .flatMapMany(Flux::fromIterable)
                .flatMap(file -> Mono.fromCallable(() -> read(file))
                        .subscribeOn(Schedulers.boundedElastic())
                        .doOnError(e -> {
                            log.warn("{} - {} unreadable: {}", getName(), file.getFileName(), e.getMessage());
                            metrics.recordFetchFailure(getName());
                        })
                        .onErrorResume(e -> Mono.empty()), Math.max(1, properties.getConcurrency()))
                .onErrorResume(e -> {
                    log.warn("{} - cannot list {}: {}", getName(), directory, e.getMessage());
                    metrics.recordFetchFailure(getName());
                    return Flux.empty();
                });
    }

    private List<Path> listEmailFiles(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            log.warn("Mailbox directory {} does not exist", directory);
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(Files::isRegularFile)
                    .filter(MailboxExportSource::isHtmlFile)
                    .sorted()
                    .toList();
        }
    }

    private RawContent read(Path file) {
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            return new RawContent(content, Files.getLastModifiedTime(file).toInstant(),
                    sourceHint(file), file.getFileName().toString());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * {@code indeed__alert-42.html} names its source; anything else relies on detection.
     */
    static String sourceHint(Path file) {
        String name = file.getFileName().toString();
        int separator = name.indexOf(HINT_SEPARATOR);
        if (separator <= 0) {
            return null;
        }
        return SourceId.fromId(name.substring(0, separator))
                .map(SourceId::id)
                .orElse(null);
    }

    private static boolean isHtmlFile(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".html") || name.endsWith(".htm");
    }
}
