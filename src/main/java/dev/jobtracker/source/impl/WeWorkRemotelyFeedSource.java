package dev.jobtracker.source.impl;

import dev.jobtracker.config.IngestionProperties;
import dev.jobtracker.metrics.IngestionMetrics;
import dev.jobtracker.model.SourceId;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

@Component
public class WeWorkRemotelyFeedSource extends AbstractFeedSource {

    private final IngestionProperties properties;

    public WeWorkRemotelyFeedSource(WebClient.Builder webClientBuilder, IngestionMetrics metrics,
                                    IngestionProperties properties) {
        super(webClientBuilder, metrics);
        this.properties = properties;
    }

    @Override
    public String getName() {
        return "WeWorkRemotely";
    }

    @Override
    public boolean isEnabled() {
        return properties.getFeeds().isEnabled();
    }

    @Override
    protected List<String> getTargets() {
        return properties.getFeeds().getUrls();
    }

    @Override
    protected String sourceHint() {
        return SourceId.WEWORKREMOTELY.id();
    }

    @Override
    protected Duration getTimeout() {
        return properties.getFeeds().getTimeout();
    }

    @Override
    protected int getConcurrency() {
        return Math.max(1, properties.getConcurrency());
    }
}
