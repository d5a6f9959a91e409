package com.costtracker.costs.requestlog;

import com.costtracker.costs.config.CostsProperties;
import com.costtracker.costs.model.RequestLogRecord;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Forwards request log records to a remote logs endpoint ({@code POST /api/logs}). Disabled
 * unless {@code costs.logs.ship-url} is set.
 */
@Component
public class LogShipper {

    private static final Logger log = LoggerFactory.getLogger(LogShipper.class);

    public enum ShipResult {
        SHIPPED,
        DISABLED,
        FAILED
    }

    private final WebClient webClient;
    private final Duration timeout;

    public LogShipper(CostsProperties properties) {
        CostsProperties.Logs logs = properties.logs();
        this.timeout = logs.shipTimeoutOrDefault();
        this.webClient = logs.shippingEnabled()
                ? WebClient.builder()
                        .baseUrl(logs.shipUrl())
                        .defaultHeader("Content-Type", MediaType.APPLICATION_JSON_VALUE)
                        .build()
                : null;
    }

    public boolean enabled() {
        return webClient != null;
    }

    /**
     * Lazily ships one record. The returned {@link Mono} never errors; failures surface as
     * {@link ShipResult#FAILED}.
     */
    public Mono<ShipResult> ship(RequestLogRecord record) {
        if (webClient == null) {
            return Mono.just(ShipResult.DISABLED);
        }
        return webClient.post().uri("/api/logs")
                .bodyValue(record)
                .retrieve()
                .toBodilessEntity()
                .timeout(timeout)
                .map(response -> ShipResult.SHIPPED)
                .onErrorResume(ex -> {
                    log.warn("Log shipping failed for {} {}: {}", record.method(), record.path(), ex.getMessage());
                    return Mono.just(ShipResult.FAILED);
                });
    }
}
