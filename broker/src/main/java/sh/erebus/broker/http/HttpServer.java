package sh.erebus.broker.http;

import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import sh.erebus.broker.config.BrokerConfig;
import sh.erebus.broker.metrics.PrometheusMetricsExporter;
import sh.erebus.broker.ws.WebSocketUpgradeHandler;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * HTTP server for WebSocket upgrades, topic history, health checks and metrics.
 */
@RequiredArgsConstructor
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final BrokerConfig config;
    private final WebSocketUpgradeHandler upgradeHandler;
    private final HistoryHandler historyHandler;
    private final PrometheusMetricsExporter metricsExporter;
    private final AtomicBoolean ready = new AtomicBoolean();
    private DisposableServer server;

    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .option(ChannelOption.SO_REUSEADDR, true)
            .metrics(true, Function.identity())
            .route(routes -> routes
                .get("/healthz", (req, res) -> res.status(200).sendString(Mono.just("OK")))
                // Not ready before start completes and once shutdown begins
                .get("/readyz", (req, res) -> ready.get()
                    ? res.status(200).sendString(Mono.just("Ready"))
                    : res.status(503).sendString(Mono.just("Not Ready")))
                .get("/metrics", (req, res) ->
                    res.header("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                        .sendString(Mono.just(metricsExporter.scrape())))
                .get("/v1/pubsub/topics/{topic}/history", historyHandler::handle)
                .get("/v1/pubsub", upgradeHandler::handle)
            )
            .bind()
            .doOnNext(bound -> log.info("HTTP server started on port {}", bound.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        ready.set(true);
        return server;
    }

    public void stop() {
        ready.set(false);
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(30));
        }
    }
}
