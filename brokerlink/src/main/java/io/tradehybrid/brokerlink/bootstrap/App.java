package io.tradehybrid.brokerlink.bootstrap;

import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.tradehybrid.brokerlink.application.port.output.BrokerConnectionRepository;
import io.tradehybrid.brokerlink.application.service.BrokerAggregator;
import io.tradehybrid.brokerlink.application.service.BrokerEventBus;
import io.tradehybrid.brokerlink.application.service.ExecutionRouter;
import io.tradehybrid.brokerlink.broker.codec.JsonSupport;
import io.tradehybrid.brokerlink.config.GatewayConfig;
import io.tradehybrid.brokerlink.domain.broker.BrokerCredentials;
import io.tradehybrid.brokerlink.domain.common.BrokerEventType;
import io.tradehybrid.brokerlink.infrastructure.broker.BrokerAdapterFactory;
import io.tradehybrid.brokerlink.infrastructure.broker.metrics.PrometheusBrokerMetrics;
import io.tradehybrid.brokerlink.infrastructure.broker.metrics.PrometheusMetricsHandler;
import io.tradehybrid.brokerlink.infrastructure.persistence.JsonFileBrokerConnectionRepository;
import io.tradehybrid.brokerlink.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Gateway entry point.
 *
 * Connects every venue whose credentials are present in the environment, plus the paper venue
 * unless BROKERLINK_PAPER_ENABLED=false, then tracks BROKERLINK_WATCH_SYMBOLS for routing.
 * Metrics are served on BROKERLINK_METRICS_PORT (0 disables).
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== BrokerLink Gateway Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        GatewayConfig config = GatewayConfig.fromEnv().validate();
        log.info("✓ Configuration loaded (requestTimeout={}ms, pollInterval={}ms)",
            config.requestTimeout().toMillis(), config.pollInterval().toMillis());

        PrometheusBrokerMetrics metrics = new PrometheusBrokerMetrics(CollectorRegistry.defaultRegistry);
        log.info("✓ Prometheus metrics initialized");

        Undertow metricsServer = null;
        if (config.metricsPort() > 0) {
            metricsServer = Undertow.builder()
                .addHttpListener(config.metricsPort(), "0.0.0.0")
                .setHandler(Handlers.path()
                    .addExactPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry())))
                .build();
            metricsServer.start();
            log.info("✓ Prometheus /metrics endpoint ready on port {}", config.metricsPort());
        }

        BrokerConnectionRepository repository = new JsonFileBrokerConnectionRepository(
            config.connectionStorePath(), JsonSupport.newObjectMapper());
        BrokerEventBus eventBus = new BrokerEventBus();
        BrokerAggregator aggregator = new BrokerAggregator(
            new BrokerAdapterFactory(config, metrics), repository, eventBus, config);
        ExecutionRouter router = new ExecutionRouter(aggregator, config.maxQuoteAge());

        eventBus.subscribe(BrokerEventType.CONNECT, e -> log.info("[EVENT] {} connected", e.brokerId()));
        eventBus.subscribe(BrokerEventType.DISCONNECT, e -> log.info("[EVENT] {} disconnected", e.brokerId()));
        eventBus.subscribe(BrokerEventType.ORDER_SUBMIT, e -> log.info("[EVENT] Order submitted on {}", e.brokerId()));
        eventBus.subscribe(BrokerEventType.ORDER_UPDATE, e -> log.info("[EVENT] Order update on {}", e.brokerId()));

        CountDownLatch stopped = new CountDownLatch(1);
        Undertow server = metricsServer;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down BrokerLink Gateway");
            aggregator.shutdown();
            if (server != null) {
                server.stop();
            }
            stopped.countDown();
        }, "brokerlink-shutdown"));

        int connected = 0;
        for (ConfiguredBroker broker : configuredBrokers()) {
            if (aggregator.connectBroker(broker.id(), broker.name(), null, broker.credentials())) {
                connected++;
            }
        }
        log.info("✓ {} brokers connected: {}", connected, aggregator.connectedBrokerIds());

        for (String symbol : Env.getList("BROKERLINK_WATCH_SYMBOLS", List.of())) {
            router.track(symbol);
        }

        log.info("BrokerLink Gateway started");
        stopped.await();
    }

    /**
     * Brokers whose credentials are set in the environment.
     */
    static List<ConfiguredBroker> configuredBrokers() {
        List<ConfiguredBroker> brokers = new ArrayList<>();

        String etradeKey = Env.get("ETRADE_CONSUMER_KEY", null);
        if (etradeKey != null) {
            brokers.add(new ConfiguredBroker("etrade", "E*TRADE", BrokerCredentials.etrade(
                etradeKey,
                Env.get("ETRADE_CONSUMER_SECRET", null),
                Env.get("ETRADE_ACCESS_TOKEN", null),
                Env.get("ETRADE_ACCESS_TOKEN_SECRET", null),
                Env.getBool("ETRADE_SANDBOX", true))));
        }

        String tradovateUser = Env.get("TRADOVATE_USERNAME", null);
        if (tradovateUser != null) {
            brokers.add(new ConfiguredBroker("tradovate", "Tradovate", BrokerCredentials.tradovate(
                Env.get("TRADOVATE_APP_ID", null),
                Env.get("TRADOVATE_APP_SECRET", null),
                tradovateUser,
                Env.get("TRADOVATE_PASSWORD", null),
                Env.getBool("TRADOVATE_DEMO", true))));
        }

        String binanceKey = Env.get("BINANCE_API_KEY", null);
        if (binanceKey != null) {
            brokers.add(new ConfiguredBroker("binance", "Binance", BrokerCredentials.binance(
                binanceKey,
                Env.get("BINANCE_API_SECRET", null),
                Env.getBool("BINANCE_TESTNET", false))));
        }

        if (Env.getBool("BROKERLINK_PAPER_ENABLED", true)) {
            brokers.add(new ConfiguredBroker("paper", "Paper", BrokerCredentials.paper()));
        }
        return brokers;
    }

    record ConfiguredBroker(String id, String name, BrokerCredentials credentials) {}

    private App() {}
}
