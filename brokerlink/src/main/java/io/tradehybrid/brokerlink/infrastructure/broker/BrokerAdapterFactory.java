package io.tradehybrid.brokerlink.infrastructure.broker;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.tradehybrid.brokerlink.broker.BrokerAdapter;
import io.tradehybrid.brokerlink.broker.adapters.BinanceAdapter;
import io.tradehybrid.brokerlink.broker.adapters.ETradeAdapter;
import io.tradehybrid.brokerlink.broker.adapters.PaperAdapter;
import io.tradehybrid.brokerlink.broker.adapters.TradovateAdapter;
import io.tradehybrid.brokerlink.broker.codec.JsonSupport;
import io.tradehybrid.brokerlink.config.GatewayConfig;
import io.tradehybrid.brokerlink.domain.broker.BrokerCredentials;
import io.tradehybrid.brokerlink.infrastructure.broker.common.VenueHttpClient;
import io.tradehybrid.brokerlink.infrastructure.broker.metrics.BrokerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates venue adapters. Each adapter gets its own HTTP client and daemon scheduler,
 * which it shuts down on disconnect.
 */
public class BrokerAdapterFactory {
    private static final Logger log = LoggerFactory.getLogger(BrokerAdapterFactory.class);

    private final GatewayConfig config;
    private final BrokerMetrics metrics;
    private final ObjectMapper objectMapper;

    public BrokerAdapterFactory(GatewayConfig config, BrokerMetrics metrics) {
        this(config, metrics, JsonSupport.newObjectMapper());
    }

    public BrokerAdapterFactory(GatewayConfig config, BrokerMetrics metrics, ObjectMapper objectMapper) {
        this.config = config;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
    }

    /**
     * New, unconnected adapter for the credentials' venue.
     *
     * @throws IllegalArgumentException if the credentials lack what the venue needs
     */
    public BrokerAdapter create(BrokerCredentials credentials) {
        if (credentials == null) {
            throw new IllegalArgumentException("Credentials cannot be null");
        }
        String code = credentials.venue().code();
        ScheduledExecutorService scheduler = newScheduler(code);
        try {
            BrokerAdapter adapter = switch (credentials.venue()) {
                case ETRADE -> new ETradeAdapter(credentials, config, scheduler, metrics, httpClient(code));
                case TRADOVATE -> new TradovateAdapter(credentials, config, scheduler, metrics, httpClient(code));
                case BINANCE -> new BinanceAdapter(credentials, config, scheduler, metrics, httpClient(code));
                case PAPER -> new PaperAdapter(credentials, config, scheduler, metrics);
            };
            log.info("[FACTORY] Created {} adapter ({})", code, credentials);
            return adapter;
        } catch (RuntimeException e) {
            scheduler.shutdownNow();
            throw e;
        }
    }

    private VenueHttpClient httpClient(String code) {
        return new VenueHttpClient(code, config, objectMapper, metrics);
    }

    private ScheduledExecutorService newScheduler(String code) {
        return Executors.newScheduledThreadPool(config.schedulerThreads(), new DaemonThreadFactory(code));
    }

    private static final class DaemonThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        DaemonThreadFactory(String code) {
            this.prefix = "brokerlink-" + code.toLowerCase() + "-";
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
