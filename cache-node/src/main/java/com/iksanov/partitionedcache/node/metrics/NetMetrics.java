package com.iksanov.partitionedcache.node.metrics;

import com.iksanov.partitionedcache.common.protocol.ClientOperation;
import com.iksanov.partitionedcache.common.protocol.ResponseStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Connection and request statistics of the node's protocol server.
 */
public class NetMetrics {

    private static final Logger log = LoggerFactory.getLogger(NetMetrics.class);
    private final PrometheusMeterRegistry registry;

    private final Counter totalConnections;
    private final Counter closedConnections;
    private final Counter totalRequests;
    private final Counter requestErrors;
    private final Counter notPrimary;
    private final AtomicLong activeConnections = new AtomicLong(0);

    public NetMetrics() {
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        this.totalConnections = Counter.builder("net.connections.total")
                .description("Total TCP connections accepted")
                .register(registry);

        this.closedConnections = Counter.builder("net.connections.closed")
                .description("Total TCP connections closed")
                .register(registry);

        this.totalRequests = Counter.builder("net.requests.total")
                .description("Total number of received cache requests")
                .register(registry);

        this.requestErrors = Counter.builder("net.requests.errors")
                .description("Requests answered with a failure status or broken by a channel error")
                .register(registry);

        this.notPrimary = Counter.builder("net.requests.not.primary")
                .description("Key requests for partitions this node does not own")
                .register(registry);

        Gauge.builder("net.connections.active", activeConnections, AtomicLong::get)
                .description("Current number of active TCP connections")
                .register(registry);

        log.debug("NetMetrics registry created");
    }

    public void incrementConnections() { totalConnections.increment(); activeConnections.incrementAndGet(); }
    public void incrementClosedConnections() { closedConnections.increment(); activeConnections.decrementAndGet(); }
    public void incrementRequests() { totalRequests.increment(); }
    public void incrementErrors() { requestErrors.increment(); }

    public void recordStatus(ResponseStatus status) {
        if (status == ResponseStatus.NOT_PRIMARY) notPrimary.increment();
        if (status != ResponseStatus.SUCCESS) requestErrors.increment();
    }

    public void recordRequestDuration(ClientOperation operation, long nanos) {
        Timer.builder("net.request.duration")
                .description("Request processing duration")
                .tag("operation", operation.name())
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }

    public long getActiveConnections() { return activeConnections.get(); }
    public double getRequestCount() { return totalRequests.count(); }
    public double getErrorCount() { return requestErrors.count(); }
    public double getNotPrimaryCount() { return notPrimary.count(); }
    public String scrape() { return registry.scrape(); }
    public PrometheusMeterRegistry getRegistry() { return registry; }
}
