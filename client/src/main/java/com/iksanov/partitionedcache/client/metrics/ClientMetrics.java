package com.iksanov.partitionedcache.client.metrics;

import com.iksanov.partitionedcache.common.protocol.ClientOperation;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.EnumMap;
import java.util.Map;

public class ClientMetrics {

    private final Counter requestsTotal;
    private final Counter requestsSuccess;
    private final Counter requestsFailed;
    private final Counter timeouts;
    private final Counter routingFailures;
    private final Counter nearCacheHits;
    private final Counter nearCacheMisses;
    private final Map<ClientOperation, Timer> durations = new EnumMap<>(ClientOperation.class);

    public ClientMetrics() {
        this(new SimpleMeterRegistry());
    }

    public ClientMetrics(MeterRegistry registry) {
        this.requestsTotal = Counter.builder("cache.client.requests.total")
                .description("Total number of requests sent to cache nodes")
                .register(registry);

        this.requestsSuccess = Counter.builder("cache.client.requests.success")
                .description("Number of requests answered with SUCCESS")
                .register(registry);

        this.requestsFailed = Counter.builder("cache.client.requests.failed")
                .description("Number of requests that ended with an error")
                .register(registry);

        this.timeouts = Counter.builder("cache.client.timeouts.total")
                .description("Number of requests that timed out")
                .register(registry);

        this.routingFailures = Counter.builder("cache.client.routing.failures")
                .description("Requests rejected because the partition table was missing or stale")
                .register(registry);

        this.nearCacheHits = Counter.builder("cache.client.near.hits")
                .description("Local peeks answered by the near cache")
                .register(registry);

        this.nearCacheMisses = Counter.builder("cache.client.near.misses")
                .description("Local peeks that found nothing in the near cache")
                .register(registry);

        for (ClientOperation op : ClientOperation.values()) {
            durations.put(op, Timer.builder("cache.client.request.duration")
                    .description("Duration of a single node request")
                    .tag("operation", op.name())
                    .register(registry));
        }
    }

    public void recordRequest() {
        requestsTotal.increment();
    }

    public void recordSuccess() {
        requestsSuccess.increment();
    }

    public void recordFailure() {
        requestsFailed.increment();
    }

    public void recordTimeout() {
        timeouts.increment();
    }

    public void recordRoutingFailure() {
        routingFailures.increment();
    }

    public void recordNearCacheHit() {
        nearCacheHits.increment();
    }

    public void recordNearCacheMiss() {
        nearCacheMisses.increment();
    }

    public Timer.Sample startTimer() {
        return Timer.start();
    }

    public void stopTimer(Timer.Sample sample, ClientOperation operation) {
        sample.stop(durations.get(operation));
    }
}
