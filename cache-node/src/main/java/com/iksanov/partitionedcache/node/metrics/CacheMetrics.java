package com.iksanov.partitionedcache.node.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Store-level statistics of a node, summed over all of its caches.
 */
public class CacheMetrics {

    private static final Duration[] LATENCY_SLOS = {
            Duration.ofMillis(1), Duration.ofMillis(5), Duration.ofMillis(10), Duration.ofMillis(50), Duration.ofMillis(100)
    };

    private final PrometheusMeterRegistry registry;
    private final Counter hits;
    private final Counter misses;
    private final Counter evictions;
    private final Timer getLatency;
    private final Timer putLatency;
    private final AtomicLong entries = new AtomicLong(0);

    public CacheMetrics() {
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        this.hits = Counter.builder("cache.node.hits")
                .description("Reads that found a live entry")
                .register(registry);

        this.misses = Counter.builder("cache.node.misses")
                .description("Reads that found no entry or an expired one")
                .register(registry);

        this.evictions = Counter.builder("cache.node.evictions")
                .description("Entries dropped to stay within the size limit")
                .register(registry);

        this.getLatency = Timer.builder("cache.node.get.duration")
                .description("Store read duration")
                .serviceLevelObjectives(LATENCY_SLOS)
                .register(registry);

        this.putLatency = Timer.builder("cache.node.put.duration")
                .description("Store write duration")
                .serviceLevelObjectives(LATENCY_SLOS)
                .register(registry);

        Gauge.builder("cache.node.entries", entries, AtomicLong::get)
                .description("Entries held by this node across all caches")
                .register(registry);

        Gauge.builder("cache.node.hit.rate", this, CacheMetrics::hitRate)
                .description("Read hit rate percentage")
                .register(registry);
    }

    public void recordHit() {
        hits.increment();
    }

    public void recordMiss() {
        misses.increment();
    }

    public void recordEviction() {
        evictions.increment();
    }

    public void adjustSize(long delta) {
        entries.addAndGet(delta);
    }

    public long entries() {
        return entries.get();
    }

    public Timer.Sample startGetTimer() {
        return Timer.start(registry);
    }

    public void stopGetTimer(Timer.Sample sample) {
        sample.stop(getLatency);
    }

    public Timer.Sample startPutTimer() {
        return Timer.start(registry);
    }

    public void stopPutTimer(Timer.Sample sample) {
        sample.stop(putLatency);
    }

    public double hitRate() {
        double h = hits.count();
        double total = h + misses.count();
        return total == 0 ? 0.0 : (h / total) * 100.0;
    }

    public String scrape() {
        return registry.scrape();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
