package com.iksanov.partitionedcache.client.router;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reference-counted owner of a {@link DataRouter}. Starts with one reference;
 * the release that drops the count to zero closes the router.
 */
public final class SharedRouter {

    private static final Logger log = LoggerFactory.getLogger(SharedRouter.class);
    private final DataRouter router;
    private final AtomicInteger refs = new AtomicInteger(1);

    public SharedRouter(DataRouter router) {
        this.router = router;
    }

    public DataRouter router() {
        return router;
    }

    public SharedRouter retain() {
        while (true) {
            int current = refs.get();
            if (current <= 0) throw new IllegalStateException("Router is already closed");
            if (refs.compareAndSet(current, current + 1)) return this;
        }
    }

    public void release() {
        int left = refs.decrementAndGet();
        if (left < 0) {
            refs.incrementAndGet();
            throw new IllegalStateException("Router released more times than retained");
        }
        if (left == 0) {
            log.debug("Last router reference released, closing");
            router.close();
        }
    }

    public int refCount() {
        return refs.get();
    }
}
