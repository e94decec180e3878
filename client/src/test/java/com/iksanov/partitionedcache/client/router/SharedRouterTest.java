package com.iksanov.partitionedcache.client.router;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SharedRouter reference counting")
class SharedRouterTest {

    @Mock
    private DataRouter router;

    @Test
    @DisplayName("Router should be closed only by the last release")
    void closesOnLastRelease() {
        SharedRouter shared = new SharedRouter(router);
        shared.retain();
        shared.retain();
        assertEquals(3, shared.refCount());

        shared.release();
        shared.release();
        verify(router, never()).close();

        shared.release();
        verify(router, times(1)).close();
        assertEquals(0, shared.refCount());
    }

    @Test
    @DisplayName("Retain after the router was closed should fail")
    void retainAfterCloseFails() {
        SharedRouter shared = new SharedRouter(router);
        shared.release();
        assertThrows(IllegalStateException.class, shared::retain);
    }

    @Test
    @DisplayName("Extra release should fail and not close twice")
    void overReleaseFails() {
        SharedRouter shared = new SharedRouter(router);
        shared.release();
        assertThrows(IllegalStateException.class, shared::release);
        verify(router, times(1)).close();
        assertEquals(0, shared.refCount());
    }
}
