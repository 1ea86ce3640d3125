package com.example.ringside;

import com.example.ringside.util.TickService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TickService Tests")
class TickServiceTest {

    @Test
    @DisplayName("Submitted tasks run on the named daemon thread")
    void runsOnNamedThread() throws Exception {
        TickService service = new TickService("ringside-test");
        Future<String> name = service.submit("thread-name", () -> Thread.currentThread().getName());
        assertEquals("ringside-test", name.get(5, TimeUnit.SECONDS));
        service.shutdown();
        assertTrue(service.isShutdown());
    }

    @Test
    @DisplayName("A named task can be cancelled once")
    void cancelByName() throws Exception {
        TickService service = new TickService("ringside-cancel");
        CountDownLatch started = new CountDownLatch(1);
        Future<Object> f = service.submit("loop", () -> {
            started.countDown();
            Thread.sleep(10_000);
            return null;
        });
        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertTrue(service.cancel("loop"));
        assertTrue(f.isCancelled());
        assertFalse(service.cancel("loop"));
        assertFalse(service.cancel("never-submitted"));
        service.shutdown();
    }
}
