package com.example.ringside.util;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Single daemon thread that runs long-lived loops such as a real-time fight.
 * Tasks are serialized on the one thread and can be cancelled by name.
 */
public class TickService {

    private final ExecutorService executor;
    private final Map<String, Future<?>> tasks = new ConcurrentHashMap<>();

    public TickService(String threadName) {
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    public <T> Future<T> submit(String name, Callable<T> task) {
        Future<T> f = executor.submit(task);
        tasks.put(name, f);
        return f;
    }

    public boolean cancel(String name) {
        Future<?> f = tasks.remove(name);
        if (f == null) return false;
        return f.cancel(true);
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    /** Stop accepting work; a running task finishes on its own. */
    public void shutdown() {
        tasks.clear();
        executor.shutdown();
    }
}
