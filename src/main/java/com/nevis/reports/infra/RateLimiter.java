package com.nevis.reports.infra;

public interface RateLimiter {

    void acquire(String key, int permits);

    default <T> T execute(String key, int permits, java.util.function.Supplier<T> task) {
        acquire(key, permits);
        return task.get();
    }
}
