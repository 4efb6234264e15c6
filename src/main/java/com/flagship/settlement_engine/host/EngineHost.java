package com.flagship.settlement_engine.host;

import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Single writer in front of the engines. HTTP requests enter one at a time, in arrival
 * order; calls made from inside a running call (receive hooks) pass straight through.
 */
@Component
public class EngineHost {

    private final ReentrantLock lock = new ReentrantLock(true);

    public <T> T call(Supplier<T> engineCall) {
        lock.lock();
        try {
            return engineCall.get();
        } finally {
            lock.unlock();
        }
    }

    public void run(Runnable engineCall) {
        call(() -> {
            engineCall.run();
            return null;
        });
    }

    public int getQueueLength() {
        return lock.getQueueLength();
    }
}
