package com.nevis.codeindex.infra;

import com.nevis.codeindex.exception.EmbeddingException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Semaphore;
import java.util.function.Supplier;

@Slf4j
public class EmbeddingConcurrencyGate {

    private final int permits;
    private volatile Semaphore semaphore;

    public EmbeddingConcurrencyGate(int permits) {
        if (permits <= 0) {
            throw new IllegalArgumentException("Embedding concurrency must be positive");
        }
        this.permits = permits;
    }

    public <T> T execute(Supplier<T> call) {
        Semaphore gate = semaphore();
        try {
            gate.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Interrupted while waiting for an embedding slot", e);
        }
        try {
            return call.get();
        } finally {
            gate.release();
        }
    }

    public boolean isInitialized() {
        return semaphore != null;
    }

    public int availablePermits() {
        Semaphore current = semaphore;
        return current == null ? permits : current.availablePermits();
    }

    private Semaphore semaphore() {
        Semaphore current = semaphore;
        if (current == null) {
            synchronized (this) {
                current = semaphore;
                if (current == null) {
                    current = new Semaphore(permits, true);
                    semaphore = current;
                    log.debug("Embedding concurrency gate created with {} permits", permits);
                }
            }
        }
        return current;
    }
}
