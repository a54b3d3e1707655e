package com.invoiceDesk.analyzer.cache.service;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Single-flight registry: at most one computation per key is in progress at a time.
 * 
 * The first caller for a key runs the computation on its own thread; callers arriving while it
 * runs wait for the same result. Failures are delivered to every waiter and are not remembered.
 */
@Slf4j
public class InFlightRequests<T> {
    
    private final ConcurrentMap<String, CompletableFuture<T>> inFlight = new ConcurrentHashMap<>();
    
    public T execute(String key, Supplier<T> computation) {
        CompletableFuture<T> created = new CompletableFuture<>();
        CompletableFuture<T> existing = inFlight.putIfAbsent(key, created);
        
        if (existing != null) {
            log.debug("Joining in-flight computation - key: {}", key);
            return await(existing);
        }
        
        try {
            T result = computation.get();
            created.complete(result);
            return result;
        } catch (RuntimeException | Error e) {
            created.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, created);
        }
    }
    
    public int inFlightCount() {
        return inFlight.size();
    }
    
    private T await(CompletableFuture<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException("Interrupted while waiting for in-flight analysis", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new CompletionException(cause);
        }
    }
}
