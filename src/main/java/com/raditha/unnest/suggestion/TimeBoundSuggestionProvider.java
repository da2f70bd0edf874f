package com.raditha.unnest.suggestion;

import com.raditha.unnest.model.RegionFingerprint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bounds every lookup of a delegate provider by a timeout.
 * A lookup that times out or fails yields no suggestion, never an error.
 */
public class TimeBoundSuggestionProvider implements SuggestionProvider, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(TimeBoundSuggestionProvider.class);

    private final SuggestionProvider delegate;
    private final long timeoutMillis;
    private final ExecutorService executor;

    public TimeBoundSuggestionProvider(SuggestionProvider delegate, long timeoutMillis) {
        this.delegate = delegate;
        this.timeoutMillis = timeoutMillis;
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "suggestion-lookup");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public Optional<Suggestion> suggest(RegionFingerprint fingerprint, int branchOrdinal) {
        CompletableFuture<Optional<Suggestion>> lookup =
                CompletableFuture.supplyAsync(() -> delegate.suggest(fingerprint, branchOrdinal), executor);
        try {
            Optional<Suggestion> suggestion = lookup.get(timeoutMillis, TimeUnit.MILLISECONDS);
            return suggestion == null ? Optional.empty() : suggestion;
        } catch (TimeoutException e) {
            lookup.cancel(true);
            logger.warn("Suggestion lookup for {} branch {} timed out after {} ms",
                    fingerprint.structuralHash(), branchOrdinal, timeoutMillis);
        } catch (ExecutionException e) {
            logger.warn("Suggestion lookup for {} branch {} failed: {}",
                    fingerprint.structuralHash(), branchOrdinal, e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Suggestion lookup for {} interrupted", fingerprint.structuralHash());
        }
        return Optional.empty();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
