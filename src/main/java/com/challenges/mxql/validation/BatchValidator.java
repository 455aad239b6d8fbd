package com.challenges.mxql.validation;

import com.challenges.mxql.report.ValidationReport;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Validates many query texts concurrently, one task per text.
 */
public class BatchValidator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BatchValidator.class);

    private final QueryValidator validator;
    private final ExecutorService executor;

    public BatchValidator(QueryValidator validator, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1: " + threads);
        }
        this.validator = validator;
        this.executor = Executors.newFixedThreadPool(threads);
    }

    public ImmutableList<ValidationReport> validateAll(Iterable<String> texts) {
        MutableList<CompletableFuture<ValidationReport>> futures = Lists.mutable.empty();
        for (String text : texts) {
            futures.add(CompletableFuture.supplyAsync(() -> validator.validate(text), executor));
        }
        log.debug("Dispatched {} validations", futures.size());
        return futures.collect(CompletableFuture::join).toImmutable();
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
