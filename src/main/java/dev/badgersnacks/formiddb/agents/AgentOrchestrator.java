package dev.badgersnacks.formiddb.agents;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executor facade that keeps filesystem probing and ingestion runs off the interactive thread.
 */
public class AgentOrchestrator implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(AgentOrchestrator.class);

    private final ExecutorService executorService;

    public AgentOrchestrator() {
        this(Math.max(2, Runtime.getRuntime().availableProcessors() / 2));
    }

    public AgentOrchestrator(int threads) {
        this.executorService = Executors.newFixedThreadPool(threads, new AgentThreadFactory());
    }

    public <T> CompletableFuture<AgentResult<T>> submit(AgentTask<T> task) {
        Objects.requireNonNull(task, "task");
        return CompletableFuture.supplyAsync(() -> execute(task), executorService);
    }

    private <T> AgentResult<T> execute(AgentTask<T> task) {
        Instant start = Instant.now();
        try {
            T payload = task.run();
            Duration duration = Duration.between(start, Instant.now());
            LOGGER.debug("Agent {} finished in {} ms", task.name(), duration.toMillis());
            return new AgentResult<>(task.name(), payload, duration);
        } catch (Exception e) {
            throw new CompletionException(e);
        }
    }

    @Override
    public void close() {
        executorService.shutdownNow();
    }

    private static class AgentThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "formid-agent-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
