package ai.dadaist.collage.work;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs independent tasks on a bounded thread pool. Each task is isolated: a failure is
 * recorded in its {@link TaskOutcome} and never aborts its siblings. Once the supplied
 * {@link CancellationToken} is cancelled, tasks that have not started yet are skipped.
 */
public class WorkerPool {

    private static final Logger LOGGER = LoggerFactory.getLogger(WorkerPool.class);

    private final int threads;

    public WorkerPool() {
        this(defaultThreadCount());
    }

    public WorkerPool(int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1");
        }
        this.threads = threads;
    }

    /**
     * One thread per core, leaving one core free.
     */
    public static int defaultThreadCount() {
        return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
    }

    public int threads() {
        return threads;
    }

    public <T> List<TaskOutcome<T>> runAll(List<NamedTask<T>> tasks, CancellationToken cancellation) {
        Objects.requireNonNull(tasks, "tasks");
        CancellationToken token = cancellation == null ? CancellationToken.none() : cancellation;
        if (tasks.isEmpty()) {
            return List.of();
        }
        int poolSize = Math.min(threads, tasks.size());
        ExecutorService executor = Executors.newFixedThreadPool(poolSize, new WorkerThreadFactory());
        try {
            List<Future<TaskOutcome<T>>> futures = new ArrayList<>(tasks.size());
            for (NamedTask<T> task : tasks) {
                futures.add(executor.submit(wrap(task, token)));
            }
            List<TaskOutcome<T>> outcomes = new ArrayList<>(tasks.size());
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(await(tasks.get(i).name(), futures.get(i)));
            }
            return List.copyOf(outcomes);
        } finally {
            executor.shutdownNow();
        }
    }

    private <T> Callable<TaskOutcome<T>> wrap(NamedTask<T> task, CancellationToken token) {
        return () -> {
            if (token.isCancelled()) {
                return TaskOutcome.skipped(task.name());
            }
            try {
                return TaskOutcome.succeeded(task.name(), task.work().call());
            } catch (Exception ex) {
                LOGGER.warn("Task {} failed: {}", task.name(), ex.getMessage(), ex);
                return TaskOutcome.failed(task.name(), describe(ex));
            }
        };
    }

    private <T> TaskOutcome<T> await(String name, Future<TaskOutcome<T>> future) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while waiting for task {}", name);
            return TaskOutcome.skipped(name);
        } catch (ExecutionException ex) {
            return TaskOutcome.failed(name, describe(ex.getCause()));
        }
    }

    private static String describe(Throwable throwable) {
        if (throwable == null) {
            return "unknown failure";
        }
        String message = throwable.getMessage();
        return message == null || message.isBlank() ? throwable.getClass().getSimpleName() : message;
    }

    /**
     * A unit of pooled work with a name used in logs and outcomes.
     */
    public record NamedTask<T>(String name, Callable<T> work) {

        public NamedTask {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(work, "work");
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();
        private final int poolId = POOL_SEQUENCE.incrementAndGet();
        private final AtomicInteger threadSequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "tile-worker-" + poolId + "-" + threadSequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
