package in.signalbridge.service.trade;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * TradeCoordinator - single writer per trade id.
 *
 * PARTITIONING STRATEGY:
 * - Partition count = clamp(availableProcessors(), 8, 32)
 * - Route by: hash(tradeId) % partitions
 * - Each partition is a single-thread executor
 *
 * Every lifecycle operation on a trade (execution after persistence, manual close,
 * monitor close) runs on that trade's partition, so transitions for one id are
 * totally ordered while unrelated trades proceed in parallel. No global lock.
 *
 * Tasks must not submit to the coordinator and wait from inside a partition thread.
 */
public final class TradeCoordinator {
    private static final Logger log = LoggerFactory.getLogger(TradeCoordinator.class);

    private static final int MIN_PARTITIONS = 8;
    private static final int MAX_PARTITIONS = 32;

    private final ExecutorService[] partitions;
    private final int partitionCount;

    public TradeCoordinator() {
        this(calculateOptimalPartitions());
    }

    public TradeCoordinator(int partitionCount) {
        if (partitionCount < 1) {
            throw new IllegalArgumentException("partitionCount must be >= 1");
        }
        this.partitionCount = partitionCount;
        this.partitions = new ExecutorService[partitionCount];

        for (int i = 0; i < partitionCount; i++) {
            final int partitionIndex = i;
            this.partitions[i] = Executors.newSingleThreadExecutor(runnable -> {
                Thread t = new Thread(runnable, "trade-coordinator-" + partitionIndex);
                t.setDaemon(true);
                return t;
            });
        }

        log.info("TradeCoordinator initialized with {} partitions (CPUs: {})",
            partitionCount, Runtime.getRuntime().availableProcessors());
    }

    private static int calculateOptimalPartitions() {
        int processors = Runtime.getRuntime().availableProcessors();
        return Math.max(MIN_PARTITIONS, Math.min(MAX_PARTITIONS, processors));
    }

    /**
     * Run a task for a trade on its partition.
     */
    public CompletableFuture<Void> execute(long tradeId, Runnable task) {
        return CompletableFuture.runAsync(task, partitions[getPartition(tradeId)]);
    }

    /**
     * Run a task for a trade on its partition and return its result.
     *
     * Unchecked exceptions complete the future with the original exception;
     * checked ones are wrapped.
     */
    public <T> CompletableFuture<T> executeWithResult(long tradeId, Callable<T> task) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return task.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new IllegalStateException("Trade operation failed: " + tradeId, e);
            }
        }, partitions[getPartition(tradeId)]);
    }

    /**
     * Blocking variant of {@link #executeWithResult}: waits for the task and
     * rethrows its unchecked exception unwrapped.
     */
    public <T> T executeAndWait(long tradeId, Callable<T> task) {
        try {
            return executeWithResult(tradeId, task).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }

    int getPartition(long tradeId) {
        return Math.abs(Long.hashCode(tradeId) % partitionCount);
    }

    /**
     * Shutdown all partitions gracefully, waiting up to 30 seconds for pending tasks.
     */
    public void shutdown() {
        log.info("Shutting down TradeCoordinator with {} partitions", partitionCount);

        for (ExecutorService partition : partitions) {
            partition.shutdown();
        }

        try {
            for (int i = 0; i < partitionCount; i++) {
                if (!partitions[i].awaitTermination(30, TimeUnit.SECONDS)) {
                    log.warn("Partition {} did not terminate in time, forcing shutdown", i);
                    partitions[i].shutdownNow();
                }
            }
        } catch (InterruptedException e) {
            log.error("Shutdown interrupted", e);
            for (ExecutorService partition : partitions) {
                partition.shutdownNow();
            }
            Thread.currentThread().interrupt();
        }

        log.info("TradeCoordinator shutdown complete");
    }

    public int getPartitionCount() {
        return partitionCount;
    }
}
