package com.memorygraph.hierarchy;

import com.memorygraph.index.SimilarityKeyFunction;
import com.memorygraph.shared.CancellationSignal;
import com.memorygraph.shared.config.RollupConfig;
import com.memorygraph.shared.model.ConsentLevel;
import com.memorygraph.shared.model.MemoryLevel;
import com.memorygraph.shared.model.MemoryNode;
import com.memorygraph.store.NodeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Rolls un-rolled nodes of one level into a summary node one level up.
 *
 * <p>Rollups for the same {@code (owner, level)} are mutually exclusive: a second caller
 * finds the lock held and skips. Source nodes are never modified or deleted; they only gain
 * a parent link when the summary commits. A rollup that times out or is cancelled commits
 * nothing.
 */
public class HierarchyAggregator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HierarchyAggregator.class);

    private static final long POLL_NANOS = TimeUnit.MILLISECONDS.toNanos(50);
    private static final List<MemoryLevel> ROLLUP_LEVELS =
            List.of(MemoryLevel.ATOMIC, MemoryLevel.DAILY, MemoryLevel.WEEKLY);

    // most recent first, importance breaks ties
    private static final Comparator<MemoryNode> SELECTION = Comparator
            .comparing(MemoryNode::createdAt, Comparator.reverseOrder())
            .thenComparing(Comparator.comparingDouble(MemoryNode::importance).reversed())
            .thenComparing(MemoryNode::id);

    private record RollupKey(String owner, MemoryLevel level) {}

    private final NodeStore store;
    private final SimilarityKeyFunction keyFunction;
    private final Summarizer summarizer;
    private final RollupConfig config;
    private final ConcurrentHashMap<RollupKey, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final ExecutorService summarizerPool;

    public HierarchyAggregator(NodeStore store, SimilarityKeyFunction keyFunction,
                               Summarizer summarizer, RollupConfig config) {
        this.store = store;
        this.keyFunction = keyFunction;
        this.summarizer = summarizer;
        this.config = config;
        var threadCount = new AtomicInteger();
        this.summarizerPool = Executors.newCachedThreadPool(r -> {
            var t = new Thread(r, "summarizer-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public boolean checkRollupTrigger(String owner, MemoryLevel level) {
        int threshold = config.thresholdFor(level);
        return threshold > 0 && store.unrolled(owner, level).size() >= threshold;
    }

    /**
     * Builds one summary for {@code (owner, level)} if the trigger holds.
     *
     * @return the committed summary, or empty when the trigger does not hold or another
     *         rollup for the same pair is in progress
     * @throws MaintenanceTimeoutException when the summarizer misses its deadline
     * @throws RollupException when the summarizer fails
     * @throws CancellationException when {@code signal} fires before commit
     */
    public Optional<MemoryNode> rollup(String owner, MemoryLevel level, CancellationSignal signal)
            throws RollupException {
        var target = level.coarser().orElse(null);
        if (target == null) return Optional.empty();

        var lock = locks.computeIfAbsent(new RollupKey(owner, level), k -> new ReentrantLock());
        if (!lock.tryLock()) {
            log.debug("Rollup already running for owner={} level={}", owner, level);
            return Optional.empty();
        }
        try {
            int threshold = config.thresholdFor(level);
            var candidates = store.unrolled(owner, level);
            if (threshold <= 0 || candidates.size() < threshold) return Optional.empty();
            signal.throwIfCancelled("rollup");

            var batch = candidates.stream().sorted(SELECTION).limit(threshold)
                    .sorted(Comparator.comparing(MemoryNode::createdAt).thenComparing(MemoryNode::id))
                    .toList();

            var content = summarizeWithDeadline(owner, target, batch, signal);
            var key = keyFunction.keyFor(content);
            signal.throwIfCancelled("rollup");

            var consent = batch.get(0).consent();
            double importance = 0.0;
            var tags = new LinkedHashSet<String>();
            var children = new ArrayList<String>(batch.size());
            for (var node : batch) {
                consent = ConsentLevel.mostRestrictive(consent, node.consent());
                importance = Math.max(importance, node.importance());
                tags.addAll(node.tags());
                children.add(node.id());
            }
            var summary = store.createSummary(owner, target, content, key, consent, importance, tags, children);
            log.info("Rolled {} {} node(s) of {} into {} summary {}",
                    children.size(), level, owner, target, summary.id());
            return Optional.of(summary);
        } finally {
            lock.unlock();
        }
    }

    private String summarizeWithDeadline(String owner, MemoryLevel target, List<MemoryNode> batch,
                                         CancellationSignal signal) throws RollupException {
        var timeout = config.summarizerTimeout();
        var future = summarizerPool.submit(() -> summarizer.summarize(target, batch));
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            while (true) {
                if (signal.isCancelled()) {
                    future.cancel(true);
                    throw new CancellationException("rollup cancelled");
                }
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    future.cancel(true);
                    throw new MaintenanceTimeoutException(owner, target, timeout);
                }
                try {
                    return future.get(Math.min(remaining, POLL_NANOS), TimeUnit.NANOSECONDS);
                } catch (TimeoutException e) {
                    log.trace("Summarizer still running for owner={} level={}", owner, target);
                }
            }
        } catch (ExecutionException e) {
            throw new RollupException("Summarizer failed for owner=" + owner + " level=" + target, e.getCause());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("rollup interrupted");
        }
    }

    /**
     * Runs rollups for every owner, finest level first, so a pass may cascade from atomic
     * nodes all the way to a monthly summary. A failed rollup is recorded as a warning and
     * the pass moves on; cancellation stops the pass with what was already committed.
     */
    public RollupPass maintain(CancellationSignal signal) {
        var summaries = new ArrayList<MemoryNode>();
        var warnings = new ArrayList<String>();
        int timeouts = 0;
        try {
            for (var owner : store.owners()) {
                for (var level : ROLLUP_LEVELS) {
                    while (checkRollupTrigger(owner, level)) {
                        signal.throwIfCancelled("maintenance");
                        try {
                            var summary = rollup(owner, level, signal);
                            if (summary.isEmpty()) break;
                            summaries.add(summary.get());
                        } catch (MaintenanceTimeoutException e) {
                            log.warn("Rollup abandoned: {}", e.getMessage());
                            warnings.add(e.getMessage());
                            timeouts++;
                            break;
                        } catch (RollupException e) {
                            log.warn("Rollup skipped: {}", e.getMessage());
                            warnings.add(e.getMessage());
                            break;
                        }
                    }
                }
            }
        } catch (CancellationException e) {
            log.info("Maintenance cancelled after {} summary node(s)", summaries.size());
            return new RollupPass(summaries, warnings, timeouts, true);
        }
        return new RollupPass(summaries, warnings, timeouts, false);
    }

    @Override
    public void close() {
        summarizerPool.shutdownNow();
    }
}
