package ai.wordle.sweep;

import ai.wordle.SolveLoop;
import ai.wordle.config.SweepProperties;
import ai.wordle.game.Dictionary;
import ai.wordle.game.Word;
import ai.wordle.player.Player;
import ai.wordle.player.TargetFeedbackSource;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Benchmarks opening words: every starter plays every sampled target, and starters are ranked by
 * success rate and then mean tries.
 *
 * <p>Games share nothing mutable, so the work is split into tasks of (starter, slice of targets)
 * on a fixed pool. Each task fills its own {@link StarterStats}; the slices are merged per starter
 * after the task finishes. When there are fewer starters than threads the targets are sliced
 * further so the pool stays busy.
 *
 * <p>A failed task is logged and its starter dropped. Once the time budget is spent the sweep
 * stops waiting: starters whose slices are all done are still merged, the rest are cancelled.
 * Neither affects other starters, and reports are written every
 * {@code saveInterval} starters so a long sweep leaves partial results behind.
 */
@Component
public class StarterSweep {
    private static final Logger log = LoggerFactory.getLogger(StarterSweep.class);
    private static final int LOGGED_LEADERS = 5;

    private final SweepProperties properties;
    private final SweepReportWriter reportWriter;

    public StarterSweep(SweepProperties properties, SweepReportWriter reportWriter) {
        this.properties = properties;
        this.reportWriter = reportWriter;
    }

    /**
     * Runs the sweep.
     *
     * @param player   chooses guesses; shared by all workers, so it must be stateless
     * @param starters opening words to test
     * @param targets  secret words every starter plays against
     * @return stats for every starter that completed, best first
     */
    public List<StarterStats> run(Player player, Dictionary dictionary, List<Word> starters, List<Word> targets) {
        int threads = Math.max(1, properties.getThreads());
        int slices = slicesPerStarter(starters.size(), targets.size(), threads);
        LocalDateTime startedAt = LocalDateTime.now();
        String intermediateName = SweepReportWriter.fileName("results_intermediate", targets.size(), properties.getSeed(), startedAt);
        String finalName = SweepReportWriter.fileName("results_final", targets.size(), properties.getSeed(), startedAt);

        log.info("Testing {} starters against {} targets ({} games) on {} threads",
                starters.size(), targets.size(), (long) starters.size() * targets.size(), threads);

        ExecutorService pool = Executors.newFixedThreadPool(threads, namedThreads());
        Map<Word, List<Future<StarterStats>>> tasks = new LinkedHashMap<>();
        for (Word starter : starters) {
            List<Future<StarterStats>> starterTasks = new ArrayList<>(slices);
            for (List<Word> slice : slice(targets, slices)) {
                starterTasks.add(pool.submit(() -> playStarter(player, dictionary, starter, slice)));
            }
            tasks.put(starter, starterTasks);
        }
        pool.shutdown();

        boolean bounded = !properties.getTimeout().isZero() && !properties.getTimeout().isNegative();
        long deadline = bounded ? System.nanoTime() + properties.getTimeout().toNanos() : 0L;
        boolean expired = false;
        List<StarterStats> completed = new ArrayList<>();
        try {
            int index = 0;
            for (Map.Entry<Word, List<Future<StarterStats>>> entry : tasks.entrySet()) {
                index++;
                StarterStats merged;
                if (expired) {
                    merged = collectFinished(entry.getKey(), entry.getValue());
                } else {
                    try {
                        merged = collect(entry.getKey(), entry.getValue(), bounded, deadline);
                    } catch (TimeoutException e) {
                        expired = true;
                        log.warn("Sweep time budget of {} used up at starter {} of {}; keeping only finished starters",
                                properties.getTimeout(), index, starters.size());
                        merged = collectFinished(entry.getKey(), entry.getValue());
                    }
                }
                if (merged != null) {
                    completed.add(merged);
                    if (log.isDebugEnabled()) {
                        log.debug("[{}/{}] {}", index, starters.size(), merged);
                    }
                }
                if (index % Math.max(1, properties.getSaveInterval()) == 0 || index == starters.size()) {
                    reportProgress(index, starters.size(), completed, intermediateName);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Sweep interrupted after {} of {} starters", completed.size(), starters.size());
        } finally {
            pool.shutdownNow();
        }

        List<StarterStats> ranked = new ArrayList<>(completed);
        ranked.sort(StarterStats.RANKING);
        reportWriter.write(finalName, ranked);
        logLeaders(ranked, 20);
        return ranked;
    }

    /**
     * Plays one starter against a list of targets; runs on a worker thread.
     */
    static StarterStats playStarter(Player player, Dictionary dictionary, Word starter, List<Word> targets) {
        SolveLoop loop = new SolveLoop(player, dictionary);
        StarterStats stats = new StarterStats(starter);
        for (Word target : targets) {
            stats.record(loop.play(new TargetFeedbackSource(target), starter));
        }
        return stats;
    }

    /**
     * Waits for all slices of one starter and merges them.
     *
     * @param bounded  whether {@code deadline} applies; without a budget this blocks until done
     * @return the merged stats, or {@code null} if a slice failed
     * @throws TimeoutException if the deadline passes before every slice is done
     */
    private StarterStats collect(Word starter, List<Future<StarterStats>> slices, boolean bounded, long deadline)
            throws InterruptedException, TimeoutException {
        StarterStats merged = new StarterStats(starter);
        for (Future<StarterStats> future : slices) {
            try {
                if (bounded) {
                    long remaining = deadline - System.nanoTime();
                    if (remaining <= 0 && !future.isDone()) {
                        throw new TimeoutException();
                    }
                    merged.merge(future.get(Math.max(0L, remaining), TimeUnit.NANOSECONDS));
                } else {
                    merged.merge(future.get());
                }
            } catch (ExecutionException | CancellationException e) {
                log.error("Starter {} failed; leaving it out of the results", starter, e);
                return null;
            }
        }
        return merged;
    }

    /**
     * Merges one starter without waiting, once the time budget is spent.
     *
     * @return the merged stats, or {@code null} if any slice is unfinished, cancelled or failed
     */
    private StarterStats collectFinished(Word starter, List<Future<StarterStats>> slices) throws InterruptedException {
        for (Future<StarterStats> future : slices) {
            if (!future.isDone() || future.isCancelled()) {
                log.warn("Starter {} did not finish within the time budget; leaving it out", starter);
                return null;
            }
        }
        StarterStats merged = new StarterStats(starter);
        for (Future<StarterStats> future : slices) {
            try {
                merged.merge(future.get());
            } catch (ExecutionException e) {
                log.error("Starter {} failed; leaving it out of the results", starter, e);
                return null;
            }
        }
        return merged;
    }

    private void reportProgress(int index, int total, List<StarterStats> completed, String fileName) {
        log.info("Progress: {}/{} starters ({}%)", index, total, String.format("%.1f", index * 100.0 / total));
        List<StarterStats> ranked = new ArrayList<>(completed);
        ranked.sort(StarterStats.RANKING);
        reportWriter.write(fileName, ranked);
        logLeaders(ranked, LOGGED_LEADERS);
    }

    private static void logLeaders(List<StarterStats> ranked, int limit) {
        if (!log.isInfoEnabled()) {
            return;
        }
        for (int i = 0; i < Math.min(limit, ranked.size()); i++) {
            log.info("  {}. {}", i + 1, ranked.get(i));
        }
    }

    static int slicesPerStarter(int starters, int targets, int threads) {
        if (starters == 0 || targets == 0 || starters >= threads) {
            return 1;
        }
        int wanted = (threads + starters - 1) / starters;
        return Math.min(wanted, targets);
    }

    static List<List<Word>> slice(List<Word> targets, int slices) {
        List<List<Word>> result = new ArrayList<>(slices);
        int size = targets.size();
        for (int i = 0; i < slices; i++) {
            int from = (int) ((long) size * i / slices);
            int to = (int) ((long) size * (i + 1) / slices);
            result.add(List.copyOf(targets.subList(from, to)));
        }
        return result;
    }

    private static ThreadFactory namedThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "sweep-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
