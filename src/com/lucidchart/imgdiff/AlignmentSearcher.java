package com.lucidchart.imgdiff;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.lucidchart.imgdiff.Require.require;

/** Finds the integer offset that best aligns the second image with the first.
 *
 * Every candidate offset of a square window is scored by the {@link SimilarityScorer} on a fixed pool of worker threads,
 * and a single collector on the calling thread keeps the best result.
 * Two strategies are available:
 * the exhaustive search scores the full window of +/- maxOffset at the configured sampling rate,
 * while the progressive search (fast mode) starts with a coarse sampling over the full window
 * and then re-centers ever smaller windows on the previous winner with finer sampling.
 *
 * The pool belongs to a single search call and is sized by the settings, so concurrent searches never interfere.
 * There is no early termination: every candidate of a window is scored exactly once.
 */
public class AlignmentSearcher {

    /** Sampling rates of the progressive stages, before the final stage at the configured rate */
    static final int[] COARSE_STAGE_SAMPLING_RATES = {8, 4, 2};

    /** Smallest search radius of a refinement stage */
    static final int MIN_STAGE_RADIUS = 2;

    private final DiffSettings settings;
    private final SimilarityScorer scorer;

    public AlignmentSearcher(DiffSettings settings) {
        this(settings, new SimilarityScorer(settings));
    }

    AlignmentSearcher(DiffSettings settings, SimilarityScorer scorer) {
        require(settings != null, "Settings must be provided");
        this.settings = settings;
        this.scorer = scorer;
    }

    /** Returns the offset with the highest similarity score.
     * @throws IllegalArgumentException if either image has no pixels
     * @throws AlignmentSearchException if a worker fails or the calling thread is interrupted
     */
    public Offset findBestAlignment(RasterImage imgA, RasterImage imgB) {
        require(imgA != null && imgB != null, "Both images must be provided");
        require(!imgA.isEmpty() && !imgB.isEmpty(), "Images must not be empty: first " + imgA + ", second " + imgB);

        LOG.info("findBestAlignment: entry, first {}, second {}, using {} worker(s)", imgA, imgB, settings.getWorkerCount());
        long startTime = System.currentTimeMillis();

        Offset best;
        if (settings.isFastMode()) {
            best = findWithProgressiveSampling(imgA, imgB);
        } else {
            if (settings.getSamplingRate() > 1)
                LOG.info("findBestAlignment: using sampling rate 1/{} (analyzing {}% of pixels)",
                        settings.getSamplingRate(), 100 / (settings.getSamplingRate() * settings.getSamplingRate()));
            best = searchWindow(imgA, imgB, Offset.ZERO, settings.getMaxOffset(), settings.getSamplingRate()).offset;
        }

        LOG.info("findBestAlignment: exit, best offset {} found in {}ms", best, System.currentTimeMillis() - startTime);
        return best;
    }

    /** Coarse to fine search: each stage samples more densely within a smaller window around the previous winner. */
    Offset findWithProgressiveSampling(RasterImage imgA, RasterImage imgB) {
        int[] stages = progressiveSamplingRates(settings.getSamplingRate());
        int radius = settings.getMaxOffset();
        Offset best = Offset.ZERO;

        for (int stage = 0; stage < stages.length; stage++) {
            long stageStart = System.currentTimeMillis();
            int stageRadius = stageRadius(radius, stage);

            LOG.info("findWithProgressiveSampling: stage {}/{}, sampling rate 1/{}, radius {} around {}",
                    stage + 1, stages.length, stages[stage], stageRadius, best);

            OffsetScore stageBest = searchWindow(imgA, imgB, best, stageRadius, stages[stage]);
            best = stageBest.offset;
            radius = stageRadius;

            LOG.info("findWithProgressiveSampling: stage {} completed with {} in {}ms",
                    stage + 1, stageBest, System.currentTimeMillis() - stageStart);
        }
        return best;
    }

    /** The sampling rate of each progressive stage.  The last stage runs at the configured rate, or every pixel. */
    static int[] progressiveSamplingRates(int samplingRate) {
        int[] stages = new int[COARSE_STAGE_SAMPLING_RATES.length + 1];
        System.arraycopy(COARSE_STAGE_SAMPLING_RATES, 0, stages, 0, COARSE_STAGE_SAMPLING_RATES.length);
        stages[stages.length - 1] = samplingRate > 1 ? samplingRate : 1;
        return stages;
    }

    /** The first stage covers the full radius, each following stage shrinks the previous radius */
    static int stageRadius(int previousRadius, int stage) {
        return stage == 0 ? previousRadius : Math.max(MIN_STAGE_RADIUS, previousRadius / (2 * stage));
    }

    /** Scores every offset within radius of the center on both axes and returns the best one. */
    OffsetScore searchWindow(RasterImage imgA, RasterImage imgB, Offset center, int radius, int samplingRate) {
        List<Offset> candidates = new ArrayList<>((2 * radius + 1) * (2 * radius + 1));
        for (int dy = center.dy - radius; dy <= center.dy + radius; dy++)
            for (int dx = center.dx - radius; dx <= center.dx + radius; dx++)
                candidates.add(Offset.apply(dx, dy));

        int total = candidates.size();
        int numWorkers = Math.min(settings.getWorkerCount(), total);

        LOG.debug("searchWindow: scoring {} offsets in x[{},{}] y[{},{}] with {} worker(s)",
                total, center.dx - radius, center.dx + radius, center.dy - radius, center.dy + radius, numWorkers);

        ExecutorService pool = Executors.newFixedThreadPool(numWorkers, new WorkerThreadFactory());
        try {
            CompletionService<OffsetScore> results = new ExecutorCompletionService<>(pool);
            for (Offset candidate : candidates)
                results.submit(() -> new OffsetScore(candidate, scorer.score(imgA, imgB, candidate, samplingRate)));

            return collect(results, total);
        } finally {
            pool.shutdownNow();
        }
    }

    /** Drains all results, keeping the best, and reports progress every progressStep percent */
    private OffsetScore collect(CompletionService<OffsetScore> results, int total) {
        long startTime = System.currentTimeMillis();
        int progressStep = settings.getProgressStep();
        int lastPercentReported = -1;
        OffsetScore best = null;

        try {
            for (int processed = 1; processed <= total; processed++) {
                OffsetScore result = results.take().get();
                if (result.isBetterThan(best)) best = result;

                int percent = (processed * 100) / total;
                if (percent > lastPercentReported && percent % progressStep == 0) {
                    long elapsed = System.currentTimeMillis() - startTime;
                    long remaining = elapsed * (total - processed) / processed;
                    LOG.info("collect: alignment search progress {}% - elapsed {}ms, est. remaining {}ms", percent, elapsed, remaining);
                    lastPercentReported = percent;
                }
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new AlignmentSearchException("Interrupted while searching for the best alignment", ie);
        } catch (ExecutionException ee) {
            throw new AlignmentSearchException("Failed to score an alignment candidate", ee.getCause());
        }
        return best;
    }

    /** Names the pool threads and keeps them from holding the JVM open */
    private static class WorkerThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL_COUNT = new AtomicInteger();
        private final int poolNumber = POOL_COUNT.incrementAndGet();
        private final AtomicInteger threadCount = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "alignment-" + poolNumber + "-worker-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(AlignmentSearcher.class);
}
