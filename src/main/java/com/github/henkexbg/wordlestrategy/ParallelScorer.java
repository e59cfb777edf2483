package com.github.henkexbg.wordlestrategy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs the outer loop of a scoring pass on a fixed pool of threads. The outer
 * range is cut into chunks, each chunk adds into its own score array, and the
 * arrays are summed once every chunk is done. Scores are whole numbers, so the
 * result is the same as running the loop on one thread.
 *
 * @author Henrik Bjerne
 *
 */
public class ParallelScorer implements AutoCloseable {

	private static final Logger log = LogManager.getLogger(ParallelScorer.class);

	private static final String THREAD_NAME_PREFIX = "wordle-score-";

	private static final int CHUNKS_PER_THREAD = 4;

	private static final long SHUTDOWN_TIMEOUT_MILLIS = 2500;

	/**
	 * Body of the outer loop. Must only write to the given array.
	 */
	@FunctionalInterface
	public interface OuterStep {

		/**
		 * @param outerIndex Index in the outer loop
		 * @param scores     Score array owned by the calling chunk
		 */
		void accumulate(int outerIndex, long[] scores);
	}

	private final int parallelism;

	/**
	 * Null when running on the caller's thread only
	 */
	private final ExecutorService pool;

	/**
	 * @param parallelism Number of threads. 0 or less means one per available
	 *                    processor. 1 runs everything on the calling thread.
	 */
	public ParallelScorer(int parallelism) {
		this.parallelism = parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors();
		this.pool = this.parallelism > 1 ? createPool(this.parallelism) : null;
		log.debug("Created scorer with parallelism {}", this.parallelism);
	}

	public int getParallelism() {
		return parallelism;
	}

	/**
	 * Runs {@code step} for every outer index in [0, outerCount) and returns the
	 * summed scores.
	 *
	 * @param outerCount Number of outer iterations
	 * @param width      Length of the score array
	 * @param step       Loop body
	 * @return Summed scores, length {@code width}
	 * @throws CancellationException if the calling thread is interrupted while
	 *                               waiting
	 */
	public long[] score(int outerCount, int width, OuterStep step) {
		if (pool == null || outerCount < 2) {
			long[] scores = new long[width];
			for (int i = 0; i < outerCount; i++) {
				step.accumulate(i, scores);
			}
			return scores;
		}
		int chunkCount = Math.min(outerCount, parallelism * CHUNKS_PER_THREAD);
		int chunkSize = (outerCount + chunkCount - 1) / chunkCount;
		List<Future<long[]>> futures = new ArrayList<>(chunkCount);
		for (int start = 0; start < outerCount; start += chunkSize) {
			final int s = start;
			final int e = Math.min(outerCount, start + chunkSize);
			futures.add(pool.submit(() -> {
				long[] partial = new long[width];
				for (int i = s; i < e; i++) {
					step.accumulate(i, partial);
				}
				return partial;
			}));
		}
		long[] scores = new long[width];
		try {
			for (Future<long[]> future : futures) {
				long[] partial = future.get();
				for (int j = 0; j < width; j++) {
					scores[j] += partial[j];
				}
			}
		} catch (InterruptedException e) {
			cancelAll(futures);
			Thread.currentThread().interrupt();
			CancellationException ce = new CancellationException("Interrupted while scoring");
			ce.initCause(e);
			throw ce;
		} catch (ExecutionException e) {
			cancelAll(futures);
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException) {
				throw (RuntimeException) cause;
			}
			if (cause instanceof Error) {
				throw (Error) cause;
			}
			throw new IllegalStateException("Scoring failed", cause);
		}
		return scores;
	}

	private static void cancelAll(List<? extends Future<?>> futures) {
		for (Future<?> future : futures) {
			future.cancel(true);
		}
	}

	private static ExecutorService createPool(int parallelism) {
		final AtomicLong threadId = new AtomicLong(1);
		ThreadFactory tf = r -> {
			Thread t = new Thread(r, THREAD_NAME_PREFIX + threadId.getAndIncrement());
			t.setDaemon(true);
			return t;
		};
		return new ThreadPoolExecutor(parallelism, parallelism, 30L, TimeUnit.SECONDS, new LinkedBlockingQueue<>(),
				tf);
	}

	@Override
	public void close() {
		if (pool == null) {
			return;
		}
		pool.shutdown();
		try {
			if (!pool.awaitTermination(SHUTDOWN_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
				log.warn("Scoring pool did not stop within {} ms, forcing shutdown", SHUTDOWN_TIMEOUT_MILLIS);
				pool.shutdownNow();
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			pool.shutdownNow();
		}
	}

}
