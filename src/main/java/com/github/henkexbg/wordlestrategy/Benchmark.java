package com.github.henkexbg.wordlestrategy;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Plays greedy trials against a number of answers and summarizes them. Secrets
 * that need more guesses than allowed are logged as warnings but do not stop
 * the run.
 *
 * @author Henrik Bjerne
 *
 */
public final class Benchmark {

	private static final Logger log = LogManager.getLogger(Benchmark.class);

	private Benchmark() {
	}

	/**
	 * Picks {@code trials} answers spread evenly over the answer list, starting
	 * with the first one.
	 *
	 * @param numAnswers Number of answers
	 * @param trials     Number of answers wanted
	 * @return Answer indices
	 */
	public static List<Integer> evenlySpaced(int numAnswers, int trials) {
		if (trials <= 0) {
			throw new IllegalArgumentException("Number of trials must be positive: " + trials);
		}
		if (trials >= numAnswers) {
			return all(numAnswers);
		}
		int step = numAnswers / trials;
		return IntStream.range(0, trials).map(i -> i * step).boxed().collect(Collectors.toList());
	}

	public static List<Integer> all(int numAnswers) {
		return IntStream.range(0, numAnswers).boxed().collect(Collectors.toList());
	}

	/**
	 * Runs one trial per answer index.
	 *
	 * @param solver        Solver to use
	 * @param secretIndices Answers to play against
	 * @param maxTurns      Guess budget
	 * @return Summary
	 */
	public static BenchmarkSummary run(GreedySolver solver, List<Integer> secretIndices, int maxTurns) {
		List<TrialResult> results = new ArrayList<>(secretIndices.size());
		for (int secretIndex : secretIndices) {
			TrialResult result = solver.runGreedyTrial(secretIndex);
			log.info("{} solved in {} guesses ({} ms)", result.getSecret(), result.getGuessCount(),
					result.getDurationMillis());
			if (!result.withinBudget(maxTurns)) {
				log.warn("{} needed {} guesses, more than the {} allowed: {}", result.getSecret(),
						result.getGuessCount(), maxTurns, result.getGuesses());
			}
			results.add(result);
		}
		return summarize(results, maxTurns);
	}

	static BenchmarkSummary summarize(List<TrialResult> results, int maxTurns) {
		int withinBudget = (int) results.stream().filter(r -> r.withinBudget(maxTurns)).count();
		double avgGuesses = results.stream().collect(Collectors.averagingInt(TrialResult::getGuessCount));
		int maxGuesses = results.stream().mapToInt(TrialResult::getGuessCount).max().orElse(0);
		long totalDurationMillis = results.stream().collect(Collectors.summingLong(TrialResult::getDurationMillis));
		List<Word> overBudget = results.stream().filter(r -> !r.withinBudget(maxTurns)).map(TrialResult::getSecret)
				.collect(Collectors.toList());
		return new BenchmarkSummary(results.size(), withinBudget, avgGuesses, maxGuesses, totalDurationMillis,
				overBudget);
	}

}
