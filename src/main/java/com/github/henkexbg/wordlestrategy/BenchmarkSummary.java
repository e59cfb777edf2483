package com.github.henkexbg.wordlestrategy;

import java.util.List;

/**
 * Summary of a number of greedy trials.
 *
 * @author Henrik Bjerne
 *
 */
public final class BenchmarkSummary {

	private final int trials;

	private final int withinBudget;

	private final double averageGuesses;

	private final int maxGuesses;

	private final long totalDurationMillis;

	private final List<Word> overBudgetSecrets;

	public BenchmarkSummary(int trials, int withinBudget, double averageGuesses, int maxGuesses,
			long totalDurationMillis, List<Word> overBudgetSecrets) {
		this.trials = trials;
		this.withinBudget = withinBudget;
		this.averageGuesses = averageGuesses;
		this.maxGuesses = maxGuesses;
		this.totalDurationMillis = totalDurationMillis;
		this.overBudgetSecrets = List.copyOf(overBudgetSecrets);
	}

	public int getTrials() {
		return trials;
	}

	public int getWithinBudget() {
		return withinBudget;
	}

	public int getOverBudget() {
		return trials - withinBudget;
	}

	public double getAverageGuesses() {
		return averageGuesses;
	}

	public int getMaxGuesses() {
		return maxGuesses;
	}

	public long getTotalDurationMillis() {
		return totalDurationMillis;
	}

	public List<Word> getOverBudgetSecrets() {
		return overBudgetSecrets;
	}

	@Override
	public String toString() {
		return String.format(
				"Run completed. Trials: %s, within budget: %s, over budget: %s, average number of guesses: %.3f, max number of guesses: %s. Total duration milliseconds: %s",
				trials, withinBudget, getOverBudget(), averageGuesses, maxGuesses, totalDurationMillis);
	}

}
