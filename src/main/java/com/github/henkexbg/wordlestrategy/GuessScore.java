package com.github.henkexbg.wordlestrategy;

/**
 * Score of one guess: the number of possible secrets left, summed over every
 * secret the guess was tried against. Lower is better. Sorts by score, then by
 * position in the word list.
 *
 * @author Henrik Bjerne
 *
 */
public final class GuessScore implements Comparable<GuessScore> {

	private final int guessIndex;

	private final Word guess;

	private final long score;

	public GuessScore(int guessIndex, Word guess, long score) {
		this.guessIndex = guessIndex;
		this.guess = guess;
		this.score = score;
	}

	public int getGuessIndex() {
		return guessIndex;
	}

	public Word getGuess() {
		return guess;
	}

	public long getScore() {
		return score;
	}

	/**
	 * @param trials Number of secrets the score was summed over
	 * @return Average number of secrets left after this guess
	 */
	public double averageRemaining(int trials) {
		return trials == 0 ? 0 : (double) score / trials;
	}

	@Override
	public int compareTo(GuessScore other) {
		int c = Long.compare(score, other.score);
		return c != 0 ? c : Integer.compare(guessIndex, other.guessIndex);
	}

	@Override
	public String toString() {
		return "GuessScore [guess=" + guess + ", guessIndex=" + guessIndex + ", score=" + score + "]";
	}

}
