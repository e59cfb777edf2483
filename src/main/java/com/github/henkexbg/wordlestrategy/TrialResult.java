package com.github.henkexbg.wordlestrategy;

import java.util.List;

/**
 * Holds the outcome of one greedy trial.
 *
 * @author Henrik Bjerne
 *
 */
public final class TrialResult {

	private final Word secret;

	private final List<Word> guesses;

	private final long durationMillis;

	public TrialResult(Word secret, List<Word> guesses, long durationMillis) {
		this.secret = secret;
		this.guesses = List.copyOf(guesses);
		this.durationMillis = durationMillis;
	}

	public Word getSecret() {
		return secret;
	}

	/**
	 * @return Guesses in the order they were made, starting with the opening guess
	 */
	public List<Word> getGuesses() {
		return guesses;
	}

	/**
	 * @return Number of guesses made until only the secret was left
	 */
	public int getGuessCount() {
		return guesses.size();
	}

	/**
	 * @return true if the last guess made was the secret itself
	 */
	public boolean solvedOnLastGuess() {
		return guesses.get(guesses.size() - 1).equals(secret);
	}

	/**
	 * @return Number of guesses including the final one naming the secret, when
	 *         the secret was found without being guessed
	 */
	public int guessesToWin() {
		return solvedOnLastGuess() ? getGuessCount() : getGuessCount() + 1;
	}

	public boolean withinBudget(int maxTurns) {
		return getGuessCount() <= maxTurns;
	}

	public long getDurationMillis() {
		return durationMillis;
	}

	@Override
	public String toString() {
		return "TrialResult [secret=" + secret + ", guesses=" + guesses + ", guessCount=" + getGuessCount()
				+ ", durationMillis=" + durationMillis + "]";
	}

}
