package com.github.henkexbg.wordlestrategy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Settings for the solver, bound from JSON. Defaults are in the field
 * initializers, {@link #validate()} fills in blanks and rejects values that
 * can't work.
 *
 * @author Henrik Bjerne
 *
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SolverConfig {

	public static final String DEFAULT_ANSWERS_RESOURCE = "/wordle-answers.txt";

	public static final String DEFAULT_ALLOWED_GUESSES_RESOURCE = "/wordle-allowed-guesses.txt";

	/**
	 * Gave the lowest total number of remaining answers when ranking first
	 * guesses against the full answer list.
	 */
	public static final String DEFAULT_OPENING_GUESS = "roate";

	public String answersResource = DEFAULT_ANSWERS_RESOURCE;

	public String allowedGuessesResource = DEFAULT_ALLOWED_GUESSES_RESOURCE;

	public String openingGuess = DEFAULT_OPENING_GUESS;

	public int maxTurns = 6;

	/** Number of first guesses printed by the ranking */
	public int rankingSize = 50;

	/** Number of evenly spaced answers used by the default benchmark */
	public int benchmarkTrials = 50;

	/** Answer used for the single demo trial. Falls back to the first answer if out of range. */
	public int sampleAnswerIndex = 445;

	/** Scoring threads, 0 means one per processor */
	public int parallelism = 0;

	public void validate() {
		if (answersResource == null || answersResource.isBlank()) {
			answersResource = DEFAULT_ANSWERS_RESOURCE;
		}
		if (allowedGuessesResource == null || allowedGuessesResource.isBlank()) {
			allowedGuessesResource = DEFAULT_ALLOWED_GUESSES_RESOURCE;
		}
		if (openingGuess == null || openingGuess.isBlank()) {
			openingGuess = DEFAULT_OPENING_GUESS;
		}
		openingGuess = openingGuess.trim();
		try {
			Word.fromString(openingGuess);
		} catch (WordFormatException e) {
			throw new IllegalStateException("Invalid openingGuess in config", e);
		}
		if (maxTurns <= 0) {
			throw new IllegalStateException("maxTurns must be positive: " + maxTurns);
		}
		if (rankingSize <= 0) {
			throw new IllegalStateException("rankingSize must be positive: " + rankingSize);
		}
		if (benchmarkTrials <= 0) {
			throw new IllegalStateException("benchmarkTrials must be positive: " + benchmarkTrials);
		}
		if (sampleAnswerIndex < 0) {
			sampleAnswerIndex = 0;
		}
		if (parallelism < 0) {
			parallelism = 0;
		}
	}

	public Word openingGuessWord() {
		return Word.fromString(openingGuess);
	}

	@Override
	public String toString() {
		return "SolverConfig [answersResource=" + answersResource + ", allowedGuessesResource="
				+ allowedGuessesResource + ", openingGuess=" + openingGuess + ", maxTurns=" + maxTurns
				+ ", rankingSize=" + rankingSize + ", benchmarkTrials=" + benchmarkTrials + ", sampleAnswerIndex="
				+ sampleAnswerIndex + ", parallelism=" + parallelism + "]";
	}

}
