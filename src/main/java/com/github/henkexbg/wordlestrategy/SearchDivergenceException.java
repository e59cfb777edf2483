package com.github.henkexbg.wordlestrategy;

/**
 * The greedy search did not end with exactly the secret word left, or a round
 * removed no candidates. Either means the simulated feedback disagrees with the
 * real feedback, so the trial result can't be trusted.
 *
 * @author Henrik Bjerne
 *
 */
public class SearchDivergenceException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	public SearchDivergenceException(String message) {
		super(message);
	}

}
