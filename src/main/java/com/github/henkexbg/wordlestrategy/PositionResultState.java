package com.github.henkexbg.wordlestrategy;

/**
 * Feedback for one letter of a guess.
 *
 * @author Henrik Bjerne
 *
 */
public enum PositionResultState {

	/**
	 * Right letter, right position. Green in Wordle.
	 */
	MATCH('G'),

	/**
	 * Letter is in the word but not at this position. Yellow in Wordle.
	 */
	OTHER_POSITION('Y'),

	/**
	 * Letter is not in the word at all. Grey in Wordle.
	 */
	NO_MATCH('-');

	private final char symbol;

	PositionResultState(char symbol) {
		this.symbol = symbol;
	}

	public char getSymbol() {
		return symbol;
	}

}
