package com.github.henkexbg.wordlestrategy;

/**
 * The feedback for one position of a guess.
 *
 * @author Henrik Bjerne
 *
 */
public class PositionResult {

	private final PositionResultState positionResultState;

	private final int letter;

	public PositionResult(PositionResultState positionResultState, int letter) {
		this.positionResultState = positionResultState;
		this.letter = letter;
	}

	public PositionResultState getPositionResultState() {
		return positionResultState;
	}

	public int getLetter() {
		return letter;
	}

	@Override
	public String toString() {
		return "PositionResult [positionResultState=" + positionResultState + ", c=" + Letters.toChar(letter) + "]";
	}

}
