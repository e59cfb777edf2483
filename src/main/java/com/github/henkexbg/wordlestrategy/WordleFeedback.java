package com.github.henkexbg.wordlestrategy;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides the feedback for a guess given the secret word. Each position is
 * judged on its own: a letter that is in the secret but not at this position is
 * always {@link PositionResultState#OTHER_POSITION}, also when it repeats a
 * letter that is matched elsewhere in the guess. Whether a letter is in the
 * secret is decided from the secret's letter set, never by comparing single
 * positions.
 *
 * @author Henrik Bjerne
 *
 */
public final class WordleFeedback {

	private WordleFeedback() {
	}

	/**
	 * Classifies one position.
	 *
	 * @param guessLetter     Letter guessed at the position
	 * @param secretLetter    Letter of the secret at the same position
	 * @param secretLetterSet All letters in the secret
	 * @return Result for the position
	 */
	public static PositionResultState classify(int guessLetter, int secretLetter, int secretLetterSet) {
		if (guessLetter == secretLetter) {
			return PositionResultState.MATCH;
		}
		if (Letters.contains(secretLetterSet, guessLetter)) {
			return PositionResultState.OTHER_POSITION;
		}
		return PositionResultState.NO_MATCH;
	}

	/**
	 * Gives the full feedback for a guess, one entry per position.
	 *
	 * @param guess  Guessed word
	 * @param secret Secret word
	 * @return List of {@link Word#LENGTH} results
	 */
	public static List<PositionResult> feedback(Word guess, Word secret) {
		List<PositionResult> result = new ArrayList<>(Word.LENGTH);
		for (int i = 0; i < Word.LENGTH; i++) {
			int letter = guess.letterAt(i);
			result.add(new PositionResult(classify(letter, secret.letterAt(i), secret.getLetterSet()), letter));
		}
		return result;
	}

	/**
	 * Renders feedback as a short pattern, e.g. "G-Y--".
	 *
	 * @param feedback Feedback from {@link #feedback(Word, Word)}
	 * @return Pattern string
	 */
	public static String render(List<PositionResult> feedback) {
		StringBuilder sb = new StringBuilder(feedback.size());
		for (PositionResult positionResult : feedback) {
			sb.append(positionResult.getPositionResultState().getSymbol());
		}
		return sb.toString();
	}

}
