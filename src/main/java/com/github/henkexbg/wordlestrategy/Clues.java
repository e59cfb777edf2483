package com.github.henkexbg.wordlestrategy;

import java.util.Arrays;

/**
 * Everything learned about the secret word from the guesses made so far:
 * <li>match - the confirmed letter per position, or
 * {@link Letters#UNKNOWN_LETTER}</li>
 * <li>excluded - per position, the letters that can not be in that
 * position</li>
 * <li>mustContain - letters known to be somewhere in the word</li>
 * <p>
 * Clues are only ever added, never taken back. Updating is done through
 * {@link WordleGame}, which knows the secret. Checking a word with
 * {@link #matches(Word)} does not change anything, so one instance can be used
 * to test any number of words.
 *
 * @author Henrik Bjerne
 *
 */
public final class Clues {

	private final int[] match;

	private final int[] excluded;

	private int mustContain;

	public Clues() {
		match = new int[Word.LENGTH];
		Arrays.fill(match, Letters.UNKNOWN_LETTER);
		excluded = new int[Word.LENGTH];
		mustContain = Letters.EMPTY_SET;
	}

	private Clues(Clues other) {
		match = other.match.clone();
		excluded = other.excluded.clone();
		mustContain = other.mustContain;
	}

	/**
	 * @return An independent copy of these clues
	 */
	public Clues copy() {
		return new Clues(this);
	}

	/**
	 * Checks whether a word could still be the secret given these clues.
	 *
	 * @param word Word to check
	 * @return true if the word breaks none of the clues
	 */
	public boolean matches(Word word) {
		for (int i = 0; i < Word.LENGTH; i++) {
			int letter = word.letterAt(i);
			int knownLetter = match[i];
			if (knownLetter != Letters.UNKNOWN_LETTER && knownLetter != letter) {
				return false;
			}
			if (Letters.contains(excluded[i], letter)) {
				return false;
			}
		}
		return Letters.containsAll(word.getLetterSet(), mustContain);
	}

	void setMatch(int position, int letter) {
		match[position] = letter;
	}

	void excludeAt(int position, int letter) {
		excluded[position] = Letters.with(excluded[position], letter);
	}

	void excludeEverywhere(int letter) {
		for (int i = 0; i < Word.LENGTH; i++) {
			excluded[i] = Letters.with(excluded[i], letter);
		}
	}

	void requireLetter(int letter) {
		mustContain = Letters.with(mustContain, letter);
	}

	public int getMatch(int position) {
		return match[position];
	}

	public int getExcluded(int position) {
		return excluded[position];
	}

	public int getMustContain() {
		return mustContain;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Clues)) {
			return false;
		}
		Clues other = (Clues) obj;
		return mustContain == other.mustContain && Arrays.equals(match, other.match)
				&& Arrays.equals(excluded, other.excluded);
	}

	@Override
	public int hashCode() {
		return 31 * (31 * Arrays.hashCode(match) + Arrays.hashCode(excluded)) + mustContain;
	}

	@Override
	public String toString() {
		StringBuilder pattern = new StringBuilder();
		String[] excludedLetters = new String[Word.LENGTH];
		for (int i = 0; i < Word.LENGTH; i++) {
			pattern.append(match[i] == Letters.UNKNOWN_LETTER ? '.' : Letters.toChar(match[i]));
			excludedLetters[i] = Letters.toString(excluded[i]);
		}
		return "Clues [match=" + pattern + ", excluded=" + Arrays.toString(excludedLetters) + ", mustContain="
				+ Letters.toString(mustContain) + "]";
	}

}
