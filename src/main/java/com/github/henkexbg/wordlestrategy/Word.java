package com.github.henkexbg.wordlestrategy;

import java.util.Arrays;

/**
 * An immutable word of exactly {@link #LENGTH} letters, stored as letter codes
 * (see {@link Letters}). Two words are equal if they have the same letter in
 * every position. Ordering is alphabetical.
 *
 * @author Henrik Bjerne
 *
 */
public final class Word implements Comparable<Word> {

	public static final int LENGTH = 5;

	private final int[] letters;

	/**
	 * All letters that occur somewhere in the word
	 */
	private final int letterSet;

	private Word(int[] letters) {
		this.letters = letters;
		int set = Letters.EMPTY_SET;
		for (int letter : letters) {
			set = Letters.with(set, letter);
		}
		this.letterSet = set;
	}

	/**
	 * Decodes a token such as "crane".
	 *
	 * @param token Exactly {@link #LENGTH} characters a-z
	 * @return Word
	 * @throws WordFormatException if the token has the wrong length or contains
	 *                             anything but lowercase letters
	 */
	public static Word fromString(String token) {
		if (token == null) {
			throw new WordFormatException(null, "null");
		}
		if (token.length() != LENGTH) {
			throw new WordFormatException(token, String.format("length %s, expected %s", token.length(), LENGTH));
		}
		int[] letters = new int[LENGTH];
		for (int i = 0; i < LENGTH; i++) {
			char c = token.charAt(i);
			if (c < 'a' || c > 'z') {
				throw new WordFormatException(token, String.format("character '%s' at position %s", c, i));
			}
			letters[i] = Letters.fromChar(c);
		}
		return new Word(letters);
	}

	/**
	 * Builds a word from letter codes, e.g. {@code Word.of(17, 14, 0, 19, 4)} for
	 * "roate".
	 *
	 * @param letters {@link #LENGTH} codes between 0 and 25
	 * @return Word
	 */
	public static Word of(int... letters) {
		if (letters == null || letters.length != LENGTH) {
			throw new IllegalArgumentException(String.format("A word needs exactly %s letters", LENGTH));
		}
		for (int letter : letters) {
			if (!Letters.isLetter(letter)) {
				throw new IllegalArgumentException("Not a letter code: " + letter);
			}
		}
		return new Word(letters.clone());
	}

	public int letterAt(int position) {
		return letters[position];
	}

	public int getLetterSet() {
		return letterSet;
	}

	public boolean containsLetter(int letter) {
		return Letters.contains(letterSet, letter);
	}

	@Override
	public int compareTo(Word other) {
		return Arrays.compare(letters, other.letters);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Word)) {
			return false;
		}
		return Arrays.equals(letters, ((Word) obj).letters);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(letters);
	}

	@Override
	public String toString() {
		char[] chars = new char[LENGTH];
		for (int i = 0; i < LENGTH; i++) {
			chars[i] = Letters.toChar(letters[i]);
		}
		return new String(chars);
	}

}
