package com.github.henkexbg.wordlestrategy;

/**
 * Letter codes and letter sets. A letter is an int code 0-25 where 0 is 'a'. A
 * set of letters is held in one int where bit i means letter i is in the set.
 * This only works as long as the alphabet fits in 32 bits, which is checked
 * when the class loads.
 *
 * @author Henrik Bjerne
 *
 */
public final class Letters {

	public static final int ALPHABET_SIZE = 26;

	/**
	 * Marks a position where the letter is not yet known
	 */
	public static final int UNKNOWN_LETTER = -1;

	public static final int EMPTY_SET = 0;

	static {
		if (ALPHABET_SIZE > Integer.SIZE) {
			throw new ExceptionInInitializerError("Alphabet of " + ALPHABET_SIZE + " letters does not fit in an int");
		}
	}

	private Letters() {
	}

	public static boolean isLetter(int letter) {
		return letter >= 0 && letter < ALPHABET_SIZE;
	}

	public static int bit(int letter) {
		return 1 << letter;
	}

	public static boolean contains(int letterSet, int letter) {
		return (letterSet & bit(letter)) != 0;
	}

	public static int with(int letterSet, int letter) {
		return letterSet | bit(letter);
	}

	/**
	 * @param letterSet Set to check
	 * @param required  Letters that all must be present
	 * @return true if every letter in required is also in letterSet
	 */
	public static boolean containsAll(int letterSet, int required) {
		return (letterSet & required) == required;
	}

	public static int fromChar(char c) {
		return c - 'a';
	}

	public static char toChar(int letter) {
		return (char) ('a' + letter);
	}

	/**
	 * Renders a letter set as its letters in alphabetical order, mainly for
	 * logging.
	 *
	 * @param letterSet Letter set
	 * @return For example "aet"
	 */
	public static String toString(int letterSet) {
		StringBuilder sb = new StringBuilder();
		for (int letter = 0; letter < ALPHABET_SIZE; letter++) {
			if (contains(letterSet, letter)) {
				sb.append(toChar(letter));
			}
		}
		return sb.toString();
	}

}
