package com.github.henkexbg.wordlestrategy;

import java.util.List;
import java.util.Objects;

/**
 * A game against one known secret word. Every guess made is judged against the
 * secret and the resulting feedback is added to the {@link Clues} of the game.
 * Used both for the real game and to simulate what would happen if some other
 * word were the secret.
 *
 * @author Henrik Bjerne
 *
 */
public final class WordleGame {

	private final Word secret;

	private final Clues clues;

	public WordleGame(Word secret) {
		this(Objects.requireNonNull(secret, "secret"), new Clues());
	}

	private WordleGame(Word secret, Clues clues) {
		this.secret = secret;
		this.clues = clues;
	}

	/**
	 * Judges a guess against the secret and adds what was learned to the clues.
	 * Letters that exist in the secret are always added to the must-contain set,
	 * whether they matched or not.
	 *
	 * @param guess Guessed word
	 */
	public void addGuess(Word guess) {
		int secretLetterSet = secret.getLetterSet();
		for (int i = 0; i < Word.LENGTH; i++) {
			int letter = guess.letterAt(i);
			switch (WordleFeedback.classify(letter, secret.letterAt(i), secretLetterSet)) {
			case MATCH:
				clues.setMatch(i, letter);
				clues.requireLetter(letter);
				break;
			case OTHER_POSITION:
				clues.excludeAt(i, letter);
				clues.requireLetter(letter);
				break;
			case NO_MATCH:
				clues.excludeEverywhere(letter);
				break;
			}
		}
	}

	public void addGuesses(List<Word> guesses) {
		for (Word guess : guesses) {
			addGuess(guess);
		}
	}

	/**
	 * @param guess Guessed word
	 * @return A new game with the same secret and clues plus the given guess. This
	 *         game is left untouched.
	 */
	public WordleGame copyWithGuess(Word guess) {
		WordleGame copy = new WordleGame(secret, clues.copy());
		copy.addGuess(guess);
		return copy;
	}

	public boolean matches(Word word) {
		return clues.matches(word);
	}

	/**
	 * Counts how many of the given words are still possible secrets.
	 *
	 * @param words Words to check
	 * @return Number of matching words
	 */
	public int countMatches(List<Word> words) {
		int count = 0;
		for (Word word : words) {
			if (clues.matches(word)) {
				count++;
			}
		}
		return count;
	}

	public Word getSecret() {
		return secret;
	}

	/**
	 * @return A copy of the current clues
	 */
	public Clues getClues() {
		return clues.copy();
	}

	@Override
	public String toString() {
		return "WordleGame [secret=" + secret + ", clues=" + clues + "]";
	}

}
