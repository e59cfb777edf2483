package com.github.henkexbg.wordlestrategy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * All words that may be guessed. The answers, i.e. the words that can be the
 * secret, come first, followed by words that are accepted as guesses but are
 * never the answer. Read-only.
 *
 * @author Henrik Bjerne
 *
 */
public final class WordList {

	private final List<Word> entries;

	private final int numAnswers;

	private WordList(List<Word> entries, int numAnswers) {
		this.entries = entries;
		this.numAnswers = numAnswers;
	}

	/**
	 * @param answers      Possible secrets. Must not contain the same word twice.
	 * @param extraGuesses Words only allowed as guesses. May repeat answers.
	 * @return Word list with the answers first
	 */
	public static WordList of(List<Word> answers, List<Word> extraGuesses) {
		if (answers.isEmpty()) {
			throw new IllegalArgumentException("At least one answer is required");
		}
		Set<Word> seen = new HashSet<>();
		for (Word answer : answers) {
			if (!seen.add(answer)) {
				throw new IllegalArgumentException("Duplicate answer: " + answer);
			}
		}
		List<Word> entries = new ArrayList<>(answers.size() + extraGuesses.size());
		entries.addAll(answers);
		entries.addAll(extraGuesses);
		return new WordList(Collections.unmodifiableList(entries), answers.size());
	}

	public static WordList ofStrings(List<String> answers, List<String> extraGuesses) {
		return of(toWords(answers), toWords(extraGuesses));
	}

	private static List<Word> toWords(List<String> tokens) {
		List<Word> words = new ArrayList<>(tokens.size());
		for (String token : tokens) {
			words.add(Word.fromString(token));
		}
		return words;
	}

	public List<Word> entries() {
		return entries;
	}

	public List<Word> answers() {
		return entries.subList(0, numAnswers);
	}

	public int numAnswers() {
		return numAnswers;
	}

	public int size() {
		return entries.size();
	}

	public Word get(int index) {
		return entries.get(index);
	}

	/**
	 * @param word Word to look for
	 * @return Index of the first entry equal to the word, or -1
	 */
	public int indexOf(Word word) {
		return entries.indexOf(word);
	}

	/**
	 * @param word Word to look for
	 * @return Index of the word among the answers, or -1 if it is not an answer
	 */
	public int answerIndexOf(Word word) {
		return answers().indexOf(word);
	}

}
