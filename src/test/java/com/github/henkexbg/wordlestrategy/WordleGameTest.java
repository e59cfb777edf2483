package com.github.henkexbg.wordlestrategy;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class WordleGameTest {

	private static WordList wordList;

	@BeforeAll
	static void loadWords() throws IOException {
		wordList = WordListLoader.loadResources("/test-answers.txt", "/test-guesses.txt");
	}

	private static Word w(String s) {
		return Word.fromString(s);
	}

	private static int l(char c) {
		return Letters.fromChar(c);
	}

	@Test
	void exactMatchIsRecorded() {
		WordleGame game = new WordleGame(w("crane"));
		game.addGuess(w("crust"));

		Clues clues = game.getClues();
		assertThat(clues.getMatch(0)).isEqualTo(l('c'));
		assertThat(clues.getMatch(1)).isEqualTo(l('r'));
		assertThat(clues.getMatch(2)).isEqualTo(Letters.UNKNOWN_LETTER);
		assertThat(Letters.toString(clues.getMustContain())).isEqualTo("cr");
	}

	@Test
	void misplacedLetterExcludedOnlyAtThatPosition() {
		WordleGame game = new WordleGame(w("crane"));
		game.addGuess(w("ennui"));

		Clues clues = game.getClues();
		assertThat(Letters.contains(clues.getExcluded(0), l('e'))).isTrue();
		assertThat(Letters.contains(clues.getExcluded(4), l('e'))).isFalse();
		assertThat(Letters.contains(clues.getMustContain(), l('e'))).isTrue();
		assertThat(Letters.contains(clues.getMustContain(), l('n'))).isTrue();
	}

	@Test
	void absentLetterExcludedEverywhere() {
		WordleGame game = new WordleGame(w("crane"));
		game.addGuess(w("stool"));

		Clues clues = game.getClues();
		for (int i = 0; i < Word.LENGTH; i++) {
			assertThat(Letters.toString(clues.getExcluded(i))).isEqualTo("lost");
		}
		assertThat(clues.getMustContain()).isEqualTo(Letters.EMPTY_SET);
	}

	@Test
	void repeatedLetterInGuessIsNeverGloballyAbsent() {
		// 'e' occurs once in the secret, at position 4, and twice in the guess
		WordleGame game = new WordleGame(w("crane"));
		game.addGuess(w("level"));

		Clues clues = game.getClues();
		int e = l('e');
		assertThat(Letters.contains(clues.getExcluded(1), e)).isTrue();
		assertThat(Letters.contains(clues.getExcluded(3), e)).isTrue();
		assertThat(Letters.contains(clues.getExcluded(0), e)).isFalse();
		assertThat(Letters.contains(clues.getExcluded(2), e)).isFalse();
		assertThat(Letters.contains(clues.getExcluded(4), e)).isFalse();
		assertThat(Letters.contains(clues.getMustContain(), e)).isTrue();
		assertThat(game.matches(w("crane"))).isTrue();
	}

	@Test
	void repeatedLetterMatchedInOnePlaceStaysPresent() {
		// second 'e' of the guess is right, the first one is only excluded where it stands
		WordleGame game = new WordleGame(w("crane"));
		game.addGuess(w("geese"));

		List<PositionResult> feedback = WordleFeedback.feedback(w("geese"), w("crane"));
		assertThat(WordleFeedback.render(feedback)).isEqualTo("-YY-G");
		assertThat(game.matches(w("crane"))).isTrue();
		assertThat(game.matches(w("grade"))).isFalse();
	}

	@Test
	void secretAlwaysMatchesItsOwnClues() {
		for (Word secret : wordList.answers()) {
			for (Word guess : wordList.entries()) {
				WordleGame game = new WordleGame(secret);
				game.addGuess(guess);
				assertThat(game.matches(secret)).as("%s guessed against %s", guess, secret).isTrue();
			}
		}
	}

	@Test
	void secretMatchesAfterAnySequenceOfGuesses() {
		Random random = new Random(42);
		List<Word> entries = wordList.entries();
		for (Word secret : wordList.answers()) {
			WordleGame game = new WordleGame(secret);
			List<Word> guesses = new ArrayList<>();
			for (int i = 0; i < 6; i++) {
				Word guess = entries.get(random.nextInt(entries.size()));
				guesses.add(guess);
				game.addGuess(guess);
				assertThat(game.matches(secret)).as("%s after %s", secret, guesses).isTrue();
			}
		}
	}

	@Test
	void repeatingAGuessAddsNothing() {
		for (Word secret : wordList.answers()) {
			for (Word guess : wordList.entries()) {
				WordleGame once = new WordleGame(secret);
				once.addGuess(guess);
				WordleGame twice = once.copyWithGuess(guess);
				assertThat(twice.getClues()).isEqualTo(once.getClues());
			}
		}
	}

	@Test
	void mustContainOnlyGrows() {
		WordleGame game = new WordleGame(w("heath"));
		int previous = Letters.EMPTY_SET;
		for (String guess : List.of("roate", "stink", "death", "heath")) {
			game.addGuess(w(guess));
			int current = game.getClues().getMustContain();
			assertThat(Letters.containsAll(current, previous)).isTrue();
			previous = current;
		}
	}

	@Test
	void copyWithGuessLeavesOriginalUntouched() {
		WordleGame game = new WordleGame(w("cigar"));
		game.addGuess(w("roate"));
		Clues before = game.getClues();

		WordleGame copy = game.copyWithGuess(w("cigar"));

		assertThat(game.getClues()).isEqualTo(before);
		assertThat(copy.getSecret()).isEqualTo(w("cigar"));
		assertThat(copy.countMatches(wordList.answers())).isEqualTo(1);
		assertThat(game.countMatches(wordList.answers())).isGreaterThan(1);
	}

	@Test
	void addGuessesAppliesAllInOrder() {
		WordleGame one = new WordleGame(w("model"));
		one.addGuess(w("roate"));
		one.addGuess(w("stool"));
		WordleGame all = new WordleGame(w("model"));
		all.addGuesses(List.of(w("roate"), w("stool")));

		assertThat(all.getClues()).isEqualTo(one.getClues());
	}

}
