package com.github.henkexbg.wordlestrategy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Solves a game with a known secret by always choosing the guess that leaves
 * the fewest possible answers on average. The opening guess is fixed. After
 * that, each round every word in the word list is tried against every answer
 * still possible, and the word with the lowest total number of remaining
 * answers is guessed. Ties go to the word that comes first in the list. The
 * game ends when a single answer is left.
 *
 * @author Henrik Bjerne
 *
 */
public class GreedySolver {

	private static final Logger log = LogManager.getLogger(GreedySolver.class);

	/**
	 * Candidate lists up to this size are logged in full at debug level
	 */
	private static final int MAX_LOGGED_CANDIDATES = 20;

	private final WordList wordList;

	private final Word openingGuess;

	private final ParallelScorer scorer;

	private volatile boolean cancelled;

	/**
	 * @param wordList     Answers followed by extra guesses
	 * @param openingGuess Always used as the first guess
	 * @param scorer       Runs the scoring loops
	 */
	public GreedySolver(WordList wordList, Word openingGuess, ParallelScorer scorer) {
		this.wordList = Objects.requireNonNull(wordList, "wordList");
		this.openingGuess = Objects.requireNonNull(openingGuess, "openingGuess");
		this.scorer = Objects.requireNonNull(scorer, "scorer");
	}

	public WordList getWordList() {
		return wordList;
	}

	public Word getOpeningGuess() {
		return openingGuess;
	}

	/**
	 * Asks running and future trials to stop. A trial only stops between rounds,
	 * never in the middle of scoring one.
	 */
	public void cancel() {
		cancelled = true;
	}

	public boolean isCancelled() {
		return cancelled;
	}

	/**
	 * Runs a trial against the given answer.
	 *
	 * @param secret One of the answers
	 * @return Trial result
	 * @throws IllegalArgumentException if the word is not an answer
	 */
	public TrialResult runGreedyTrial(Word secret) {
		int secretIndex = wordList.answerIndexOf(secret);
		if (secretIndex < 0) {
			throw new IllegalArgumentException(String.format("'%s' is not one of the answers", secret));
		}
		return runGreedyTrial(secretIndex);
	}

	/**
	 * Runs a trial against the answer at the given index.
	 *
	 * @param secretIndex Index among the answers
	 * @return Trial result with all guesses made
	 * @throws IndexOutOfBoundsException if the index is not that of an answer
	 * @throws SearchDivergenceException if the search does not end with exactly
	 *                                   the secret left
	 * @throws CancellationException     if cancelled or interrupted between rounds
	 */
	public TrialResult runGreedyTrial(int secretIndex) {
		Objects.checkIndex(secretIndex, wordList.numAnswers());
		long startTime = System.currentTimeMillis();
		Word secret = wordList.get(secretIndex);
		List<Word> entries = wordList.entries();

		WordleGame trialGame = new WordleGame(secret);
		trialGame.addGuess(openingGuess);
		List<Word> guesses = new ArrayList<>();
		guesses.add(openingGuess);
		List<Word> candidates = filter(wordList.answers(), trialGame);
		logRound(secret, openingGuess, -1, candidates);

		while (candidates.size() > 1) {
			checkCancelled(secret);
			final List<Word> current = candidates;
			final List<Word> guessesSoFar = List.copyOf(guesses);
			long[] scores = scorer.score(current.size(), entries.size(), (candidateIndex, partial) -> {
				WordleGame gameForCandidate = new WordleGame(current.get(candidateIndex));
				gameForCandidate.addGuesses(guessesSoFar);
				for (int j = 0; j < entries.size(); j++) {
					partial[j] += gameForCandidate.copyWithGuess(entries.get(j)).countMatches(current);
				}
			});
			int bestIndex = indexOfMin(scores);
			Word bestGuess = entries.get(bestIndex);
			guesses.add(bestGuess);
			trialGame.addGuess(bestGuess);
			List<Word> next = filter(current, trialGame);
			logRound(secret, bestGuess, scores[bestIndex], next);
			if (next.size() >= current.size()) {
				throw new SearchDivergenceException(
						String.format("Guess '%s' left all %s candidates for secret '%s'", bestGuess, current.size(),
								secret));
			}
			candidates = next;
		}

		if (candidates.size() != 1 || !candidates.get(0).equals(secret)) {
			throw new SearchDivergenceException(
					String.format("Search for '%s' ended with candidates %s", secret, candidates));
		}
		TrialResult result = new TrialResult(secret, guesses, System.currentTimeMillis() - startTime);
		log.debug("Solved '{}' in {} guesses: {}", secret, result.getGuessCount(), guesses);
		return result;
	}

	/**
	 * @param scores Scores per entry
	 * @return Index of the lowest score, the first one if several are equal
	 */
	static int indexOfMin(long[] scores) {
		int best = 0;
		for (int i = 1; i < scores.length; i++) {
			if (scores[i] < scores[best]) {
				best = i;
			}
		}
		return best;
	}

	private static List<Word> filter(List<Word> words, WordleGame game) {
		List<Word> result = new ArrayList<>();
		for (Word word : words) {
			if (game.matches(word)) {
				result.add(word);
			}
		}
		return Collections.unmodifiableList(result);
	}

	private void checkCancelled(Word secret) {
		if (cancelled || Thread.currentThread().isInterrupted()) {
			throw new CancellationException(String.format("Trial for '%s' cancelled", secret));
		}
	}

	private void logRound(Word secret, Word guess, long score, List<Word> candidates) {
		if (!log.isDebugEnabled()) {
			return;
		}
		String feedback = WordleFeedback.render(WordleFeedback.feedback(guess, secret));
		if (candidates.size() <= MAX_LOGGED_CANDIDATES) {
			log.debug("Guess {} -> {} (score {}), candidates left {}: {}", guess, feedback, score, candidates.size(),
					candidates);
		} else {
			log.debug("Guess {} -> {} (score {}), candidates left {}", guess, feedback, score, candidates.size());
		}
	}

}
