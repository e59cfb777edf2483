package com.github.henkexbg.wordlestrategy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Ranks every word in the word list as a first guess. For each possible secret
 * and each guess, counts how many answers would still be possible after that
 * guess. A guess's score is the total over all secrets, so a lower score means
 * fewer answers left on average.
 *
 * @author Henrik Bjerne
 *
 */
public class FirstGuessRanker {

	private static final Logger log = LogManager.getLogger(FirstGuessRanker.class);

	private final WordList wordList;

	private final ParallelScorer scorer;

	public FirstGuessRanker(WordList wordList, ParallelScorer scorer) {
		this.wordList = wordList;
		this.scorer = scorer;
	}

	/**
	 * @param topN Number of guesses to return
	 * @return The best {@code topN} guesses, best first
	 */
	public List<GuessScore> rankFirstGuesses(int topN) {
		List<GuessScore> all = scoreAll();
		return all.subList(0, Math.min(topN, all.size()));
	}

	/**
	 * @return Every entry of the word list with its score, best first
	 */
	public List<GuessScore> scoreAll() {
		long startTime = System.currentTimeMillis();
		List<Word> entries = wordList.entries();
		List<Word> answers = wordList.answers();
		int numAnswers = answers.size();
		int progressStep = Math.max(1, numAnswers / 10);
		AtomicInteger done = new AtomicInteger();
		log.info("Ranking {} guesses against {} answers", entries.size(), numAnswers);

		long[] scores = scorer.score(numAnswers, entries.size(), (secretIndex, partial) -> {
			WordleGame game = new WordleGame(answers.get(secretIndex));
			for (int j = 0; j < entries.size(); j++) {
				partial[j] += game.copyWithGuess(entries.get(j)).countMatches(answers);
			}
			int finished = done.incrementAndGet();
			if (finished % progressStep == 0) {
				log.info("{} / {}", finished, numAnswers);
			}
		});

		List<GuessScore> result = new ArrayList<>(entries.size());
		for (int j = 0; j < entries.size(); j++) {
			result.add(new GuessScore(j, entries.get(j), scores[j]));
		}
		Collections.sort(result);
		log.info("Ranking done in {} ms, best guess {}", System.currentTimeMillis() - startTime,
				result.isEmpty() ? null : result.get(0));
		return result;
	}

}
