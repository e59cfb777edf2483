package com.github.henkexbg.wordlestrategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.util.List;

import org.junit.jupiter.api.Test;

class BenchmarkTest {

	@Test
	void evenlySpacedIndices() {
		List<Integer> indices = Benchmark.evenlySpaced(2315, 50);

		assertThat(indices).hasSize(50).startsWith(0, 46, 92).endsWith(49 * 46);
		assertThat(Benchmark.evenlySpaced(3, 10)).containsExactly(0, 1, 2);
		assertThatThrownBy(() -> Benchmark.evenlySpaced(10, 0)).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void summarizesTrials() {
		Word apple = Word.fromString("apple");
		Word grape = Word.fromString("grape");
		Word zzzzz = Word.fromString("zzzzz");
		List<TrialResult> results = List.of(new TrialResult(apple, List.of(apple), 5),
				new TrialResult(grape, List.of(zzzzz, apple, zzzzz), 7));

		BenchmarkSummary summary = Benchmark.summarize(results, 2);

		assertThat(summary.getTrials()).isEqualTo(2);
		assertThat(summary.getWithinBudget()).isEqualTo(1);
		assertThat(summary.getOverBudget()).isEqualTo(1);
		assertThat(summary.getAverageGuesses()).isEqualTo(2.0);
		assertThat(summary.getMaxGuesses()).isEqualTo(3);
		assertThat(summary.getTotalDurationMillis()).isEqualTo(12);
		assertThat(summary.getOverBudgetSecrets()).containsExactly(grape);
		assertThat(summary.toString()).contains("over budget: 1");
	}

	@Test
	void flagsSecretsOverBudgetWithoutFailing() throws IOException {
		WordList wordList = WordListLoader.loadResources("/test-answers.txt", "/test-guesses.txt");
		BenchmarkSummary summary;
		try (ParallelScorer scorer = new ParallelScorer(2)) {
			GreedySolver solver = new GreedySolver(wordList, Word.fromString("zzzzz"), scorer);
			summary = Benchmark.run(solver, Benchmark.evenlySpaced(wordList.numAnswers(), 5), 1);
		}

		// the opening guess never solves, so a budget of one is always exceeded
		assertThat(summary.getTrials()).isEqualTo(5);
		assertThat(summary.getWithinBudget()).isZero();
		assertThat(summary.getOverBudgetSecrets()).hasSize(5);
		assertThat(summary.getMaxGuesses()).isGreaterThanOrEqualTo(2);
	}

}
