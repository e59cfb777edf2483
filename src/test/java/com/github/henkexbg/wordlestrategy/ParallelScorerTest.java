package com.github.henkexbg.wordlestrategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.junit.jupiter.api.Test;

class ParallelScorerTest {

	private static final ParallelScorer.OuterStep STEP = (outer, scores) -> {
		for (int j = 0; j < scores.length; j++) {
			scores[j] += (long) (outer + 1) * (j + 1);
		}
	};

	@Test
	void parallelSumEqualsSequentialSum() {
		long[] sequential;
		long[] parallel;
		try (ParallelScorer single = new ParallelScorer(1); ParallelScorer multi = new ParallelScorer(4)) {
			sequential = single.score(1000, 17, STEP);
			parallel = multi.score(1000, 17, STEP);
		}

		assertThat(parallel).isEqualTo(sequential);
		// sum of 1..1000 times (j + 1)
		assertThat(sequential[0]).isEqualTo(500500L);
		assertThat(sequential[16]).isEqualTo(500500L * 17);
	}

	@Test
	void singleThreadRunsOnCaller() {
		Set<String> threadNames = ConcurrentHashMap.newKeySet();
		try (ParallelScorer scorer = new ParallelScorer(1)) {
			scorer.score(10, 1, (outer, scores) -> threadNames.add(Thread.currentThread().getName()));
		}

		assertThat(threadNames).containsExactly(Thread.currentThread().getName());
	}

	@Test
	void workersUseNamedThreads() {
		Set<String> threadNames = ConcurrentHashMap.newKeySet();
		try (ParallelScorer scorer = new ParallelScorer(3)) {
			assertThat(scorer.getParallelism()).isEqualTo(3);
			scorer.score(50, 1, (outer, scores) -> threadNames.add(Thread.currentThread().getName()));
		}

		assertThat(threadNames).isNotEmpty().allMatch(name -> name.startsWith("wordle-score-"));
	}

	@Test
	void autoParallelismUsesProcessors() {
		try (ParallelScorer scorer = new ParallelScorer(0)) {
			assertThat(scorer.getParallelism()).isEqualTo(Runtime.getRuntime().availableProcessors());
		}
	}

	@Test
	void workerFailureReachesCaller() {
		try (ParallelScorer scorer = new ParallelScorer(2)) {
			assertThatThrownBy(() -> scorer.score(20, 1, (outer, scores) -> {
				if (outer == 13) {
					throw new SearchDivergenceException("boom");
				}
			})).isInstanceOf(SearchDivergenceException.class).hasMessage("boom");
		}
	}

	@Test
	void emptyOuterLoopGivesZeros() {
		try (ParallelScorer scorer = new ParallelScorer(2)) {
			assertThat(scorer.score(0, 3, STEP)).containsExactly(0L, 0L, 0L);
		}
	}

}
