package com.github.henkexbg.wordlestrategy;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WordleStrategyAppTest {

	private ByteArrayOutputStream buffer;

	private WordleStrategyApp app;

	@BeforeEach
	void setUp() throws IOException {
		SolverConfig config = new SolverConfigReader().loadResource("/test-solver-config.json");
		WordList wordList = WordListLoader.loadResources(config.answersResource, config.allowedGuessesResource);
		buffer = new ByteArrayOutputStream();
		app = new WordleStrategyApp(config, wordList, new PrintStream(buffer, true, StandardCharsets.UTF_8));
	}

	private String output() {
		return buffer.toString(StandardCharsets.UTF_8);
	}

	@Test
	void trialPrintsGuessesAndCount() {
		int exitCode = app.run(List.of("trial", "HEATH"));

		assertThat(exitCode).isEqualTo(WordleStrategyApp.EXIT_OK);
		assertThat(output()).startsWith("Guesses:").contains("  soare ");
	}

	@Test
	void trialOfNonAnswerIsUsageError() {
		assertThat(app.run(List.of("trial", "roate"))).isEqualTo(WordleStrategyApp.EXIT_USAGE);
		assertThat(output()).contains("not one of the 30 answers");
	}

	@Test
	void trialOfMalformedWordIsUsageError() {
		assertThat(app.run(List.of("trial", "abc"))).isEqualTo(WordleStrategyApp.EXIT_USAGE);
		assertThat(app.run(List.of("trial"))).isEqualTo(WordleStrategyApp.EXIT_USAGE);
	}

	@Test
	void rankPrintsRequestedNumberOfGuesses() {
		assertThat(app.run(List.of("rank", "3"))).isEqualTo(WordleStrategyApp.EXIT_OK);

		String[] lines = output().split("\\R");
		assertThat(lines).hasSize(3);
		assertThat(lines[0]).startsWith("0 guess: ");
		assertThat(lines[2]).startsWith("2 guess: ");
	}

	@Test
	void rankDefaultsToConfiguredSize() {
		app.run(List.of("rank"));

		assertThat(output().split("\\R")).hasSize(5);
	}

	@Test
	void benchmarkPrintsSummary() {
		assertThat(app.run(List.of("benchmark", "4"))).isEqualTo(WordleStrategyApp.EXIT_OK);

		assertThat(output()).contains("Run completed. Trials: 4");
	}

	@Test
	void demoRunsSampleTrialAndBenchmark() {
		assertThat(app.run(List.of())).isEqualTo(WordleStrategyApp.EXIT_OK);

		assertThat(output()).startsWith("Guesses:").contains("greedy avg: ");
	}

	@Test
	void badArgumentsAreUsageErrors() {
		assertThat(app.run(List.of("fly"))).isEqualTo(WordleStrategyApp.EXIT_USAGE);
		assertThat(app.run(List.of("rank", "many"))).isEqualTo(WordleStrategyApp.EXIT_USAGE);
		assertThat(app.run(List.of("benchmark", "0"))).isEqualTo(WordleStrategyApp.EXIT_USAGE);
		assertThat(output()).contains("Usage:");
	}

}
