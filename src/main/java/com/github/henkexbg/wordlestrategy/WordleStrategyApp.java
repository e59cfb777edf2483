package com.github.henkexbg.wordlestrategy;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Starting point. Loads config and word lists and runs one of:
 * <li>trial &lt;word&gt; - solves one game against the given answer</li>
 * <li>benchmark [n|all] - solves games against n evenly spread answers, or all
 * of them</li>
 * <li>rank [n] - prints the n best first guesses</li>
 * <p>
 * Without a command, one trial is run against a sample answer followed by the
 * default benchmark. A config file can be given with --config &lt;path&gt;
 * before the command.
 *
 * @author Henrik Bjerne
 *
 */
public class WordleStrategyApp {

	private static final Logger log = LogManager.getLogger(WordleStrategyApp.class);

	static final int EXIT_OK = 0;

	static final int EXIT_USAGE = 2;

	private static final String USAGE = "Usage: [--config <file>] [trial <word> | benchmark [n|all] | rank [n]]";

	private final SolverConfig config;

	private final WordList wordList;

	private final PrintStream out;

	public WordleStrategyApp(SolverConfig config, WordList wordList, PrintStream out) {
		this.config = config;
		this.wordList = wordList;
		this.out = out;
	}

	public static void main(String[] args) throws Exception {
		List<String> arguments = new ArrayList<>(Arrays.asList(args));
		SolverConfigReader configReader = new SolverConfigReader();
		SolverConfig config;
		if (arguments.size() >= 2 && "--config".equals(arguments.get(0))) {
			config = configReader.loadFile(Path.of(arguments.get(1)));
			arguments = arguments.subList(2, arguments.size());
		} else {
			config = configReader.load();
		}
		WordList wordList = WordListLoader.loadResources(config.answersResource, config.allowedGuessesResource);
		int exitCode = new WordleStrategyApp(config, wordList, System.out).run(arguments);
		if (exitCode != EXIT_OK) {
			System.exit(exitCode);
		}
	}

	/**
	 * @param arguments Command and its arguments
	 * @return Exit code
	 */
	public int run(List<String> arguments) {
		try (ParallelScorer scorer = new ParallelScorer(config.parallelism)) {
			String command = arguments.isEmpty() ? "" : arguments.get(0);
			List<String> rest = arguments.isEmpty() ? List.of() : arguments.subList(1, arguments.size());
			switch (command) {
			case "":
				runDemo(scorer);
				return EXIT_OK;
			case "trial":
				if (rest.size() != 1) {
					return usage("trial needs exactly one word");
				}
				return runTrial(scorer, rest.get(0));
			case "benchmark":
				return runBenchmark(scorer, rest);
			case "rank":
				return runRanking(scorer, rest);
			default:
				return usage("Unknown command: " + command);
			}
		} catch (NumberFormatException e) {
			return usage("Not a number: " + e.getMessage());
		}
	}

	private void runDemo(ParallelScorer scorer) {
		GreedySolver solver = newSolver(scorer);
		int sampleIndex = config.sampleAnswerIndex;
		if (sampleIndex >= wordList.numAnswers()) {
			log.warn("sampleAnswerIndex {} is out of range for {} answers, using the first answer", sampleIndex,
					wordList.numAnswers());
			sampleIndex = 0;
		}
		printTrial(solver.runGreedyTrial(sampleIndex));
		BenchmarkSummary summary = Benchmark.run(solver,
				Benchmark.evenlySpaced(wordList.numAnswers(), config.benchmarkTrials), config.maxTurns);
		out.println(String.format("greedy avg: %.3f", summary.getAverageGuesses()));
	}

	private int runTrial(ParallelScorer scorer, String token) {
		Word secret;
		try {
			secret = Word.fromString(token.trim().toLowerCase());
		} catch (WordFormatException e) {
			return usage(e.getMessage());
		}
		GreedySolver solver = newSolver(scorer);
		if (wordList.answerIndexOf(secret) < 0) {
			return usage(String.format("'%s' is not one of the %s answers", secret, wordList.numAnswers()));
		}
		printTrial(solver.runGreedyTrial(secret));
		return EXIT_OK;
	}

	private int runBenchmark(ParallelScorer scorer, List<String> rest) {
		List<Integer> secretIndices;
		if (rest.isEmpty()) {
			secretIndices = Benchmark.evenlySpaced(wordList.numAnswers(), config.benchmarkTrials);
		} else if ("all".equals(rest.get(0))) {
			secretIndices = Benchmark.all(wordList.numAnswers());
		} else {
			int trials = Integer.parseInt(rest.get(0));
			if (trials <= 0) {
				return usage("Number of trials must be positive");
			}
			secretIndices = Benchmark.evenlySpaced(wordList.numAnswers(), trials);
		}
		BenchmarkSummary summary = Benchmark.run(newSolver(scorer), secretIndices, config.maxTurns);
		out.println(summary);
		if (!summary.getOverBudgetSecrets().isEmpty()) {
			out.println("Over budget: " + summary.getOverBudgetSecrets());
		}
		return EXIT_OK;
	}

	private int runRanking(ParallelScorer scorer, List<String> rest) {
		int topN = rest.isEmpty() ? config.rankingSize : Integer.parseInt(rest.get(0));
		if (topN <= 0) {
			return usage("Number of guesses must be positive");
		}
		List<GuessScore> ranking = new FirstGuessRanker(wordList, scorer).rankFirstGuesses(topN);
		for (int i = 0; i < ranking.size(); i++) {
			GuessScore guessScore = ranking.get(i);
			out.println(String.format("%s guess: %s %s (avg %.2f left)", i, guessScore.getGuess(),
					guessScore.getScore(), guessScore.averageRemaining(wordList.numAnswers())));
		}
		return EXIT_OK;
	}

	private GreedySolver newSolver(ParallelScorer scorer) {
		return new GreedySolver(wordList, config.openingGuessWord(), scorer);
	}

	private void printTrial(TrialResult result) {
		out.println("Guesses:");
		for (Word guess : result.getGuesses()) {
			out.println(String.format("  %s %s", guess,
					WordleFeedback.render(WordleFeedback.feedback(guess, result.getSecret()))));
		}
		out.println(result.getGuessCount());
	}

	private int usage(String message) {
		out.println(message);
		out.println(USAGE);
		return EXIT_USAGE;
	}

}
