package com.github.henkexbg.wordlestrategy;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reads word files. File format is one word per line. Blank lines are ignored.
 * Lines that are not exactly {@link Word#LENGTH} lowercase letters, and words
 * already read, are logged and skipped.
 *
 * @author Henrik Bjerne
 *
 */
public final class WordListLoader {

	private static final Logger log = LogManager.getLogger(WordListLoader.class);

	private WordListLoader() {
	}

	/**
	 * Loads the answers and extra guesses from the classpath.
	 *
	 * @param answersResource        Classpath location of the answers
	 * @param allowedGuessesResource Classpath location of the extra guesses
	 * @return Word list
	 * @throws IOException if a resource is missing or can't be read
	 */
	public static WordList loadResources(String answersResource, String allowedGuessesResource) throws IOException {
		return WordList.of(loadResource(answersResource), loadResource(allowedGuessesResource));
	}

	public static List<Word> loadResource(String resourceLocation) throws IOException {
		InputStream in = WordListLoader.class.getResourceAsStream(resourceLocation);
		if (in == null) {
			throw new IOException("Word list resource not found: " + resourceLocation);
		}
		try (in) {
			return load(in, resourceLocation);
		}
	}

	public static List<Word> loadFile(Path path) throws IOException {
		try (InputStream in = Files.newInputStream(path)) {
			return load(in, path.toString());
		}
	}

	/**
	 * Reads words from a stream. The stream is not closed.
	 *
	 * @param in         Stream with one word per line, UTF-8
	 * @param sourceName Name used in log messages
	 * @return Words in file order
	 * @throws IOException on read errors
	 */
	public static List<Word> load(InputStream in, String sourceName) throws IOException {
		List<Word> words = new ArrayList<>();
		Set<Word> seen = new HashSet<>();
		BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
		int lineNumber = 0;
		String oneLine;
		while ((oneLine = br.readLine()) != null) {
			lineNumber++;
			String token = oneLine.trim();
			if (token.isEmpty()) {
				continue;
			}
			Word word;
			try {
				word = Word.fromString(token);
			} catch (WordFormatException e) {
				log.warn("Skipping line {} of {}: {}", lineNumber, sourceName, e.getMessage());
				continue;
			}
			if (!seen.add(word)) {
				log.warn("Skipping duplicate word '{}' on line {} of {}", word, lineNumber, sourceName);
				continue;
			}
			words.add(word);
		}
		log.info("Added {} words from {}", words.size(), sourceName);
		return Collections.unmodifiableList(words);
	}

}
