package com.github.henkexbg.wordlestrategy;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Loads {@link SolverConfig} from JSON, either from the classpath or from a
 * file. A missing config gives the defaults.
 *
 * @author Henrik Bjerne
 *
 */
public final class SolverConfigReader {

	private static final Logger log = LogManager.getLogger(SolverConfigReader.class);

	public static final String DEFAULT_CONFIG_RESOURCE = "/solver-config.json";

	private final ObjectMapper mapper;

	public SolverConfigReader() {
		this(new ObjectMapper());
	}

	public SolverConfigReader(ObjectMapper mapper) {
		this.mapper = mapper;
	}

	/**
	 * @return Config from {@link #DEFAULT_CONFIG_RESOURCE}, or defaults if there is
	 *         no such resource
	 * @throws IOException if the resource is not valid JSON
	 */
	public SolverConfig load() throws IOException {
		return loadResource(DEFAULT_CONFIG_RESOURCE);
	}

	public SolverConfig loadResource(String resourceLocation) throws IOException {
		InputStream in = SolverConfigReader.class.getResourceAsStream(resourceLocation);
		if (in == null) {
			log.warn("Config resource {} not found, using defaults", resourceLocation);
			return defaults();
		}
		try (in) {
			return read(mapper.readTree(in), resourceLocation);
		}
	}

	public SolverConfig loadFile(Path configFile) throws IOException {
		if (!Files.exists(configFile)) {
			log.warn("Config file {} not found, using defaults", configFile);
			return defaults();
		}
		try (InputStream in = Files.newInputStream(configFile)) {
			return read(mapper.readTree(in), configFile.toString());
		}
	}

	private SolverConfig read(JsonNode root, String source) throws IOException {
		if (root == null || root.isNull() || root.isMissingNode()) {
			log.warn("Config {} is empty, using defaults", source);
			return defaults();
		}
		if (!root.isObject()) {
			throw new IllegalStateException("Config root must be a JSON object: " + source);
		}
		SolverConfig config = mapper.treeToValue(root, SolverConfig.class);
		config.validate();
		log.debug("Loaded {} from {}", config, source);
		return config;
	}

	private static SolverConfig defaults() {
		SolverConfig config = new SolverConfig();
		config.validate();
		return config;
	}

}
