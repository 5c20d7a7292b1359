package org.clinnorm.conf;

/*
 * This file is part of ClinNorm.
 *
 * Copyright (C) 2025 The ClinNorm Authors
 *
 * ClinNorm is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * ClinNorm is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with ClinNorm.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import org.clinnorm.util.Logger;

/**
 * Loads the normalizer configuration from a {@code .properties} file.
 * <p>
 * By default this loader reads <code>config/clinnorm.properties</code> from
 * the classpath. You can override this by setting the system property
 * <code>clinnorm.config</code> to a file path, or by using the
 * {@link #NormalizerConfigLoader(Path)} constructor.
 *
 * <h3>Notes</h3>
 * <ul>
 * <li>Lexicon locations are resolved relative to the properties file first
 * (when loaded from disk), then as given on the file system, then on the
 * classpath.</li>
 * <li>Use {@link #validate()} during startup to list problems without
 * failing; {@link #loadLexicon()} and {@link #loadSettings()} fail fast with a
 * {@link ConfigurationException}.</li>
 * </ul>
 */
public final class NormalizerConfigLoader {

	/** Default classpath resource. */
	public static final String DEFAULT_CLASSPATH_RESOURCE = "config/clinnorm.properties";

	/** System property to point to an external config file. */
	public static final String SYS_PROP_CONFIG_PATH = "clinnorm.config";

	// ---- Property keys -------------------------------------------------------
	static final String K_BASE_STOPWORDS = "BASE_STOPWORDS";
	static final String K_EXTRA_STOPWORDS = "EXTRA_STOPWORDS";
	static final String K_LEMMA_OVERRIDES = "LEMMA_OVERRIDES";
	static final String K_NEGATION_TERMS = "NEGATION_TERMS";

	static final String K_NUMERIC_POLICY = "NUMERIC_POLICY";
	static final String K_NUMERIC_PLACEHOLDER = "NUMERIC_PLACEHOLDER";
	static final String K_FOLD_CONTENT = "FOLD_CONTENT";
	static final String K_PARALLEL_DOCUMENT_LIMIT = "PARALLEL_DOCUMENT_LIMIT";
	static final String K_TOKENIZE_TIMEOUT_SECONDS = "TOKENIZE_TIMEOUT_SECONDS";

	// OpenNLP assets
	static final String K_TOKEN_MODEL = "TOKEN_MODEL";
	static final String K_POS_MODEL = "POS_MODEL";
	static final String K_LEMMA_DICT = "LEMMA_DICT";

	// --------------------------------------------------------------------------

	private final Properties properties = new Properties();

	/** Directory of the loaded properties file; null when read from the classpath. */
	private Path baseDir;

	/**
	 * Read {@value #DEFAULT_CLASSPATH_RESOURCE}, unless the system property
	 * {@value #SYS_PROP_CONFIG_PATH} names a readable file.
	 */
	public NormalizerConfigLoader() {
		String external = System.getProperty(SYS_PROP_CONFIG_PATH);
		if (external != null && !external.isBlank()) {
			Path p = Path.of(external.trim());
			if (Files.isReadable(p)) {
				loadFromFile(p);
				return;
			}
			Logger.warn("System property {} points to an unreadable path: {}", SYS_PROP_CONFIG_PATH, p);
		}
		loadFromClasspath(DEFAULT_CLASSPATH_RESOURCE);
	}

	/**
	 * Read a specific file on disk.
	 *
	 * @throws IllegalArgumentException if the file is not readable
	 */
	public NormalizerConfigLoader(Path filePath) {
		if (filePath == null || !Files.isReadable(filePath)) {
			throw new IllegalArgumentException("Config file is null or not readable: " + filePath);
		}
		loadFromFile(filePath);
	}

	// -------------------------- Public API -------------------------------------

	/**
	 * Check required keys and value formats. Does not throw; returns
	 * human-readable issues (empty when everything looks OK).
	 */
	public List<String> validate() {
		List<String> issues = new ArrayList<>();

		requireNonBlank(K_BASE_STOPWORDS, issues);
		requireNonBlank(K_LEMMA_OVERRIDES, issues);
		requireNonBlank(K_NEGATION_TERMS, issues);

		for (String key : List.of(K_BASE_STOPWORDS, K_EXTRA_STOPWORDS, K_LEMMA_OVERRIDES, K_NEGATION_TERMS)) {
			String v = getOptional(key, null);
			if (v != null && !LexiconFiles.exists(resolve(v))) {
				issues.add("Lexicon file not found for " + key + ": " + v);
			}
		}

		String policy = getOptional(K_NUMERIC_POLICY, null);
		if (policy != null) {
			try {
				NumericPolicy.parse(policy);
			} catch (ConfigurationException ex) {
				issues.add(ex.getMessage());
			}
		}

		checkInteger(K_PARALLEL_DOCUMENT_LIMIT, issues);
		checkInteger(K_TOKENIZE_TIMEOUT_SECONDS, issues);

		String fold = getOptional(K_FOLD_CONTENT, null);
		if (fold != null && !fold.equalsIgnoreCase("true") && !fold.equalsIgnoreCase("false")) {
			issues.add("FOLD_CONTENT must be true or false: '" + fold + "'");
		}
		return issues;
	}

	/**
	 * Read the lexicon files and build the immutable lexicon.
	 *
	 * @throws ConfigurationException if a required location is missing or a
	 *                                file cannot be read or parsed
	 */
	public NormalizerConfig loadLexicon() {
		List<String> base = LexiconFiles.readWordList(resolve(lexiconLocation(K_BASE_STOPWORDS)));
		String extraLoc = getOptional(K_EXTRA_STOPWORDS, null);
		List<String> extra = (extraLoc == null) ? List.of() : LexiconFiles.readWordList(resolve(extraLoc));
		List<LemmaRow> lemmas = LexiconFiles.readLemmaTable(resolve(lexiconLocation(K_LEMMA_OVERRIDES)));
		List<String> negation = LexiconFiles.readWordList(resolve(lexiconLocation(K_NEGATION_TERMS)));

		NormalizerConfig cfg = NormalizerConfig.fromRows(base, extra, lemmas, negation);
		Logger.info("Lexicon loaded: {} stopwords, {} lemma overrides, {} negation terms", cfg.stopwords().size(),
				cfg.lemmaOverrides().size(), cfg.negationKeep().size());
		return cfg;
	}

	/**
	 * Build pipeline settings from the run-time keys; absent keys keep the
	 * {@link NormalizerSettings} defaults.
	 *
	 * @throws ConfigurationException for an unknown numeric policy
	 */
	public NormalizerSettings loadSettings() {
		NormalizerSettings s = NormalizerSettings.defaults();

		String policy = getOptional(K_NUMERIC_POLICY, null);
		if (policy != null)
			s.setNumericPolicy(NumericPolicy.parse(policy));

		s.setNumericPlaceholder(getOptional(K_NUMERIC_PLACEHOLDER, NormalizerSettings.DEFAULT_PLACEHOLDER));
		s.setFoldContent(Boolean.parseBoolean(getOptional(K_FOLD_CONTENT, "false")));
		s.setParallelism(getParallelDocumentLimit());
		s.setTokenizeTimeout(getTokenizeTimeout());
		return s;
	}

	/**
	 * Worker threads for batch normalization. Defaults to ~25% of available
	 * cores; never exceeds the core count.
	 */
	public int getParallelDocumentLimit() {
		int cores = Math.max(1, Runtime.getRuntime().availableProcessors());
		int defaultLimit = Math.max(1, (int) Math.floor(cores / 4.0));

		String raw = getOptional(K_PARALLEL_DOCUMENT_LIMIT, null);
		if (raw != null) {
			try {
				int val = Integer.parseInt(raw);
				if (val <= 0)
					return defaultLimit;
				return Math.min(val, cores);
			} catch (NumberFormatException nfe) {
				Logger.warn("Invalid integer for {}: '{}'. Using default {}", K_PARALLEL_DOCUMENT_LIMIT, raw,
						defaultLimit);
			}
		}
		return defaultLimit;
	}

	/** Per-text tokenizer timeout; {@link Duration#ZERO} when unset or invalid. */
	public Duration getTokenizeTimeout() {
		String raw = getOptional(K_TOKENIZE_TIMEOUT_SECONDS, null);
		if (raw == null)
			return Duration.ZERO;
		try {
			long secs = Long.parseLong(raw);
			return (secs <= 0) ? Duration.ZERO : Duration.ofSeconds(secs);
		} catch (NumberFormatException nfe) {
			Logger.warn("Invalid integer for {}: '{}'. Tokenizer calls are unbounded", K_TOKENIZE_TIMEOUT_SECONDS, raw);
			return Duration.ZERO;
		}
	}

	/** Optional OpenNLP tokenizer model location ("" when unset). */
	public String getTokenModel() {
		return resolveOptional(K_TOKEN_MODEL);
	}

	/** OpenNLP POS model location. */
	public String getPosModel() {
		return resolve(getRequired(K_POS_MODEL));
	}

	/** Optional OpenNLP lemma dictionary location ("" when unset). */
	public String getLemmaDict() {
		return resolveOptional(K_LEMMA_DICT);
	}

	// -------------------------- Internals --------------------------------------

	private void loadFromClasspath(String resource) {
		try (InputStream in = getClass().getClassLoader().getResourceAsStream(resource)) {
			if (in == null) {
				Logger.error("Unable to find resource on classpath: {}", resource);
				return;
			}
			properties.load(in);
		} catch (Exception ex) {
			Logger.error("Failed to load properties from classpath: {} :: {}", resource, ex.getMessage());
		}
	}

	private void loadFromFile(Path file) {
		try (InputStream in = Files.newInputStream(file)) {
			properties.load(in);
			baseDir = file.toAbsolutePath().getParent();
		} catch (Exception ex) {
			Logger.error("Failed to load properties from file: {} :: {}", file, ex.getMessage());
		}
	}

	/** Prefer a file next to the loaded properties file, else the raw location. */
	private String resolve(String location) {
		String loc = location.trim();
		if (baseDir != null) {
			Path p = Path.of(loc);
			if (!p.isAbsolute()) {
				Path sibling = baseDir.resolve(p);
				if (Files.isReadable(sibling))
					return sibling.toString();
			}
		}
		return loc;
	}

	private String resolveOptional(String key) {
		String v = getOptional(key, null);
		return (v == null) ? "" : resolve(v);
	}

	private String lexiconLocation(String key) {
		String v = getOptional(key, null);
		if (v == null) {
			throw new ConfigurationException("Missing required property: " + key);
		}
		return v;
	}

	private String getRequired(String key) {
		String v = getOptional(key, null);
		if (v == null) {
			throw new IllegalStateException("Missing required property: " + key);
		}
		return v;
	}

	private String getOptional(String key, String defaultVal) {
		String v = properties.getProperty(key);
		if (v == null)
			return defaultVal;
		v = v.trim();
		return v.isEmpty() ? defaultVal : v;
	}

	private void requireNonBlank(String key, List<String> issues) {
		if (getOptional(key, null) == null) {
			issues.add("Missing required property: " + key);
		}
	}

	private void checkInteger(String key, List<String> issues) {
		String v = getOptional(key, null);
		if (v == null)
			return;
		try {
			Long.parseLong(v);
		} catch (NumberFormatException nfe) {
			issues.add("Property " + key + " is not an integer: '" + v + "'");
		}
	}
}
