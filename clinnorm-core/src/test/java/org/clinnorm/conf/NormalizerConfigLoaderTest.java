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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Properties;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NormalizerConfigLoaderTest {

	@TempDir
	Path tmp;

	private String priorSysProp;

	@AfterEach
	void cleanupSysProp() {
		if (priorSysProp == null) {
			System.clearProperty(NormalizerConfigLoader.SYS_PROP_CONFIG_PATH);
		} else {
			System.setProperty(NormalizerConfigLoader.SYS_PROP_CONFIG_PATH, priorSysProp);
		}
	}

	// --- helpers -------------------------------------------------------------

	private Path writePropsFile(Properties p, String filename) throws IOException {
		Path f = tmp.resolve(filename);
		try (var out = Files.newOutputStream(f)) {
			p.store(out, "test");
		}
		return f;
	}

	private Properties minimalRequiredProps() throws IOException {
		Files.writeString(tmp.resolve("stop.txt"), "# stop\nla\ny\nno\n", StandardCharsets.UTF_8);
		Files.writeString(tmp.resolve("extra.txt"), "refiere\n", StandardCharsets.UTF_8);
		Files.writeString(tmp.resolve("lemmas.csv"), "checar,checo,checas\n", StandardCharsets.UTF_8);
		Files.writeString(tmp.resolve("neg.txt"), "no\nningún\n", StandardCharsets.UTF_8);

		Properties p = new Properties();
		// relative to the properties file
		p.setProperty("BASE_STOPWORDS", "stop.txt");
		p.setProperty("EXTRA_STOPWORDS", "extra.txt");
		p.setProperty("LEMMA_OVERRIDES", "lemmas.csv");
		p.setProperty("NEGATION_TERMS", "neg.txt");
		return p;
	}

	// --- tests ---------------------------------------------------------------

	@Test
	void loads_lexicon_relative_to_properties_file() throws Exception {
		Path f = writePropsFile(minimalRequiredProps(), "clinnorm.properties");

		NormalizerConfigLoader loader = new NormalizerConfigLoader(f);
		assertTrue(loader.validate().isEmpty(), () -> "unexpected issues: " + loader.validate());

		NormalizerConfig cfg = loader.loadLexicon();
		assertTrue(cfg.isStopword("la"));
		assertTrue(cfg.isStopword("refiere"));
		assertFalse(cfg.isStopword("no"));
		assertTrue(cfg.isNegation("ningun"));
		assertEquals("checar", cfg.overrideFor("checas"));
	}

	@Test
	void extra_stopwords_are_optional() throws Exception {
		Properties p = minimalRequiredProps();
		p.remove("EXTRA_STOPWORDS");
		NormalizerConfigLoader loader = new NormalizerConfigLoader(writePropsFile(p, "no_extra.properties"));

		assertTrue(loader.validate().isEmpty());
		assertFalse(loader.loadLexicon().isStopword("refiere"));
	}

	@Test
	void validate_reports_missing_required_keys() throws Exception {
		NormalizerConfigLoader loader = new NormalizerConfigLoader(writePropsFile(new Properties(), "empty.properties"));
		List<String> issues = loader.validate();

		assertTrue(issues.stream().anyMatch(s -> s.contains("Missing required property: BASE_STOPWORDS")));
		assertTrue(issues.stream().anyMatch(s -> s.contains("Missing required property: LEMMA_OVERRIDES")));
		assertTrue(issues.stream().anyMatch(s -> s.contains("Missing required property: NEGATION_TERMS")));
		assertFalse(issues.stream().anyMatch(s -> s.contains("EXTRA_STOPWORDS")));
	}

	@Test
	void validate_reports_bad_values_and_missing_files() throws Exception {
		Properties p = minimalRequiredProps();
		p.setProperty("NEGATION_TERMS", "missing-neg.txt");
		p.setProperty("NUMERIC_POLICY", "round");
		p.setProperty("PARALLEL_DOCUMENT_LIMIT", "many");
		p.setProperty("TOKENIZE_TIMEOUT_SECONDS", "1.5");
		p.setProperty("FOLD_CONTENT", "yes");
		NormalizerConfigLoader loader = new NormalizerConfigLoader(writePropsFile(p, "bad.properties"));

		List<String> issues = loader.validate();
		assertEquals(5, issues.size(), issues::toString);
		assertTrue(issues.stream().anyMatch(s -> s.contains("Lexicon file not found for NEGATION_TERMS")));
		assertTrue(issues.stream().anyMatch(s -> s.contains("round")));
		assertTrue(issues.stream().anyMatch(s -> s.contains("PARALLEL_DOCUMENT_LIMIT")));
		assertTrue(issues.stream().anyMatch(s -> s.contains("TOKENIZE_TIMEOUT_SECONDS")));
		assertTrue(issues.stream().anyMatch(s -> s.contains("FOLD_CONTENT")));
	}

	@Test
	void load_lexicon_fails_fast() throws Exception {
		Properties p = minimalRequiredProps();
		p.setProperty("LEMMA_OVERRIDES", "gone.csv");
		NormalizerConfigLoader missingFile = new NormalizerConfigLoader(writePropsFile(p, "gone.properties"));
		assertThrows(ConfigurationException.class, missingFile::loadLexicon);

		Properties q = minimalRequiredProps();
		q.remove("BASE_STOPWORDS");
		NormalizerConfigLoader missingKey = new NormalizerConfigLoader(writePropsFile(q, "nokey.properties"));
		ConfigurationException ex = assertThrows(ConfigurationException.class, missingKey::loadLexicon);
		assertTrue(ex.getMessage().contains("BASE_STOPWORDS"));
	}

	@Test
	void settings_default_when_keys_absent() throws Exception {
		NormalizerConfigLoader loader = new NormalizerConfigLoader(
				writePropsFile(minimalRequiredProps(), "defaults.properties"));
		NormalizerSettings s = loader.loadSettings();

		assertEquals(NumericPolicy.PRESERVE_ORIGINAL, s.getNumericPolicy());
		assertEquals(NormalizerSettings.DEFAULT_PLACEHOLDER, s.getNumericPlaceholder());
		assertFalse(s.isFoldContent());
		assertEquals(Duration.ZERO, s.getTokenizeTimeout());
		assertTrue(s.getParallelism() >= 1);
	}

	@Test
	void settings_read_from_properties() throws Exception {
		Properties p = minimalRequiredProps();
		p.setProperty("NUMERIC_POLICY", "mark_as_placeholder");
		p.setProperty("NUMERIC_PLACEHOLDER", "#NUM");
		p.setProperty("FOLD_CONTENT", "TRUE");
		p.setProperty("PARALLEL_DOCUMENT_LIMIT", "1");
		p.setProperty("TOKENIZE_TIMEOUT_SECONDS", "30");
		NormalizerSettings s = new NormalizerConfigLoader(writePropsFile(p, "custom.properties")).loadSettings();

		assertEquals(NumericPolicy.MARK_AS_PLACEHOLDER, s.getNumericPolicy());
		assertEquals("#NUM", s.getNumericPlaceholder());
		assertTrue(s.isFoldContent());
		assertEquals(1, s.getParallelism());
		assertEquals(Duration.ofSeconds(30), s.getTokenizeTimeout());
	}

	@Test
	void unknown_policy_fails_settings() throws Exception {
		Properties p = minimalRequiredProps();
		p.setProperty("NUMERIC_POLICY", "drop");
		NormalizerConfigLoader loader = new NormalizerConfigLoader(writePropsFile(p, "policy.properties"));
		assertThrows(ConfigurationException.class, loader::loadSettings);
	}

	@Test
	void parallel_limit_caps_at_cores_and_ignores_non_positive() throws Exception {
		int cores = Math.max(1, Runtime.getRuntime().availableProcessors());
		int defaultLimit = Math.max(1, cores / 4);

		Properties p = minimalRequiredProps();
		p.setProperty("PARALLEL_DOCUMENT_LIMIT", "9999");
		assertEquals(cores, new NormalizerConfigLoader(writePropsFile(p, "huge.properties")).getParallelDocumentLimit());

		p.setProperty("PARALLEL_DOCUMENT_LIMIT", "0");
		assertEquals(defaultLimit,
				new NormalizerConfigLoader(writePropsFile(p, "zero.properties")).getParallelDocumentLimit());

		p.setProperty("PARALLEL_DOCUMENT_LIMIT", "lots");
		assertEquals(defaultLimit,
				new NormalizerConfigLoader(writePropsFile(p, "nan.properties")).getParallelDocumentLimit());
	}

	@Test
	void model_locations() throws Exception {
		Path pos = tmp.resolve("pos.bin");
		Files.writeString(pos, "x");
		Properties p = minimalRequiredProps();
		p.setProperty("POS_MODEL", "pos.bin");
		NormalizerConfigLoader loader = new NormalizerConfigLoader(writePropsFile(p, "models.properties"));

		assertEquals(pos.toAbsolutePath().toString(), loader.getPosModel());
		assertEquals("", loader.getTokenModel());
		assertEquals("", loader.getLemmaDict());

		NormalizerConfigLoader noPos = new NormalizerConfigLoader(
				writePropsFile(minimalRequiredProps(), "nopos.properties"));
		assertThrows(IllegalStateException.class, noPos::getPosModel);
	}

	@Test
	void system_property_override_loads_external_file() throws Exception {
		Properties p = minimalRequiredProps();
		p.setProperty("NUMERIC_PLACEHOLDER", "[n]");
		Path f = writePropsFile(p, "override.properties");

		priorSysProp = System.getProperty(NormalizerConfigLoader.SYS_PROP_CONFIG_PATH);
		System.setProperty(NormalizerConfigLoader.SYS_PROP_CONFIG_PATH, f.toAbsolutePath().toString());

		NormalizerConfigLoader loader = new NormalizerConfigLoader();
		assertEquals("[n]", loader.loadSettings().getNumericPlaceholder());
		assertEquals("checar", loader.loadLexicon().overrideFor("checo"));
	}

	@Test
	void classpath_default_is_valid() {
		priorSysProp = System.getProperty(NormalizerConfigLoader.SYS_PROP_CONFIG_PATH);
		System.clearProperty(NormalizerConfigLoader.SYS_PROP_CONFIG_PATH);

		NormalizerConfigLoader loader = new NormalizerConfigLoader();
		assertTrue(loader.validate().isEmpty(), () -> "unexpected issues: " + loader.validate());

		NormalizerConfig cfg = loader.loadLexicon();
		assertTrue(cfg.isStopword("la"));
		assertFalse(cfg.isStopword("no"));
		assertTrue(cfg.isNegation("ningun"));
		assertEquals(NumericPolicy.PRESERVE_ORIGINAL, loader.loadSettings().getNumericPolicy());
	}

	@Test
	void unreadable_file_is_rejected() {
		assertThrows(IllegalArgumentException.class, () -> new NormalizerConfigLoader(tmp.resolve("absent.properties")));
		assertThrows(IllegalArgumentException.class, () -> new NormalizerConfigLoader((Path) null));
	}
}
