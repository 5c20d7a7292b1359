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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.clinnorm.util.Logger;

/**
 * Readers for the lexicon files behind {@link NormalizerConfig}.
 *
 * <ul>
 * <li>Word lists (stopwords, negation terms): UTF-8, one term per line; blank
 * lines and lines starting with '#' are ignored.</li>
 * <li>Lemma table: CSV rows {@code canonical,variant1,variant2,...}; '#'
 * starts a comment line. Rows are returned as declared, so a canonical lemma
 * may appear more than once and later rows win override collisions.</li>
 * </ul>
 *
 * Locations are tried on the file system first, then on the classpath.
 */
public final class LexiconFiles {

	private static final CSVFormat LEMMA_CSV = CSVFormat.DEFAULT.builder()
			.setCommentMarker('#')
			.setIgnoreEmptyLines(true)
			.setIgnoreSurroundingSpaces(true)
			.setTrim(true)
			.build();

	private LexiconFiles() {
	}

	/** True if the location resolves to a readable file or classpath resource. */
	public static boolean exists(String location) {
		if (location == null || location.isBlank())
			return false;
		Path p = Path.of(location.trim());
		if (Files.isReadable(p))
			return true;
		return classLoader().getResource(stripLeadingSlash(location.trim())) != null;
	}

	/**
	 * Read a word list.
	 *
	 * @throws ConfigurationException if missing or unreadable
	 */
	public static List<String> readWordList(String location) {
		try (InputStream in = open(location);
				BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
			List<String> words = readWordList(br);
			Logger.debug("Read {} terms from {}", words.size(), location);
			return words;
		} catch (IOException e) {
			throw new ConfigurationException("Failed to read word list " + location + ": " + e.getMessage(), e);
		}
	}

	static List<String> readWordList(BufferedReader reader) throws IOException {
		List<String> words = new ArrayList<>();
		String line;
		while ((line = reader.readLine()) != null) {
			String trimmed = stripBom(line).trim();
			if (trimmed.isEmpty() || trimmed.startsWith("#"))
				continue;
			words.add(trimmed);
		}
		return words;
	}

	/**
	 * Read the lemma table rows in file order.
	 *
	 * @throws ConfigurationException if missing, unreadable or malformed
	 */
	public static List<LemmaRow> readLemmaTable(String location) {
		try (InputStream in = open(location);
				Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
			return readLemmaTable(reader, location);
		} catch (IOException e) {
			throw new ConfigurationException("Failed to read lemma table " + location + ": " + e.getMessage(), e);
		}
	}

	static List<LemmaRow> readLemmaTable(Reader reader, String sourceName) throws IOException {
		List<LemmaRow> rows = new ArrayList<>();
		try (CSVParser parser = new CSVParser(reader, LEMMA_CSV)) {
			for (CSVRecord record : parser) {
				String canonical = stripBom(record.get(0));
				if (canonical.isBlank()) {
					throw new ConfigurationException(
							sourceName + ": line " + parser.getCurrentLineNumber() + " has no canonical lemma");
				}
				List<String> variants = new ArrayList<>(record.size());
				for (int i = 1; i < record.size(); i++) {
					variants.add(record.get(i));
				}
				rows.add(new LemmaRow(canonical, variants));
			}
		}
		Logger.debug("{}: {} lemma rows", sourceName, rows.size());
		return rows;
	}

	// -------------------------- Internals -------------------------------------

	private static InputStream open(String location) throws IOException {
		if (location == null || location.isBlank()) {
			throw new ConfigurationException("Lexicon location is blank");
		}
		String loc = location.trim();
		Path p = Path.of(loc);
		if (Files.isReadable(p)) {
			return Files.newInputStream(p);
		}
		InputStream in = classLoader().getResourceAsStream(stripLeadingSlash(loc));
		if (in == null) {
			throw new ConfigurationException("Lexicon file not found on file system or classpath: " + loc);
		}
		return in;
	}

	private static ClassLoader classLoader() {
		ClassLoader cl = Thread.currentThread().getContextClassLoader();
		return (cl != null) ? cl : LexiconFiles.class.getClassLoader();
	}

	private static String stripLeadingSlash(String s) {
		return s.startsWith("/") ? s.substring(1) : s;
	}

	private static String stripBom(String s) {
		return (!s.isEmpty() && s.charAt(0) == '\uFEFF') ? s.substring(1) : s;
	}
}
