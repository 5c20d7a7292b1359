package org.clinnorm;

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

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.clinnorm.conf.NormalizerConfig;
import org.clinnorm.conf.NormalizerConfigLoader;
import org.clinnorm.conf.NormalizerSettings;
import org.clinnorm.nlp.OpenNlpTokenProducer;
import org.clinnorm.processing.NormalizationPipeline;
import org.clinnorm.processing.TextNormalizer;
import org.clinnorm.util.Logger;

/**
 * Batch entry point: normalizes every text of a CSV file.
 *
 * <pre>
 *   java org.clinnorm.ClinNormMain input.csv output.csv
 * </pre>
 *
 * The input needs a header with a {@code TEXT} column; an {@code ID} column is
 * copied through when present, otherwise the 1-based row number is used. The
 * output has the columns {@code ID,TEXT,NORMALIZED} in input order.
 * Configuration comes from {@link NormalizerConfigLoader} (system property
 * {@code clinnorm.config} or the classpath default); the OpenNLP models are
 * named by {@code TOKEN_MODEL}, {@code POS_MODEL} and {@code LEMMA_DICT}.
 */
public class ClinNormMain {

	static final String COL_ID = "ID";
	static final String COL_TEXT = "TEXT";
	static final String COL_NORMALIZED = "NORMALIZED";

	/** Texts handed to the normalizer at a time. */
	static final int BATCH_SIZE = 64;

	private static final CSVFormat INPUT_FORMAT = CSVFormat.DEFAULT.builder()
			.setHeader()
			.setSkipHeaderRecord(true)
			.setIgnoreHeaderCase(true)
			.setIgnoreEmptyLines(true)
			.build();

	private static final CSVFormat OUTPUT_FORMAT = CSVFormat.DEFAULT.builder()
			.setHeader(COL_ID, COL_TEXT, COL_NORMALIZED)
			.build();

	private final NormalizerConfigLoader cfg;

	public ClinNormMain() {
		this.cfg = new NormalizerConfigLoader();
	}

	ClinNormMain(NormalizerConfigLoader cfg) {
		this.cfg = cfg;
	}

	public static void main(String[] args) {
		if (args.length != 2) {
			System.err.println("Usage: ClinNormMain <input.csv> <output.csv>");
			System.exit(2);
		}
		ClinNormMain app = new ClinNormMain();
		try {
			int rows = app.run(Path.of(args[0]), Path.of(args[1]));
			Logger.log("Normalized rows: " + rows);
		} catch (IOException e) {
			Logger.error("Normalization run failed: {}", e, e.getMessage());
			System.exit(1);
		}
	}

	/**
	 * Validate configuration, load lexicon and models, then normalize the input
	 * file into the output file.
	 *
	 * @return number of rows written
	 */
	int run(Path input, Path output) throws IOException {
		List<String> issues = cfg.validate();
		if (!issues.isEmpty()) {
			issues.forEach(i -> Logger.error("Config: {}", i));
			throw new IllegalStateException("Invalid configuration (" + issues.size() + " issue(s))");
		}

		NormalizerConfig lexicon = cfg.loadLexicon();
		NormalizerSettings settings = cfg.loadSettings();
		Logger.log("Numeric policy: " + settings.getNumericPolicy() + ", fold content: " + settings.isFoldContent()
				+ ", workers: " + settings.getParallelism());

		OpenNlpTokenProducer producer = OpenNlpTokenProducer.fromModels(cfg.getTokenModel(), cfg.getPosModel(),
				cfg.getLemmaDict());
		NormalizationPipeline pipeline = new NormalizationPipeline(lexicon, settings);

		try (TextNormalizer normalizer = new TextNormalizer(producer, pipeline, settings);
				Reader in = Files.newBufferedReader(input, StandardCharsets.UTF_8);
				Writer out = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
			return process(in, out, normalizer);
		}
	}

	/**
	 * Stream rows from {@code in} to {@code out} in batches of
	 * {@value #BATCH_SIZE}.
	 *
	 * @return number of rows written
	 * @throws IllegalArgumentException if the input has no TEXT column
	 */
	static int process(Reader in, Writer out, TextNormalizer normalizer) throws IOException {
		int written = 0;
		try (CSVParser parser = new CSVParser(in, INPUT_FORMAT); CSVPrinter printer = new CSVPrinter(out, OUTPUT_FORMAT)) {
			if (!parser.getHeaderMap().containsKey(COL_TEXT)) {
				throw new IllegalArgumentException("Input CSV has no " + COL_TEXT + " column: " + parser.getHeaderNames());
			}
			boolean hasId = parser.getHeaderMap().containsKey(COL_ID);

			List<String> ids = new ArrayList<>(BATCH_SIZE);
			List<String> texts = new ArrayList<>(BATCH_SIZE);
			int row = 0;
			for (CSVRecord record : parser) {
				row++;
				ids.add(hasId ? record.get(COL_ID) : String.valueOf(row));
				texts.add(record.isSet(COL_TEXT) ? record.get(COL_TEXT) : "");
				if (texts.size() == BATCH_SIZE) {
					written += flush(ids, texts, normalizer, printer);
				}
			}
			written += flush(ids, texts, normalizer, printer);
		}
		return written;
	}

	private static int flush(List<String> ids, List<String> texts, TextNormalizer normalizer, CSVPrinter printer)
			throws IOException {
		if (texts.isEmpty())
			return 0;
		List<String> normalized = normalizer.normalizeAll(texts);
		for (int i = 0; i < texts.size(); i++) {
			printer.printRecord(ids.get(i), texts.get(i), normalized.get(i));
		}
		int n = texts.size();
		ids.clear();
		texts.clear();
		return n;
	}
}
