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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.StringReader;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.stream.Collectors;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.clinnorm.conf.NormalizerConfig;
import org.clinnorm.conf.NormalizerConfigLoader;
import org.clinnorm.nlp.TokenFlags;
import org.clinnorm.nlp.TokenProducer;
import org.clinnorm.om.PartOfSpeech;
import org.clinnorm.om.Token;
import org.clinnorm.processing.NormalizationPipeline;
import org.clinnorm.processing.TextNormalizer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import opennlp.tools.tokenize.SimpleTokenizer;

class ClinNormMainTest {

	@TempDir
	Path tmp;

	private TextNormalizer normalizer;

	@BeforeEach
	void setUp() {
		TokenProducer producer = text -> Arrays.stream(SimpleTokenizer.INSTANCE.tokenize(text))
				.map(s -> new Token(s, "", PartOfSpeech.X, TokenFlags.isAlpha(s), TokenFlags.isPunctOrSpace(s),
						TokenFlags.likeNumber(s)))
				.collect(Collectors.toList());
		NormalizerConfig cfg = NormalizerConfig.of(List.of("la", "de", "y", "no", "con"),
				Map.of("checar", List.of("checo")), List.of("no", "sin", "ningun"));
		normalizer = new TextNormalizer(producer, new NormalizationPipeline(cfg));
	}

	@AfterEach
	void tearDown() {
		normalizer.close();
	}

	private static List<CSVRecord> parseOutput(String csv) throws Exception {
		CSVFormat fmt = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).build();
		try (CSVParser p = new CSVParser(new StringReader(csv), fmt)) {
			assertEquals(List.of("ID", "TEXT", "NORMALIZED"), p.getHeaderNames());
			return p.getRecords();
		}
	}

	@Test
	void normalizesEveryRowAndCopiesIds() throws Exception {
		String in = "ID,TEXT\n" //
				+ "a1,la mamá no toma agua\n" //
				+ "a2,\"Ningún dolor, sin fiebre\"\n" //
				+ "a3,\n";
		StringWriter out = new StringWriter();

		int rows = ClinNormMain.process(new StringReader(in), out, normalizer);
		assertEquals(3, rows);

		List<CSVRecord> records = parseOutput(out.toString());
		assertEquals(3, records.size());
		assertEquals("a1", records.get(0).get("ID"));
		assertEquals("mamá no toma agua", records.get(0).get("NORMALIZED"));
		assertEquals("Ningún dolor, sin fiebre", records.get(1).get("TEXT"));
		assertEquals("ningún dolor sin fiebre", records.get(1).get("NORMALIZED"));
		assertEquals("", records.get(2).get("NORMALIZED"));
	}

	@Test
	void rowNumberStandsInForMissingIdAndHeaderCaseIsIgnored() throws Exception {
		String in = "text\nChecó la presión 120/80\nfiebre de 39\n";
		StringWriter out = new StringWriter();

		ClinNormMain.process(new StringReader(in), out, normalizer);

		List<CSVRecord> records = parseOutput(out.toString());
		assertEquals("1", records.get(0).get("ID"));
		assertEquals("2", records.get(1).get("ID"));
		assertEquals("fiebre 39", records.get(1).get("NORMALIZED"));
	}

	@Test
	void largeInputsAreProcessedInOrderAcrossBatches() throws Exception {
		StringBuilder in = new StringBuilder("ID,TEXT\n");
		int n = ClinNormMain.BATCH_SIZE * 2 + 7;
		for (int i = 0; i < n; i++)
			in.append(i).append(",la dosis ").append(i).append('\n');
		StringWriter out = new StringWriter();

		assertEquals(n, ClinNormMain.process(new StringReader(in.toString()), out, normalizer));

		List<CSVRecord> records = parseOutput(out.toString());
		assertEquals(n, records.size());
		for (int i = 0; i < n; i++) {
			assertEquals(String.valueOf(i), records.get(i).get("ID"));
			assertEquals("dosis " + i, records.get(i).get("NORMALIZED"));
		}
	}

	@Test
	void inputWithoutTextColumnIsRejected() {
		StringWriter out = new StringWriter();
		IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
				() -> ClinNormMain.process(new StringReader("ID,NOTE\n1,x\n"), out, normalizer));
		assertTrue(ex.getMessage().contains("TEXT"));
	}

	@Test
	void emptyInputWritesOnlyTheHeader() throws Exception {
		StringWriter out = new StringWriter();
		assertEquals(0, ClinNormMain.process(new StringReader("ID,TEXT\n"), out, normalizer));
		assertTrue(parseOutput(out.toString()).isEmpty());
	}

	@Test
	void invalidConfigurationStopsTheRun() throws Exception {
		Path props = tmp.resolve("empty.properties");
		try (var o = Files.newOutputStream(props)) {
			new Properties().store(o, "empty");
		}
		Path input = tmp.resolve("in.csv");
		Files.writeString(input, "ID,TEXT\n1,tos\n");
		Path output = tmp.resolve("out.csv");

		ClinNormMain app = new ClinNormMain(new NormalizerConfigLoader(props));
		assertThrows(IllegalStateException.class, () -> app.run(input, output));
		assertFalse(Files.exists(output));
	}

	@Test
	void idsAreKeptVerbatim() throws Exception {
		List<String> ids = new ArrayList<>(List.of("007", " x ", "z"));
		StringBuilder in = new StringBuilder("ID,TEXT\n");
		for (String id : ids)
			in.append('"').append(id).append("\",tos\n");
		StringWriter out = new StringWriter();
		ClinNormMain.process(new StringReader(in.toString()), out, normalizer);

		List<CSVRecord> records = parseOutput(out.toString());
		for (int i = 0; i < ids.size(); i++)
			assertEquals(ids.get(i), records.get(i).get("ID"));
	}
}
