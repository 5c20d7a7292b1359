package org.clinnorm.nlp;

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

import java.util.List;
import java.util.Map;

import org.clinnorm.conf.NormalizerConfig;
import org.clinnorm.om.PartOfSpeech;
import org.clinnorm.om.Token;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class LemmaResolverTest {

	private static NormalizerConfig config;

	@BeforeAll
	static void lexicon() {
		config = NormalizerConfig.of(List.of("la"), Map.of("checar", List.of("checo", "checas")), List.of("no"));
	}

	@Test
	void overrideWinsOverTokenizerLemma() {
		Token t = Token.word("Checo", "checo", PartOfSpeech.VERB);
		assertEquals("checar", LemmaResolver.resolve(t, config));
	}

	@Test
	void overrideAppliesWhateverThePartOfSpeech() {
		assertEquals("checar", LemmaResolver.resolve(Token.word("CHECAS", "", PartOfSpeech.NOUN), config));
	}

	@Test
	void verbUsesTokenizerLemmaLowercased() {
		assertEquals("tomar", LemmaResolver.resolve(Token.word("toma", "Tomar", PartOfSpeech.VERB), config));
		assertEquals("haber", LemmaResolver.resolve(Token.word("ha", "haber", PartOfSpeech.AUX), config));
	}

	@Test
	void verbWithoutLemmaFallsBackToSurface() {
		assertEquals("vomitó", LemmaResolver.resolve(Token.word("Vomitó", "", PartOfSpeech.VERB), config));
	}

	@Test
	void otherTagsUseLemmaThenSurface() {
		assertEquals("agua", LemmaResolver.resolve(Token.word("Aguas", "agua", PartOfSpeech.NOUN), config));
		assertEquals("fiebre", LemmaResolver.resolve(Token.word("Fiebre"), config));
	}

	@Test
	void accentsAreKept() {
		assertEquals("mamá", LemmaResolver.resolve(Token.word("Mamá", "mamá", PartOfSpeech.NOUN), config));
	}

	@Test
	void neverEmptyForNonEmptySurface() {
		for (PartOfSpeech pos : PartOfSpeech.values()) {
			assertFalse(LemmaResolver.resolve(new Token("x", null, pos, true, false, false), config).isEmpty(),
					pos.name());
		}
	}
}
