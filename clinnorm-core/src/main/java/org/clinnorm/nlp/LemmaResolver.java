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

import java.util.Locale;

import org.clinnorm.conf.NormalizerConfig;
import org.clinnorm.om.Token;

/**
 * Picks the canonical form of a token, first match wins:
 * <ol>
 * <li>explicit override for the lowercase surface text</li>
 * <li>VERB/AUX: the tokenizer lemma, lowercased, else the lowercase surface</li>
 * <li>anything else: the tokenizer lemma, lowercased, else the lowercase
 * surface</li>
 * </ol>
 * Never empty for a non-empty surface text.
 */
public final class LemmaResolver {

	private LemmaResolver() {
	}

	public static String resolve(Token token, NormalizerConfig config) {
		String lw = token.text().toLowerCase(Locale.ROOT);

		String override = config.overrideFor(lw);
		if (override != null)
			return override;

		// Same result as the general branch for now; POS-specific rules go here.
		if (token.pos().isVerbal()) {
			return token.hasLemma() ? token.lemma().toLowerCase(Locale.ROOT) : lw;
		}
		return token.hasLemma() ? token.lemma().toLowerCase(Locale.ROOT) : lw;
	}
}
