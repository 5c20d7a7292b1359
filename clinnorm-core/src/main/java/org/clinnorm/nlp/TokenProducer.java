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

import java.util.List;

import org.clinnorm.om.Token;

/**
 * External tokenizer/lemmatizer: turns raw text into an ordered, finite
 * sequence of tokens, each carrying surface text, lemma, coarse POS tag and
 * the alpha / punctuation / number flags.
 * <p>
 * Injected into {@link org.clinnorm.processing.TextNormalizer}; tests pass
 * fakes. Implementations are expected to be deterministic for identical input
 * and model version. They need not be thread-safe.
 */
@FunctionalInterface
public interface TokenProducer {

	/** Empty or blank text yields an empty list. */
	List<Token> tokenize(String text);
}
