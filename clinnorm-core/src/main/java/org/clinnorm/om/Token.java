package org.clinnorm.om;

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

import java.util.Objects;

/**
 * A single lexical unit as produced by the external tokenizer/lemmatizer.
 * <p>
 * Tokens are read-only input to the normalizer: classification and lemma
 * resolution only derive values from them.
 *
 * @param text         original surface string (non-null, non-empty)
 * @param lemma        candidate base form; {@code ""} when the tokenizer has none
 * @param pos          coarse part-of-speech tag
 * @param alpha        tokenizer says the token is alphabetic
 * @param punctOrSpace tokenizer says the token is punctuation or whitespace
 * @param likeNumber   tokenizer says the token looks like a number
 */
public record Token(String text, String lemma, PartOfSpeech pos, boolean alpha, boolean punctOrSpace,
		boolean likeNumber) {

	public Token {
		Objects.requireNonNull(text, "Token text must not be null");
		if (text.isEmpty()) {
			throw new IllegalArgumentException("Token text must not be empty");
		}
		lemma = (lemma == null) ? "" : lemma;
		pos = (pos == null) ? PartOfSpeech.X : pos;
	}

	/** Alphabetic token with the given lemma and tag. */
	public static Token word(String text, String lemma, PartOfSpeech pos) {
		return new Token(text, lemma, pos, true, false, false);
	}

	/** Alphabetic token without a lemma. */
	public static Token word(String text) {
		return word(text, "", PartOfSpeech.X);
	}

	/** Punctuation or whitespace token. */
	public static Token punct(String text) {
		return new Token(text, "", PartOfSpeech.PUNCT, false, true, false);
	}

	/** Numeric-looking token as flagged by the tokenizer. */
	public static Token number(String text) {
		return new Token(text, "", PartOfSpeech.NUM, false, false, true);
	}

	public boolean hasLemma() {
		return !lemma.isEmpty();
	}
}
