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

/**
 * Outcome of classifying a single token.
 */
public enum Disposition {
	/** Quantitative value; kept as original text or placeholder. */
	NUMERIC(true),
	/** Punctuation, whitespace or otherwise unusable token. */
	SKIP(false),
	/** Negation term; kept even when it is also a stopword. */
	NEGATION(true),
	/** Low-value vocabulary; dropped. */
	STOPWORD(false),
	/** Everything else; kept as its resolved lemma. */
	CONTENT(true);

	private final boolean keepsOutput;

	Disposition(boolean keepsOutput) {
		this.keepsOutput = keepsOutput;
	}

	public boolean keepsOutput() {
		return keepsOutput;
	}
}
