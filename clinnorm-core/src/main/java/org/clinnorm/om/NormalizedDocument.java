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

import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Ordered, non-empty normalized tokens of one input text.
 */
public record NormalizedDocument(List<String> tokens) {

	private static final NormalizedDocument EMPTY = new NormalizedDocument(List.of());

	public NormalizedDocument {
		tokens = (tokens == null) ? List.of() : List.copyOf(tokens);
	}

	public static NormalizedDocument empty() {
		return EMPTY;
	}

	public boolean isEmpty() {
		return tokens.isEmpty();
	}

	/**
	 * Tokens joined by single spaces; any whitespace runs inside tokens are
	 * collapsed too. Empty document gives {@code ""}.
	 */
	public String text() {
		if (tokens.isEmpty())
			return "";
		return StringUtils.normalizeSpace(String.join(" ", tokens));
	}

	@Override
	public String toString() {
		return text();
	}
}
