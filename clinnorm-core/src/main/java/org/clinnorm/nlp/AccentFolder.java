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

import java.text.Normalizer;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Diacritic stripping: canonical decomposition (NFD) followed by removal of
 * every non-spacing combining mark (Unicode category Mn).
 * <p>
 * Case is left alone; callers lowercase separately. {@code fold} is
 * idempotent.
 */
public final class AccentFolder {

	private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{Mn}+");

	private AccentFolder() {
	}

	public static String fold(String s) {
		Objects.requireNonNull(s, "text to fold");
		if (isAscii(s))
			return s;
		return COMBINING_MARKS.matcher(Normalizer.normalize(s, Normalizer.Form.NFD)).replaceAll("");
	}

	private static boolean isAscii(String s) {
		for (int i = 0; i < s.length(); i++) {
			if (s.charAt(i) > 0x7F)
				return false;
		}
		return true;
	}
}
