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

/**
 * Lexical flags for tokenizers that do not compute them (OpenNLP only returns
 * strings).
 */
public final class TokenFlags {

	private TokenFlags() {
	}

	/** Every code point is a letter. */
	public static boolean isAlpha(String s) {
		if (s == null || s.isEmpty())
			return false;
		return s.codePoints().allMatch(Character::isLetter);
	}

	/** Every code point is whitespace or punctuation. */
	public static boolean isPunctOrSpace(String s) {
		if (s == null || s.isEmpty())
			return false;
		return s.codePoints().allMatch(cp -> Character.isWhitespace(cp) || Character.isSpaceChar(cp) || isPunctuation(cp));
	}

	/**
	 * Digits once a leading sign and the '.'/',' separators are removed, or a
	 * fraction of two such digit runs ({@code 3/4}). Spelled-out numbers are
	 * not recognized.
	 */
	public static boolean likeNumber(String s) {
		if (s == null || s.isEmpty())
			return false;
		String t = s;
		while (!t.isEmpty() && "+-±~".indexOf(t.charAt(0)) >= 0) {
			t = t.substring(1);
		}
		String stripped = t.replace(",", "").replace(".", "");
		if (isDigits(stripped))
			return true;
		int slash = t.indexOf('/');
		if (slash > 0 && slash == t.lastIndexOf('/')) {
			return isDigits(t.substring(0, slash)) && isDigits(t.substring(slash + 1));
		}
		return false;
	}

	private static boolean isDigits(String s) {
		return !s.isEmpty() && s.chars().allMatch(Character::isDigit);
	}

	private static boolean isPunctuation(int cp) {
		switch (Character.getType(cp)) {
		case Character.CONNECTOR_PUNCTUATION:
		case Character.DASH_PUNCTUATION:
		case Character.START_PUNCTUATION:
		case Character.END_PUNCTUATION:
		case Character.INITIAL_QUOTE_PUNCTUATION:
		case Character.FINAL_QUOTE_PUNCTUATION:
		case Character.OTHER_PUNCTUATION:
			return true;
		default:
			return false;
		}
	}
}
