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

import java.util.regex.Pattern;

import org.clinnorm.om.Token;

/**
 * Recognizes quantitative tokens, including the clinical formats a generic
 * tokenizer does not always flag.
 * <p>
 * A token is numeric when the tokenizer says it looks like a number, or when
 * its whole surface text is one of:
 * <ul>
 * <li>an integer or decimal, with '.' or ',' as separator: {@code 12},
 * {@code 12.3}, {@code 12,3}</li>
 * <li>the same in scientific notation: {@code 1e-3}, {@code 2.5E+4}</li>
 * <li>any of the above followed by {@code %}, {@code ‰}, {@code ‱} or
 * {@code /%}: {@code 12%}, {@code 96.5%}</li>
 * <li>a simple fraction of two integers: {@code 120/80}</li>
 * </ul>
 */
public final class NumericClassifier {

	private static final Pattern CLINICAL_NUMBER = Pattern.compile(
			"\\d+(?:[.,]\\d+)?(?:[eE][+-]?\\d+)?(?:/%|%|\u2030|\u2031)?" // 12 / 12,3 / 1e-3 / 12%
					+ "|\\d+/\\d+"); // 120/80

	private NumericClassifier() {
	}

	/** Never throws; a null token is not numeric. */
	public static boolean isNumeric(Token token) {
		if (token == null)
			return false;
		return token.likeNumber() || matchesNumericGrammar(token.text());
	}

	/** Whole-string match against the clinical number grammar. */
	public static boolean matchesNumericGrammar(String text) {
		return text != null && CLINICAL_NUMBER.matcher(text).matches();
	}
}
