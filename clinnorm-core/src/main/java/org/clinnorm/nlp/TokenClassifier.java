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
import java.util.Objects;

import org.clinnorm.conf.NormalizerConfig;
import org.clinnorm.conf.NormalizerSettings;
import org.clinnorm.conf.NumericPolicy;
import org.clinnorm.om.Classification;
import org.clinnorm.om.Disposition;
import org.clinnorm.om.Token;

/**
 * Assigns a {@link Disposition} and output text to each token.
 *
 * <h3>Decision order (first match wins)</h3>
 * <ol>
 * <li>punctuation/whitespace, or neither alphabetic nor numeric: SKIP</li>
 * <li>numeric: NUMERIC, original text or placeholder per {@link NumericPolicy}</li>
 * <li>folded lemma (or folded surface) is a negation term: NEGATION, output is
 * the resolved lemma with its accents</li>
 * <li>folded lemma is a stopword: STOPWORD</li>
 * <li>otherwise CONTENT, output is the resolved lemma (folded only when
 * content folding is on)</li>
 * </ol>
 * Stopword and negation matching always happen on the lowercase,
 * accent-folded lemma, so {@code Ningún}, {@code ningun} and {@code NINGÚN}
 * behave the same.
 * <p>
 * Stateless apart from its final options; one instance can be shared.
 */
public final class TokenClassifier {

	private final NumericPolicy numericPolicy;
	private final String numericPlaceholder;
	private final boolean foldContent;

	public TokenClassifier() {
		this(NumericPolicy.PRESERVE_ORIGINAL, NormalizerSettings.DEFAULT_PLACEHOLDER, false);
	}

	public TokenClassifier(NumericPolicy numericPolicy, String numericPlaceholder, boolean foldContent) {
		this.numericPolicy = Objects.requireNonNull(numericPolicy, "numericPolicy");
		if (numericPolicy == NumericPolicy.MARK_AS_PLACEHOLDER
				&& (numericPlaceholder == null || numericPlaceholder.isBlank())) {
			throw new IllegalArgumentException("A non-blank placeholder is required for " + numericPolicy);
		}
		this.numericPlaceholder = (numericPlaceholder == null) ? "" : numericPlaceholder.trim();
		this.foldContent = foldContent;
	}

	public static TokenClassifier from(NormalizerSettings settings) {
		return new TokenClassifier(settings.getNumericPolicy(), settings.getNumericPlaceholder(),
				settings.isFoldContent());
	}

	public Classification classify(Token token, NormalizerConfig config) {
		Objects.requireNonNull(token, "token");
		Objects.requireNonNull(config, "config");

		boolean numeric = NumericClassifier.isNumeric(token);
		if (token.punctOrSpace() || (!token.alpha() && !numeric))
			return Classification.skip();

		if (numeric)
			return new Classification(Disposition.NUMERIC, numericOutput(token));

		String resolved = LemmaResolver.resolve(token, config).trim();
		if (resolved.isEmpty())
			return Classification.skip();

		String key = AccentFolder.fold(resolved.toLowerCase(Locale.ROOT));
		if (key.isEmpty())
			return Classification.skip();

		if (config.isNegation(key) || config.isNegation(AccentFolder.fold(token.text().toLowerCase(Locale.ROOT))))
			return new Classification(Disposition.NEGATION, resolved);

		if (config.isStopword(key))
			return Classification.stopword();

		return new Classification(Disposition.CONTENT, foldContent ? AccentFolder.fold(resolved) : resolved);
	}

	private String numericOutput(Token token) {
		return switch (numericPolicy) {
		case PRESERVE_ORIGINAL -> token.text();
		case MARK_AS_PLACEHOLDER -> numericPlaceholder;
		};
	}

	public NumericPolicy getNumericPolicy() {
		return numericPolicy;
	}

	public boolean isFoldContent() {
		return foldContent;
	}
}
