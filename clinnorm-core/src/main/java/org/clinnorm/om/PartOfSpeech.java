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

import java.util.Locale;

/**
 * Coarse part-of-speech tags (Universal Dependencies set).
 * <p>
 * Taggers that emit Penn Treebank tags (the OpenNLP English models) are
 * mapped onto the same set by {@link #fromTag(String)}.
 */
public enum PartOfSpeech {
	ADJ, ADP, ADV, AUX, CCONJ, DET, INTJ, NOUN, NUM, PART, PRON, PROPN, PUNCT, SCONJ, SYM, VERB, SPACE, X;

	/** True for VERB and AUX. */
	public boolean isVerbal() {
		return this == VERB || this == AUX;
	}

	/**
	 * Map a raw tagger tag to a coarse tag. Unknown or blank tags map to
	 * {@link #X}. UD tags are matched first, then Penn Treebank prefixes.
	 */
	public static PartOfSpeech fromTag(String tag) {
		if (tag == null || tag.isBlank())
			return X;
		String t = tag.trim().toUpperCase(Locale.ROOT);

		// UD tags, possibly with features appended (e.g. "VERB__Mood=Ind")
		int sep = indexOfFeatureSeparator(t);
		String head = (sep > 0) ? t.substring(0, sep) : t;
		for (PartOfSpeech p : values()) {
			if (p.name().equals(head))
				return p;
		}

		if (t.equals("MD"))
			return AUX;
		if (t.startsWith("VB"))
			return VERB;
		if (t.equals("NNP") || t.equals("NNPS"))
			return PROPN;
		if (t.startsWith("NN"))
			return NOUN;
		if (t.startsWith("JJ"))
			return ADJ;
		if (t.startsWith("RB") || t.equals("WRB"))
			return ADV;
		if (t.startsWith("PRP") || t.equals("WP") || t.equals("WP$") || t.equals("EX"))
			return PRON;
		if (t.equals("DT") || t.equals("PDT") || t.equals("WDT"))
			return DET;
		return switch (t) {
		case "IN" -> ADP;
		case "CC" -> CCONJ;
		case "CD" -> NUM;
		case "UH" -> INTJ;
		case "RP", "TO", "POS" -> PART;
		case "SYM", "$", "#" -> SYM;
		case ".", ",", ":", "``", "''", "-LRB-", "-RRB-", "HYPH", "NFP" -> PUNCT;
		case "_SP" -> SPACE;
		default -> X;
		};
	}

	private static int indexOfFeatureSeparator(String t) {
		for (int i = 0; i < t.length(); i++) {
			char c = t.charAt(i);
			if (c == '_' || c == '|' || c == ' ')
				return i;
		}
		return -1;
	}
}
