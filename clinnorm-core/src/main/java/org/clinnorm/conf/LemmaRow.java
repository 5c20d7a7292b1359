package org.clinnorm.conf;

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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * One declaration of the lemma override table: a canonical lemma and the
 * surface forms that map to it. Blank variants are dropped.
 *
 * @param canonical canonical lemma (non-blank)
 * @param variants  surface forms, in declaration order
 */
public record LemmaRow(String canonical, List<String> variants) {

	public LemmaRow {
		if (canonical == null || canonical.isBlank()) {
			throw new ConfigurationException("Lemma table contains a blank canonical lemma");
		}
		variants = copyVariants(canonical, variants);
	}

	public static LemmaRow of(String canonical, String... variants) {
		return new LemmaRow(canonical, List.of(variants));
	}

	private static List<String> copyVariants(String canonical, Collection<String> variants) {
		if (variants == null) {
			throw new ConfigurationException("Lemma '" + canonical + "' has no variant list");
		}
		List<String> out = new ArrayList<>(variants.size());
		for (String v : variants) {
			if (v == null) {
				throw new ConfigurationException("Lemma '" + canonical + "' has a null variant");
			}
			if (!v.isBlank())
				out.add(v);
		}
		return Collections.unmodifiableList(out);
	}
}
