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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.clinnorm.nlp.AccentFolder;
import org.clinnorm.util.Logger;

/**
 * Immutable lexicon used by the normalizer: stopwords, lemma overrides and
 * negation terms, with the lookup structures derived once at construction.
 *
 * <h3>Derived structures</h3>
 * <ul>
 * <li><b>stopwords</b>: base vocabulary plus extras, lowercased and
 * accent-folded. The negation particle {@value #NEGATION_PARTICLE} is always
 * removed, whatever the source lists contain.</li>
 * <li><b>lemma overrides</b>: lowercase surface form to lowercase canonical
 * lemma, built by inverting the canonical-to-variants rows one row at a time.
 * A surface form declared under two canonical lemmas keeps the one from the
 * <i>last</i> row that declares it, even when a canonical lemma appears in
 * more than one row. Each such collision is logged at WARN.</li>
 * <li><b>negation terms</b>: lowercased and accent-folded.</li>
 * </ul>
 *
 * Instances are safe to share between threads.
 */
public final class NormalizerConfig {

	/** Negation of existence; never treated as a stopword. */
	public static final String NEGATION_PARTICLE = "no";

	private final Set<String> stopwords;
	private final Map<String, String> lemmaOverrides;
	private final Set<String> negationKeep;

	private NormalizerConfig(Set<String> stopwords, Map<String, String> lemmaOverrides, Set<String> negationKeep) {
		this.stopwords = Collections.unmodifiableSet(stopwords);
		this.lemmaOverrides = Collections.unmodifiableMap(lemmaOverrides);
		this.negationKeep = Collections.unmodifiableSet(negationKeep);
	}

	/**
	 * Build from a single stopword collection.
	 *
	 * @throws ConfigurationException if any collection is null or malformed
	 */
	public static NormalizerConfig of(Collection<String> stopwords, Map<String, ? extends Collection<String>> lemmas,
			Collection<String> negation) {
		return of(stopwords, List.of(), lemmas, negation);
	}

	/**
	 * Build from the base stopword vocabulary, user extras, the
	 * canonical-to-variants lemma table and the negation terms.
	 *
	 * @throws ConfigurationException if any collection is null or malformed
	 */
	public static NormalizerConfig of(Collection<String> baseStopwords, Collection<String> extraStopwords,
			Map<String, ? extends Collection<String>> lemmas, Collection<String> negation) {
		requirePresent("lemmas", lemmas);
		List<LemmaRow> rows = new ArrayList<>(lemmas.size());
		for (Map.Entry<String, ? extends Collection<String>> e : lemmas.entrySet()) {
			Collection<String> variants = e.getValue();
			if (variants == null) {
				throw new ConfigurationException("Lemma '" + e.getKey() + "' has no variant list");
			}
			rows.add(new LemmaRow(e.getKey(), new ArrayList<>(variants)));
		}
		return fromRows(baseStopwords, extraStopwords, rows, negation);
	}

	/**
	 * Build from the lemma table as declared, row by row. A canonical lemma may
	 * appear in several rows; later rows override earlier ones per surface form.
	 *
	 * @throws ConfigurationException if any collection is null or malformed
	 */
	public static NormalizerConfig fromRows(Collection<String> baseStopwords, Collection<String> extraStopwords,
			List<LemmaRow> lemmaRows, Collection<String> negation) {
		requirePresent("stopwords", baseStopwords);
		requirePresent("extra stopwords", extraStopwords);
		requirePresent("lemmas", lemmaRows);
		requirePresent("negation", negation);

		Set<String> stop = new HashSet<>();
		addFolded(stop, baseStopwords, "stopwords");
		addFolded(stop, extraStopwords, "extra stopwords");
		stop.remove(NEGATION_PARTICLE);

		Set<String> neg = new HashSet<>();
		addFolded(neg, negation, "negation");

		Map<String, String> overrides = invertLemmaRows(lemmaRows);

		Logger.debug("NormalizerConfig: {} stopwords, {} overrides, {} negation terms", stop.size(), overrides.size(),
				neg.size());
		return new NormalizerConfig(stop, overrides, neg);
	}

	// -------------------------- Lookups ---------------------------------------

	/** Folded, lowercase stopwords. */
	public Set<String> stopwords() {
		return stopwords;
	}

	/** Lowercase surface form to canonical lemma. */
	public Map<String, String> lemmaOverrides() {
		return lemmaOverrides;
	}

	/** Folded, lowercase negation terms. */
	public Set<String> negationKeep() {
		return negationKeep;
	}

	/** @param folded lowercase, accent-folded form */
	public boolean isStopword(String folded) {
		return folded != null && stopwords.contains(folded);
	}

	/** @param folded lowercase, accent-folded form */
	public boolean isNegation(String folded) {
		return folded != null && negationKeep.contains(folded);
	}

	/** Canonical lemma for a lowercase surface form, or null. */
	public String overrideFor(String lowerSurface) {
		return (lowerSurface == null) ? null : lemmaOverrides.get(lowerSurface);
	}

	// -------------------------- Internals -------------------------------------

	private static void requirePresent(String name, Object collection) {
		if (collection == null) {
			throw new ConfigurationException("Missing required collection: " + name);
		}
	}

	private static void addFolded(Set<String> target, Collection<String> source, String name) {
		for (String w : source) {
			if (w == null) {
				throw new ConfigurationException("Null entry in " + name);
			}
			String t = w.trim();
			if (!t.isEmpty()) {
				target.add(AccentFolder.fold(t.toLowerCase(Locale.ROOT)));
			}
		}
	}

	private static Map<String, String> invertLemmaRows(List<LemmaRow> rows) {
		Map<String, String> out = new LinkedHashMap<>();
		for (LemmaRow row : rows) {
			if (row == null) {
				throw new ConfigurationException("Lemma table contains a null row");
			}
			String lemma = row.canonical().trim().toLowerCase(Locale.ROOT);
			for (String v : row.variants()) {
				String surface = v.trim().toLowerCase(Locale.ROOT);
				String prior = out.put(surface, lemma);
				if (prior != null && !prior.equals(lemma)) {
					Logger.warn("Lemma override collision for '{}': '{}' replaced by '{}' (last declaration wins)",
							surface, prior, lemma);
				}
			}
		}
		return out;
	}
}
