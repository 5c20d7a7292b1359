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

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.clinnorm.om.PartOfSpeech;
import org.clinnorm.om.Token;
import org.clinnorm.util.Logger;

import opennlp.tools.lemmatizer.DictionaryLemmatizer;
import opennlp.tools.lemmatizer.Lemmatizer;
import opennlp.tools.postag.POSModel;
import opennlp.tools.postag.POSTagger;
import opennlp.tools.postag.POSTaggerME;
import opennlp.tools.tokenize.SimpleTokenizer;
import opennlp.tools.tokenize.Tokenizer;
import opennlp.tools.tokenize.TokenizerME;
import opennlp.tools.tokenize.TokenizerModel;

/**
 * {@link TokenProducer} backed by OpenNLP: tokenizer, POS tagger and an
 * optional dictionary lemmatizer.
 * <p>
 * Flags are computed with {@link TokenFlags}; raw tags are mapped with
 * {@link PartOfSpeech#fromTag(String)}. Dictionary misses (OpenNLP returns
 * {@code "O"}) become empty lemmas, so the resolver falls back to the surface
 * text.
 * <p>
 * The ME tokenizer and tagger are not thread-safe: use one instance per
 * thread.
 */
public class OpenNlpTokenProducer implements TokenProducer {

	/** Lemma returned by {@link DictionaryLemmatizer} for unknown words. */
	static final String NO_LEMMA = "O";

	private final Tokenizer tokenizer;
	private final POSTagger tagger;
	private final Lemmatizer lemmatizer;

	/**
	 * @param tokenizer  required
	 * @param tagger     required
	 * @param lemmatizer optional; null leaves every lemma empty
	 */
	public OpenNlpTokenProducer(Tokenizer tokenizer, POSTagger tagger, Lemmatizer lemmatizer) {
		this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
		this.tagger = Objects.requireNonNull(tagger, "tagger");
		this.lemmatizer = lemmatizer;
	}

	/**
	 * Load models from the file system (first) or the classpath.
	 *
	 * @param tokenModel tokenizer model; blank or missing falls back to
	 *                   {@link SimpleTokenizer}
	 * @param posModel   POS model; required
	 * @param lemmaDict  lemma dictionary ({@code word\ttag\tlemma}); blank or
	 *                   missing disables lemmatization
	 * @throws IOException if the POS model is missing or a model cannot be read
	 */
	public static OpenNlpTokenProducer fromModels(String tokenModel, String posModel, String lemmaDict)
			throws IOException {
		Tokenizer tok;
		try (InputStream in = tryOpen(tokenModel)) {
			if (in == null) {
				Logger.warn("Tokenizer model not found ({}); using SimpleTokenizer", tokenModel);
				tok = SimpleTokenizer.INSTANCE;
			} else {
				tok = new TokenizerME(new TokenizerModel(in));
			}
		}

		POSTagger pos;
		try (InputStream in = tryOpen(posModel)) {
			if (in == null) {
				throw new IOException("POS model not found: " + posModel);
			}
			pos = new POSTaggerME(new POSModel(in));
		}

		Lemmatizer lem = null;
		try (InputStream in = tryOpen(lemmaDict)) {
			if (in != null) {
				lem = new DictionaryLemmatizer(in);
			} else {
				Logger.info("No lemma dictionary configured; tokenizer lemmas will be empty");
			}
		}
		return new OpenNlpTokenProducer(tok, pos, lem);
	}

	@Override
	public List<Token> tokenize(String text) {
		Objects.requireNonNull(text, "text");
		if (text.isBlank())
			return List.of();

		String[] toks = tokenizer.tokenize(text);
		if (toks.length == 0)
			return List.of();

		String[] tags = tagger.tag(toks);
		String[] lemmas = (lemmatizer == null) ? null : lemmatizer.lemmatize(toks, tags);

		List<Token> out = new ArrayList<>(toks.length);
		for (int i = 0; i < toks.length; i++) {
			String t = toks[i];
			if (t == null || t.isEmpty())
				continue;
			String tag = (tags != null && i < tags.length) ? tags[i] : null;
			String lemma = (lemmas != null && i < lemmas.length) ? lemmas[i] : null;
			if (NO_LEMMA.equals(lemma))
				lemma = "";
			out.add(new Token(t, lemma, PartOfSpeech.fromTag(tag), TokenFlags.isAlpha(t), TokenFlags.isPunctOrSpace(t),
					TokenFlags.likeNumber(t)));
		}
		return out;
	}

	// FS first, classpath next; null when blank or absent
	private static InputStream tryOpen(String path) throws IOException {
		if (path == null || path.isBlank())
			return null;
		Path p = Path.of(path.trim());
		if (Files.isReadable(p))
			return new FileInputStream(p.toFile());
		return OpenNlpTokenProducer.class.getClassLoader().getResourceAsStream(path.trim());
	}
}
