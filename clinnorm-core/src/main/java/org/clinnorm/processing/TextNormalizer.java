package org.clinnorm.processing;

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

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.clinnorm.conf.NormalizerSettings;
import org.clinnorm.nlp.TokenProducer;
import org.clinnorm.om.NormalizedDocument;
import org.clinnorm.om.Token;
import org.clinnorm.util.Logger;

/**
 * Raw text in, normalized string out: the injected {@link TokenProducer}
 * tokenizes, the {@link NormalizationPipeline} filters and rewrites.
 * <p>
 * Tokenization is the only call that can be slow, so it is the only one that
 * is time-bounded. Texts are tokenized one after another on a single
 * dedicated thread (tokenizers are typically not thread-safe); the resulting
 * token sequences are then normalized as one batch.
 * <p>
 * A timed-out tokenizer call is cancelled and its thread abandoned: the
 * next text runs on a fresh tokenizer thread, so a tokenizer that ignores
 * interruption cannot stall the texts after it.
 * <p>
 * Call {@link #close()} to release the tokenizer thread.
 */
public class TextNormalizer implements AutoCloseable {

	private final TokenProducer producer;
	private final NormalizationPipeline pipeline;
	private final Duration timeout;
	private ExecutorService tokenizerThread;

	public TextNormalizer(TokenProducer producer, NormalizationPipeline pipeline) {
		this(producer, pipeline, Duration.ZERO);
	}

	public TextNormalizer(TokenProducer producer, NormalizationPipeline pipeline, NormalizerSettings settings) {
		this(producer, pipeline, settings.getTokenizeTimeout());
	}

	/**
	 * @param timeout per-text tokenizer timeout; null, zero or negative means
	 *                unbounded (the tokenizer is then called on the caller's
	 *                thread)
	 */
	public TextNormalizer(TokenProducer producer, NormalizationPipeline pipeline, Duration timeout) {
		this.producer = Objects.requireNonNull(producer, "producer");
		this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
		this.timeout = (timeout == null || timeout.isNegative() || timeout.isZero()) ? null : timeout;
		this.tokenizerThread = (this.timeout == null) ? null : newTokenizerThread();
	}

	/** Normalize one text; empty text gives {@code ""}. */
	public String normalize(String text) {
		Objects.requireNonNull(text, "text");
		return pipeline.normalize(tokenize(text, 0)).text();
	}

	/** Normalize texts in order; empty list gives an empty list. */
	public List<String> normalizeAll(List<String> texts) {
		Objects.requireNonNull(texts, "texts");
		if (texts.isEmpty())
			return List.of();

		long startMs = System.currentTimeMillis();
		List<List<Token>> sequences = new ArrayList<>(texts.size());
		for (int i = 0; i < texts.size(); i++) {
			String text = Objects.requireNonNull(texts.get(i), "text at index " + i);
			sequences.add(tokenize(text, i));
		}
		long tokenizedMs = System.currentTimeMillis();

		List<NormalizedDocument> docs = pipeline.normalizeBatch(sequences);
		List<String> out = new ArrayList<>(docs.size());
		for (NormalizedDocument d : docs)
			out.add(d.text());

		Logger.debug("Normalized {} texts (tokenize {} ms, normalize {} ms)", texts.size(), tokenizedMs - startMs,
				System.currentTimeMillis() - tokenizedMs);
		return out;
	}

	private List<Token> tokenize(String text, int index) {
		if (text.isEmpty())
			return List.of();
		if (timeout == null)
			return callProducer(text, index);

		Future<List<Token>> f = tokenizerThread.submit(() -> producer.tokenize(text));
		try {
			return nonNull(f.get(timeout.toMillis(), TimeUnit.MILLISECONDS), index);
		} catch (TimeoutException te) {
			f.cancel(true);
			replaceTokenizerThread();
			throw new TokenizationException("Tokenizer timed out after " + timeout.toMillis() + " ms on text " + index,
					index, te);
		} catch (InterruptedException ie) {
			f.cancel(true);
			Thread.currentThread().interrupt();
			throw new TokenizationException("Interrupted while tokenizing text " + index, index, ie);
		} catch (ExecutionException ee) {
			throw new TokenizationException("Tokenizer failed on text " + index + ": " + ee.getCause(), index,
					ee.getCause());
		}
	}

	private void replaceTokenizerThread() {
		tokenizerThread.shutdownNow();
		tokenizerThread = newTokenizerThread();
		Logger.warn("Tokenizer thread replaced after timeout");
	}

	private static ExecutorService newTokenizerThread() {
		return Executors.newSingleThreadExecutor(r -> {
			Thread t = new Thread(r, "clinnorm-tokenizer");
			t.setDaemon(true);
			return t;
		});
	}

	private List<Token> callProducer(String text, int index) {
		List<Token> tokens;
		try {
			tokens = producer.tokenize(text);
		} catch (RuntimeException ex) {
			throw new TokenizationException("Tokenizer failed on text " + index + ": " + ex, index, ex);
		}
		return nonNull(tokens, index);
	}

	private static List<Token> nonNull(List<Token> tokens, int index) {
		if (tokens == null) {
			throw new TokenizationException("Tokenizer returned null for text " + index, index, null);
		}
		return tokens;
	}

	@Override
	public void close() {
		if (tokenizerThread != null)
			tokenizerThread.shutdownNow();
	}
}
