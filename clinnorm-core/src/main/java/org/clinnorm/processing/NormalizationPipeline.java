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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.clinnorm.conf.NormalizerConfig;
import org.clinnorm.conf.NormalizerSettings;
import org.clinnorm.nlp.TokenClassifier;
import org.clinnorm.om.Classification;
import org.clinnorm.om.NormalizedDocument;
import org.clinnorm.om.Token;
import org.clinnorm.util.Logger;

/**
 * Turns token sequences into normalized documents.
 * <p>
 * Each token is classified by {@link TokenClassifier}; only NUMERIC, NEGATION
 * and CONTENT tokens with non-empty output are kept, in input order.
 * <p>
 * The pipeline holds nothing mutable: the lexicon is immutable and the
 * options are copied at construction. {@link #normalize(List)} may be called
 * from many threads at once. {@link #normalizeBatch(List)} fans documents out
 * over a bounded worker pool and gathers results by index, so
 * {@code result.get(i)} always belongs to {@code batch.get(i)}.
 */
public class NormalizationPipeline {

	private static final AtomicInteger POOL_SEQ = new AtomicInteger();

	private final NormalizerConfig config;
	private final TokenClassifier classifier;
	private final int parallelism;

	public NormalizationPipeline(NormalizerConfig config) {
		this(config, NormalizerSettings.defaults());
	}

	/**
	 * @throws NullPointerException     if config or settings is null
	 * @throws IllegalArgumentException if the placeholder policy has no marker
	 */
	public NormalizationPipeline(NormalizerConfig config, NormalizerSettings settings) {
		this.config = Objects.requireNonNull(config, "config");
		Objects.requireNonNull(settings, "settings");
		this.classifier = TokenClassifier.from(settings);
		this.parallelism = Math.max(1, settings.getParallelism());
	}

	/** Empty sequence gives an empty document. */
	public NormalizedDocument normalize(List<Token> tokens) {
		Objects.requireNonNull(tokens, "tokens");
		if (tokens.isEmpty())
			return NormalizedDocument.empty();

		List<String> kept = new ArrayList<>(tokens.size());
		for (Token t : tokens) {
			Classification c = classifier.classify(t, config);
			if (Logger.isEnabled(Logger.Level.TRACE)) {
				Logger.trace("{} -> {} '{}'", t.text(), c.disposition(), c.output());
			}
			if (c.isKept())
				kept.add(c.output());
		}
		return new NormalizedDocument(kept);
	}

	/**
	 * Normalize every sequence; output order matches input order. Empty batch
	 * gives an empty list.
	 */
	public List<NormalizedDocument> normalizeBatch(List<? extends List<Token>> batch) {
		Objects.requireNonNull(batch, "batch");
		if (batch.isEmpty())
			return List.of();

		int workers = Math.min(parallelism, batch.size());
		if (workers <= 1) {
			List<NormalizedDocument> out = new ArrayList<>(batch.size());
			for (List<Token> doc : batch)
				out.add(normalize(doc));
			return out;
		}

		long startMs = System.currentTimeMillis();
		int poolId = POOL_SEQ.incrementAndGet();
		AtomicInteger threadSeq = new AtomicInteger();
		ExecutorService exec = Executors.newFixedThreadPool(workers, r -> {
			Thread t = new Thread(r, "clinnorm-" + poolId + "-worker-" + threadSeq.incrementAndGet());
			t.setDaemon(true);
			return t;
		});

		try {
			// scatter: one task per document, futures kept in input order
			List<Future<NormalizedDocument>> futures = new ArrayList<>(batch.size());
			for (List<Token> doc : batch) {
				futures.add(exec.submit(() -> normalize(doc)));
			}

			// gather by index
			NormalizedDocument[] results = new NormalizedDocument[batch.size()];
			for (int i = 0; i < futures.size(); i++) {
				results[i] = await(futures.get(i), i);
			}
			Logger.debug("Normalized {} documents with {} workers in {} ms", batch.size(), workers,
					System.currentTimeMillis() - startMs);
			return List.of(results);
		} finally {
			exec.shutdownNow();
		}
	}

	private static NormalizedDocument await(Future<NormalizedDocument> f, int index) {
		try {
			return f.get();
		} catch (InterruptedException ie) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted while normalizing document " + index, ie);
		} catch (ExecutionException ee) {
			Throwable cause = ee.getCause();
			if (cause instanceof RuntimeException re)
				throw re;
			if (cause instanceof Error err)
				throw err;
			throw new IllegalStateException("Normalization failed for document " + index, cause);
		}
	}

	public NormalizerConfig getConfig() {
		return config;
	}

	public int getParallelism() {
		return parallelism;
	}
}
