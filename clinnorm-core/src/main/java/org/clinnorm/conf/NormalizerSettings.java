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

import java.time.Duration;

import lombok.Data;

/**
 * Run-time options for the normalization pipeline and the tokenizer boundary.
 * Values are copied by the pipeline at construction, so changing a settings
 * object afterwards does not affect pipelines already built from it.
 */
@Data
public class NormalizerSettings {

	public static final String DEFAULT_PLACEHOLDER = "<num>";

	/** Output policy for NUMERIC tokens. */
	private NumericPolicy numericPolicy = NumericPolicy.PRESERVE_ORIGINAL;

	/** Marker used under {@link NumericPolicy#MARK_AS_PLACEHOLDER}. */
	private String numericPlaceholder = DEFAULT_PLACEHOLDER;

	/** Strip diacritics from CONTENT output (comparison is always folded). */
	private boolean foldContent = false;

	/** Worker threads for batch normalization; 1 means sequential. */
	private int parallelism = 1;

	/** Per-text tokenizer timeout; zero or negative means unbounded. */
	private Duration tokenizeTimeout = Duration.ZERO;

	public static NormalizerSettings defaults() {
		return new NormalizerSettings();
	}
}
