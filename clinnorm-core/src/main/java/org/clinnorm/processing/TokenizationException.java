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

/**
 * The external tokenizer failed, timed out or was interrupted.
 */
public class TokenizationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final int textIndex;

	public TokenizationException(String message, int textIndex, Throwable cause) {
		super(message, cause);
		this.textIndex = textIndex;
	}

	/** Position of the failing text in its batch (0 for single texts). */
	public int getTextIndex() {
		return textIndex;
	}
}
