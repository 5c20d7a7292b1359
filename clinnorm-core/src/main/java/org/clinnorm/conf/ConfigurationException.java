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

/**
 * Raised when the normalizer lexicon or settings cannot be built: a missing
 * or unreadable lexicon file, a missing collection, a malformed lemma table,
 * or an invalid setting value.
 * <p>
 * Always thrown at construction time; a pipeline never exists in a partially
 * configured state.
 */
public class ConfigurationException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	public ConfigurationException(String message) {
		super(message);
	}

	public ConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
