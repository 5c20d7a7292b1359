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

import java.util.Locale;

/**
 * What a NUMERIC token contributes to the normalized output.
 */
public enum NumericPolicy {
	/** Keep the original surface text (e.g. {@code 96.5%}). */
	PRESERVE_ORIGINAL,
	/** Replace every quantity with a single placeholder marker (e.g. {@code <num>}). */
	MARK_AS_PLACEHOLDER;

	/**
	 * Parse a configuration value. Case-insensitive; hyphens and spaces are
	 * accepted in place of underscores.
	 *
	 * @throws ConfigurationException for blank or unknown values
	 */
	public static NumericPolicy parse(String raw) {
		if (raw == null || raw.isBlank()) {
			throw new ConfigurationException("Numeric policy is blank");
		}
		String key = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
		for (NumericPolicy p : values()) {
			if (p.name().equals(key))
				return p;
		}
		throw new ConfigurationException("Unknown numeric policy: '" + raw + "'. Expected one of PRESERVE_ORIGINAL, MARK_AS_PLACEHOLDER");
	}
}
