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

import java.util.Objects;

/**
 * Disposition of a token plus the text it contributes to the normalized
 * document ({@code ""} for dispositions that drop the token).
 */
public record Classification(Disposition disposition, String output) {

	private static final Classification SKIPPED = new Classification(Disposition.SKIP, "");
	private static final Classification STOPPED = new Classification(Disposition.STOPWORD, "");

	public Classification {
		Objects.requireNonNull(disposition, "disposition");
		output = (output == null || !disposition.keepsOutput()) ? "" : output;
	}

	public static Classification skip() {
		return SKIPPED;
	}

	public static Classification stopword() {
		return STOPPED;
	}

	public boolean isKept() {
		return disposition.keepsOutput() && !output.isEmpty();
	}
}
