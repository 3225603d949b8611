////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.modelicafmt.formatter;

import java.util.Objects;

/**
 * Immutable formatter options.
 *
 * <ul>
 *   <li>{@code maxLineLength} - line budget used for wrapping; {@code 0}
 *       disables wrapping</li>
 *   <li>{@code emptyLines} - whether a blank line is inserted between
 *       statements</li>
 * </ul>
 */
public final class FormatterConfig {
	public static final int DEFAULT_MAX_LINE_LENGTH = 80;
	public static final boolean DEFAULT_EMPTY_LINES = true;

	private static final FormatterConfig DEFAULTS = new FormatterConfig(DEFAULT_MAX_LINE_LENGTH, DEFAULT_EMPTY_LINES);

	private final int maxLineLength;
	private final boolean emptyLines;

	public FormatterConfig(int maxLineLength, boolean emptyLines) {
		if (maxLineLength < 0) {
			throw new IllegalArgumentException("maxLineLength must be >= 0, got " + maxLineLength);
		}
		this.maxLineLength = maxLineLength;
		this.emptyLines = emptyLines;
	}

	public static FormatterConfig defaults() {
		return DEFAULTS;
	}

	public int getMaxLineLength() {
		return maxLineLength;
	}

	public boolean isEmptyLines() {
		return emptyLines;
	}

	public boolean isWrappingEnabled() {
		return maxLineLength > 0;
	}

	public FormatterConfig withMaxLineLength(int newMaxLineLength) {
		return new FormatterConfig(newMaxLineLength, emptyLines);
	}

	public FormatterConfig withEmptyLines(boolean newEmptyLines) {
		return new FormatterConfig(maxLineLength, newEmptyLines);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof FormatterConfig)) {
			return false;
		}
		FormatterConfig other = (FormatterConfig) o;
		return maxLineLength == other.maxLineLength && emptyLines == other.emptyLines;
	}

	@Override
	public int hashCode() {
		return Objects.hash(maxLineLength, emptyLines);
	}

	@Override
	public String toString() {
		return "FormatterConfig{maxLineLength=" + maxLineLength + ", emptyLines=" + emptyLines + "}";
	}
}
