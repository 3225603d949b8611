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
package com.tomaszrup.lsp.utils;

import org.eclipse.lsp4j.Position;

/**
 * Conversions between LSP positions (zero-based line and character) and
 * string offsets. Lines are separated by {@code \n}; a {@code \r} before it
 * belongs to the line it ends.
 */
public class Positions {
	private Positions() {
	}

	public static boolean valid(Position p) {
		return p.getLine() >= 0 && p.getCharacter() >= 0;
	}

	/**
	 * @return the offset of {@code position} in {@code string}, or -1 if the
	 *         line does not exist or the character lies past the line end
	 */
	public static int getOffset(String string, Position position) {
		if (string == null || position == null || !valid(position)) {
			return -1;
		}
		int lineStart = 0;
		for (int line = 0; line < position.getLine(); line++) {
			int newline = string.indexOf('\n', lineStart);
			if (newline < 0) {
				return -1;
			}
			lineStart = newline + 1;
		}
		int lineEnd = string.indexOf('\n', lineStart);
		if (lineEnd < 0) {
			lineEnd = string.length();
		} else if (lineEnd > lineStart && string.charAt(lineEnd - 1) == '\r') {
			lineEnd--;
		}
		if (position.getCharacter() > lineEnd - lineStart) {
			return -1;
		}
		return lineStart + position.getCharacter();
	}

	/** Inverse of {@link #getOffset}; offsets outside the string are clamped. */
	public static Position positionAt(String string, int offset) {
		int clamped = Math.max(0, Math.min(offset, string.length()));
		int line = 0;
		int lineStart = 0;
		for (int i = 0; i < clamped; i++) {
			if (string.charAt(i) == '\n') {
				line++;
				lineStart = i + 1;
			}
		}
		return new Position(line, clamped - lineStart);
	}
}
