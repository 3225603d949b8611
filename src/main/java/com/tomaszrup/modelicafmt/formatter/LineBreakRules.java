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

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Places where an over-long line may be broken.
 *
 * <p>Outside annotations a line may break after any token of
 * {@link #BREAK_AFTER}. Inside annotations only the candidate itself can open
 * the new line, and only when it matches one of the {@link #BREAK_BEFORE}
 * patterns (quoted strings and graphical annotation keywords).</p>
 */
final class LineBreakRules {

	static final Set<String> BREAK_AFTER = Set.of(";", "+", "=", "==", "<>");

	static final List<Pattern> BREAK_BEFORE = Stream.of(
			"\".*\"",
			"\\bcolor\\b",
			"\\bextent\\b",
			"\\bgroup\\b",
			"\\bif\\b",
			"\\bthen\\b",
			"\\belse\\b",
			"\\belseif\\b",
			"\\band\\b",
			"\\bor\\b",
			"\\bhorizontalAlignment\\b",
			"\\bLine\\b",
			"\\bPolygon\\b",
			"\\bRectangle\\b",
			"\\bEllipse\\b",
			"\\bText\\b",
			"\\bBitmap\\b",
			"\\borigin\\b",
			"\\bpoints\\b",
			"\\brotation\\b",
			"\\btransformation\\b",
			"\\bvisible\\b")
			.map(Pattern::compile)
			.collect(Collectors.toUnmodifiableList());

	private LineBreakRules() {
	}

	static boolean allowsBreakAfter(String previous) {
		return BREAK_AFTER.contains(previous);
	}

	static boolean allowsBreakBefore(String candidate) {
		for (Pattern pattern : BREAK_BEFORE) {
			if (pattern.matcher(candidate).find()) {
				return true;
			}
		}
		return false;
	}
}
