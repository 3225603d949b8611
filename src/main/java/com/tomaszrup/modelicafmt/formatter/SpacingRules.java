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

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Token-pair spacing tables. Outside annotations a space is dropped when the
 * previous token is in {@link #NO_SPACE_AFTER} or the current one is in
 * {@link #NO_SPACE_BEFORE}; inside annotations the stricter
 * {@link #NO_SPACE_AROUND_IN_ANNOTATION} applies to both tokens.
 */
final class SpacingRules {

	static final Set<String> NO_SPACE_AFTER = Set.of(
			"(", "=", ".", "[", "{", ";",
			":" // array range constructor
	);

	static final Set<String> NO_SPACE_BEFORE = Set.of(
			"(", ")", "[", "]", "}", ";", "=", ",", ".",
			":" // array range constructor
	);

	static final Set<String> NO_SPACE_AROUND_IN_ANNOTATION = Set.of(
			"(", ")", "[", "]", "{", "}", ";", "=", "==", "<>", ",", ".",
			"-", "+", "^", "*", "/", ":");

	/** Keywords after which an opening parenthesis keeps its leading space. */
	private static final Pattern SPACED_PAREN_KEYWORDS = Pattern.compile(
			"\\bannotation\\b|\\bif\\b|\\bthen\\b|\\band\\b|\\bor\\b|\\belse\\b|\\belseif\\b");

	private SpacingRules() {
	}

	static boolean insertSpaceBefore(String current, String previous, boolean inAnnotation) {
		if ("(".equals(current) && SPACED_PAREN_KEYWORDS.matcher(previous).find()) {
			return true;
		}
		if (inAnnotation) {
			return !NO_SPACE_AROUND_IN_ANNOTATION.contains(previous)
					&& !NO_SPACE_AROUND_IN_ANNOTATION.contains(current);
		}
		return !NO_SPACE_AFTER.contains(previous) && !NO_SPACE_BEFORE.contains(current);
	}
}
