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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class LineBreakRulesTests {

	@Test
	void testBreakAfterStatementAndOperators() {
		for (String token : new String[] {";", "+", "=", "==", "<>"}) {
			Assertions.assertTrue(LineBreakRules.allowsBreakAfter(token), token);
		}
	}

	@Test
	void testNoBreakAfterOtherTokens() {
		for (String token : new String[] {"-", "*", ",", "(", "x", "and"}) {
			Assertions.assertFalse(LineBreakRules.allowsBreakAfter(token), token);
		}
	}

	@Test
	void testBreakBeforeQuotedString() {
		Assertions.assertTrue(LineBreakRules.allowsBreakBefore("\"some text\""));
		Assertions.assertTrue(LineBreakRules.allowsBreakBefore("\"\""));
	}

	@Test
	void testBreakBeforeGraphicalKeywords() {
		for (String token : new String[] {"color", "extent", "Line", "Rectangle", "Text", "points", "origin",
				"rotation", "transformation", "visible", "elseif"}) {
			Assertions.assertTrue(LineBreakRules.allowsBreakBefore(token), token);
		}
	}

	@Test
	void testKeywordsMustMatchAsWholeWords() {
		Assertions.assertFalse(LineBreakRules.allowsBreakBefore("lineColor"));
		Assertions.assertFalse(LineBreakRules.allowsBreakBefore("Textual"));
		Assertions.assertFalse(LineBreakRules.allowsBreakBefore("iconTransformation"));
		Assertions.assertFalse(LineBreakRules.allowsBreakBefore("x"));
	}
}
