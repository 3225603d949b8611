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
package com.tomaszrup.modelicafmt;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.tomaszrup.modelicafmt.formatter.FormatterConfig;

class FormattingSettingsTests {
	private FormattingSettings settings;

	@BeforeEach
	void setup() {
		settings = new FormattingSettings();
	}

	private static JsonObject json(String text) {
		return JsonParser.parseString(text).getAsJsonObject();
	}

	@Test
	void testDefaults() {
		Assertions.assertTrue(settings.isEnabled());
		Assertions.assertEquals(FormatterConfig.defaults(), settings.getConfig());
	}

	@Test
	void testUpdateAllKeys() {
		settings.update(json(
				"{\"modelica\":{\"formatting\":{\"enabled\":false,\"maxLineLength\":120,\"emptyLines\":false}}}"));
		Assertions.assertFalse(settings.isEnabled());
		Assertions.assertEquals(new FormatterConfig(120, false), settings.getConfig());
	}

	@Test
	void testMissingKeysKeepCurrentValues() {
		settings.update(json("{\"modelica\":{\"formatting\":{\"maxLineLength\":100}}}"));
		settings.update(json("{\"modelica\":{\"formatting\":{\"emptyLines\":false}}}"));
		Assertions.assertTrue(settings.isEnabled());
		Assertions.assertEquals(new FormatterConfig(100, false), settings.getConfig());
	}

	@Test
	void testZeroLineLengthDisablesWrapping() {
		settings.update(json("{\"modelica\":{\"formatting\":{\"maxLineLength\":0}}}"));
		Assertions.assertFalse(settings.getConfig().isWrappingEnabled());
	}

	@Test
	void testInvalidLineLengthIsIgnored() {
		settings.update(json("{\"modelica\":{\"formatting\":{\"maxLineLength\":-3}}}"));
		Assertions.assertEquals(FormatterConfig.DEFAULT_MAX_LINE_LENGTH, settings.getConfig().getMaxLineLength());
		settings.update(json("{\"modelica\":{\"formatting\":{\"maxLineLength\":\"wide\"}}}"));
		Assertions.assertEquals(FormatterConfig.DEFAULT_MAX_LINE_LENGTH, settings.getConfig().getMaxLineLength());
	}

	@Test
	void testNonPrimitiveValuesAreIgnored() {
		settings.update(json("{\"modelica\":{\"formatting\":{\"enabled\":{},\"maxLineLength\":[1]}}}"));
		Assertions.assertTrue(settings.isEnabled());
		Assertions.assertEquals(FormatterConfig.defaults(), settings.getConfig());
	}

	@Test
	void testUnrelatedSectionsAreIgnored() {
		settings.update(null);
		settings.update(json("{}"));
		settings.update(json("{\"modelica\":true}"));
		settings.update(json("{\"modelica\":{\"formatting\":\"off\"}}"));
		settings.update(json("{\"editor\":{\"formatting\":{\"enabled\":false}}}"));
		Assertions.assertTrue(settings.isEnabled());
		Assertions.assertEquals(FormatterConfig.defaults(), settings.getConfig());
	}
}
