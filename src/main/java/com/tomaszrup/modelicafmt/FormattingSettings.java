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

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.tomaszrup.modelicafmt.formatter.FormatterConfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Formatting settings of the language server, updated from the
 * {@code modelica.formatting} section of the initialization options and of
 * {@code workspace/didChangeConfiguration}.
 *
 * <pre>{@code
 * { "modelica": { "formatting": { "enabled": true, "maxLineLength": 80, "emptyLines": true } } }
 * }</pre>
 */
public final class FormattingSettings {
	private static final Logger logger = LoggerFactory.getLogger(FormattingSettings.class);

	static final String KEY_MODELICA = "modelica";
	static final String KEY_FORMATTING = "formatting";
	static final String KEY_ENABLED = "enabled";
	static final String KEY_MAX_LINE_LENGTH = "maxLineLength";
	static final String KEY_EMPTY_LINES = "emptyLines";

	private volatile boolean enabled = true;
	private volatile FormatterConfig config = FormatterConfig.defaults();

	public boolean isEnabled() {
		return enabled;
	}

	public FormatterConfig getConfig() {
		return config;
	}

	/**
	 * Applies the {@code modelica.formatting} section of {@code settings}, if
	 * present. Keys that are missing or of the wrong type keep their current
	 * value.
	 */
	public void update(JsonObject settings) {
		if (settings == null || !settings.has(KEY_MODELICA) || !settings.get(KEY_MODELICA).isJsonObject()) {
			return;
		}
		JsonObject modelica = settings.getAsJsonObject(KEY_MODELICA);
		if (!modelica.has(KEY_FORMATTING) || !modelica.get(KEY_FORMATTING).isJsonObject()) {
			return;
		}
		JsonObject fmt = modelica.getAsJsonObject(KEY_FORMATTING);

		if (isPrimitive(fmt, KEY_ENABLED)) {
			enabled = fmt.get(KEY_ENABLED).getAsBoolean();
		}
		FormatterConfig updated = config;
		if (isPrimitive(fmt, KEY_MAX_LINE_LENGTH)) {
			try {
				updated = updated.withMaxLineLength(fmt.get(KEY_MAX_LINE_LENGTH).getAsInt());
			} catch (IllegalArgumentException e) {
				logger.warn("Ignoring invalid {}: {}", KEY_MAX_LINE_LENGTH, fmt.get(KEY_MAX_LINE_LENGTH));
			}
		}
		if (isPrimitive(fmt, KEY_EMPTY_LINES)) {
			updated = updated.withEmptyLines(fmt.get(KEY_EMPTY_LINES).getAsBoolean());
		}
		if (!updated.equals(config)) {
			logger.info("Formatter settings changed to {}", updated);
		}
		config = updated;
	}

	private static boolean isPrimitive(JsonObject object, String key) {
		JsonElement element = object.get(key);
		return element != null && element.isJsonPrimitive();
	}
}
