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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.modelicafmt.parser.ModelicaSourceParser;
import com.tomaszrup.modelicafmt.parser.ParsedModelica;

/**
 * Formats Modelica source text. Instances are immutable and may be shared;
 * every call runs a fresh formatting pass.
 */
public class ModelicaFormatter {
	private static final Logger logger = LoggerFactory.getLogger(ModelicaFormatter.class);

	private final FormatterConfig config;

	public ModelicaFormatter() {
		this(FormatterConfig.defaults());
	}

	public ModelicaFormatter(FormatterConfig config) {
		if (config == null) {
			throw new IllegalArgumentException("config must not be null");
		}
		this.config = config;
	}

	public FormatterConfig getConfig() {
		return config;
	}

	public String format(String source) {
		return format(source, ModelicaSourceParser.DEFAULT_SOURCE_NAME);
	}

	/**
	 * Parses and formats {@code source}.
	 *
	 * @throws com.tomaszrup.modelicafmt.parser.ModelicaSyntaxException if the
	 *         source does not parse
	 */
	public String format(String source, String sourceName) {
		ParsedModelica parsed = ModelicaSourceParser.parse(source, sourceName);
		StringBuilder out = new StringBuilder(source.length() + source.length() / 4);
		format(parsed, out);
		return out.toString();
	}

	/** Appends the formatted rendering of an already parsed file to {@code out}. */
	public void format(ParsedModelica parsed, StringBuilder out) {
		long start = System.nanoTime();
		new FormattingWalker(parsed, config, out).run();
		if (logger.isDebugEnabled()) {
			logger.debug("Formatted {} with {} ({} comments) in {}ms", parsed.getSourceName(), config,
					parsed.getComments().size(), (System.nanoTime() - start) / 1_000_000);
		}
	}
}
