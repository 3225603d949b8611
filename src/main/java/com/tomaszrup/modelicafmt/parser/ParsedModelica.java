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
package com.tomaszrup.modelicafmt.parser;

import java.util.ArrayList;
import java.util.List;

import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;

/**
 * Result of parsing one Modelica source: the syntax tree, the fully
 * materialized token stream, and the comment tokens in source order.
 */
public final class ParsedModelica {
	private final String sourceName;
	private final ModelicaParser.Stored_definitionContext tree;
	private final CommonTokenStream tokens;
	private final List<Token> comments;

	ParsedModelica(String sourceName, ModelicaParser.Stored_definitionContext tree,
			CommonTokenStream tokens, List<Token> comments) {
		this.sourceName = sourceName;
		this.tree = tree;
		this.tokens = tokens;
		this.comments = comments;
	}

	public String getSourceName() {
		return sourceName;
	}

	public ModelicaParser.Stored_definitionContext getTree() {
		return tree;
	}

	public CommonTokenStream getTokens() {
		return tokens;
	}

	public List<Token> getComments() {
		return comments;
	}

	/**
	 * Texts of the default-channel tokens, excluding EOF. Two sources with the
	 * same significant content produce the same list regardless of layout.
	 */
	public List<String> significantTokenTexts() {
		List<String> texts = new ArrayList<>();
		for (Token token : tokens.getTokens()) {
			if (token.getType() != Token.EOF && token.getChannel() == Token.DEFAULT_CHANNEL) {
				texts.add(token.getText());
			}
		}
		return texts;
	}
}
