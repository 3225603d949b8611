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

import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.atn.PredictionMode;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lexes and parses a complete Modelica source text.
 *
 * <p>Parsing runs in two stages: a fast SLL pass that bails out on the first
 * problem, and a full LL pass that is only attempted when the SLL pass
 * failed. Any error reported by the lexer or by the LL pass aborts with a
 * {@link ModelicaSyntaxException}.</p>
 */
public final class ModelicaSourceParser {
	private static final Logger logger = LoggerFactory.getLogger(ModelicaSourceParser.class);

	public static final String DEFAULT_SOURCE_NAME = "<input>";

	private ModelicaSourceParser() {
	}

	public static ParsedModelica parse(String source) {
		return parse(source, DEFAULT_SOURCE_NAME);
	}

	public static ParsedModelica parse(String source, String sourceName) {
		SyntaxErrorListener errorListener = new SyntaxErrorListener(sourceName);

		ModelicaLexer lexer = new ModelicaLexer(CharStreams.fromString(source, sourceName));
		lexer.removeErrorListeners();
		lexer.addErrorListener(errorListener);

		CommentCollector commentCollector = new CommentCollector(lexer);
		CommonTokenStream tokens = new CommonTokenStream(commentCollector);
		// lex everything up front so the comment queue is complete before any tree walk
		tokens.fill();

		ModelicaParser parser = new ModelicaParser(tokens);
		parser.removeErrorListeners();
		parser.getInterpreter().setPredictionMode(PredictionMode.SLL);
		parser.setErrorHandler(new BailErrorStrategy());

		ModelicaParser.Stored_definitionContext tree;
		try {
			tree = parser.stored_definition();
		} catch (ParseCancellationException e) {
			logger.debug("SLL parse of {} failed, retrying with full LL prediction", sourceName);
			tokens.seek(0);
			parser.reset();
			parser.addErrorListener(errorListener);
			parser.setErrorHandler(new DefaultErrorStrategy());
			parser.getInterpreter().setPredictionMode(PredictionMode.LL);
			tree = parser.stored_definition();
		}

		return new ParsedModelica(sourceName, tree, tokens, commentCollector.getComments());
	}

	private static final class SyntaxErrorListener extends BaseErrorListener {
		private final String sourceName;

		SyntaxErrorListener(String sourceName) {
			this.sourceName = sourceName;
		}

		@Override
		public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
				int charPositionInLine, String msg, RecognitionException e) {
			throw new ModelicaSyntaxException(sourceName, line, charPositionInLine, msg, e);
		}
	}
}
