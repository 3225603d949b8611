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

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import com.tomaszrup.modelicafmt.parser.ParsedModelica;

/**
 * Depth-first walk over one parsed file. Entering a rule decides whether it
 * opens an indented line and which context it sets up; both are undone when
 * the rule is left, whichever way the walk leaves it.
 *
 * <p>Annotation arguments are the exception: their indent decision depends on
 * the previous token, so it is taken again on exit. An argument written right
 * after {@code (} therefore releases an indent it never requested, and the
 * arguments following it end up one level shallower.</p>
 */
final class FormattingWalker {
	private final ParsedModelica parsed;
	private final FormatterConfig config;
	private final FormattingContext context = new FormattingContext();
	private final LayoutWriter writer;
	private final CommentInterleaver comments;
	private final Token finalSemicolon;

	FormattingWalker(ParsedModelica parsed, FormatterConfig config, StringBuilder out) {
		this.parsed = parsed;
		this.config = config;
		this.writer = new LayoutWriter(out, config, context);
		this.comments = new CommentInterleaver(parsed.getComments(), writer);
		List<TerminalNode> semicolons = parsed.getTree().SEMICOLON();
		this.finalSemicolon = semicolons.isEmpty() ? null : semicolons.get(semicolons.size() - 1).getSymbol();
	}

	void run() {
		walk(parsed.getTree());
		comments.flushRemaining();
		writer.finish();
	}

	private void walk(ParseTree node) {
		if (node instanceof TerminalNode) {
			visitTerminal((TerminalNode) node);
			return;
		}
		ParserRuleContext rule = (ParserRuleContext) node;
		NodeKind kind = NodeKind.of(rule);
		if (LayoutRules.startsSection(kind)) {
			writer.newlineIfNeeded();
		}
		try (FormattingContext.Scope indent = enterLayout(rule, kind);
				FormattingContext.Scope scope = context.enter(rule, kind)) {
			for (int i = 0; i < rule.getChildCount(); i++) {
				walk(rule.getChild(i));
			}
		}
	}

	private FormattingContext.Scope enterLayout(ParserRuleContext rule, NodeKind kind) {
		boolean indented = LayoutRules.needsOwnLineAndIndent(rule, kind, context, writer.getPreviousTokenText());
		if (indented) {
			writer.newlineIfNeeded();
			writer.requestIndent();
		}
		if (LayoutRules.decidedAgainOnExit(kind)) {
			return () -> {
				if (LayoutRules.needsOwnLineAndIndent(rule, kind, context, writer.getPreviousTokenText())) {
					writer.dedent();
				}
			};
		}
		return indented ? writer::releaseIndent : FormattingContext.NO_CHANGE;
	}

	private void visitTerminal(TerminalNode terminal) {
		Token symbol = terminal.getSymbol();
		if (symbol.getType() == Token.EOF) {
			return;
		}
		if (LayoutRules.startsOwnLine(terminal)) {
			writer.newlineIfNeeded();
		}
		comments.flushBefore(symbol.getTokenIndex());

		String text = symbol.getText();
		TokenRole role = TokenRole.of(terminal);
		writer.write(text, role);
		writer.afterTokenWritten();

		if (";".equals(text)) {
			writer.newline();
			if (insertBlankLine(symbol)) {
				writer.newline();
			} else {
				writer.clearWithinOnCurrentLine();
			}
		}

		writer.recordToken(text, symbol.getTokenIndex(), role);
	}

	private boolean insertBlankLine(Token semicolon) {
		if (!config.isEmptyLines()) {
			return false;
		}
		// at the end of the file only separate the trailing comments
		if (semicolon == finalSemicolon) {
			return comments.hasPending();
		}
		return !writer.isWithinOnCurrentLine() && !writer.isInsideBracket();
	}
}
