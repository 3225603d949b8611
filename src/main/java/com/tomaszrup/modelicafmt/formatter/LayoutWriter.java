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

/**
 * Output cursor of one formatting pass. Owns the output buffer, the
 * indentation stack and the per-line state, and decides spacing and line
 * breaks for every piece of text written through {@link #write}.
 */
final class LayoutWriter {
	private final StringBuilder out;
	private final FormatterConfig config;
	private final FormattingContext context;
	private final IndentationStack indentation = new IndentationStack();

	private int currentLineLength;
	private boolean onNewLine = true;
	private boolean withinOnCurrentLine;
	private boolean insideBracket;

	private String previousTokenText = "";
	private int previousTokenIndex = -1;
	private TokenRole previousRole = TokenRole.PLAIN;

	LayoutWriter(StringBuilder out, FormatterConfig config, FormattingContext context) {
		this.out = out;
		this.config = config;
		this.context = context;
	}

	/**
	 * Writes {@code text} preceded by its indentation or separating space,
	 * breaking the line first when the text would overflow the budget and a
	 * break is allowed here.
	 */
	void write(String text, TokenRole role) {
		String prefix = spaceBefore(text, role, true);
		int firstNewline = text.indexOf('\n');
		int charsOnFirstLine = prefix.length() + (firstNewline < 0 ? text.length() : firstNewline);

		String written;
		if (shouldBreakBefore(text, charsOnFirstLine)) {
			newline();
			indentation.requestIndent();
			written = spaceBefore(text, role, false) + text;
			out.append(written);
			indentation.release();
		} else {
			written = spaceBefore(text, role, false) + text;
			out.append(written);
		}

		int lastNewline = written.lastIndexOf('\n');
		if (lastNewline < 0) {
			currentLineLength += written.length();
		} else {
			currentLineLength = written.length() - (lastNewline + 1);
		}
	}

	private boolean shouldBreakBefore(String text, int charsOnFirstLine) {
		if (!config.isWrappingEnabled() || onNewLine
				|| currentLineLength + charsOnFirstLine <= config.getMaxLineLength()) {
			return false;
		}
		return (!context.isInAnnotation() && LineBreakRules.allowsBreakAfter(previousTokenText))
				|| LineBreakRules.allowsBreakBefore(text);
	}

	/**
	 * Whitespace to put in front of {@code text}: the indentation at the start
	 * of a line, otherwise a single space or nothing. A dry run leaves the
	 * start-of-line flag untouched.
	 */
	String spaceBefore(String text, TokenRole role, boolean dryRun) {
		if (onNewLine) {
			if (!dryRun) {
				onNewLine = false;
			}
			return indentation.indentation();
		}
		return insertSpace(text, role) ? " " : "";
	}

	private boolean insertSpace(String text, TokenRole role) {
		boolean inAnnotation = context.isInAnnotation();
		if (!inAnnotation) {
			if (previousRole == TokenRole.UNARY_SIGN || role == TokenRole.IMPORT_WILDCARD) {
				return false;
			}
			if (role == TokenRole.EQUATION_OPERATOR || previousRole == TokenRole.EQUATION_OPERATOR) {
				return true;
			}
		}
		return SpacingRules.insertSpaceBefore(text, previousTokenText, inAnnotation);
	}

	void newline() {
		out.append('\n');
		onNewLine = true;
		currentLineLength = 0;
		indentation.lineStarted();
	}

	void newlineIfNeeded() {
		if (!onNewLine) {
			newline();
		}
	}

	void requestIndent() {
		indentation.requestIndent();
	}

	void releaseIndent() {
		indentation.release();
	}

	void dedent() {
		indentation.releaseIfAny();
	}

	/** Updates the {@code within} and bracket flags from the token before the one just written. */
	void afterTokenWritten() {
		if ("within".equals(previousTokenText)) {
			withinOnCurrentLine = true;
		}
		if ("[".equals(previousTokenText)) {
			insideBracket = true;
		} else if ("]".equals(previousTokenText)) {
			insideBracket = false;
		}
	}

	void clearWithinOnCurrentLine() {
		withinOnCurrentLine = false;
	}

	void recordToken(String text, int tokenIndex, TokenRole role) {
		previousTokenText = text;
		previousTokenIndex = tokenIndex;
		previousRole = role;
	}

	/**
	 * Ends the pass with a trailing newline. Every rule exit releases at least
	 * what its entry requested, so nothing may be left on the stack.
	 */
	void finish() {
		newlineIfNeeded();
		if (!indentation.isEmpty()) {
			throw new IllegalStateException(
					"Unbalanced indentation after formatting: " + indentation.size() + " level(s) left open");
		}
	}

	boolean isWithinOnCurrentLine() {
		return withinOnCurrentLine;
	}

	boolean isInsideBracket() {
		return insideBracket;
	}

	String getPreviousTokenText() {
		return previousTokenText;
	}

	int getPreviousTokenIndex() {
		return previousTokenIndex;
	}
}
