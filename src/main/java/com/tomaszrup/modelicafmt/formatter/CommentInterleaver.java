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

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;

import org.antlr.v4.runtime.Token;

import com.tomaszrup.modelicafmt.parser.ModelicaLexer;

/**
 * Writes queued comments at the first token boundary that follows them in the
 * source. Each comment is written exactly once, in source order.
 */
final class CommentInterleaver {
	private final Deque<Token> pending;
	private final LayoutWriter writer;

	CommentInterleaver(Collection<Token> comments, LayoutWriter writer) {
		this.pending = new ArrayDeque<>(comments);
		this.writer = writer;
	}

	/**
	 * Writes every queued comment that lies strictly between the previously
	 * written token and the token at {@code tokenIndex}.
	 */
	void flushBefore(int tokenIndex) {
		int previousTokenIndex = writer.getPreviousTokenIndex();
		while (!pending.isEmpty()
				&& pending.peekFirst().getTokenIndex() < tokenIndex
				&& pending.peekFirst().getTokenIndex() > previousTokenIndex) {
			writeComment(pending.pollFirst());
		}
	}

	void flushRemaining() {
		while (!pending.isEmpty()) {
			writeComment(pending.pollFirst());
		}
	}

	boolean hasPending() {
		return !pending.isEmpty();
	}

	private void writeComment(Token comment) {
		writer.write(comment.getText(), TokenRole.PLAIN);
		// a line comment runs to the end of its line
		if (comment.getType() == ModelicaLexer.LINE_COMMENT) {
			writer.newline();
		}
	}
}
