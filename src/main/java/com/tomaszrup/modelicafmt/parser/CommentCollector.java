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
import java.util.Collections;
import java.util.List;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.TokenFactory;
import org.antlr.v4.runtime.TokenSource;

/**
 * {@link TokenSource} wrapper that remembers every comment token read from
 * the lexer. Tokens are handed to the token stream unchanged; the stream
 * assigns token indexes to the same instances, so the collected comments carry
 * their final source index once the stream is filled.
 */
public class CommentCollector implements TokenSource {
	private final TokenSource delegate;
	private final List<Token> comments = new ArrayList<>();

	public CommentCollector(TokenSource delegate) {
		this.delegate = delegate;
	}

	@Override
	public Token nextToken() {
		Token token = delegate.nextToken();
		if (isComment(token)) {
			comments.add(token);
		}
		return token;
	}

	public static boolean isComment(Token token) {
		int type = token.getType();
		return type == ModelicaLexer.COMMENT || type == ModelicaLexer.LINE_COMMENT;
	}

	/** Comments in source order. */
	public List<Token> getComments() {
		return Collections.unmodifiableList(comments);
	}

	@Override
	public int getLine() {
		return delegate.getLine();
	}

	@Override
	public int getCharPositionInLine() {
		return delegate.getCharPositionInLine();
	}

	@Override
	public CharStream getInputStream() {
		return delegate.getInputStream();
	}

	@Override
	public String getSourceName() {
		return delegate.getSourceName();
	}

	@Override
	public void setTokenFactory(TokenFactory<?> factory) {
		delegate.setTokenFactory(factory);
	}

	@Override
	public TokenFactory<?> getTokenFactory() {
		return delegate.getTokenFactory();
	}
}
