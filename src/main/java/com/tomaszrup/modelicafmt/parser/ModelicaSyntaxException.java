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

/**
 * Raised when a Modelica source cannot be lexed or parsed. Formatting of the
 * affected file is aborted; no partial output is produced.
 */
public class ModelicaSyntaxException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	private final String sourceName;
	private final int line;
	private final int column;

	public ModelicaSyntaxException(String sourceName, int line, int column, String message, Throwable cause) {
		super(sourceName + ":" + line + ":" + column + ": " + message, cause);
		this.sourceName = sourceName;
		this.line = line;
		this.column = column;
	}

	public String getSourceName() {
		return sourceName;
	}

	/** 1-based line of the offending token. */
	public int getLine() {
		return line;
	}

	/** 0-based column of the offending token. */
	public int getColumn() {
		return column;
	}
}
