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
import java.util.Deque;

/**
 * Stack of indentation markers. Only one marker per output line is
 * {@link Marker#RENDERED}; further requests on the same line push
 * {@link Marker#SUPPRESSED} placeholders so that every request still has a
 * matching {@link #release()}.
 */
final class IndentationStack {
	static final String INDENT_UNIT = "  ";

	enum Marker {
		RENDERED,
		SUPPRESSED
	}

	private final Deque<Marker> markers = new ArrayDeque<>();
	private int renderedCount;
	private boolean indentAppliedOnLine;

	void requestIndent() {
		if (!indentAppliedOnLine) {
			markers.push(Marker.RENDERED);
			renderedCount++;
			indentAppliedOnLine = true;
		} else {
			markers.push(Marker.SUPPRESSED);
		}
	}

	void release() {
		if (markers.isEmpty()) {
			throw new IllegalStateException("Indentation released without a matching request");
		}
		if (markers.pop() == Marker.RENDERED) {
			renderedCount--;
		}
	}

	/** Like {@link #release()}, but a no-op on an empty stack. */
	void releaseIfAny() {
		if (!markers.isEmpty()) {
			release();
		}
	}

	/** Called whenever a newline is written: the next line may render one indent again. */
	void lineStarted() {
		indentAppliedOnLine = false;
	}

	int depth() {
		return renderedCount;
	}

	int size() {
		return markers.size();
	}

	boolean isEmpty() {
		return markers.isEmpty();
	}

	String indentation() {
		return INDENT_UNIT.repeat(renderedCount);
	}
}
