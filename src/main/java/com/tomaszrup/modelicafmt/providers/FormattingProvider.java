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
package com.tomaszrup.modelicafmt.providers;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;

import com.tomaszrup.modelicafmt.formatter.FormatterConfig;
import com.tomaszrup.modelicafmt.formatter.ModelicaFormatter;

/**
 * Provides textDocument/formatting support for Modelica source files.
 *
 * <p>The whole document is run through {@link ModelicaFormatter}; the result
 * is reported as a single edit covering the lines between the first and the
 * last line that differ. Replacement text uses {@code \r\n} when the document
 * does. A source that does not parse raises a
 * {@link com.tomaszrup.modelicafmt.parser.ModelicaSyntaxException}.</p>
 */
public class FormattingProvider {

	public CompletableFuture<List<TextEdit>> provideFormatting(String sourceText, String sourceName,
			FormatterConfig config) {
		if (sourceText == null || sourceText.isEmpty()) {
			return CompletableFuture.completedFuture(new ArrayList<>());
		}
		String normalizedSource = sourceText.replace("\r\n", "\n").replace("\r", "\n");
		String formatted = new ModelicaFormatter(config).format(normalizedSource, sourceName);
		if (formatted.equals(normalizedSource)) {
			return CompletableFuture.completedFuture(new ArrayList<>());
		}
		List<TextEdit> edits = computeMinimalEdits(normalizedSource, formatted);
		if (sourceText.contains("\r\n")) {
			for (TextEdit edit : edits) {
				edit.setNewText(edit.getNewText().replace("\n", "\r\n"));
			}
		}
		return CompletableFuture.completedFuture(edits);
	}

	/**
	 * Compute minimal line-level TextEdits between the original and formatted text.
	 */
	public static List<TextEdit> computeMinimalEdits(String original, String formatted) {
		String[] origLines = original.split("\\n", -1);
		String[] fmtLines = formatted.split("\\n", -1);
		List<TextEdit> edits = new ArrayList<>();

		int origLen = origLines.length;
		int fmtLen = fmtLines.length;
		int top = findFirstDifferentLine(origLines, fmtLines, origLen, fmtLen);

		if (top == origLen && top == fmtLen) {
			return edits;
		}

		int[] bottoms = findLastDifferentLine(origLines, fmtLines, top, origLen, fmtLen);
		int origBottom = bottoms[0];
		int fmtBottom = bottoms[1];

		String replacement = joinLines(fmtLines, top, fmtBottom);
		edits.add(createEdit(origLines, top, origBottom, fmtBottom, replacement));
		return edits;
	}

	private static int findFirstDifferentLine(String[] origLines, String[] fmtLines, int origLen, int fmtLen) {
		int top = 0;
		int minLen = Math.min(origLen, fmtLen);
		while (top < minLen && origLines[top].equals(fmtLines[top])) {
			top++;
		}
		return top;
	}

	private static int[] findLastDifferentLine(String[] origLines, String[] fmtLines, int top, int origLen,
			int fmtLen) {
		int origBottom = origLen - 1;
		int fmtBottom = fmtLen - 1;
		while (origBottom >= top && fmtBottom >= top && origLines[origBottom].equals(fmtLines[fmtBottom])) {
			origBottom--;
			fmtBottom--;
		}
		return new int[] {origBottom, fmtBottom};
	}

	private static String joinLines(String[] lines, int from, int to) {
		StringBuilder joined = new StringBuilder();
		for (int j = from; j <= to; j++) {
			if (j > from) {
				joined.append('\n');
			}
			joined.append(lines[j]);
		}
		return joined.toString();
	}

	private static TextEdit createEdit(String[] origLines, int top, int origBottom, int fmtBottom,
			String replacement) {
		if (top <= origBottom && fmtBottom < top) {
			// pure deletion: drop the line breaks of the removed lines as well
			if (top == 0) {
				return new TextEdit(new Range(new Position(0, 0), new Position(origBottom + 1, 0)), "");
			}
			Position start = new Position(top - 1, origLines[top - 1].length());
			Position end = new Position(origBottom, origLines[origBottom].length());
			return new TextEdit(new Range(start, end), "");
		}
		if (top <= origBottom) {
			Position start = new Position(top, 0);
			Position end = new Position(origBottom, origLines[origBottom].length());
			return new TextEdit(new Range(start, end), replacement);
		}
		// pure insertion: no original line is replaced
		if (top == 0) {
			Position start = new Position(0, 0);
			return new TextEdit(new Range(start, start), fmtBottom >= top ? replacement + "\n" : replacement);
		}
		Position anchor = new Position(top - 1, origLines[top - 1].length());
		return new TextEdit(new Range(anchor, anchor), fmtBottom >= top ? "\n" + replacement : replacement);
	}
}
