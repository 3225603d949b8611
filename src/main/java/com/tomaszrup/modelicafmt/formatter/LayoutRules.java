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

import java.util.EnumSet;
import java.util.Set;
import java.util.regex.Pattern;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.TerminalNode;

import com.tomaszrup.modelicafmt.parser.ModelicaParser;

/**
 * Which grammar rules open a new, indented line and which keywords must start
 * a line of their own.
 */
final class LayoutRules {

	static final Set<NodeKind> ALWAYS_OWN_LINE = EnumSet.of(
			NodeKind.ELEMENT,
			NodeKind.EQUATIONS,
			NodeKind.ALGORITHM_STATEMENTS,
			NodeKind.CONTROL_STRUCTURE_BODY,
			NodeKind.ANNOTATION,
			NodeKind.ENUMERATION_LITERAL,
			NodeKind.CONDITION_ATTRIBUTE,
			NodeKind.EXPRESSION_LIST,
			NodeKind.CONSTRAINING_CLAUSE,
			NodeKind.EXTERNAL_FUNCTION_CALL_ARGUMENT);

	/**
	 * Arguments of a non-model annotation that still get their own line. The
	 * match is on the whole argument text, so some vendor annotations
	 * ({@code __Vendor(...)} nested in another argument) stay on the line of
	 * their parent.
	 */
	static final Pattern OWN_LINE_ANNOTATION_ARGUMENT = Pattern.compile(
			"choice|^enable|iconTransformation|Placement|Dialog|Evaluate|^__");

	private LayoutRules() {
	}

	/**
	 * @param previousTokenText text of the last token written so far
	 * @return true if {@code node} starts on a fresh line, one indent deeper
	 */
	static boolean needsOwnLineAndIndent(ParserRuleContext node, NodeKind kind, FormattingContext context,
			String previousTokenText) {
		if (ALWAYS_OWN_LINE.contains(kind)) {
			return true;
		}
		switch (kind) {
			case STRING_COMMENT:
				return !context.isInAnnotation();
			case ARGUMENT:
			case NAMED_ARGUMENT:
				if (!context.isInAnnotation() || context.isInModelAnnotation()) {
					return true;
				}
				return OWN_LINE_ANNOTATION_ARGUMENT.matcher(node.getText()).find()
						&& !"(".equals(previousTokenText);
			case EXPRESSION:
				return isElementOfActiveVector(node, context);
			default:
				return false;
		}
	}

	/**
	 * Rules whose indent decision reads the previous token. Their exit asks
	 * {@link #needsOwnLineAndIndent} again instead of undoing what the entry did.
	 */
	static boolean decidedAgainOnExit(NodeKind kind) {
		return kind == NodeKind.ARGUMENT || kind == NodeKind.NAMED_ARGUMENT;
	}

	private static boolean isElementOfActiveVector(ParserRuleContext expression, FormattingContext context) {
		if (context.activeVectorCount() == 0
				|| !(expression.getParent() instanceof ModelicaParser.Array_argumentsContext)) {
			return false;
		}
		ParserRuleContext vector = expression.getParent().getParent();
		return vector instanceof ModelicaParser.VectorContext
				&& context.isActiveVector((ModelicaParser.VectorContext) vector);
	}

	/** Equation and algorithm sections begin on their own line. */
	static boolean startsSection(NodeKind kind) {
		return kind == NodeKind.EQUATION_SECTION || kind == NodeKind.ALGORITHM_SECTION;
	}

	/**
	 * Keywords that must not trail the previous line: the visibility and
	 * {@code external} keywords of a composition, and the {@code end} closing
	 * a class.
	 */
	static boolean startsOwnLine(TerminalNode terminal) {
		int type = terminal.getSymbol().getType();
		Object parent = terminal.getParent();
		switch (type) {
			case ModelicaParser.PUBLIC:
			case ModelicaParser.PROTECTED:
			case ModelicaParser.EXTERNAL:
				return parent instanceof ModelicaParser.CompositionContext;
			case ModelicaParser.END:
				return parent instanceof ModelicaParser.Long_class_specifierContext;
			default:
				return false;
		}
	}
}
