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

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.TerminalNode;

import com.tomaszrup.modelicafmt.parser.ModelicaParser;

/**
 * Syntactic role of a terminal that overrides the text-based spacing tables
 * outside annotations.
 */
enum TokenRole {
	/** Spaced purely by {@link SpacingRules}. */
	PLAIN,
	/** The {@code =} of an equation: spaced on both sides. */
	EQUATION_OPERATOR,
	/** A leading sign of an arithmetic expression: glued to its operand. */
	UNARY_SIGN,
	/** The {@code .*} of a wildcard import: glued to the package name. */
	IMPORT_WILDCARD;

	static TokenRole of(TerminalNode node) {
		ParserRuleContext parent = (ParserRuleContext) node.getParent();
		int type = node.getSymbol().getType();
		if (type == ModelicaParser.EQUAL && parent instanceof ModelicaParser.EquationContext) {
			return EQUATION_OPERATOR;
		}
		if (type == ModelicaParser.DOTSTAR && parent instanceof ModelicaParser.Import_clauseContext) {
			return IMPORT_WILDCARD;
		}
		if (parent instanceof ModelicaParser.Add_operatorContext
				&& parent.getParent() instanceof ModelicaParser.Arithmetic_expressionContext
				&& parent.getParent().getChild(0) == parent) {
			return UNARY_SIGN;
		}
		return PLAIN;
	}
}
