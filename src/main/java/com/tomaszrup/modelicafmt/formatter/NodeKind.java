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

import com.tomaszrup.modelicafmt.parser.ModelicaParser;

/**
 * Grammar rules the layout decisions dispatch on. Every other rule maps to
 * {@link #OTHER}.
 */
enum NodeKind {
	ELEMENT,
	EQUATIONS,
	ALGORITHM_STATEMENTS,
	CONTROL_STRUCTURE_BODY,
	ANNOTATION,
	MODEL_ANNOTATION,
	ENUMERATION_LITERAL,
	CONDITION_ATTRIBUTE,
	EXPRESSION_LIST,
	CONSTRAINING_CLAUSE,
	EXTERNAL_FUNCTION_CALL_ARGUMENT,
	STRING_COMMENT,
	ARGUMENT,
	NAMED_ARGUMENT,
	EXPRESSION,
	VECTOR,
	EQUATION_SECTION,
	ALGORITHM_SECTION,
	OTHER;

	static NodeKind of(ParserRuleContext node) {
		switch (node.getRuleIndex()) {
			case ModelicaParser.RULE_element:
				return ELEMENT;
			case ModelicaParser.RULE_equations:
				return EQUATIONS;
			case ModelicaParser.RULE_algorithm_statements:
				return ALGORITHM_STATEMENTS;
			case ModelicaParser.RULE_control_structure_body:
				return CONTROL_STRUCTURE_BODY;
			case ModelicaParser.RULE_annotation:
				return ANNOTATION;
			case ModelicaParser.RULE_model_annotation:
				return MODEL_ANNOTATION;
			case ModelicaParser.RULE_enumeration_literal:
				return ENUMERATION_LITERAL;
			case ModelicaParser.RULE_condition_attribute:
				return CONDITION_ATTRIBUTE;
			case ModelicaParser.RULE_expression_list:
				return EXPRESSION_LIST;
			case ModelicaParser.RULE_constraining_clause:
				return CONSTRAINING_CLAUSE;
			case ModelicaParser.RULE_external_function_call_argument:
				return EXTERNAL_FUNCTION_CALL_ARGUMENT;
			case ModelicaParser.RULE_string_comment:
				return STRING_COMMENT;
			case ModelicaParser.RULE_argument:
				return ARGUMENT;
			case ModelicaParser.RULE_named_argument:
				return NAMED_ARGUMENT;
			case ModelicaParser.RULE_expression:
				return EXPRESSION;
			case ModelicaParser.RULE_vector:
				return VECTOR;
			case ModelicaParser.RULE_equation_section:
				return EQUATION_SECTION;
			case ModelicaParser.RULE_algorithm_section:
				return ALGORITHM_SECTION;
			default:
				return OTHER;
		}
	}
}
