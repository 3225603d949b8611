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

import java.util.ArrayList;
import java.util.List;

import org.antlr.v4.runtime.Token;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tomaszrup.modelicafmt.parser.ModelicaSourceParser;
import com.tomaszrup.modelicafmt.parser.ModelicaSyntaxException;
import com.tomaszrup.modelicafmt.parser.ParsedModelica;

class ModelicaFormatterTests {

	private static final List<String> SAMPLES = List.of(
			"model A equation x=1; end A;",
			"within Lib; model A end A;",
			"// header\nmodel A\n  Real x; // trailing\nend A;\n",
			"model A Real x annotation(Placement(transformation(extent={{0,0},{10,10}})), Dialog(group=\"g\")); end A;",
			"model A annotation(Icon(graphics={Rectangle(extent={{-100,100},{100,-100}}),Text(textString=\"A\")}));end A;",
			"package P \"doc\" import Modelica.Units.SI.*; model M parameter Real k(min=0)=1 \"gain\"; "
					+ "Real y; equation if k > 0 then y = k*time; else y = -k; end if; end M; end P;",
			"function f input Real u; output Real y; algorithm y := -u; /* negate */ for i in 1:3 loop "
					+ "y := y + i; end for; end f;",
			"type E = enumeration(a \"first\", b, c);",
			"model A Real x[2] = {1, 2}; Real m[2,2] = [1, 2; 3, 4]; protected Real z; public Real w; end A;",
			"model A replaceable model B = C constrainedby D; B b(k=1, each final n=2) if true; end A;");

	private ModelicaFormatter formatter;

	@BeforeEach
	void setup() {
		formatter = new ModelicaFormatter();
	}

	// --- Construction ---

	@Test
	void testDefaultConfig() {
		Assertions.assertEquals(FormatterConfig.defaults(), formatter.getConfig());
	}

	@Test
	void testRejectsNullConfig() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> new ModelicaFormatter(null));
	}

	// --- Layout ---

	@Test
	void testEquationSection() {
		Assertions.assertEquals("model A\nequation\n  x = 1;\n\nend A;\n",
				formatter.format("model A equation x=1; end A;"));
	}

	@Test
	void testSeveralEquations() {
		Assertions.assertEquals("model A\nequation\n  x = 1;\n\n  y = 2;\n\nend A;\n",
				formatter.format("model A equation x=1; y=2; end A;"));
	}

	@Test
	void testNoEmptyLines() {
		ModelicaFormatter compact = new ModelicaFormatter(FormatterConfig.defaults().withEmptyLines(false));
		Assertions.assertEquals("model A\nequation\n  x = 1;\n  y = 2;\nend A;\n",
				compact.format("model A equation x=1; y=2; end A;"));
		Assertions.assertEquals("model A\n  Real x;\n  Real y;\nend A;\n",
				compact.format("model A Real x; Real y; end A;"));
	}

	@Test
	void testNoEmptyLinesNeverProducesBlankLine() {
		ModelicaFormatter compact = new ModelicaFormatter(FormatterConfig.defaults().withEmptyLines(false));
		for (String sample : SAMPLES) {
			String formatted = compact.format(sample);
			Assertions.assertFalse(formatted.contains("\n\n"), formatted);
		}
	}

	@Test
	void testComponentDeclarations() {
		Assertions.assertEquals("model A\n  Real x;\n\n  Real y;\n\nend A;\n",
				formatter.format("model A Real x; Real y; end A;"));
	}

	@Test
	void testWithinClauseHasNoBlankLine() {
		Assertions.assertEquals("within Lib;\nmodel A\nend A;\n", formatter.format("within Lib; model A end A;"));
	}

	@Test
	void testNegativeRightHandSide() {
		Assertions.assertEquals("model A\nequation\n  x = -1;\n\nend A;\n",
				formatter.format("model A equation x=-1; end A;"));
	}

	@Test
	void testWildcardImport() {
		Assertions.assertEquals("model A\n  import Modelica.Units.SI.*;\n\nend A;\n",
				formatter.format("model A import Modelica.Units.SI.*; end A;"));
	}

	@Test
	void testElementAnnotation() {
		String expected = "model A\n"
				+ "  Real x\n"
				+ "    annotation (Placement(transformation(extent={{0,0},{10,10}})),\n"
				+ "    Dialog(group=\"g\"));\n"
				+ "\n"
				+ "end A;\n";
		Assertions.assertEquals(expected, formatter.format(SAMPLES.get(3)));
	}

	@Test
	void testArgumentAfterOpeningParenthesisShallowsLaterArguments() {
		String expected = "model A\n"
				+ "  parameter Real k=1\n"
				+ "    annotation (Dialog(tab=\"t\",\n"
				+ "      enable=false),\n"
				+ "    Evaluate=true,\n"
				+ "    __Dymola_x=1);\n"
				+ "\n"
				+ "end A;\n";
		String source = "model A parameter Real k = 1 annotation(Dialog(tab=\"t\", enable=false), "
				+ "Evaluate=true, __Dymola_x=1); end A;";
		String formatted = formatter.format(source);
		Assertions.assertEquals(expected, formatted);
		Assertions.assertEquals(formatted, formatter.format(formatted));
	}

	@Test
	void testShallowedArgumentsDoNotLeakIntoNextElement() {
		String expected = "model A\n"
				+ "  Real x\n"
				+ "    annotation (Dialog(group=\"g\"),\n"
				+ "    Evaluate=true);\n"
				+ "\n"
				+ "  Real y;\n"
				+ "\n"
				+ "end A;\n";
		Assertions.assertEquals(expected,
				formatter.format("model A Real x annotation(Dialog(group=\"g\"), Evaluate=true); Real y; end A;"));
	}

	@Test
	void testModelAnnotationGraphics() {
		String expected = "model A\n"
				+ "  annotation (\n"
				+ "    Icon(\n"
				+ "      graphics={\n"
				+ "        Rectangle(\n"
				+ "          extent={{-100,100},{100,-100}}),\n"
				+ "        Text(\n"
				+ "          textString=\"A\")}));\n"
				+ "\n"
				+ "end A;\n";
		Assertions.assertEquals(expected, formatter.format(SAMPLES.get(4)));
	}

	// --- Line length ---

	@Test
	void testWrapsLongEquation() {
		ModelicaFormatter narrow = new ModelicaFormatter(FormatterConfig.defaults().withMaxLineLength(20));
		String expected = "model A\n"
				+ "equation\n"
				+ "  y = a + b + c + d +\n"
				+ "    e;\n"
				+ "\n"
				+ "end A;\n";
		Assertions.assertEquals(expected, narrow.format("model A equation y=a+b+c+d+e; end A;"));
	}

	@Test
	void testZeroLineLengthNeverWraps() {
		ModelicaFormatter unbounded = new ModelicaFormatter(FormatterConfig.defaults().withMaxLineLength(0));
		String formatted = unbounded.format("model A equation y=a+b+c+d+e+f+g+h+i+j+k+l+m+n+o+p+q+r+s+t+u+v+w; end A;");
		Assertions.assertTrue(formatted.contains("  y = a + b + c + d + e + f + g + h + i + j + k + l + m + n + o + p"
				+ " + q + r + s + t + u + v + w;\n"), formatted);
	}

	@Test
	void testBreakableLinesStayWithinBudget() {
		ModelicaFormatter narrow = new ModelicaFormatter(FormatterConfig.defaults().withMaxLineLength(30));
		String formatted = narrow.format(
				"model A equation y = alpha + beta + gamma + delta + epsilon + zeta + eta + theta; end A;");
		for (String line : formatted.split("\n")) {
			Assertions.assertTrue(line.length() <= 30, "line too long: " + line);
		}
	}

	// --- Comments ---

	@Test
	void testCommentsKeepTheirOrder() {
		String expected = "// header\n"
				+ "model A\n"
				+ "  Real x;\n"
				+ "\n"
				+ "// trailing\n"
				+ "end A;\n";
		Assertions.assertEquals(expected, formatter.format(SAMPLES.get(2)));
	}

	@Test
	void testTrailingCommentsAfterLastClass() {
		String formatted = formatter.format("model A end A; // one\n/* two */");
		Assertions.assertEquals("model A\nend A;\n\n// one\n/* two */\n", formatted);
	}

	@Test
	void testEveryCommentIsWrittenOnce() {
		for (String sample : SAMPLES) {
			List<String> before = commentTexts(ModelicaSourceParser.parse(sample));
			List<String> after = commentTexts(ModelicaSourceParser.parse(formatter.format(sample)));
			Assertions.assertEquals(before, after, sample);
		}
	}

	// --- Invariants over the sample corpus ---

	@Test
	void testPreservesSignificantTokens() {
		for (String sample : SAMPLES) {
			String formatted = formatter.format(sample);
			Assertions.assertEquals(ModelicaSourceParser.parse(sample).significantTokenTexts(),
					ModelicaSourceParser.parse(formatted).significantTokenTexts(), sample);
		}
	}

	@Test
	void testFormattingIsIdempotent() {
		for (String sample : SAMPLES) {
			String once = formatter.format(sample);
			Assertions.assertEquals(once, formatter.format(once), sample);
		}
	}

	@Test
	void testOutputEndsWithSingleNewline() {
		for (String sample : SAMPLES) {
			String formatted = formatter.format(sample);
			Assertions.assertTrue(formatted.endsWith(";\n") || formatted.endsWith("*/\n"), formatted);
			Assertions.assertFalse(formatted.endsWith("\n\n"), formatted);
		}
	}

	@Test
	void testReusableAcrossCalls() {
		String first = formatter.format(SAMPLES.get(0));
		formatter.format(SAMPLES.get(4));
		Assertions.assertEquals(first, formatter.format(SAMPLES.get(0)));
	}

	@Test
	void testAppendsToExistingBuffer() {
		StringBuilder out = new StringBuilder("prefix\n");
		formatter.format(ModelicaSourceParser.parse("model A end A;"), out);
		Assertions.assertEquals("prefix\nmodel A\nend A;\n", out.toString());
	}

	// --- Errors ---

	@Test
	void testSyntaxErrorNamesSource() {
		ModelicaSyntaxException e = Assertions.assertThrows(ModelicaSyntaxException.class,
				() -> formatter.format("model A\n  Real x\nend A;", "A.mo"));
		Assertions.assertEquals("A.mo", e.getSourceName());
		Assertions.assertEquals(3, e.getLine());
		Assertions.assertTrue(e.getMessage().startsWith("A.mo:3:"), e.getMessage());
	}

	private static List<String> commentTexts(ParsedModelica parsed) {
		List<String> texts = new ArrayList<>();
		for (Token comment : parsed.getComments()) {
			texts.add(comment.getText());
		}
		return texts;
	}
}
