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

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.misc.Interval;

import com.tomaszrup.modelicafmt.parser.ModelicaParser;

/**
 * Syntactic context of the node being visited: how many annotations and model
 * annotations enclose it, and which vectors inside a model annotation have
 * their elements laid out one per line.
 *
 * <p>Every change is made through {@link #enter(ParserRuleContext, NodeKind)},
 * whose returned {@link Scope} undoes it when closed.</p>
 */
final class FormattingContext {

	/** Undoes one context change. Closing never throws. */
	interface Scope extends AutoCloseable {
		@Override
		void close();
	}

	static final Scope NO_CHANGE = () -> {
	};

	private int annotationDepth;
	private int modelAnnotationDepth;
	private final Deque<ModelicaParser.VectorContext> activeVectors = new ArrayDeque<>();

	Scope enter(ParserRuleContext node, NodeKind kind) {
		switch (kind) {
			case ANNOTATION:
				annotationDepth++;
				return () -> annotationDepth--;
			case MODEL_ANNOTATION:
				modelAnnotationDepth++;
				return () -> modelAnnotationDepth--;
			case VECTOR:
				return enterVector((ModelicaParser.VectorContext) node);
			default:
				return NO_CHANGE;
		}
	}

	private Scope enterVector(ModelicaParser.VectorContext vector) {
		if (modelAnnotationDepth == 0 || vector.array_iterator_constructor() != null) {
			return NO_CHANGE;
		}
		for (ModelicaParser.ExpressionContext element : vector.array_arguments().expression()) {
			if (element.getStart().getType() == ModelicaParser.IDENT) {
				activeVectors.push(vector);
				return () -> {
					if (!activeVectors.isEmpty() && sameSpan(activeVectors.peek(), vector)) {
						activeVectors.pop();
					}
				};
			}
		}
		return NO_CHANGE;
	}

	boolean isInAnnotation() {
		return annotationDepth > 0;
	}

	boolean isInModelAnnotation() {
		return modelAnnotationDepth > 0;
	}

	/**
	 * @return true if {@code vector} is the innermost vector whose elements
	 *         get their own lines
	 */
	boolean isActiveVector(ModelicaParser.VectorContext vector) {
		return !activeVectors.isEmpty() && sameSpan(activeVectors.peek(), vector);
	}

	int activeVectorCount() {
		return activeVectors.size();
	}

	private static boolean sameSpan(ModelicaParser.VectorContext a, ModelicaParser.VectorContext b) {
		Interval first = a.getSourceInterval();
		Interval second = b.getSourceInterval();
		return first.a == second.a && first.b == second.b;
	}
}
