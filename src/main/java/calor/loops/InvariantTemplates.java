// Copyright 2026 The Calor Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package calor.loops;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

import calor.core.BoundModule;
import calor.core.BoundModule.Expr;
import calor.core.BoundModule.Types;
import calor.core.BoundModule.Variable;

/**
 * Common shapes of loop invariant, instantiated against a particular loop to
 * give candidates for k-induction. Every candidate is a boolean expression
 * over the loop variable and integer constants.
 *
 * @author The Calor Project Developers
 *
 */
public class InvariantTemplates {

	public static class Template {
		private final String name;
		private final String description;
		private final Function<LoopContext, Expr> generator;

		public Template(String name, String description, Function<LoopContext, Expr> generator) {
			this.name = name;
			this.description = description;
			this.generator = generator;
		}

		public String getName() {
			return name;
		}

		public String getDescription() {
			return description;
		}

		/**
		 * Instantiate this template for a given loop.
		 *
		 * @param context
		 * @return The candidate invariant, or <code>null</code> if this template
		 *         does not apply.
		 */
		public Expr generate(LoopContext context) {
			return generator.apply(context);
		}

		@Override
		public String toString() {
			return name;
		}
	}

	/**
	 * <code>lower &lt;= v &amp;&amp; v &lt;= upper</code>
	 */
	public static final Template BOUNDED_LOOP_VARIABLE = new Template("BoundedLoopVariable",
			"Loop variable is within loop bounds", ctx -> {
				if (ctx.getLoopVariable() == null || !ctx.hasKnownBounds()) {
					return null;
				}
				Expr v = var(ctx);
				return BoundModule.AND(
						BoundModule.COMPARE(Expr.BinaryOperator.LTEQ, BoundModule.CONST(ctx.getLowerBound()), v),
						BoundModule.COMPARE(Expr.BinaryOperator.LTEQ, v, BoundModule.CONST(ctx.getUpperBound())));
			});

	/**
	 * <code>v &gt;= lower</code>, or <code>v &gt;= lower - 1</code> for a loop
	 * counting down, since the variable steps just past its bound on exit.
	 */
	public static final Template LOWER_BOUND_PRESERVED = new Template("LowerBoundPreserved",
			"Loop variable never falls below its lower bound", ctx -> {
				if (ctx.getLoopVariable() == null || ctx.getLowerBound() == null) {
					return null;
				}
				int bound = ctx.isDecrementing() ? ctx.getLowerBound() - 1 : ctx.getLowerBound();
				return BoundModule.COMPARE(Expr.BinaryOperator.GTEQ, var(ctx), BoundModule.CONST(bound));
			});

	/**
	 * <code>v &lt;= upper</code> for a loop counting up.
	 */
	public static final Template UPPER_BOUND_PRESERVED = new Template("UpperBoundPreserved",
			"Loop variable never exceeds its upper bound", ctx -> {
				if (ctx.getLoopVariable() == null || ctx.getUpperBound() == null || ctx.isDecrementing()) {
					return null;
				}
				return BoundModule.COMPARE(Expr.BinaryOperator.LTEQ, var(ctx), BoundModule.CONST(ctx.getUpperBound()));
			});

	/**
	 * <code>v &gt;= 0</code>
	 */
	public static final Template NON_NEGATIVE_COUNTER = new Template("NonNegativeCounter",
			"Loop variable stays non-negative", ctx -> {
				if (ctx.getLoopVariable() == null) {
					return null;
				}
				return BoundModule.COMPARE(Expr.BinaryOperator.GTEQ, var(ctx), BoundModule.CONST(0));
			});

	/**
	 * The loop condition itself, which holds on every iteration.
	 */
	public static final Template CONDITION_AS_INVARIANT = new Template("ConditionAsInvariant",
			"Loop condition holds on every iteration", ctx -> ctx.getCondition());

	public static final List<Template> ALL = Collections.unmodifiableList(Arrays.asList(BOUNDED_LOOP_VARIABLE,
			LOWER_BOUND_PRESERVED, UPPER_BOUND_PRESERVED, NON_NEGATIVE_COUNTER, CONDITION_AS_INVARIANT));

	/**
	 * Instantiate every applicable template for a given loop, in order.
	 *
	 * @param context
	 * @return
	 */
	public static List<Expr> synthesizeInvariants(LoopContext context) {
		ArrayList<Expr> invariants = new ArrayList<>();
		for (Template t : ALL) {
			Expr e = t.generate(context);
			if (e != null) {
				invariants.add(e);
			}
		}
		return invariants;
	}

	/**
	 * Conjoin every applicable candidate invariant.
	 *
	 * @param context
	 * @return The conjunction, or <code>null</code> if no template applies.
	 */
	public static Expr synthesizeStrongestInvariant(LoopContext context) {
		List<Expr> invariants = synthesizeInvariants(context);
		return invariants.isEmpty() ? null : BoundModule.AND(invariants);
	}

	private static Expr var(LoopContext ctx) {
		return BoundModule.VAR(new Variable(ctx.getLoopVariable(), Types.INT));
	}
}
