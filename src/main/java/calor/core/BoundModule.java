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
package calor.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * A semantically resolved Calor module, as produced by the binder. Every name
 * has been resolved to a {@link Variable} and every expression carries the name
 * of its type. Instances are immutable: passes which rewrite a module construct
 * fresh nodes and share everything which did not change.
 *
 * @author The Calor Project Developers
 *
 */
public class BoundModule {
	private final String name;
	private final List<Function> functions;
	private final Span span;

	public BoundModule(String name, List<Function> functions) {
		this(name, functions, Span.NONE);
	}

	public BoundModule(String name, List<Function> functions, Span span) {
		if (name == null) {
			throw new IllegalArgumentException("invalid module name");
		}
		this.name = name;
		this.functions = Collections.unmodifiableList(new ArrayList<>(functions));
		this.span = span;
	}

	public String getName() {
		return name;
	}

	public List<Function> getFunctions() {
		return functions;
	}

	public Span getSpan() {
		return span;
	}

	/**
	 * Create a copy of this module with a different set of functions.
	 *
	 * @param functions
	 * @return
	 */
	public BoundModule withFunctions(List<Function> functions) {
		return new BoundModule(name, functions, span);
	}

	// =========================================================================
	// Types
	// =========================================================================

	/**
	 * Names of the primitive types assigned by the binder. Integer types use
	 * fixed width two's complement arithmetic.
	 */
	public static final class Types {
		public static final String INT = "i32";
		public static final String FLOAT = "f64";
		public static final String BOOL = "bool";
		public static final String STRING = "str";
		public static final String VOID = "void";

		private static final List<String> INTEGRAL = Arrays.asList("i8", "i16", "i32", "i64", "u8", "u16", "u32",
				"u64", "int", "long", "short", "byte");

		private static final List<String> FLOATING = Arrays.asList("f32", "f64", "float", "double", "decimal");

		public static boolean isIntegral(String type) {
			return type != null && INTEGRAL.contains(type.toLowerCase());
		}

		public static boolean isFloating(String type) {
			return type != null && FLOATING.contains(type.toLowerCase());
		}

		public static boolean isBoolean(String type) {
			return type != null && (type.equalsIgnoreCase(BOOL) || type.equalsIgnoreCase("boolean"));
		}

		private Types() {
		}
	}

	// =========================================================================
	// Spans
	// =========================================================================

	/**
	 * Identifies a region of the original source file. Spans are opaque to the
	 * analyses, which only carry them through to diagnostics.
	 */
	public static final class Span {
		public static final Span NONE = new Span(0, 0, 0, 0);

		private final int start;
		private final int length;
		private final int line;
		private final int column;

		public Span(int start, int length, int line, int column) {
			this.start = start;
			this.length = length;
			this.line = line;
			this.column = column;
		}

		public int getStart() {
			return start;
		}

		public int getLength() {
			return length;
		}

		public int getLine() {
			return line;
		}

		public int getColumn() {
			return column;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Span) {
				Span s = (Span) o;
				return start == s.start && length == s.length && line == s.line && column == s.column;
			}
			return false;
		}

		@Override
		public int hashCode() {
			return (start * 31 + length) * 31 + line * 7 + column;
		}

		@Override
		public String toString() {
			return line + ":" + column;
		}
	}

	public static class AbstractItem {
		private final Span span;

		public AbstractItem(Span span) {
			this.span = span == null ? Span.NONE : span;
		}

		public Span getSpan() {
			return span;
		}
	}

	// =========================================================================
	// Symbols
	// =========================================================================

	/**
	 * A resolved variable, which may be a parameter, a local or a quantified
	 * variable.
	 */
	public static class Variable extends AbstractItem {
		private final String name;
		private final String type;
		private final boolean mutable;

		public Variable(String name, String type) {
			this(name, type, false, Span.NONE);
		}

		public Variable(String name, String type, boolean mutable, Span span) {
			super(span);
			if (name == null || name.isEmpty()) {
				throw new IllegalArgumentException("invalid variable name");
			}
			this.name = name;
			this.type = type;
			this.mutable = mutable;
		}

		public String getName() {
			return name;
		}

		public String getType() {
			return type;
		}

		public boolean isMutable() {
			return mutable;
		}

		@Override
		public String toString() {
			return name + ":" + type;
		}
	}

	// =========================================================================
	// Functions
	// =========================================================================

	public static class Function extends AbstractItem {
		private final String name;
		private final List<Variable> parameters;
		private final String returnType;
		private final List<Expr> preconditions;
		private final List<Expr> postconditions;
		private final List<Stmt> body;
		private final List<String> effects;

		public Function(String name, List<Variable> parameters, String returnType, List<Expr> preconditions,
				List<Expr> postconditions, List<Stmt> body, List<String> effects, Span span) {
			super(span);
			if (name == null) {
				throw new IllegalArgumentException("invalid function name");
			}
			this.name = name;
			this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
			this.returnType = returnType;
			this.preconditions = Collections.unmodifiableList(new ArrayList<>(preconditions));
			this.postconditions = Collections.unmodifiableList(new ArrayList<>(postconditions));
			this.body = Collections.unmodifiableList(new ArrayList<>(body));
			this.effects = Collections.unmodifiableList(new ArrayList<>(effects));
		}

		public String getName() {
			return name;
		}

		public List<Variable> getParameters() {
			return parameters;
		}

		public String getReturnType() {
			return returnType;
		}

		public List<Expr> getPreconditions() {
			return preconditions;
		}

		public List<Expr> getPostconditions() {
			return postconditions;
		}

		public List<Stmt> getBody() {
			return body;
		}

		/**
		 * Get the declared effects of this function, in the order they were
		 * declared. These are either normalised (e.g. <code>io:database_write</code>)
		 * or raw (e.g. <code>db:w</code>).
		 *
		 * @return
		 */
		public List<String> getEffects() {
			return effects;
		}

		public Function withContracts(List<Expr> preconditions, List<Expr> postconditions) {
			return new Function(name, parameters, returnType, preconditions, postconditions, body, effects,
					getSpan());
		}

		public Function withBody(List<Stmt> body) {
			return new Function(name, parameters, returnType, preconditions, postconditions, body, effects,
					getSpan());
		}

		@Override
		public String toString() {
			return "function " + name + parameters;
		}
	}

	// =========================================================================
	// Statements
	// =========================================================================

	public interface Stmt {
		Span getSpan();

		/**
		 * Assign a value to a variable. When the initialiser is <code>null</code>
		 * this declares the variable without giving it a value.
		 */
		public static class Bind extends AbstractItem implements Stmt {
			private final Variable variable;
			private final Expr initializer;

			public Bind(Variable variable, Expr initializer, Span span) {
				super(span);
				this.variable = variable;
				this.initializer = initializer;
			}

			public Variable getVariable() {
				return variable;
			}

			public Expr getInitializer() {
				return initializer;
			}
		}

		public static class Call extends AbstractItem implements Stmt {
			private final String target;
			private final List<Expr> arguments;

			public Call(String target, List<Expr> arguments, Span span) {
				super(span);
				this.target = target;
				this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
			}

			public String getTarget() {
				return target;
			}

			public List<Expr> getArguments() {
				return arguments;
			}
		}

		public static class Return extends AbstractItem implements Stmt {
			private final Expr operand;

			public Return(Expr operand, Span span) {
				super(span);
				this.operand = operand;
			}

			/**
			 * Get the returned value, which is <code>null</code> for a function
			 * returning nothing.
			 *
			 * @return
			 */
			public Expr getOperand() {
				return operand;
			}
		}

		public static class IfElse extends AbstractItem implements Stmt {
			private final Expr condition;
			private final List<Stmt> trueBranch;
			private final List<ElseIf> elseIfs;
			private final List<Stmt> falseBranch;

			public IfElse(Expr condition, List<Stmt> trueBranch, List<ElseIf> elseIfs, List<Stmt> falseBranch,
					Span span) {
				super(span);
				this.condition = condition;
				this.trueBranch = Collections.unmodifiableList(new ArrayList<>(trueBranch));
				this.elseIfs = Collections.unmodifiableList(new ArrayList<>(elseIfs));
				this.falseBranch = falseBranch == null ? null
						: Collections.unmodifiableList(new ArrayList<>(falseBranch));
			}

			public Expr getCondition() {
				return condition;
			}

			public List<Stmt> getTrueBranch() {
				return trueBranch;
			}

			public List<ElseIf> getElseIfs() {
				return elseIfs;
			}

			/**
			 * Get the final <code>else</code> branch, or <code>null</code> if there
			 * is none.
			 *
			 * @return
			 */
			public List<Stmt> getFalseBranch() {
				return falseBranch;
			}
		}

		public static class ElseIf extends AbstractItem {
			private final Expr condition;
			private final List<Stmt> body;

			public ElseIf(Expr condition, List<Stmt> body, Span span) {
				super(span);
				this.condition = condition;
				this.body = Collections.unmodifiableList(new ArrayList<>(body));
			}

			public Expr getCondition() {
				return condition;
			}

			public List<Stmt> getBody() {
				return body;
			}
		}

		public interface Loop extends Stmt {
			List<Stmt> getBody();

			List<Expr> getInvariants();
		}

		/**
		 * A bounded counting loop <code>for v = from to to by step</code>. The
		 * upper bound is inclusive and the step defaults to one.
		 */
		public static class For extends AbstractItem implements Loop {
			private final Variable variable;
			private final Expr from;
			private final Expr to;
			private final Expr step;
			private final List<Stmt> body;
			private final List<Expr> invariants;

			public For(Variable variable, Expr from, Expr to, Expr step, List<Stmt> body, List<Expr> invariants,
					Span span) {
				super(span);
				this.variable = variable;
				this.from = from;
				this.to = to;
				this.step = step;
				this.body = Collections.unmodifiableList(new ArrayList<>(body));
				this.invariants = Collections.unmodifiableList(new ArrayList<>(invariants));
			}

			public Variable getVariable() {
				return variable;
			}

			public Expr getFrom() {
				return from;
			}

			public Expr getTo() {
				return to;
			}

			public Expr getStep() {
				return step;
			}

			@Override
			public List<Stmt> getBody() {
				return body;
			}

			@Override
			public List<Expr> getInvariants() {
				return invariants;
			}

			public For with(List<Stmt> body, List<Expr> invariants) {
				return new For(variable, from, to, step, body, invariants, getSpan());
			}
		}

		public static class While extends AbstractItem implements Loop {
			private final Expr condition;
			private final List<Stmt> body;
			private final List<Expr> invariants;

			public While(Expr condition, List<Stmt> body, List<Expr> invariants, Span span) {
				super(span);
				this.condition = condition;
				this.body = Collections.unmodifiableList(new ArrayList<>(body));
				this.invariants = Collections.unmodifiableList(new ArrayList<>(invariants));
			}

			public Expr getCondition() {
				return condition;
			}

			@Override
			public List<Stmt> getBody() {
				return body;
			}

			@Override
			public List<Expr> getInvariants() {
				return invariants;
			}

			public While with(List<Stmt> body, List<Expr> invariants) {
				return new While(condition, body, invariants, getSpan());
			}
		}
	}

	// =========================================================================
	// Expressions
	// =========================================================================

	public interface Expr {
		Span getSpan();

		/**
		 * Get the name of the type the binder assigned to this expression.
		 *
		 * @return
		 */
		String getType();

		public enum UnaryOperator {
			NOT("!"), NEGATE("-"), BITWISE_NOT("~");

			private final String symbol;

			UnaryOperator(String symbol) {
				this.symbol = symbol;
			}

			public String getSymbol() {
				return symbol;
			}
		}

		public enum BinaryOperator {
			ADD("+", true), SUB("-", false), MUL("*", true), DIV("/", false), MOD("%", false), POW("**", false),
			EQ("==", true), NEQ("!=", true), LT("<", false), LTEQ("<=", false), GT(">", false), GTEQ(">=", false),
			AND("&&", true), OR("||", true), BITAND("&", true), BITOR("|", true), BITXOR("^", true),
			SHL("<<", false), SHR(">>", false);

			private final String symbol;
			private final boolean commutative;

			BinaryOperator(String symbol, boolean commutative) {
				this.symbol = symbol;
				this.commutative = commutative;
			}

			public String getSymbol() {
				return symbol;
			}

			public boolean isCommutative() {
				return commutative;
			}

			public boolean isComparison() {
				switch (this) {
				case EQ:
				case NEQ:
				case LT:
				case LTEQ:
				case GT:
				case GTEQ:
					return true;
				default:
					return false;
				}
			}
		}

		public static abstract class AbstractExpr extends AbstractItem implements Expr {
			private final String type;

			public AbstractExpr(String type, Span span) {
				super(span);
				this.type = type;
			}

			@Override
			public String getType() {
				return type;
			}
		}

		public static class IntLiteral extends AbstractExpr {
			private final int value;

			public IntLiteral(int value, Span span) {
				super(Types.INT, span);
				this.value = value;
			}

			public int getValue() {
				return value;
			}

			@Override
			public String toString() {
				return Integer.toString(value);
			}
		}

		public static class FloatLiteral extends AbstractExpr {
			private final double value;

			public FloatLiteral(double value, Span span) {
				super(Types.FLOAT, span);
				this.value = value;
			}

			public double getValue() {
				return value;
			}

			@Override
			public String toString() {
				return Double.toString(value);
			}
		}

		public static class BoolLiteral extends AbstractExpr {
			private final boolean value;

			public BoolLiteral(boolean value, Span span) {
				super(Types.BOOL, span);
				this.value = value;
			}

			public boolean getValue() {
				return value;
			}

			@Override
			public String toString() {
				return Boolean.toString(value);
			}
		}

		public static class StringLiteral extends AbstractExpr {
			private final String value;

			public StringLiteral(String value, Span span) {
				super(Types.STRING, span);
				this.value = value;
			}

			public String getValue() {
				return value;
			}

			@Override
			public String toString() {
				return "\"" + value + "\"";
			}
		}

		public static class VariableAccess extends AbstractExpr {
			private final Variable variable;

			public VariableAccess(Variable variable, Span span) {
				super(variable.getType(), span);
				this.variable = variable;
			}

			public Variable getVariable() {
				return variable;
			}

			@Override
			public String toString() {
				return variable.getName();
			}
		}

		public static class Unary extends AbstractExpr {
			private final UnaryOperator operator;
			private final Expr operand;

			public Unary(UnaryOperator operator, Expr operand, String type, Span span) {
				super(type, span);
				this.operator = operator;
				this.operand = operand;
			}

			public UnaryOperator getOperator() {
				return operator;
			}

			public Expr getOperand() {
				return operand;
			}
		}

		public static class Binary extends AbstractExpr {
			private final BinaryOperator operator;
			private final Expr lhs;
			private final Expr rhs;

			public Binary(BinaryOperator operator, Expr lhs, Expr rhs, String type, Span span) {
				super(type, span);
				this.operator = operator;
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public BinaryOperator getOperator() {
				return operator;
			}

			public Expr getLeftHandSide() {
				return lhs;
			}

			public Expr getRightHandSide() {
				return rhs;
			}
		}

		public static class Implies extends AbstractExpr {
			private final Expr lhs;
			private final Expr rhs;

			public Implies(Expr lhs, Expr rhs, Span span) {
				super(Types.BOOL, span);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public Expr getLeftHandSide() {
				return lhs;
			}

			public Expr getRightHandSide() {
				return rhs;
			}
		}

		public static class Conditional extends AbstractExpr {
			private final Expr condition;
			private final Expr trueBranch;
			private final Expr falseBranch;

			public Conditional(Expr condition, Expr trueBranch, Expr falseBranch, String type, Span span) {
				super(type, span);
				this.condition = condition;
				this.trueBranch = trueBranch;
				this.falseBranch = falseBranch;
			}

			public Expr getCondition() {
				return condition;
			}

			public Expr getTrueBranch() {
				return trueBranch;
			}

			public Expr getFalseBranch() {
				return falseBranch;
			}
		}

		public static abstract class Quantifier extends AbstractExpr {
			private final List<Variable> variables;
			private final Expr body;

			public Quantifier(Collection<Variable> variables, Expr body, Span span) {
				super(Types.BOOL, span);
				this.variables = Collections.unmodifiableList(new ArrayList<>(variables));
				this.body = body;
			}

			public List<Variable> getVariables() {
				return variables;
			}

			public Expr getBody() {
				return body;
			}
		}

		public static class UniversalQuantifier extends Quantifier {
			public UniversalQuantifier(Collection<Variable> variables, Expr body, Span span) {
				super(variables, body, span);
			}
		}

		public static class ExistentialQuantifier extends Quantifier {
			public ExistentialQuantifier(Collection<Variable> variables, Expr body, Span span) {
				super(variables, body, span);
			}
		}

		public static class Invoke extends AbstractExpr {
			private final String target;
			private final List<Expr> arguments;

			public Invoke(String target, List<Expr> arguments, String type, Span span) {
				super(type, span);
				this.target = target;
				this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
			}

			public String getTarget() {
				return target;
			}

			public List<Expr> getArguments() {
				return arguments;
			}
		}

		public static class ArrayAccess extends AbstractExpr {
			private final Expr source;
			private final Expr index;

			public ArrayAccess(Expr source, Expr index, String type, Span span) {
				super(type, span);
				this.source = source;
				this.index = index;
			}

			public Expr getSource() {
				return source;
			}

			public Expr getIndex() {
				return index;
			}
		}

		public static class FieldAccess extends AbstractExpr {
			private final Expr source;
			private final String field;

			public FieldAccess(Expr source, String field, String type, Span span) {
				super(type, span);
				this.source = source;
				this.field = field;
			}

			public Expr getSource() {
				return source;
			}

			public String getField() {
				return field;
			}
		}

		public static class CollectionLiteral extends AbstractExpr {
			private final List<Expr> elements;

			public CollectionLiteral(List<Expr> elements, String type, Span span) {
				super(type, span);
				this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
			}

			public List<Expr> getElements() {
				return elements;
			}
		}
	}

	// =======================================================
	// Constructor API (for convenience)
	// =======================================================

	public static Expr.IntLiteral CONST(int value) {
		return new Expr.IntLiteral(value, Span.NONE);
	}

	public static Expr.BoolLiteral CONST(boolean value) {
		return new Expr.BoolLiteral(value, Span.NONE);
	}

	public static Expr.VariableAccess VAR(Variable v) {
		return new Expr.VariableAccess(v, Span.NONE);
	}

	public static Expr.Unary NOT(Expr operand) {
		return new Expr.Unary(Expr.UnaryOperator.NOT, operand, Types.BOOL, operand.getSpan());
	}

	public static Expr.Binary AND(Expr lhs, Expr rhs) {
		return new Expr.Binary(Expr.BinaryOperator.AND, lhs, rhs, Types.BOOL, lhs.getSpan());
	}

	public static Expr.Binary OR(Expr lhs, Expr rhs) {
		return new Expr.Binary(Expr.BinaryOperator.OR, lhs, rhs, Types.BOOL, lhs.getSpan());
	}

	/**
	 * Construct the conjunction of zero or more expressions, where the empty
	 * conjunction is <code>true</code>.
	 *
	 * @param operands
	 * @return
	 */
	public static Expr AND(List<Expr> operands) {
		if (operands.isEmpty()) {
			return CONST(true);
		}
		Expr result = operands.get(0);
		for (int i = 1; i < operands.size(); ++i) {
			result = AND(result, operands.get(i));
		}
		return result;
	}

	/**
	 * Construct a binary comparison, whose result is always boolean.
	 *
	 * @param op
	 * @param lhs
	 * @param rhs
	 * @return
	 */
	public static Expr.Binary COMPARE(Expr.BinaryOperator op, Expr lhs, Expr rhs) {
		if (!op.isComparison()) {
			throw new IllegalArgumentException("invalid comparison operator (" + op + ")");
		}
		return new Expr.Binary(op, lhs, rhs, Types.BOOL, lhs.getSpan());
	}

	/**
	 * Construct an arithmetic operation whose type is that of the left-hand side.
	 *
	 * @param op
	 * @param lhs
	 * @param rhs
	 * @return
	 */
	public static Expr.Binary ARITH(Expr.BinaryOperator op, Expr lhs, Expr rhs) {
		return new Expr.Binary(op, lhs, rhs, lhs.getType(), lhs.getSpan());
	}
}
