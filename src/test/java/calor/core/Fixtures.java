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
import java.util.Collections;
import java.util.List;

import calor.core.BoundModule.Expr;
import calor.core.BoundModule.Function;
import calor.core.BoundModule.Span;
import calor.core.BoundModule.Stmt;
import calor.core.BoundModule.Types;
import calor.core.BoundModule.Variable;

/**
 * Shorthand for constructing bound modules in tests.
 */
public class Fixtures {

	public static Span span(int line) {
		return new Span(line * 10, 1, line, 1);
	}

	public static Variable intVar(String name) {
		return new Variable(name, Types.INT);
	}

	public static Variable floatVar(String name) {
		return new Variable(name, Types.FLOAT);
	}

	public static Variable boolVar(String name) {
		return new Variable(name, Types.BOOL);
	}

	public static Variable strVar(String name) {
		return new Variable(name, Types.STRING);
	}

	public static Variable param(String name, String type, int line) {
		return new Variable(name, type, false, span(line));
	}

	public static Expr.VariableAccess var(String name) {
		return BoundModule.VAR(intVar(name));
	}

	public static Expr.VariableAccess bool(String name) {
		return BoundModule.VAR(boolVar(name));
	}

	public static Expr.IntLiteral i(int value) {
		return BoundModule.CONST(value);
	}

	public static Expr.FloatLiteral f(double value) {
		return new Expr.FloatLiteral(value, Span.NONE);
	}

	public static Expr.Binary bin(Expr.BinaryOperator op, Expr lhs, Expr rhs) {
		if (op.isComparison()) {
			return BoundModule.COMPARE(op, lhs, rhs);
		} else if (op == Expr.BinaryOperator.AND) {
			return BoundModule.AND(lhs, rhs);
		} else if (op == Expr.BinaryOperator.OR) {
			return BoundModule.OR(lhs, rhs);
		} else {
			return BoundModule.ARITH(op, lhs, rhs);
		}
	}

	public static Expr.Binary bin(Expr.BinaryOperator op, Expr lhs, Expr rhs, int line) {
		return new Expr.Binary(op, lhs, rhs, bin(op, lhs, rhs).getType(), span(line));
	}

	public static Expr.Invoke invoke(String target, String type, Expr... args) {
		return new Expr.Invoke(target, Arrays.asList(args), type, Span.NONE);
	}

	public static Expr.Invoke invoke(String target, String type, int line, Expr... args) {
		return new Expr.Invoke(target, Arrays.asList(args), type, span(line));
	}

	public static Stmt.Bind bind(Variable v, Expr init, int line) {
		return new Stmt.Bind(v, init, span(line));
	}

	public static Stmt.Call call(String target, int line, Expr... args) {
		return new Stmt.Call(target, Arrays.asList(args), span(line));
	}

	public static Stmt.Return ret(Expr operand, int line) {
		return new Stmt.Return(operand, span(line));
	}

	public static Stmt.IfElse ifElse(Expr condition, List<Stmt> trueBranch, List<Stmt> falseBranch, int line) {
		return new Stmt.IfElse(condition, trueBranch, Collections.<Stmt.ElseIf>emptyList(), falseBranch, span(line));
	}

	public static Stmt.While loop(Expr condition, List<Expr> invariants, int line, Stmt... body) {
		return new Stmt.While(condition, Arrays.asList(body), invariants, span(line));
	}

	public static Stmt.For loop(Variable v, Expr from, Expr to, Expr step, int line, Stmt... body) {
		return new Stmt.For(v, from, to, step, Arrays.asList(body), Collections.<Expr>emptyList(), span(line));
	}

	@SafeVarargs
	public static <T> List<T> list(T... items) {
		return new ArrayList<>(Arrays.asList(items));
	}

	/**
	 * Build a function from its parts. Unlisted parts are empty.
	 */
	public static class FunctionBuilder {
		private final String name;
		private final List<Variable> parameters = new ArrayList<>();
		private String returnType = Types.VOID;
		private final List<Expr> preconditions = new ArrayList<>();
		private final List<Expr> postconditions = new ArrayList<>();
		private final List<Stmt> body = new ArrayList<>();
		private final List<String> effects = new ArrayList<>();

		public FunctionBuilder(String name) {
			this.name = name;
		}

		public FunctionBuilder parameter(Variable v) {
			parameters.add(v);
			return this;
		}

		public FunctionBuilder returns(String type) {
			this.returnType = type;
			return this;
		}

		public FunctionBuilder requires(Expr e) {
			preconditions.add(e);
			return this;
		}

		public FunctionBuilder ensures(Expr e) {
			postconditions.add(e);
			return this;
		}

		public FunctionBuilder body(Stmt... stmts) {
			body.addAll(Arrays.asList(stmts));
			return this;
		}

		public FunctionBuilder effects(String... names) {
			effects.addAll(Arrays.asList(names));
			return this;
		}

		public Function build() {
			return new Function(name, parameters, returnType, preconditions, postconditions, body, effects, span(1));
		}
	}

	public static FunctionBuilder function(String name) {
		return new FunctionBuilder(name);
	}

	public static BoundModule module(Function... functions) {
		return new BoundModule("test", Arrays.asList(functions));
	}
}
