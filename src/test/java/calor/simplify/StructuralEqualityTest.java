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
package calor.simplify;

import static calor.core.Fixtures.*;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import calor.core.BoundModule;
import calor.core.BoundModule.Expr;
import calor.core.BoundModule.Expr.BinaryOperator;
import calor.core.BoundModule.Span;

public class StructuralEqualityTest {

	@Test
	public void distinctNodesSameShape() {
		Expr a = bin(BinaryOperator.MUL, var("x"), bin(BinaryOperator.ADD, var("y"), i(1)));
		Expr b = bin(BinaryOperator.MUL, var("x"), bin(BinaryOperator.ADD, var("y"), i(1)));
		assertTrue(StructuralEquality.equal(a, b));
	}

	@Test
	public void spansAreIgnored() {
		Expr a = new Expr.IntLiteral(3, span(1));
		Expr b = new Expr.IntLiteral(3, span(7));
		assertTrue(StructuralEquality.equal(a, b));
	}

	@Test
	public void differentLiteralKinds() {
		assertFalse(StructuralEquality.equal(i(1), f(1.0)));
	}

	@Test
	public void differentVariables() {
		assertFalse(StructuralEquality.equal(var("x"), var("y")));
		assertFalse(StructuralEquality.equal(var("x"), BoundModule.VAR(floatVar("x"))));
	}

	@Test
	public void commutativeOperands() {
		Expr ab = bin(BinaryOperator.ADD, var("a"), var("b"));
		Expr ba = bin(BinaryOperator.ADD, var("b"), var("a"));
		assertFalse(StructuralEquality.equal(ab, ba));
		assertTrue(StructuralEquality.equalOrCommutative(ab, ba));
	}

	@Test
	public void nonCommutativeOperands() {
		Expr ab = bin(BinaryOperator.SUB, var("a"), var("b"));
		Expr ba = bin(BinaryOperator.SUB, var("b"), var("a"));
		assertFalse(StructuralEquality.equalOrCommutative(ab, ba));
	}

	@Test
	public void negation() {
		Expr p = bin(BinaryOperator.LT, var("x"), i(0));
		assertTrue(StructuralEquality.isNegationOf(BoundModule.NOT(p), p));
		assertFalse(StructuralEquality.isNegationOf(p, BoundModule.NOT(p)));
	}

	@Test
	public void invocations() {
		Expr a = invoke("len", "i32", var("xs"));
		Expr b = invoke("len", "i32", var("xs"));
		Expr c = invoke("size", "i32", var("xs"));
		assertTrue(StructuralEquality.equal(a, b));
		assertFalse(StructuralEquality.equal(a, c));
	}

	@Test
	public void implications() {
		Expr a = new Expr.Implies(bool("p"), bool("q"), Span.NONE);
		Expr b = new Expr.Implies(bool("q"), bool("p"), Span.NONE);
		assertFalse(StructuralEquality.equal(a, b));
	}
}
