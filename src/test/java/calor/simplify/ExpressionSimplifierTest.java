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
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Collections;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import calor.core.BoundModule;
import calor.core.BoundModule.Expr;
import calor.core.BoundModule.Expr.BinaryOperator;
import calor.core.BoundModule.Span;
import calor.core.BoundModule.Types;
import calor.core.Diagnostic;
import calor.core.DiagnosticBag;
import calor.core.DiagnosticCode;

public class ExpressionSimplifierTest {

	private static Expr simplify(Expr e) {
		return ExpressionSimplifier.simplifyToFixedPoint(e);
	}

	private static int intValue(Expr e) {
		assertInstanceOf(Expr.IntLiteral.class, e);
		return ((Expr.IntLiteral) e).getValue();
	}

	private static boolean boolValue(Expr e) {
		assertInstanceOf(Expr.BoolLiteral.class, e);
		return ((Expr.BoolLiteral) e).getValue();
	}

	// ======================================================================
	// Constant folding
	// ======================================================================

	@ParameterizedTest
	@CsvSource({ "ADD,2,3,5", "SUB,2,3,-1", "MUL,4,5,20", "DIV,7,2,3", "MOD,7,2,1", "BITAND,6,3,2", "BITOR,6,3,7",
			"BITXOR,6,3,5", "SHL,1,4,16", "SHR,16,2,4" })
	public void integerFolding(BinaryOperator op, int lhs, int rhs, int expected) {
		assertEquals(expected, intValue(simplify(bin(op, i(lhs), i(rhs)))));
	}

	@ParameterizedTest
	@CsvSource({ "LT,1,2,true", "LTEQ,2,2,true", "GT,1,2,false", "GTEQ,1,2,false", "EQ,3,3,true", "NEQ,3,3,false" })
	public void integerComparisonFolding(BinaryOperator op, int lhs, int rhs, boolean expected) {
		assertEquals(expected, boolValue(simplify(bin(op, i(lhs), i(rhs)))));
	}

	@Test
	public void floatFolding() {
		Expr r = simplify(bin(BinaryOperator.POW, f(2.0), f(10.0)));
		assertInstanceOf(Expr.FloatLiteral.class, r);
		assertEquals(1024.0, ((Expr.FloatLiteral) r).getValue());
	}

	@Test
	public void mixedFolding() {
		Expr r = simplify(bin(BinaryOperator.ADD, i(1), f(0.5)));
		assertInstanceOf(Expr.FloatLiteral.class, r);
		assertEquals(1.5, ((Expr.FloatLiteral) r).getValue());
	}

	@Test
	public void floatEqualityIsExact() {
		assertFalse(boolValue(simplify(bin(BinaryOperator.EQ, bin(BinaryOperator.ADD, f(0.1), f(0.2)), f(0.3)))));
	}

	@Test
	public void integerDivisionByZeroIsNotFolded() {
		Expr e = bin(BinaryOperator.DIV, i(5), i(0));
		ExpressionSimplifier s = new ExpressionSimplifier();
		assertSame(e, s.simplify(e));
		assertFalse(s.isChanged());
	}

	@Test
	public void integerRemainderByZeroIsNotFolded() {
		Expr e = bin(BinaryOperator.MOD, var("x"), i(0));
		assertSame(e, simplify(e));
	}

	@Test
	public void floatDivisionByZeroIsNotFolded() {
		Expr e = bin(BinaryOperator.DIV, f(1.0), f(0.0));
		assertSame(e, simplify(e));
	}

	@Test
	public void mixedDivisionByZeroIsNotFolded() {
		Expr e = bin(BinaryOperator.DIV, i(1), f(0.0));
		assertSame(e, simplify(e));
	}

	@Test
	public void negationFolding() {
		Expr e = new Expr.Unary(Expr.UnaryOperator.NEGATE, i(4), Types.INT, Span.NONE);
		assertEquals(-4, intValue(simplify(e)));
	}

	// ======================================================================
	// Algebraic identities
	// ======================================================================

	@Test
	public void additiveIdentity() {
		assertTrue(StructuralEquality.equal(var("x"), simplify(bin(BinaryOperator.ADD, var("x"), i(0)))));
		assertTrue(StructuralEquality.equal(var("x"), simplify(bin(BinaryOperator.ADD, i(0), var("x")))));
	}

	@Test
	public void multiplicativeIdentities() {
		assertTrue(StructuralEquality.equal(var("x"), simplify(bin(BinaryOperator.MUL, var("x"), i(1)))));
		assertEquals(0, intValue(simplify(bin(BinaryOperator.MUL, i(0), var("x")))));
		assertTrue(StructuralEquality.equal(var("x"), simplify(bin(BinaryOperator.DIV, var("x"), i(1)))));
		assertEquals(0, intValue(simplify(bin(BinaryOperator.MOD, var("x"), i(1)))));
	}

	@Test
	public void commutativeSubtraction() {
		Expr ab = bin(BinaryOperator.ADD, var("a"), var("b"));
		Expr ba = bin(BinaryOperator.ADD, var("b"), var("a"));
		assertEquals(0, intValue(simplify(bin(BinaryOperator.SUB, ab, ba))));
	}

	@Test
	public void floatSelfSubtraction() {
		Expr x = BoundModule.VAR(floatVar("x"));
		Expr r = simplify(bin(BinaryOperator.SUB, x, x));
		assertInstanceOf(Expr.FloatLiteral.class, r);
		assertEquals(0.0, ((Expr.FloatLiteral) r).getValue());
	}

	// ======================================================================
	// Boolean identities
	// ======================================================================

	@Test
	public void trueConjunct() {
		Expr cmp = bin(BinaryOperator.GTEQ, var("x"), i(0));
		Expr r = simplify(BoundModule.AND(BoundModule.CONST(true), cmp));
		assertTrue(StructuralEquality.equal(cmp, r));
	}

	@Test
	public void commutativeEqualityConjunction() {
		Expr ab = bin(BinaryOperator.EQ, var("a"), var("b"));
		Expr ba = bin(BinaryOperator.EQ, var("b"), var("a"));
		Expr r = simplify(BoundModule.AND(ab, ba));
		assertInstanceOf(Expr.Binary.class, r);
		assertEquals(BinaryOperator.EQ, ((Expr.Binary) r).getOperator());
	}

	@Test
	public void excludedMiddle() {
		DiagnosticBag bag = new DiagnosticBag();
		Expr r = ExpressionSimplifier.simplifyToFixedPoint(BoundModule.OR(bool("x"), BoundModule.NOT(bool("x"))),
				ExpressionSimplifier.DEFAULT_MAX_ITERATIONS, bag);
		assertTrue(boolValue(r));
		assertEquals(1, bag.size());
		assertEquals(DiagnosticCode.CONTRACT_TAUTOLOGY, bag.get(0).getCode());
		assertEquals(Diagnostic.Severity.INFO, bag.get(0).getSeverity());
	}

	@Test
	public void contradictoryConjunction() {
		DiagnosticBag bag = new DiagnosticBag();
		Expr r = ExpressionSimplifier.simplifyToFixedPoint(BoundModule.AND(bool("x"), BoundModule.NOT(bool("x"))),
				ExpressionSimplifier.DEFAULT_MAX_ITERATIONS, bag);
		assertFalse(boolValue(r));
		assertEquals(1, bag.size());
		assertEquals(DiagnosticCode.CONTRACT_CONTRADICTION, bag.get(0).getCode());
		assertEquals(Diagnostic.Severity.WARNING, bag.get(0).getSeverity());
	}

	@Test
	public void selfInequality() {
		assertFalse(boolValue(simplify(bin(BinaryOperator.NEQ, var("x"), var("x")))));
	}

	@Test
	public void equalityWithFalse() {
		Expr r = simplify(bin(BinaryOperator.EQ, bool("b"), BoundModule.CONST(false)));
		assertInstanceOf(Expr.Unary.class, r);
		assertEquals(Expr.UnaryOperator.NOT, ((Expr.Unary) r).getOperator());
	}

	@Test
	public void doubleNegation() {
		Expr r = simplify(BoundModule.NOT(BoundModule.NOT(bool("b"))));
		assertTrue(StructuralEquality.equal(bool("b"), r));
	}

	@Test
	public void deMorgan() {
		Expr r = simplify(BoundModule.NOT(BoundModule.AND(bool("a"), bool("b"))));
		assertInstanceOf(Expr.Binary.class, r);
		Expr.Binary b = (Expr.Binary) r;
		assertEquals(BinaryOperator.OR, b.getOperator());
		assertTrue(StructuralEquality.equal(BoundModule.NOT(bool("a")), b.getLeftHandSide()));
		assertTrue(StructuralEquality.equal(BoundModule.NOT(bool("b")), b.getRightHandSide()));
	}

	// ======================================================================
	// Implication, conditionals and quantifiers
	// ======================================================================

	@Test
	public void selfImplication() {
		DiagnosticBag bag = new DiagnosticBag();
		Expr p = bin(BinaryOperator.GTEQ, var("x"), i(0));
		Expr r = ExpressionSimplifier.simplifyToFixedPoint(new Expr.Implies(p, p, Span.NONE), 10, bag);
		assertTrue(boolValue(r));
		assertEquals(1, bag.size());
		assertEquals(DiagnosticCode.CONTRACT_TAUTOLOGY, bag.get(0).getCode());
	}

	@Test
	public void implicationFromTrue() {
		Expr p = bin(BinaryOperator.GT, var("x"), i(0));
		Expr r = simplify(new Expr.Implies(BoundModule.CONST(true), p, Span.NONE));
		assertTrue(StructuralEquality.equal(p, r));
	}

	@Test
	public void implicationToFalse() {
		Expr r = simplify(new Expr.Implies(bool("p"), BoundModule.CONST(false), Span.NONE));
		assertTrue(StructuralEquality.equal(BoundModule.NOT(bool("p")), r));
	}

	@Test
	public void conditionalOfBooleans() {
		Expr c = bin(BinaryOperator.LT, var("x"), var("y"));
		Expr r = simplify(new Expr.Conditional(c, BoundModule.CONST(true), BoundModule.CONST(false), Types.BOOL,
				Span.NONE));
		assertTrue(StructuralEquality.equal(c, r));
	}

	@Test
	public void conditionalWithEqualBranches() {
		Expr r = simplify(new Expr.Conditional(bool("c"), var("x"), var("x"), Types.INT, Span.NONE));
		assertTrue(StructuralEquality.equal(var("x"), r));
	}

	@Test
	public void trivialQuantifier() {
		Expr q = new Expr.UniversalQuantifier(Collections.singletonList(intVar("i")),
				bin(BinaryOperator.EQ, var("i"), var("i")), Span.NONE);
		assertTrue(boolValue(simplify(q)));
	}

	// ======================================================================
	// Fixed point
	// ======================================================================

	@Test
	public void unchangedExpressionIsIdentical() {
		Expr e = BoundModule.AND(bin(BinaryOperator.GT, var("x"), i(0)), bin(BinaryOperator.LT, var("y"), var("x")));
		ExpressionSimplifier s = new ExpressionSimplifier();
		assertSame(e, s.simplify(e));
		assertFalse(s.isChanged());
	}

	@Test
	public void fixedPointIsIdempotent() {
		Expr eq = bin(BinaryOperator.EQ, bin(BinaryOperator.ADD, var("x"), i(0)), bin(BinaryOperator.ADD, i(1), i(2)));
		Expr e = BoundModule.OR(BoundModule.CONST(false), BoundModule.AND(eq, bool("b")));
		Expr once = simplify(e);
		ExpressionSimplifier s = new ExpressionSimplifier();
		Expr twice = s.simplify(once);
		assertFalse(s.isChanged());
		assertSame(once, twice);
	}

	@Test
	public void deeplyNestedExpression() {
		Expr e = var("x");
		for (int n = 0; n != 1000; ++n) {
			e = bin(BinaryOperator.ADD, e, i(0));
		}
		assertTrue(StructuralEquality.equal(var("x"), simplify(e)));
	}

	@Test
	public void invalidIterationLimit() {
		assertThrows(IllegalArgumentException.class,
				() -> ExpressionSimplifier.simplifyToFixedPoint(var("x"), 0, null));
	}
}
