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
package calor.analysis;

import static calor.core.Fixtures.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import calor.core.BoundModule;
import calor.core.BoundModule.Expr;
import calor.core.BoundModule.Expr.BinaryOperator;
import calor.core.BoundModule.Function;
import calor.core.BoundModule.Stmt;
import calor.core.BoundModule.Types;
import calor.core.BoundModule.Variable;
import calor.core.DiagnosticBag;
import calor.core.DiagnosticCode;

public class NullDereferenceCheckerTest {
	private static final String OPTION = "Option<i32>";

	private static DiagnosticBag check(Function f) {
		DiagnosticBag bag = new DiagnosticBag();
		new NullDereferenceChecker().check(f, bag);
		return bag;
	}

	private static Variable opt(String name) {
		return new Variable(name, OPTION);
	}

	private static Expr.Invoke isSome(String name) {
		return invoke(name + ".is_some", Types.BOOL);
	}

	@Test
	public void unwrapWithoutCheck() {
		DiagnosticBag bag = check(function("f").parameter(opt("opt")).body(call("opt.unwrap", 2)).build());
		assertEquals(1, bag.size());
		assertEquals(DiagnosticCode.UNSAFE_UNWRAP, bag.get(0).getCode());
		assertEquals("Unsafe unwrap on 'opt' without prior Some/Ok check", bag.get(0).getMessage());
		assertEquals(span(2), bag.get(0).getSpan());
	}

	@Test
	public void unwrapWithinExpression() {
		Function f = function("f").parameter(opt("res"))
				.body(bind(intVar("v"), invoke("res.expect", Types.INT, 2, new Expr.StringLiteral("no value",
						BoundModule.Span.NONE)), 2))
				.build();
		DiagnosticBag bag = check(f);
		assertEquals(1, bag.size());
		assertEquals(span(2), bag.get(0).getSpan());
	}

	@Test
	public void unwrapWithoutReceiver() {
		DiagnosticBag bag = check(function("f").parameter(opt("opt"))
				.body(call("unwrap", 2, BoundModule.VAR(opt("opt")))).build());
		assertEquals(1, bag.size());
		assertEquals(DiagnosticCode.NULL_DEREFERENCE, bag.get(0).getCode());
		assertEquals("Potential unsafe unwrap without prior Option/Result check", bag.get(0).getMessage());
	}

	@Test
	public void fallbackIsSafe() {
		Function f = function("f").parameter(opt("opt"))
				.body(ret(invoke("opt.unwrap_or", Types.INT, 2, i(0)), 2), call("opt.unwrap_or_default", 3))
				.build();
		assertTrue(check(f).isEmpty());
	}

	@Test
	public void unsafeTargets() {
		assertTrue(NullDereferenceChecker.isUnsafeUnwrap("opt.unwrap"));
		assertTrue(NullDereferenceChecker.isUnsafeUnwrap("opt.UNWRAP"));
		assertTrue(NullDereferenceChecker.isUnsafeUnwrap("xs.get_unchecked"));
		assertTrue(NullDereferenceChecker.isUnsafeUnwrap("force_unwrap"));
		assertFalse(NullDereferenceChecker.isUnsafeUnwrap("opt.unwrap_or_else"));
		assertFalse(NullDereferenceChecker.isUnsafeUnwrap("opt.map"));
	}

	@Test
	public void guardedBySomeCheck() {
		Stmt body = ifElse(isSome("opt"), list((Stmt) call("opt.unwrap", 3)), null, 2);
		assertTrue(check(function("f").parameter(opt("opt")).body(body).build()).isEmpty());
	}

	@Test
	public void elseBranchIsUnchecked() {
		Stmt body = ifElse(isSome("opt"), list((Stmt) ret(i(0), 3)), list((Stmt) call("opt.unwrap", 4)), 2);
		assertEquals(1, check(function("f").parameter(opt("opt")).body(body).build()).size());
	}

	@Test
	public void checkOnOtherReceiver() {
		Stmt body = ifElse(isSome("a"), list((Stmt) call("b.unwrap", 3)), null, 2);
		assertEquals(1, check(function("f").parameter(opt("a")).parameter(opt("b")).body(body).build()).size());
	}

	@Test
	public void guardedByNoneComparison() {
		Expr notNone = bin(BinaryOperator.NEQ, BoundModule.VAR(opt("opt")), invoke("None", OPTION));
		Stmt body = ifElse(notNone, list((Stmt) call("opt.unwrap", 3)), null, 2);
		assertTrue(check(function("f").parameter(opt("opt")).body(body).build()).isEmpty());
	}

	@Test
	public void guardedByNegatedErrorCheck() {
		Stmt body = ifElse(BoundModule.NOT(invoke("res.is_err", Types.BOOL)), list((Stmt) call("res.unwrap", 3)),
				null, 2);
		assertTrue(check(function("f").parameter(opt("res")).body(body).build()).isEmpty());
	}

	@Test
	public void guardedByPrecondition() {
		Function f = function("f").parameter(opt("res")).requires(invoke("res.is_ok", Types.BOOL))
				.body(call("res.unwrap", 2)).build();
		assertTrue(check(f).isEmpty());
	}

	@Test
	public void guardedWithinConjunction() {
		Expr e = BoundModule.AND(isSome("opt"),
				bin(BinaryOperator.GT, invoke("opt.unwrap", Types.INT), i(0)));
		assertTrue(check(function("f").parameter(opt("opt")).returns(Types.BOOL).body(ret(e, 2)).build()).isEmpty());
	}

	@Test
	public void reassignedAfterCheck() {
		Stmt body = ifElse(isSome("opt"),
				list((Stmt) bind(opt("opt"), invoke("lookup", OPTION), 3), call("opt.unwrap", 4)), null, 2);
		DiagnosticBag bag = check(function("f").parameter(opt("opt")).body(body).build());
		assertEquals(1, bag.size());
		assertEquals(span(4), bag.get(0).getSpan());
	}
}
