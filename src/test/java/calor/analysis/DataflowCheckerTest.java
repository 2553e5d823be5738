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
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Collections;

import org.junit.jupiter.api.Test;

import calor.core.BoundModule.Expr;
import calor.core.BoundModule.Expr.BinaryOperator;
import calor.core.BoundModule.Function;
import calor.core.BoundModule.Stmt;
import calor.core.BoundModule.Types;
import calor.core.Diagnostic;
import calor.core.DiagnosticBag;
import calor.core.DiagnosticCode;

public class DataflowCheckerTest {

	private static DiagnosticBag check(Function f) {
		DiagnosticBag bag = new DiagnosticBag();
		int n = new DataflowChecker().check(f, bag);
		assertEquals(bag.size(), n);
		return bag;
	}

	@Test
	public void cleanFunction() {
		Function f = function("f").parameter(intVar("x")).returns(Types.INT)
				.body(bind(intVar("y"), bin(BinaryOperator.ADD, var("x"), i(1)), 2), ret(var("y"), 3)).build();
		assertTrue(check(f).isEmpty());
	}

	@Test
	public void readBeforeAssignment() {
		Function f = function("f").returns(Types.INT).body(bind(intVar("x"), null, 2),
				ret(bin(BinaryOperator.ADD, var("x"), var("x")), 3)).build();
		DiagnosticBag bag = check(f);
		assertEquals(1, bag.size());
		Diagnostic d = bag.get(0);
		assertEquals(DiagnosticCode.UNINITIALIZED_VARIABLE, d.getCode());
		assertEquals(Diagnostic.Severity.WARNING, d.getSeverity());
		assertEquals("Variable 'x' may be used before it is assigned", d.getMessage());
	}

	@Test
	public void assignedOnEveryBranch() {
		Stmt branch = ifElse(bool("c"), list((Stmt) bind(intVar("x"), i(1), 4)),
				list((Stmt) bind(intVar("x"), i(2), 6)), 3);
		Function f = function("f").parameter(boolVar("c")).returns(Types.INT)
				.body(bind(intVar("x"), null, 2), branch, ret(var("x"), 7)).build();
		assertTrue(check(f).isEmpty());
	}

	@Test
	public void assignedOnOneBranch() {
		Stmt branch = ifElse(bool("c"), list((Stmt) bind(intVar("x"), i(1), 4)), null, 3);
		Function f = function("f").parameter(boolVar("c")).returns(Types.INT)
				.body(bind(intVar("x"), null, 2), branch, ret(var("x"), 5)).build();
		DiagnosticBag bag = check(f);
		assertEquals(1, bag.size());
		assertEquals(DiagnosticCode.UNINITIALIZED_VARIABLE, bag.get(0).getCode());
	}

	@Test
	public void assignedOnlyInLoop() {
		Stmt w = loop(bool("c"), Collections.<Expr>emptyList(), 3, bind(intVar("x"), i(1), 4));
		Function f = function("f").parameter(boolVar("c")).returns(Types.INT)
				.body(bind(intVar("x"), null, 2), w, ret(var("x"), 5)).build();
		assertEquals(1, check(f).size());
	}

	@Test
	public void forLoopVariableIsAssigned() {
		Stmt s = loop(intVar("i"), i(0), i(9), null, 2, call("print", 3, var("i")));
		assertTrue(check(function("f").body(s).build()).isEmpty());
	}

	@Test
	public void deadStore() {
		Function f = function("f").parameter(intVar("x")).returns(Types.INT)
				.body(bind(intVar("y"), i(1), 2), ret(var("x"), 3)).build();
		DiagnosticBag bag = check(f);
		assertEquals(1, bag.size());
		Diagnostic d = bag.get(0);
		assertEquals(DiagnosticCode.DEAD_STORE, d.getCode());
		assertEquals("Value assigned to 'y' is never used", d.getMessage());
		assertEquals(span(2), d.getSpan());
	}

	@Test
	public void underscoreIsNotDeadStore() {
		Function f = function("f").body(bind(intVar("_ignored"), i(1), 2)).build();
		assertTrue(check(f).isEmpty());
	}

	@Test
	public void readInPostcondition() {
		Function f = function("f").ensures(bin(BinaryOperator.GT, var("y"), i(0))).body(bind(intVar("y"), i(1), 2))
				.build();
		assertTrue(check(f).isEmpty());
	}

	@Test
	public void readInLoopInvariant() {
		Stmt w = loop(bool("c"), Collections.<Expr>singletonList(bin(BinaryOperator.GTEQ, var("n"), i(0))), 3,
				bind(intVar("i"), i(1), 4), call("print", 5, var("i")));
		Function f = function("f").parameter(boolVar("c")).body(bind(intVar("n"), i(0), 2), w).build();
		assertTrue(check(f).isEmpty());
	}

	@Test
	public void parameterReassignment() {
		Function f = function("f").parameter(intVar("x")).body(bind(intVar("x"), i(0), 2)).build();
		assertTrue(check(f).isEmpty());
	}
}
