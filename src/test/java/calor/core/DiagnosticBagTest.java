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

import static calor.core.Fixtures.span;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import calor.core.BoundModule.Span;

public class DiagnosticBagTest {

	@Test
	public void reportInOrder() {
		DiagnosticBag bag = new DiagnosticBag();
		bag.reportInfo(span(1), DiagnosticCode.CONTRACT_SIMPLIFIED, "a");
		bag.reportWarning(span(2), DiagnosticCode.DEAD_STORE, "b");
		assertEquals(2, bag.size());
		assertEquals("a", bag.get(0).getMessage());
		assertEquals("b", bag.get(1).getMessage());
		assertFalse(bag.hasErrors());
		bag.reportError(span(3), DiagnosticCode.DIVISION_BY_ZERO, "c");
		assertTrue(bag.hasErrors());
	}

	@Test
	public void countFrom() {
		DiagnosticBag bag = new DiagnosticBag();
		bag.reportInfo(span(1), DiagnosticCode.LOOP_INVARIANT_SYNTHESIZED, "a");
		bag.reportInfo(span(2), DiagnosticCode.LOOP_INVARIANT_UNKNOWN, "b");
		bag.reportInfo(span(3), DiagnosticCode.LOOP_INVARIANT_SYNTHESIZED, "c");
		assertEquals(2, bag.count(0, DiagnosticCode.LOOP_INVARIANT_SYNTHESIZED));
		assertEquals(1, bag.count(1, DiagnosticCode.LOOP_INVARIANT_SYNTHESIZED));
		assertEquals(0, bag.count(3, DiagnosticCode.LOOP_INVARIANT_SYNTHESIZED));
	}

	@Test
	public void unmodifiableView() {
		DiagnosticBag bag = new DiagnosticBag();
		bag.reportInfo(span(1), DiagnosticCode.CONTRACT_SIMPLIFIED, "a");
		assertThrows(UnsupportedOperationException.class, () -> bag.getDiagnostics().clear());
	}

	@Test
	public void format() {
		Diagnostic d = new Diagnostic(DiagnosticCode.DIVISION_BY_ZERO, Diagnostic.Severity.WARNING, "y may be zero",
				span(3));
		assertEquals("3:1: warning Calor0920: y may be zero", d.toString());
	}

	@Test
	public void missingSpan() {
		Diagnostic d = new Diagnostic(DiagnosticCode.DEAD_STORE, Diagnostic.Severity.INFO, "m", null);
		assertEquals(Span.NONE, d.getSpan());
	}

	@Test
	public void missingCode() {
		assertThrows(IllegalArgumentException.class,
				() -> new Diagnostic(null, Diagnostic.Severity.INFO, "m", Span.NONE));
	}
}
