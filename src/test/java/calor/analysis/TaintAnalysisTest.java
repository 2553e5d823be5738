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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import calor.core.BoundModule;
import calor.core.BoundModule.Expr;
import calor.core.BoundModule.Expr.BinaryOperator;
import calor.core.BoundModule.Function;
import calor.core.BoundModule.Span;
import calor.core.BoundModule.Types;
import calor.core.Diagnostic;
import calor.core.DiagnosticBag;
import calor.core.DiagnosticCode;

public class TaintAnalysisTest {

	private static Expr str(String s) {
		return new Expr.StringLiteral(s, Span.NONE);
	}

	private static Expr svar(String name) {
		return BoundModule.VAR(strVar(name));
	}

	/**
	 * Reads a string from the network, concatenates it into a query and then
	 * executes the query.
	 */
	private static Function injection(String... effects) {
		return function("lookup").effects(effects).body(
				bind(strVar("input"), invoke("net.fetch", Types.STRING, 3), 3),
				bind(strVar("q"), bin(BinaryOperator.ADD, str("SELECT * FROM t WHERE id = "), svar("input")), 4),
				call("db.execute", 5, svar("q"))).build();
	}

	@Test
	public void nullFunction() {
		assertThrows(NullPointerException.class, () -> new TaintAnalysis(null));
	}

	@Test
	public void sqlInjection() {
		List<TaintVulnerability> vs = new TaintAnalysis(injection("net:r", "db:w")).getVulnerabilities();
		assertEquals(1, vs.size());
		TaintVulnerability v = vs.get(0);
		assertEquals(TaintSink.SQL_QUERY, v.getSink());
		assertEquals(DiagnosticCode.SQL_INJECTION, v.getCode());
		assertEquals(TaintSource.NETWORK_INPUT, v.getSource());
		assertEquals("input", v.getLabel().getSourceVariable());
		assertEquals(span(3), v.getLabel().getSourceSpan());
		assertEquals(span(5), v.getSinkSpan());
		assertEquals("Potential SQL injection: tainted data from network input ('input' at 3:1) flows to SQL query"
				+ " (db.execute(q))", v.getMessage());
	}

	@Test
	public void normalisedEffects() {
		assertEquals(1, new TaintAnalysis(injection("io:network_read", "io:database_write")).getVulnerabilities()
				.size());
	}

	@Test
	public void noSourceEffects() {
		assertTrue(new TaintAnalysis(injection("db:w")).getVulnerabilities().isEmpty());
	}

	@Test
	public void noSinkEffects() {
		assertTrue(new TaintAnalysis(injection("net:r")).getVulnerabilities().isEmpty());
	}

	@Test
	public void noEffects() {
		TaintAnalysis t = new TaintAnalysis(injection());
		assertTrue(t.getVulnerabilities().isEmpty());
		assertTrue(t.getLabels("input").isEmpty());
	}

	@Test
	public void disabledSink() {
		TaintAnalysisOptions options = TaintAnalysisOptions.defaults().setDetectSink(TaintSink.SQL_QUERY, false);
		assertTrue(new TaintAnalysis(injection("net:r", "db:w"), options).getVulnerabilities().isEmpty());
	}

	@Test
	public void untrackedSource() {
		TaintAnalysisOptions options = TaintAnalysisOptions.defaults().setTrackSource(TaintSource.NETWORK_INPUT,
				false);
		assertTrue(new TaintAnalysis(injection("net:r", "db:w"), options).getVulnerabilities().isEmpty());
	}

	@Test
	public void parameterIsSource() {
		Function f = function("run").parameter(param("cmd", Types.STRING, 1)).effects("console:r", "process:rw")
				.body(call("process.exec", 2, svar("cmd"))).build();
		List<TaintVulnerability> vs = new TaintAnalysis(f).getVulnerabilities();
		assertEquals(1, vs.size());
		assertEquals(TaintSink.COMMAND_EXECUTION, vs.get(0).getSink());
		assertEquals(TaintSource.USER_INPUT, vs.get(0).getSource());
		assertEquals("cmd", vs.get(0).getLabel().getSourceVariable());
		assertEquals(DiagnosticCode.COMMAND_INJECTION, vs.get(0).getCode());
	}

	@Test
	public void parameterSeededPerSource() {
		Function f = function("run").parameter(param("p", Types.STRING, 1)).effects("net:r", "fs:r", "fs:w")
				.body(call("fs.open", 2, svar("p"))).build();
		TaintAnalysis t = new TaintAnalysis(f);
		assertEquals(2, t.getLabels("p").size());
		assertEquals(2, t.getVulnerabilities().size());
	}

	@Test
	public void untaintedArgument() {
		Function f = function("run").parameter(param("p", Types.STRING, 1)).effects("net:r", "db:w")
				.body(call("db.execute", 2, str("SELECT 1"))).build();
		assertTrue(new TaintAnalysis(f).getVulnerabilities().isEmpty());
	}

	@Test
	public void sanitizerClearsTaint() {
		Function f = function("render").effects("net:r", "html:w").body(
				bind(strVar("input"), invoke("http.get", Types.STRING, 2), 2),
				bind(strVar("safe"), invoke("html_escape", Types.STRING, svar("input")), 3),
				call("html.write", 4, svar("safe"))).build();
		TaintAnalysis t = new TaintAnalysis(f);
		assertTrue(t.getVulnerabilities().isEmpty());
		assertTrue(t.getLabels("safe").isEmpty());
		assertEquals(1, t.getLabels("input").size());
	}

	@Test
	public void crossSiteScripting() {
		Function f = function("render").effects("net:r", "html:w").body(
				bind(strVar("input"), invoke("http.get", Types.STRING, 2), 2),
				call("html.write", 3, svar("input"))).build();
		List<TaintVulnerability> vs = new TaintAnalysis(f).getVulnerabilities();
		assertEquals(1, vs.size());
		assertEquals(DiagnosticCode.CROSS_SITE_SCRIPTING, vs.get(0).getCode());
		assertTrue(vs.get(0).getMessage().startsWith("Potential XSS:"));
	}

	@Test
	public void nestedSourceLabelledByTarget() {
		Expr query = bin(BinaryOperator.ADD, str("SELECT "), invoke("net.read", Types.STRING, 2));
		Function f = function("f").effects("net:r", "db:w").body(call("db.query", 2, query)).build();
		List<TaintVulnerability> vs = new TaintAnalysis(f).getVulnerabilities();
		assertEquals(1, vs.size());
		assertEquals("net.read", vs.get(0).getLabel().getSourceVariable());
		assertTrue(vs.get(0).getMessage().endsWith("(db.query(expression))"));
	}

	@Test
	public void sinkInvokeExpression() {
		Function f = function("f").parameter(param("p", Types.STRING, 1)).effects("env:r", "sql:w")
				.body(bind(strVar("rows"), invoke("sql_query", Types.INT, 3, svar("p")), 3)).build();
		List<TaintVulnerability> vs = new TaintAnalysis(f).getVulnerabilities();
		assertEquals(1, vs.size());
		assertEquals(TaintSource.ENVIRONMENT, vs.get(0).getSource());
		assertEquals(span(3), vs.get(0).getSinkSpan());
	}

	@Test
	public void taintReachesThroughLoop() {
		// x is only tainted on the second iteration
		Function f = function("f").effects("net:r", "db:w").body(
				bind(strVar("input"), invoke("net.fetch", Types.STRING, 2), 2),
				bind(strVar("x"), str(""), 3),
				bind(strVar("y"), str(""), 4),
				loop(bool("more"), Collections.<Expr>emptyList(), 5,
						call("db.execute", 6, svar("x")),
						bind(strVar("x"), svar("y"), 7),
						bind(strVar("y"), svar("input"), 8))).build();
		TaintAnalysis t = new TaintAnalysis(f);
		assertEquals(1, t.getLabels("x").size());
		assertEquals(1, t.getVulnerabilities().size());
	}

	@Test
	public void forLoopVariableTaintedByBound() {
		Function f = function("f").parameter(param("n", Types.INT, 1)).effects("console:r", "fs:w")
				.body(loop(intVar("i"), var("n"), i(10), null, 2, call("fs.delete", 3, var("i")))).build();
		assertEquals(1, new TaintAnalysis(f).getVulnerabilities().size());
	}

	@Test
	public void reportDiagnostics() {
		DiagnosticBag bag = new DiagnosticBag();
		new TaintAnalysis(injection("net:r", "db:w")).reportDiagnostics(bag);
		assertEquals(1, bag.size());
		Diagnostic d = bag.get(0);
		assertEquals(DiagnosticCode.SQL_INJECTION, d.getCode());
		assertEquals(Diagnostic.Severity.WARNING, d.getSeverity());
		assertEquals(span(5), d.getSpan());
	}

	@Test
	public void runnerReportsEveryFunction() {
		DiagnosticBag bag = new DiagnosticBag();
		TaintAnalysisRunner runner = new TaintAnalysisRunner(bag);
		runner.analyze(module(injection("net:r", "db:w"), injection("db:w"), injection("net:r", "sql:w")));
		assertEquals(2, bag.size());
	}

	@Test
	public void runnerNullDiagnostics() {
		assertThrows(NullPointerException.class, () -> new TaintAnalysisRunner(null));
	}
}
