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
package calor.tasks;

import java.util.List;

import calor.core.BoundModule;
import calor.core.BoundModule.Expr;
import calor.core.BoundModule.Function;
import calor.core.BoundModule.Stmt;
import calor.core.Diagnostic;
import calor.core.DiagnosticBag;
import calor.simplify.ExpressionSimplifier;
import calor.util.Util;

/**
 * Simplifies every contract in a module, namely the preconditions and
 * postconditions of each function and the invariants of each loop (however
 * deeply nested). Each contract is simplified to a fixed point and any
 * rewrites are reported against the span of the contract being simplified.
 * Parts of the module which are unchanged are shared with the result and, when
 * nothing changes at all, the original module is returned.
 *
 * @author The Calor Project Developers
 *
 */
public class ContractSimplificationPass {
	private final DiagnosticBag diagnostics;
	private int maxIterations = ExpressionSimplifier.DEFAULT_MAX_ITERATIONS;

	public ContractSimplificationPass(DiagnosticBag diagnostics) {
		if (diagnostics == null) {
			throw new NullPointerException("diagnostics");
		}
		this.diagnostics = diagnostics;
	}

	public ContractSimplificationPass setMaxIterations(int maxIterations) {
		if (maxIterations < 1) {
			throw new IllegalArgumentException("invalid iteration limit (" + maxIterations + ")");
		}
		this.maxIterations = maxIterations;
		return this;
	}

	public BoundModule simplify(BoundModule module) {
		List<Function> functions = Util.rewrite(module.getFunctions(), this::simplify);
		if (functions == module.getFunctions()) {
			return module;
		}
		return module.withFunctions(functions);
	}

	public Function simplify(Function function) {
		List<Expr> preconditions = simplifyContracts(function.getPreconditions());
		List<Expr> postconditions = simplifyContracts(function.getPostconditions());
		List<Stmt> body = simplifyStatements(function.getBody());
		Function result = function;
		if (preconditions != function.getPreconditions() || postconditions != function.getPostconditions()) {
			result = result.withContracts(preconditions, postconditions);
		}
		if (body != function.getBody()) {
			result = result.withBody(body);
		}
		return result;
	}

	private List<Expr> simplifyContracts(List<Expr> contracts) {
		return Util.rewrite(contracts, this::simplifyContract);
	}

	private Expr simplifyContract(Expr contract) {
		DiagnosticBag local = new DiagnosticBag();
		Expr result = ExpressionSimplifier.simplifyToFixedPoint(contract, maxIterations, local);
		for (Diagnostic d : local) {
			diagnostics.report(new Diagnostic(d.getCode(), d.getSeverity(), d.getMessage(), contract.getSpan()));
		}
		return result;
	}

	// =========================================================================
	// Statements
	// =========================================================================

	private List<Stmt> simplifyStatements(List<Stmt> stmts) {
		return Util.rewrite(stmts, this::simplifyStatement);
	}

	private Stmt simplifyStatement(Stmt stmt) {
		if (stmt instanceof Stmt.IfElse) {
			return simplifyIfElse((Stmt.IfElse) stmt);
		} else if (stmt instanceof Stmt.For) {
			Stmt.For s = (Stmt.For) stmt;
			List<Stmt> body = simplifyStatements(s.getBody());
			List<Expr> invariants = simplifyContracts(s.getInvariants());
			return body == s.getBody() && invariants == s.getInvariants() ? s : s.with(body, invariants);
		} else if (stmt instanceof Stmt.While) {
			Stmt.While s = (Stmt.While) stmt;
			List<Stmt> body = simplifyStatements(s.getBody());
			List<Expr> invariants = simplifyContracts(s.getInvariants());
			return body == s.getBody() && invariants == s.getInvariants() ? s : s.with(body, invariants);
		} else {
			return stmt;
		}
	}

	private Stmt simplifyIfElse(Stmt.IfElse s) {
		List<Stmt> trueBranch = simplifyStatements(s.getTrueBranch());
		List<Stmt.ElseIf> elseIfs = Util.rewrite(s.getElseIfs(), this::simplifyElseIf);
		List<Stmt> falseBranch = s.getFalseBranch() == null ? null : simplifyStatements(s.getFalseBranch());
		if (trueBranch == s.getTrueBranch() && elseIfs == s.getElseIfs() && falseBranch == s.getFalseBranch()) {
			return s;
		}
		return new Stmt.IfElse(s.getCondition(), trueBranch, elseIfs, falseBranch, s.getSpan());
	}

	private Stmt.ElseIf simplifyElseIf(Stmt.ElseIf s) {
		List<Stmt> body = simplifyStatements(s.getBody());
		return body == s.getBody() ? s : new Stmt.ElseIf(s.getCondition(), body, s.getSpan());
	}
}
