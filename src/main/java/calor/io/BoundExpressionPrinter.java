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
package calor.io;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

import calor.core.BoundModule.Expr;
import calor.core.BoundModule.Variable;

/**
 * Writes bound expressions in an infix notation. This is used to describe
 * expressions in diagnostics, rather than to produce parseable source, so
 * compound operands are always bracketed.
 *
 * @author The Calor Project Developers
 *
 */
public class BoundExpressionPrinter {
	private final PrintWriter out;

	public BoundExpressionPrinter(OutputStream output) {
		this.out = new PrintWriter(new OutputStreamWriter(output, StandardCharsets.UTF_8));
	}

	public void flush() {
		out.flush();
	}

	public void write(Expr e) {
		writeExpression(e);
	}

	private void writeExpressionWithBraces(Expr e) {
		if (e instanceof Expr.Unary || e instanceof Expr.Binary || e instanceof Expr.Implies
				|| e instanceof Expr.Conditional || e instanceof Expr.Quantifier) {
			out.print("(");
			writeExpression(e);
			out.print(")");
		} else {
			writeExpression(e);
		}
	}

	private void writeExpression(Expr e) {
		if (e instanceof Expr.IntLiteral || e instanceof Expr.FloatLiteral || e instanceof Expr.BoolLiteral
				|| e instanceof Expr.StringLiteral || e instanceof Expr.VariableAccess) {
			out.print(e.toString());
		} else if (e instanceof Expr.Unary) {
			writeUnary((Expr.Unary) e);
		} else if (e instanceof Expr.Binary) {
			writeBinary((Expr.Binary) e);
		} else if (e instanceof Expr.Implies) {
			writeImplies((Expr.Implies) e);
		} else if (e instanceof Expr.Conditional) {
			writeConditional((Expr.Conditional) e);
		} else if (e instanceof Expr.Quantifier) {
			writeQuantifier((Expr.Quantifier) e);
		} else if (e instanceof Expr.Invoke) {
			writeInvoke((Expr.Invoke) e);
		} else if (e instanceof Expr.ArrayAccess) {
			writeArrayAccess((Expr.ArrayAccess) e);
		} else if (e instanceof Expr.FieldAccess) {
			writeFieldAccess((Expr.FieldAccess) e);
		} else if (e instanceof Expr.CollectionLiteral) {
			writeCollectionLiteral((Expr.CollectionLiteral) e);
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + e.getClass().getName() + ")");
		}
	}

	private void writeUnary(Expr.Unary e) {
		out.print(e.getOperator().getSymbol());
		writeExpressionWithBraces(e.getOperand());
	}

	private void writeBinary(Expr.Binary e) {
		writeExpressionWithBraces(e.getLeftHandSide());
		out.print(" " + e.getOperator().getSymbol() + " ");
		writeExpressionWithBraces(e.getRightHandSide());
	}

	private void writeImplies(Expr.Implies e) {
		writeExpressionWithBraces(e.getLeftHandSide());
		out.print(" ==> ");
		writeExpressionWithBraces(e.getRightHandSide());
	}

	private void writeConditional(Expr.Conditional e) {
		writeExpressionWithBraces(e.getCondition());
		out.print(" ? ");
		writeExpressionWithBraces(e.getTrueBranch());
		out.print(" : ");
		writeExpressionWithBraces(e.getFalseBranch());
	}

	private void writeQuantifier(Expr.Quantifier e) {
		List<Variable> vars = e.getVariables();
		if (e instanceof Expr.UniversalQuantifier) {
			out.print("forall ");
		} else {
			out.print("exists ");
		}
		for (int i = 0; i != vars.size(); ++i) {
			if (i != 0) {
				out.print(",");
			}
			out.print(vars.get(i).getName());
			out.print(":");
			out.print(vars.get(i).getType());
		}
		out.print(" :: ");
		writeExpression(e.getBody());
	}

	private void writeInvoke(Expr.Invoke e) {
		out.print(e.getTarget());
		writeArguments(e.getArguments(), "(", ")");
	}

	private void writeArrayAccess(Expr.ArrayAccess e) {
		writeExpressionWithBraces(e.getSource());
		out.print("[");
		writeExpression(e.getIndex());
		out.print("]");
	}

	private void writeFieldAccess(Expr.FieldAccess e) {
		writeExpressionWithBraces(e.getSource());
		out.print(".");
		out.print(e.getField());
	}

	private void writeCollectionLiteral(Expr.CollectionLiteral e) {
		writeArguments(e.getElements(), "[", "]");
	}

	private void writeArguments(List<Expr> args, String open, String close) {
		out.print(open);
		for (int i = 0; i != args.size(); ++i) {
			if (i != 0) {
				out.print(", ");
			}
			writeExpression(args.get(i));
		}
		out.print(close);
	}

	public static String toString(Expr expr) {
		ByteArrayOutputStream buf = new ByteArrayOutputStream();
		BoundExpressionPrinter p = new BoundExpressionPrinter(buf);
		p.writeExpression(expr);
		p.flush();
		return new String(buf.toByteArray(), StandardCharsets.UTF_8);
	}
}
