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
package calor.util;

import java.util.List;

import calor.core.BoundModule.Expr;
import calor.core.BoundModule.Stmt;

/**
 * Walks the statements of a function body in order, descending into every
 * branch and loop body. A context value is threaded down the tree so that
 * subclasses can track facts such as the conditions known to hold on the
 * current path.
 *
 * @param <C> the context carried into nested statements.
 */
public abstract class AbstractStatementVisitor<C> {

    public void visitStatements(List<Stmt> stmts, C context) {
        for (int i = 0; i != stmts.size(); ++i) {
            visitStatement(stmts.get(i), context);
        }
    }

    public void visitStatement(Stmt s, C context) {
        if (s instanceof Stmt.Bind) {
            visitBind((Stmt.Bind) s, context);
        } else if (s instanceof Stmt.Call) {
            visitCall((Stmt.Call) s, context);
        } else if (s instanceof Stmt.Return) {
            visitReturn((Stmt.Return) s, context);
        } else if (s instanceof Stmt.IfElse) {
            visitIfElse((Stmt.IfElse) s, context);
        } else if (s instanceof Stmt.For) {
            visitFor((Stmt.For) s, context);
        } else if (s instanceof Stmt.While) {
            visitWhile((Stmt.While) s, context);
        } else {
            throw new IllegalArgumentException("unknown statement encountered (" + s.getClass().getName() + ")");
        }
    }

    protected void visitBind(Stmt.Bind s, C context) {
        if (s.getInitializer() != null) {
            visitExpression(s.getInitializer(), context);
        }
    }

    protected void visitCall(Stmt.Call s, C context) {
        for (Expr arg : s.getArguments()) {
            visitExpression(arg, context);
        }
    }

    protected void visitReturn(Stmt.Return s, C context) {
        if (s.getOperand() != null) {
            visitExpression(s.getOperand(), context);
        }
    }

    protected void visitIfElse(Stmt.IfElse s, C context) {
        visitExpression(s.getCondition(), context);
        visitStatements(s.getTrueBranch(), context);
        for (Stmt.ElseIf elseIf : s.getElseIfs()) {
            visitExpression(elseIf.getCondition(), context);
            visitStatements(elseIf.getBody(), context);
        }
        if (s.getFalseBranch() != null) {
            visitStatements(s.getFalseBranch(), context);
        }
    }

    protected void visitFor(Stmt.For s, C context) {
        visitExpression(s.getFrom(), context);
        visitExpression(s.getTo(), context);
        if (s.getStep() != null) {
            visitExpression(s.getStep(), context);
        }
        visitStatements(s.getBody(), context);
    }

    protected void visitWhile(Stmt.While s, C context) {
        visitExpression(s.getCondition(), context);
        visitStatements(s.getBody(), context);
    }

    /**
     * Called for every top-level expression appearing in a statement.
     *
     * @param expr
     * @param context
     */
    protected void visitExpression(Expr expr, C context) {

    }
}
