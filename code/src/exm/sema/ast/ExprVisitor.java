/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.sema.ast;

import exm.sema.ast.Exprs.AnonClosureArgExpr;
import exm.sema.ast.Exprs.ApplyExpr;
import exm.sema.ast.Exprs.BinaryExpr;
import exm.sema.ast.Exprs.BraceExpr;
import exm.sema.ast.Exprs.ClosureExpr;
import exm.sema.ast.Exprs.DeclRefExpr;
import exm.sema.ast.Exprs.IntegerLiteral;
import exm.sema.ast.Exprs.OverloadSetRefExpr;
import exm.sema.ast.Exprs.SequenceExpr;
import exm.sema.ast.Exprs.TupleElementExpr;
import exm.sema.ast.Exprs.TupleExpr;
import exm.sema.ast.Exprs.UnresolvedDeclRefExpr;
import exm.sema.ast.Exprs.UnresolvedDotExpr;
import exm.sema.ast.Exprs.UnresolvedMemberExpr;
import exm.sema.ast.Exprs.UnresolvedScopedIdentifierExpr;

/**
 * One method per expression kind.
 * @param <R> result of visiting a node
 */
public interface ExprVisitor<R> {
  R visitIntegerLiteral(IntegerLiteral e);
  R visitDeclRef(DeclRefExpr e);
  R visitOverloadSetRef(OverloadSetRefExpr e);
  R visitUnresolvedDeclRef(UnresolvedDeclRefExpr e);
  R visitUnresolvedMember(UnresolvedMemberExpr e);
  R visitUnresolvedScopedIdentifier(UnresolvedScopedIdentifierExpr e);
  R visitTuple(TupleExpr e);
  R visitUnresolvedDot(UnresolvedDotExpr e);
  R visitTupleElement(TupleElementExpr e);
  R visitApply(ApplyExpr e);
  R visitSequence(SequenceExpr e);
  R visitBrace(BraceExpr e);
  R visitClosure(ClosureExpr e);
  R visitAnonClosureArg(AnonClosureArgExpr e);
  R visitBinary(BinaryExpr e);
}
