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

import java.io.PrintWriter;
import java.io.StringWriter;

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
import exm.sema.common.lang.Types.Type;
import exm.sema.frontend.ExprPrinter;
import exm.sema.frontend.typecheck.ConversionRank;
import exm.sema.frontend.typecheck.ConversionRanker;

/**
 * Base class for expression nodes.
 *
 * The set of subclasses is closed: they all live in {@link Exprs} and
 * are created through an {@link ASTContext}, which owns them for its
 * whole lifetime.  Code that needs to handle every kind of expression
 * should implement {@link ExprVisitor} so that adding a kind is a
 * compile error until every visitor handles it.
 */
public abstract class Expr {

  public static enum ExprKind {
    INTEGER_LITERAL,
    DECL_REF,
    OVERLOAD_SET_REF,
    UNRESOLVED_DECL_REF,
    UNRESOLVED_MEMBER,
    UNRESOLVED_SCOPED_IDENTIFIER,
    TUPLE,
    /** Member access by name, before resolution */
    UNRESOLVED_DOT,
    /** Tuple field access by index, after resolution */
    TUPLE_ELEMENT,
    APPLY,
    SEQUENCE,
    BRACE,
    CLOSURE,
    ANON_CLOSURE_ARG,
    BINARY,
  }

  private final ExprKind kind;
  private final ASTContext context;

  /** null until type checking assigns one */
  private Type type;

  protected Expr(ExprKind kind, ASTContext context, Type type) {
    assert(kind != null);
    assert(context != null);
    this.kind = kind;
    this.context = context;
    this.type = type;
  }

  public ExprKind getKind() {
    return kind;
  }

  /**
   * @return the context whose arena allocated this node
   */
  public ASTContext getContext() {
    return context;
  }

  public Type getType() {
    return type;
  }

  public void setType(Type type) {
    this.type = type;
  }

  public abstract <R> R accept(ExprVisitor<R> visitor);

  /**
   * Return the location of the start of the expression.
   */
  public SourceLoc getStartLoc() {
    return accept(START_LOC);
  }

  public ConversionRank getRankOfConversionTo(Type destType) {
    return ConversionRanker.getConversionRank(this, destType);
  }

  public String printTree() {
    StringWriter sw = new StringWriter();
    PrintWriter writer = new PrintWriter(sw);
    ExprPrinter.print(this, writer, 0);
    writer.flush();
    return sw.toString();
  }

  public void dump() {
    PrintWriter err = new PrintWriter(System.err);
    ExprPrinter.print(this, err, 0);
    err.println();
    err.flush();
  }

  @Override
  public String toString() {
    return kind + "@" + getStartLoc();
  }

  private static final ExprVisitor<SourceLoc> START_LOC =
                                        new ExprVisitor<SourceLoc>() {
    @Override
    public SourceLoc visitIntegerLiteral(IntegerLiteral e) {
      return e.getLoc();
    }

    @Override
    public SourceLoc visitDeclRef(DeclRefExpr e) {
      return e.getLoc();
    }

    @Override
    public SourceLoc visitOverloadSetRef(OverloadSetRefExpr e) {
      return e.getLoc();
    }

    @Override
    public SourceLoc visitUnresolvedDeclRef(UnresolvedDeclRefExpr e) {
      return e.getLoc();
    }

    @Override
    public SourceLoc visitUnresolvedMember(UnresolvedMemberExpr e) {
      return e.getColonLoc();
    }

    @Override
    public SourceLoc visitUnresolvedScopedIdentifier(
                                    UnresolvedScopedIdentifierExpr e) {
      return e.getTypeDeclLoc();
    }

    @Override
    public SourceLoc visitTuple(TupleExpr e) {
      return e.getLParenLoc();
    }

    @Override
    public SourceLoc visitUnresolvedDot(UnresolvedDotExpr e) {
      if (e.getSubExpr() != null) {
        return e.getSubExpr().getStartLoc();
      }
      return e.getDotLoc();
    }

    @Override
    public SourceLoc visitTupleElement(TupleElementExpr e) {
      return e.getSubExpr().getStartLoc();
    }

    @Override
    public SourceLoc visitApply(ApplyExpr e) {
      return e.getFn().getStartLoc();
    }

    @Override
    public SourceLoc visitSequence(SequenceExpr e) {
      return e.getElement(0).getStartLoc();
    }

    @Override
    public SourceLoc visitBrace(BraceExpr e) {
      return e.getLBraceLoc();
    }

    @Override
    public SourceLoc visitClosure(ClosureExpr e) {
      return e.getInput().getStartLoc();
    }

    @Override
    public SourceLoc visitAnonClosureArg(AnonClosureArgExpr e) {
      return e.getLoc();
    }

    @Override
    public SourceLoc visitBinary(BinaryExpr e) {
      return e.getLhs().getStartLoc();
    }
  };
}
