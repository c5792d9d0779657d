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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.log4j.Logger;

import exm.sema.ast.Decls.TypeDecl;
import exm.sema.ast.Decls.ValueDecl;
import exm.sema.ast.Exprs.AnonClosureArgExpr;
import exm.sema.ast.Exprs.ApplyExpr;
import exm.sema.ast.Exprs.BinaryExpr;
import exm.sema.ast.Exprs.BraceElement;
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
import exm.sema.common.Logging;
import exm.sema.common.Settings;
import exm.sema.common.exceptions.SemaRuntimeError;
import exm.sema.common.lang.Types.Type;

/**
 * Owns every expression node of a compilation unit.  Nodes are allocated
 * through the create* methods and live as long as the context: they are
 * never freed individually and never shared with another context.
 *
 * Not thread-safe.
 */
public class ASTContext {

  private final Logger logger;

  private final String inputFile;

  /** All nodes allocated so far, in allocation order */
  private final ArrayList<Expr> arena = new ArrayList<Expr>();

  private final boolean checkArena;

  public ASTContext(String inputFile) {
    this(inputFile, Logging.getSemaLogger());
  }

  public ASTContext(String inputFile, Logger logger) {
    this.inputFile = inputFile;
    this.logger = logger;
    this.checkArena = Settings.getBooleanUnchecked(Settings.CHECK_ARENA);
  }

  public String getInputFile() {
    return inputFile;
  }

  public Logger getLogger() {
    return logger;
  }

  public int getNumAllocated() {
    return arena.size();
  }

  /**
   * Convenience to make a location in this context's input file
   */
  public SourceLoc loc(int line, int column) {
    return new SourceLoc(inputFile, line, column);
  }

  private <T extends Expr> T allocate(T expr) {
    arena.add(expr);
    if (logger.isTraceEnabled()) {
      logger.trace("Allocated " + expr.getKind() + " (" + arena.size()
                   + " nodes in " + inputFile + ")");
    }
    return expr;
  }

  /**
   * Check that a child node was allocated by this context
   * @param child may be null for optional children
   */
  private void checkOwned(Expr child) {
    if (checkArena && child != null && child.getContext() != this) {
      throw new SemaRuntimeError("Expression " + child.getKind() +
          " from " + child.getContext().getInputFile() +
          " used as child of a node in " + inputFile);
    }
  }

  private void checkOwned(List<Expr> children) {
    for (Expr child: children) {
      checkOwned(child);
    }
  }

  public IntegerLiteral createIntegerLiteral(String text, SourceLoc loc) {
    return allocate(new IntegerLiteral(this, text, loc));
  }

  public IntegerLiteral createIntegerLiteral(String text, SourceLoc loc,
                                             Type type) {
    IntegerLiteral lit = createIntegerLiteral(text, loc);
    lit.setType(type);
    return lit;
  }

  public DeclRefExpr createDeclRef(ValueDecl decl, SourceLoc loc) {
    return allocate(new DeclRefExpr(this, decl, loc, decl.getType()));
  }

  public OverloadSetRefExpr createOverloadSetRef(List<ValueDecl> decls,
                                                 SourceLoc loc) {
    return allocate(new OverloadSetRefExpr(this, decls, loc));
  }

  public UnresolvedDeclRefExpr createUnresolvedDeclRef(String name,
                                                       SourceLoc loc) {
    return allocate(new UnresolvedDeclRefExpr(this, name, loc));
  }

  public UnresolvedMemberExpr createUnresolvedMember(SourceLoc colonLoc,
                                    SourceLoc nameLoc, String name) {
    return allocate(new UnresolvedMemberExpr(this, colonLoc, nameLoc, name));
  }

  public UnresolvedScopedIdentifierExpr createUnresolvedScopedIdentifier(
      TypeDecl typeDecl, SourceLoc typeDeclLoc, String name,
      SourceLoc nameLoc) {
    return allocate(new UnresolvedScopedIdentifierExpr(this, typeDecl,
                                          typeDeclLoc, name, nameLoc));
  }

  /**
   * @param names element names, null for an all-positional tuple;
   *              individual entries may be null
   */
  public TupleExpr createTuple(SourceLoc lParenLoc, List<Expr> subExprs,
                               List<String> names, SourceLoc rParenLoc) {
    checkOwned(subExprs);
    return allocate(new TupleExpr(this, lParenLoc, subExprs, names,
                                  rParenLoc, false));
  }

  /**
   * "(expr)" where the parentheses only group
   */
  public TupleExpr createParen(SourceLoc lParenLoc, Expr subExpr,
                               SourceLoc rParenLoc) {
    checkOwned(subExpr);
    TupleExpr paren = allocate(new TupleExpr(this, lParenLoc,
                  Arrays.asList(subExpr), null, rParenLoc, true));
    paren.setType(subExpr.getType());
    return paren;
  }

  public UnresolvedDotExpr createUnresolvedDot(Expr subExpr,
      SourceLoc dotLoc, String name, SourceLoc nameLoc) {
    checkOwned(subExpr);
    return allocate(new UnresolvedDotExpr(this, subExpr, dotLoc, name,
                                          nameLoc));
  }

  public TupleElementExpr createTupleElement(Expr subExpr, SourceLoc dotLoc,
                            int fieldNo, SourceLoc nameLoc, Type type) {
    checkOwned(subExpr);
    return allocate(new TupleElementExpr(this, subExpr, dotLoc, fieldNo,
                                         nameLoc, type));
  }

  public ApplyExpr createApply(Expr fn, Expr arg, Type type) {
    checkOwned(fn);
    checkOwned(arg);
    return allocate(new ApplyExpr(this, fn, arg, type));
  }

  public SequenceExpr createSequence(List<Expr> elements) {
    checkOwned(elements);
    return allocate(new SequenceExpr(this, elements));
  }

  public BraceExpr createBrace(SourceLoc lBraceLoc,
                   List<BraceElement> elements, SourceLoc rBraceLoc) {
    for (BraceElement element: elements) {
      if (element.isExpr()) {
        checkOwned(element.getExpr());
      } else if (element.getDecl() instanceof ValueDecl) {
        checkOwned(((ValueDecl)element.getDecl()).getInit());
      }
    }
    return allocate(new BraceExpr(this, lBraceLoc, elements, rBraceLoc));
  }

  public ClosureExpr createClosure(Expr input, Type type) {
    checkOwned(input);
    return allocate(new ClosureExpr(this, input, type));
  }

  public AnonClosureArgExpr createAnonClosureArg(int argNo, SourceLoc loc) {
    return allocate(new AnonClosureArgExpr(this, argNo, loc));
  }

  /**
   * @param fn operator function, or null for assignment
   */
  public BinaryExpr createBinary(Expr fn, Expr lhs, Expr rhs, Type type) {
    checkOwned(fn);
    checkOwned(lhs);
    checkOwned(rhs);
    return allocate(new BinaryExpr(this, fn, lhs, rhs, type));
  }
}
