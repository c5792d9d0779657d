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
package exm.sema.frontend;

import java.io.PrintWriter;

import org.apache.commons.lang3.StringUtils;

import exm.sema.ast.Decls.Decl;
import exm.sema.ast.Decls.TypeDecl;
import exm.sema.ast.Decls.ValueDecl;
import exm.sema.ast.Expr;
import exm.sema.ast.ExprVisitor;
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
import exm.sema.common.lang.Types.Type;

/**
 * Dumps an expression tree as nested, indented s-expressions, one
 * clause per node.  Children are indented two more spaces than their
 * parent.  Used for debugging and for comparing trees in tests.
 */
public class ExprPrinter implements ExprVisitor<Void> {

  public static final String NULL_EXPR = "(**NULL EXPRESSION**)";
  public static final String DEFAULT_ELEMENT =
                                    "<<tuple element default value>>";

  private final PrintWriter out;
  private int indent;

  private ExprPrinter(PrintWriter out, int indent) {
    this.out = out;
    this.indent = indent;
  }

  /**
   * Print e to out, starting at the given indentation.  No trailing
   * newline is written.
   */
  public static void print(Expr e, PrintWriter out, int indent) {
    e.accept(new ExprPrinter(out, indent));
  }

  private void indent(int n) {
    out.print(StringUtils.repeat(' ', n));
  }

  private void printRec(Expr e) {
    indent += 2;
    if (e != null) {
      e.accept(this);
    } else {
      indent(indent);
      out.print(NULL_EXPR);
    }
    indent -= 2;
  }

  private void printRec(Decl d) {
    indent += 2;
    indent(indent);
    if (d instanceof ValueDecl) {
      ValueDecl vd = (ValueDecl)d;
      out.print("(value_decl '" + vd.getName() + "' type='"
                + typeStr(vd.getType()) + "'");
      if (vd.getInit() != null) {
        out.print('\n');
        printRec(vd.getInit());
      }
      out.print(')');
    } else if (d instanceof TypeDecl) {
      out.print("(type_decl '" + d.getName() + "')");
    } else {
      out.print("(decl '" + d.getName() + "')");
    }
    indent -= 2;
  }

  private static String typeStr(Type t) {
    return t == null ? "<<null>>" : t.toString();
  }

  private void open(String name, Expr e) {
    indent(indent);
    out.print("(" + name + " type='" + typeStr(e.getType()) + "'");
  }

  @Override
  public Void visitIntegerLiteral(IntegerLiteral e) {
    open("integer_literal", e);
    out.print(" value=" + e.getText() + ")");
    return null;
  }

  @Override
  public Void visitDeclRef(DeclRefExpr e) {
    open("declref_expr", e);
    out.print(" decl=" + e.getDecl().getName() + ")");
    return null;
  }

  @Override
  public Void visitOverloadSetRef(OverloadSetRefExpr e) {
    open("overloadsetref_expr", e);
    out.print(" decl=" + e.getDecls().get(0).getName() + ")");
    return null;
  }

  @Override
  public Void visitUnresolvedDeclRef(UnresolvedDeclRefExpr e) {
    open("unresolved_decl_ref_expr", e);
    out.print(" name=" + e.getName() + ")");
    return null;
  }

  @Override
  public Void visitUnresolvedMember(UnresolvedMemberExpr e) {
    open("unresolved_member_expr", e);
    out.print(" name='" + e.getName() + "')");
    return null;
  }

  @Override
  public Void visitUnresolvedScopedIdentifier(
                            UnresolvedScopedIdentifierExpr e) {
    indent(indent);
    out.print("(unresolved_scoped_identifier_expr type='"
              + e.getTypeDecl().getName() + "' name='" + e.getName() + "')");
    return null;
  }

  @Override
  public Void visitTuple(TupleExpr e) {
    open("tuple_expr", e);
    for (int i = 0; i < e.getNumElements(); i++) {
      out.print('\n');
      if (e.getElement(i) != null) {
        printRec(e.getElement(i));
      } else {
        indent(indent + 2);
        out.print(DEFAULT_ELEMENT);
      }
    }
    out.print(')');
    return null;
  }

  @Override
  public Void visitUnresolvedDot(UnresolvedDotExpr e) {
    open("unresolved_dot_expr", e);
    out.print(" field '" + e.getName() + "'");
    if (!e.getResolvedDecls().isEmpty()) {
      out.print(" decl resolved to " + e.getResolvedDecls().size()
                + " candidate(s)!");
    }
    if (e.getSubExpr() != null) {
      out.print('\n');
      printRec(e.getSubExpr());
    }
    out.print(')');
    return null;
  }

  @Override
  public Void visitTupleElement(TupleElementExpr e) {
    open("tuple_element_expr", e);
    out.print(" field #" + e.getFieldNo() + '\n');
    printRec(e.getSubExpr());
    out.print(')');
    return null;
  }

  @Override
  public Void visitApply(ApplyExpr e) {
    open("apply_expr", e);
    out.print('\n');
    printRec(e.getFn());
    out.print('\n');
    printRec(e.getArg());
    out.print(')');
    return null;
  }

  @Override
  public Void visitSequence(SequenceExpr e) {
    open("sequence_expr", e);
    for (Expr elt: e.getElements()) {
      out.print('\n');
      printRec(elt);
    }
    out.print(')');
    return null;
  }

  @Override
  public Void visitBrace(BraceExpr e) {
    open("brace_expr", e);
    for (BraceElement element: e.getElements()) {
      out.print('\n');
      if (element.isExpr()) {
        printRec(element.getExpr());
      } else {
        printRec(element.getDecl());
      }
    }
    out.print(')');
    return null;
  }

  @Override
  public Void visitClosure(ClosureExpr e) {
    open("closure_expr", e);
    out.print('\n');
    printRec(e.getInput());
    out.print(')');
    return null;
  }

  @Override
  public Void visitAnonClosureArg(AnonClosureArgExpr e) {
    open("anon_closure_arg_expr", e);
    out.print(" ArgNo=" + e.getArgNo() + ")");
    return null;
  }

  @Override
  public Void visitBinary(BinaryExpr e) {
    indent(indent);
    out.print("(binary_expr '" + operatorName(e.getFn()) + "' type='"
              + typeStr(e.getType()) + "'");
    out.print('\n');
    printRec(e.getLhs());
    out.print('\n');
    printRec(e.getRhs());
    out.print(')');
    return null;
  }

  private static String operatorName(Expr fn) {
    if (fn == null) {
      return "=";
    } else if (fn instanceof DeclRefExpr) {
      return ((DeclRefExpr)fn).getDecl().getName();
    } else if (fn instanceof OverloadSetRefExpr) {
      return ((OverloadSetRefExpr)fn).getDecls().get(0).getName();
    } else {
      return "***UNKNOWN***";
    }
  }
}
