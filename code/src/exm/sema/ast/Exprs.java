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
import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.sema.ast.Decls.Decl;
import exm.sema.ast.Decls.TypeDecl;
import exm.sema.ast.Decls.ValueDecl;
import exm.sema.common.exceptions.SemaRuntimeError;
import exm.sema.common.lang.Types;
import exm.sema.common.lang.Types.FunctionType;
import exm.sema.common.lang.Types.TupleType;
import exm.sema.common.lang.Types.Type;

/**
 * The expression node classes.  Nodes are only constructed by
 * {@link ASTContext}.  Child slots may be overwritten while a tree is
 * being rewritten; everything else is fixed at construction.
 */
public class Exprs {

  public static final class IntegerLiteral extends Expr {
    private final String text;
    private final SourceLoc loc;

    IntegerLiteral(ASTContext context, String text, SourceLoc loc) {
      super(ExprKind.INTEGER_LITERAL, context, null);
      assert(text != null);
      this.text = text;
      this.loc = loc;
    }

    /**
     * @return literal as written in source
     */
    public String getText() {
      return text;
    }

    public SourceLoc getLoc() {
      return loc;
    }

    /**
     * Interpret the literal as an unsigned 64-bit value.  Prefixes 0x,
     * 0b and 0o select the radix, as does a leading zero (octal).
     * Values above Long.MAX_VALUE come back negative: use
     * Long.toUnsignedString and Long.compareUnsigned on the result.
     * @throws SemaRuntimeError if the text is not a valid literal
     */
    public long getValue() {
      int radix = 10;
      String digits = text;
      if (text.length() > 2 && text.charAt(0) == '0') {
        char prefix = Character.toLowerCase(text.charAt(1));
        if (prefix == 'x') {
          radix = 16;
        } else if (prefix == 'b') {
          radix = 2;
        } else if (prefix == 'o') {
          radix = 8;
        }
        if (radix != 10) {
          digits = text.substring(2);
        }
      }
      if (radix == 10 && text.length() > 1 && text.charAt(0) == '0') {
        radix = 8;
        digits = text.substring(1);
      }
      // parseUnsignedLong would accept a leading sign
      if (digits.isEmpty() || Character.digit(digits.charAt(0), radix) < 0) {
        throw new SemaRuntimeError("Invalid IntegerLiteral formed: " + text);
      }
      try {
        return Long.parseUnsignedLong(digits, radix);
      } catch (NumberFormatException e) {
        throw new SemaRuntimeError("Invalid IntegerLiteral formed: " + text,
                                   e);
      }
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitIntegerLiteral(this);
    }
  }

  /**
   * Reference to a single resolved declaration
   */
  public static final class DeclRefExpr extends Expr {
    private final ValueDecl decl;
    private final SourceLoc loc;

    DeclRefExpr(ASTContext context, ValueDecl decl, SourceLoc loc,
                Type type) {
      super(ExprKind.DECL_REF, context, type);
      assert(decl != null);
      this.decl = decl;
      this.loc = loc;
    }

    public ValueDecl getDecl() {
      return decl;
    }

    public SourceLoc getLoc() {
      return loc;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitDeclRef(this);
    }
  }

  /**
   * Reference to a name that resolved to several declarations
   */
  public static final class OverloadSetRefExpr extends Expr {
    private final ImmutableList<ValueDecl> decls;
    private final SourceLoc loc;

    OverloadSetRefExpr(ASTContext context, List<ValueDecl> decls,
                       SourceLoc loc) {
      super(ExprKind.OVERLOAD_SET_REF, context, null);
      this.decls = ImmutableList.copyOf(decls);
      if (this.decls.isEmpty()) {
        throw new SemaRuntimeError("Overload set with no candidates at "
                                   + loc);
      }
      this.loc = loc;
    }

    public List<ValueDecl> getDecls() {
      return decls;
    }

    public SourceLoc getLoc() {
      return loc;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitOverloadSetRef(this);
    }
  }

  /**
   * Plain identifier not yet looked up
   */
  public static final class UnresolvedDeclRefExpr extends Expr {
    private final String name;
    private final SourceLoc loc;

    UnresolvedDeclRefExpr(ASTContext context, String name, SourceLoc loc) {
      super(ExprKind.UNRESOLVED_DECL_REF, context, null);
      this.name = name;
      this.loc = loc;
    }

    public String getName() {
      return name;
    }

    public SourceLoc getLoc() {
      return loc;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitUnresolvedDeclRef(this);
    }
  }

  /**
   * ":name", a member of a type that context has to supply
   */
  public static final class UnresolvedMemberExpr extends Expr {
    private final SourceLoc colonLoc;
    private final SourceLoc nameLoc;
    private final String name;

    UnresolvedMemberExpr(ASTContext context, SourceLoc colonLoc,
                         SourceLoc nameLoc, String name) {
      super(ExprKind.UNRESOLVED_MEMBER, context, null);
      this.colonLoc = colonLoc;
      this.nameLoc = nameLoc;
      this.name = name;
    }

    public SourceLoc getColonLoc() {
      return colonLoc;
    }

    public SourceLoc getNameLoc() {
      return nameLoc;
    }

    public String getName() {
      return name;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitUnresolvedMember(this);
    }
  }

  /**
   * "Type::name"
   */
  public static final class UnresolvedScopedIdentifierExpr extends Expr {
    private final TypeDecl typeDecl;
    private final SourceLoc typeDeclLoc;
    private final String name;
    private final SourceLoc nameLoc;

    UnresolvedScopedIdentifierExpr(ASTContext context, TypeDecl typeDecl,
        SourceLoc typeDeclLoc, String name, SourceLoc nameLoc) {
      super(ExprKind.UNRESOLVED_SCOPED_IDENTIFIER, context, null);
      assert(typeDecl != null);
      this.typeDecl = typeDecl;
      this.typeDeclLoc = typeDeclLoc;
      this.name = name;
      this.nameLoc = nameLoc;
    }

    public TypeDecl getTypeDecl() {
      return typeDecl;
    }

    public SourceLoc getTypeDeclLoc() {
      return typeDeclLoc;
    }

    public String getName() {
      return name;
    }

    public SourceLoc getNameLoc() {
      return nameLoc;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitUnresolvedScopedIdentifier(this);
    }
  }

  /**
   * Parenthesized list of elements, each optionally named.  An element
   * slot may be null once a default value has been substituted for it.
   */
  public static final class TupleExpr extends Expr {
    private final SourceLoc lParenLoc;
    private final Expr[] subExprs;
    /** null entries for positional elements */
    private final String[] names;
    private final SourceLoc rParenLoc;
    private final boolean groupingParen;

    TupleExpr(ASTContext context, SourceLoc lParenLoc, List<Expr> subExprs,
              List<String> names, SourceLoc rParenLoc,
              boolean groupingParen) {
      super(ExprKind.TUPLE, context, null);
      this.lParenLoc = lParenLoc;
      this.subExprs = subExprs.toArray(new Expr[subExprs.size()]);
      if (names == null) {
        this.names = new String[this.subExprs.length];
      } else {
        if (names.size() != subExprs.size()) {
          throw new SemaRuntimeError("Tuple at " + lParenLoc + " has "
              + subExprs.size() + " elements but " + names.size() + " names");
        }
        this.names = names.toArray(new String[names.size()]);
        for (String name: this.names) {
          if (name != null && name.isEmpty()) {
            throw new SemaRuntimeError("Tuple at " + lParenLoc
                      + " has an element with an empty name");
          }
        }
      }
      this.rParenLoc = rParenLoc;
      if (groupingParen && (this.subExprs.length != 1 ||
                            this.names[0] != null)) {
        throw new SemaRuntimeError("Grouping parenthesis at " + lParenLoc
                      + " must contain exactly one unnamed element");
      }
      this.groupingParen = groupingParen;
    }

    public SourceLoc getLParenLoc() {
      return lParenLoc;
    }

    public SourceLoc getRParenLoc() {
      return rParenLoc;
    }

    public int getNumElements() {
      return subExprs.length;
    }

    /**
     * @return the element, or null if it is a default value placeholder
     */
    public Expr getElement(int i) {
      return subExprs[i];
    }

    public void setElement(int i, Expr e) {
      subExprs[i] = e;
    }

    public List<Expr> getElements() {
      return Collections.unmodifiableList(Arrays.asList(subExprs));
    }

    /**
     * @return the element's name, or null if positional
     */
    public String getElementName(int i) {
      return names[i];
    }

    /**
     * @return true if this is just "(expr)" used for grouping
     */
    public boolean isGroupingParen() {
      return groupingParen;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitTuple(this);
    }
  }

  /**
   * "expr.name" before the member is resolved.  The base may be
   * missing, as in ".name".
   */
  public static final class UnresolvedDotExpr extends Expr {
    private Expr subExpr;
    private final SourceLoc dotLoc;
    private final String name;
    private final SourceLoc nameLoc;
    private List<ValueDecl> resolvedDecls = Collections.emptyList();

    UnresolvedDotExpr(ASTContext context, Expr subExpr, SourceLoc dotLoc,
                      String name, SourceLoc nameLoc) {
      super(ExprKind.UNRESOLVED_DOT, context, null);
      this.subExpr = subExpr;
      this.dotLoc = dotLoc;
      this.name = name;
      this.nameLoc = nameLoc;
    }

    /**
     * @return base expression, or null if none
     */
    public Expr getSubExpr() {
      return subExpr;
    }

    public void setSubExpr(Expr subExpr) {
      this.subExpr = subExpr;
    }

    public SourceLoc getDotLoc() {
      return dotLoc;
    }

    public String getName() {
      return name;
    }

    public SourceLoc getNameLoc() {
      return nameLoc;
    }

    /**
     * @return candidate declarations found so far for the member
     */
    public List<ValueDecl> getResolvedDecls() {
      return resolvedDecls;
    }

    public void setResolvedDecls(List<ValueDecl> decls) {
      this.resolvedDecls = ImmutableList.copyOf(decls);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitUnresolvedDot(this);
    }
  }

  /**
   * Access to a tuple field by index
   */
  public static final class TupleElementExpr extends Expr {
    private Expr subExpr;
    private final SourceLoc dotLoc;
    private final int fieldNo;
    private final SourceLoc nameLoc;

    TupleElementExpr(ASTContext context, Expr subExpr, SourceLoc dotLoc,
                     int fieldNo, SourceLoc nameLoc, Type type) {
      super(ExprKind.TUPLE_ELEMENT, context, type);
      assert(subExpr != null);
      assert(fieldNo >= 0);
      this.subExpr = subExpr;
      this.dotLoc = dotLoc;
      this.fieldNo = fieldNo;
      this.nameLoc = nameLoc;
    }

    public Expr getSubExpr() {
      return subExpr;
    }

    public void setSubExpr(Expr subExpr) {
      this.subExpr = subExpr;
    }

    public SourceLoc getDotLoc() {
      return dotLoc;
    }

    public int getFieldNo() {
      return fieldNo;
    }

    public SourceLoc getNameLoc() {
      return nameLoc;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitTupleElement(this);
    }
  }

  /**
   * Function application: fn applied to a single argument, usually a
   * tuple.
   */
  public static final class ApplyExpr extends Expr {
    private Expr fn;
    private Expr arg;

    ApplyExpr(ASTContext context, Expr fn, Expr arg, Type type) {
      super(ExprKind.APPLY, context, type);
      assert(fn != null);
      assert(arg != null);
      this.fn = fn;
      this.arg = arg;
    }

    public Expr getFn() {
      return fn;
    }

    public void setFn(Expr fn) {
      this.fn = fn;
    }

    public Expr getArg() {
      return arg;
    }

    public void setArg(Expr arg) {
      this.arg = arg;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitApply(this);
    }
  }

  /**
   * Expressions evaluated in order, e.g. the operands and operators of
   * an expression before precedence is applied.
   */
  public static final class SequenceExpr extends Expr {
    private final Expr[] elements;

    SequenceExpr(ASTContext context, List<Expr> elements) {
      super(ExprKind.SEQUENCE, context, null);
      if (elements.isEmpty()) {
        throw new SemaRuntimeError("Empty sequence expression");
      }
      this.elements = elements.toArray(new Expr[elements.size()]);
    }

    public int getNumElements() {
      return elements.length;
    }

    public Expr getElement(int i) {
      return elements[i];
    }

    public void setElement(int i, Expr e) {
      elements[i] = e;
    }

    public List<Expr> getElements() {
      return Collections.unmodifiableList(Arrays.asList(elements));
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitSequence(this);
    }
  }

  /**
   * An item in a brace expression: either an expression or a
   * declaration.
   */
  public static final class BraceElement {
    private final Expr expr;
    private final Decl decl;

    private BraceElement(Expr expr, Decl decl) {
      assert((expr == null) != (decl == null));
      this.expr = expr;
      this.decl = decl;
    }

    public static BraceElement ofExpr(Expr expr) {
      return new BraceElement(expr, null);
    }

    public static BraceElement ofDecl(Decl decl) {
      return new BraceElement(null, decl);
    }

    public boolean isExpr() {
      return expr != null;
    }

    public boolean isDecl() {
      return decl != null;
    }

    public Expr getExpr() {
      if (expr == null) {
        throw new SemaRuntimeError("Brace element is a declaration: "
                                   + decl);
      }
      return expr;
    }

    public Decl getDecl() {
      if (decl == null) {
        throw new SemaRuntimeError("Brace element is an expression: "
                                   + expr);
      }
      return decl;
    }
  }

  /**
   * "{ ... }" block of expressions and declarations
   */
  public static final class BraceExpr extends Expr {
    private final SourceLoc lBraceLoc;
    private final ArrayList<BraceElement> elements;
    private final SourceLoc rBraceLoc;

    BraceExpr(ASTContext context, SourceLoc lBraceLoc,
              List<BraceElement> elements, SourceLoc rBraceLoc) {
      super(ExprKind.BRACE, context, null);
      this.lBraceLoc = lBraceLoc;
      this.elements = new ArrayList<BraceElement>(elements);
      this.rBraceLoc = rBraceLoc;
    }

    public SourceLoc getLBraceLoc() {
      return lBraceLoc;
    }

    public SourceLoc getRBraceLoc() {
      return rBraceLoc;
    }

    public int getNumElements() {
      return elements.size();
    }

    public BraceElement getElement(int i) {
      return elements.get(i);
    }

    public void setElement(int i, BraceElement element) {
      elements.set(i, element);
    }

    public List<BraceElement> getElements() {
      return Collections.unmodifiableList(elements);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitBrace(this);
    }
  }

  /**
   * Closure whose body is a single expression.  Its type, once
   * assigned, is a function type.
   */
  public static final class ClosureExpr extends Expr {
    private Expr input;

    ClosureExpr(ASTContext context, Expr input, Type type) {
      super(ExprKind.CLOSURE, context, type);
      assert(input != null);
      this.input = input;
    }

    public Expr getInput() {
      return input;
    }

    public void setInput(Expr input) {
      this.input = input;
    }

    /**
     * @return number of arguments the closure takes: the number of
     *    fields of its input type if a tuple, otherwise 1
     */
    public int getNumArgs() {
      FunctionType ft = getType() == null ? null
                                          : Types.getAsFunction(getType());
      if (ft == null) {
        throw new SemaRuntimeError("Closure at " + getStartLoc()
                           + " does not have function type: " + getType());
      }
      TupleType inputTT = Types.getAsTuple(ft.getInput());
      if (inputTT != null) {
        return inputTT.numFields();
      }
      return 1;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitClosure(this);
    }
  }

  /**
   * Anonymous positional closure argument, e.g. $0
   */
  public static final class AnonClosureArgExpr extends Expr {
    private final int argNo;
    private final SourceLoc loc;

    AnonClosureArgExpr(ASTContext context, int argNo, SourceLoc loc) {
      super(ExprKind.ANON_CLOSURE_ARG, context, null);
      assert(argNo >= 0);
      this.argNo = argNo;
      this.loc = loc;
    }

    public int getArgNo() {
      return argNo;
    }

    public SourceLoc getLoc() {
      return loc;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitAnonClosureArg(this);
    }
  }

  /**
   * Binary operator application.  The operator function is null for
   * plain assignment.
   */
  public static final class BinaryExpr extends Expr {
    private final Expr fn;
    private Expr lhs;
    private Expr rhs;

    BinaryExpr(ASTContext context, Expr fn, Expr lhs, Expr rhs, Type type) {
      super(ExprKind.BINARY, context, type);
      assert(lhs != null);
      assert(rhs != null);
      this.fn = fn;
      this.lhs = lhs;
      this.rhs = rhs;
    }

    public Expr getFn() {
      return fn;
    }

    public Expr getLhs() {
      return lhs;
    }

    public void setLhs(Expr lhs) {
      this.lhs = lhs;
    }

    public Expr getRhs() {
      return rhs;
    }

    public void setRhs(Expr rhs) {
      this.rhs = rhs;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitBinary(this);
    }
  }
}
