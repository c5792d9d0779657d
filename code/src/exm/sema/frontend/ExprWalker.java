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

import org.apache.log4j.Logger;

import exm.sema.ast.Decls.Decl;
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
import exm.sema.common.Logging;
import exm.sema.common.exceptions.WalkAbortedError;

/**
 * Walks an expression tree, calling a function before and after the
 * children of each node are visited, and rewriting child slots in place
 * with whatever the post-order call returns.
 *
 * Pre-order: returning null skips the node's children and leaves the
 * node as it is (no post-order call).  Any other value continues into
 * the children.
 * Post-order: the returned node replaces the visited one in its parent.
 * Returning null aborts the whole walk.
 *
 * An aborted walk does not undo rewrites already made.  Two walks must
 * not run over overlapping subtrees at the same time.
 */
public class ExprWalker {

  public static enum WalkOrder {
    PRE_ORDER,
    POST_ORDER,
  }

  public static interface WalkFn {
    Expr visit(Expr e, WalkOrder order);
  }

  /**
   * Convenience base class for walks that only need one of the hooks.
   */
  public static abstract class TreeWalker implements WalkFn {
    @Override
    public final Expr visit(Expr e, WalkOrder order) {
      if (order == WalkOrder.PRE_ORDER) {
        return walkToChildren(e) ? e : null;
      } else {
        return walkToParent(e);
      }
    }

    /**
     * @return false to leave this subtree untouched
     */
    protected boolean walkToChildren(Expr e) {
      return true;
    }

    /**
     * @return replacement for e, or null to abort the walk
     */
    protected Expr walkToParent(Expr e) {
      return e;
    }
  }

  /**
   * Walk the tree rooted at root.
   * @param root
   * @param fn
   * @return the (possibly replaced) root, or null if the walk was aborted
   */
  public static Expr walk(Expr root, WalkFn fn) {
    return walk(Logging.getSemaLogger(), root, fn);
  }

  public static Expr walk(Logger logger, Expr root, WalkFn fn) {
    Expr result = new ChildWalker(logger, fn).process(root);
    if (result == null) {
      logger.debug("Expression walk from " + root.getStartLoc()
                   + " aborted");
    }
    return result;
  }

  /**
   * Walk for passes where an abort can only mean an earlier failure.
   * @throws WalkAbortedError if the walk was aborted
   */
  public static Expr walkOrFail(Expr root, WalkFn fn) {
    Expr result = walk(root, fn);
    if (result == null) {
      throw new WalkAbortedError("Walk of expression at "
                                 + root.getStartLoc() + " was aborted");
    }
    return result;
  }

  /**
   * Processes the children of one node.  Returns the node itself, or
   * null as soon as any child aborts.
   */
  private static class ChildWalker implements ExprVisitor<Expr> {
    private final Logger logger;
    private final WalkFn fn;

    ChildWalker(Logger logger, WalkFn fn) {
      this.logger = logger;
      this.fn = fn;
    }

    Expr process(Expr e) {
      if (fn.visit(e, WalkOrder.PRE_ORDER) == null) {
        if (logger.isTraceEnabled()) {
          logger.trace("Skipping children of " + e.getKind() + " at "
                       + e.getStartLoc());
        }
        return e;
      }

      Expr visited = e.accept(this);
      if (visited == null) {
        return null;
      }
      return fn.visit(visited, WalkOrder.POST_ORDER);
    }

    @Override
    public Expr visitIntegerLiteral(IntegerLiteral e) {
      return e;
    }

    @Override
    public Expr visitDeclRef(DeclRefExpr e) {
      return e;
    }

    @Override
    public Expr visitOverloadSetRef(OverloadSetRefExpr e) {
      return e;
    }

    @Override
    public Expr visitUnresolvedDeclRef(UnresolvedDeclRefExpr e) {
      return e;
    }

    @Override
    public Expr visitUnresolvedMember(UnresolvedMemberExpr e) {
      return e;
    }

    @Override
    public Expr visitUnresolvedScopedIdentifier(
                                    UnresolvedScopedIdentifierExpr e) {
      return e;
    }

    @Override
    public Expr visitTuple(TupleExpr e) {
      for (int i = 0; i < e.getNumElements(); i++) {
        Expr elt = e.getElement(i);
        if (elt == null) {
          // Default value placeholder
          continue;
        }
        Expr newElt = process(elt);
        if (newElt == null) {
          return null;
        }
        e.setElement(i, newElt);
      }
      return e;
    }

    @Override
    public Expr visitUnresolvedDot(UnresolvedDotExpr e) {
      if (e.getSubExpr() == null) {
        return e;
      }
      Expr sub = process(e.getSubExpr());
      if (sub == null) {
        return null;
      }
      e.setSubExpr(sub);
      return e;
    }

    @Override
    public Expr visitTupleElement(TupleElementExpr e) {
      Expr sub = process(e.getSubExpr());
      if (sub == null) {
        return null;
      }
      e.setSubExpr(sub);
      return e;
    }

    @Override
    public Expr visitApply(ApplyExpr e) {
      Expr fnExpr = process(e.getFn());
      if (fnExpr == null) {
        return null;
      }
      e.setFn(fnExpr);

      Expr arg = process(e.getArg());
      if (arg == null) {
        return null;
      }
      e.setArg(arg);
      return e;
    }

    @Override
    public Expr visitSequence(SequenceExpr e) {
      for (int i = 0; i < e.getNumElements(); i++) {
        Expr elt = process(e.getElement(i));
        if (elt == null) {
          return null;
        }
        e.setElement(i, elt);
      }
      return e;
    }

    @Override
    public Expr visitBrace(BraceExpr e) {
      for (int i = 0; i < e.getNumElements(); i++) {
        BraceElement element = e.getElement(i);
        if (element.isExpr()) {
          Expr sub = process(element.getExpr());
          if (sub == null) {
            return null;
          }
          e.setElement(i, BraceElement.ofExpr(sub));
          continue;
        }

        Decl d = element.getDecl();
        if (d instanceof ValueDecl) {
          ValueDecl vd = (ValueDecl)d;
          if (vd.getInit() != null) {
            Expr init = process(vd.getInit());
            if (init == null) {
              return null;
            }
            vd.setInit(init);
          }
        }
      }
      return e;
    }

    @Override
    public Expr visitClosure(ClosureExpr e) {
      Expr input = process(e.getInput());
      if (input == null) {
        return null;
      }
      e.setInput(input);
      return e;
    }

    @Override
    public Expr visitAnonClosureArg(AnonClosureArgExpr e) {
      return e;
    }

    @Override
    public Expr visitBinary(BinaryExpr e) {
      Expr lhs = process(e.getLhs());
      if (lhs == null) {
        return null;
      }
      e.setLhs(lhs);

      Expr rhs = process(e.getRhs());
      if (rhs == null) {
        return null;
      }
      e.setRhs(rhs);
      return e;
    }
  }
}
