package exm.sema.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.sema.ast.ASTContext;
import exm.sema.ast.Decls.ValueDecl;
import exm.sema.ast.Expr;
import exm.sema.ast.Exprs.ApplyExpr;
import exm.sema.ast.Exprs.BinaryExpr;
import exm.sema.ast.Exprs.BraceElement;
import exm.sema.ast.Exprs.BraceExpr;
import exm.sema.ast.Exprs.IntegerLiteral;
import exm.sema.ast.Exprs.SequenceExpr;
import exm.sema.ast.Exprs.TupleExpr;
import exm.sema.ast.Exprs.UnresolvedDeclRefExpr;
import exm.sema.common.Logging;
import exm.sema.common.exceptions.WalkAbortedError;
import exm.sema.common.lang.Types;
import exm.sema.frontend.ExprWalker.TreeWalker;
import exm.sema.frontend.ExprWalker.WalkFn;
import exm.sema.frontend.ExprWalker.WalkOrder;

public class ExprWalkerTest {

  private final ASTContext ctx = new ASTContext("walker.test");

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/ExprWalkerTest.sema.log", true);
  }

  /**
   * Records every call as "pre:name" or "post:name"
   */
  private static class Recorder implements WalkFn {
    final List<String> calls = new ArrayList<String>();

    @Override
    public Expr visit(Expr e, WalkOrder order) {
      calls.add((order == WalkOrder.PRE_ORDER ? "pre:" : "post:")
                + label(e));
      return e;
    }
  }

  private static String label(Expr e) {
    if (e instanceof IntegerLiteral) {
      return ((IntegerLiteral)e).getText();
    } else if (e instanceof UnresolvedDeclRefExpr) {
      return ((UnresolvedDeclRefExpr)e).getName();
    }
    return e.getKind().toString();
  }

  private IntegerLiteral lit(String text) {
    return ctx.createIntegerLiteral(text, ctx.loc(1, 1), Types.INT);
  }

  private UnresolvedDeclRefExpr ref(String name) {
    return ctx.createUnresolvedDeclRef(name, ctx.loc(1, 1));
  }

  private TupleExpr tuple(Expr ...elts) {
    return ctx.createTuple(ctx.loc(1, 1), Arrays.asList(elts), null,
                           ctx.loc(1, 2));
  }

  @Test
  public void testPreAndPostOrder() {
    BinaryExpr add = ctx.createBinary(null, lit("1"), lit("2"), Types.INT);
    Recorder rec = new Recorder();
    assertSame(add, ExprWalker.walk(add, rec));
    assertEquals(Arrays.asList("pre:BINARY", "pre:1", "post:1",
                               "pre:2", "post:2", "post:BINARY"),
                 rec.calls);
  }

  @Test
  public void testAbortInCalleeSkipsArgument() {
    final Expr f = ref("f");
    Expr x = ref("x");
    ApplyExpr apply = ctx.createApply(f, x, Types.INT);

    final List<Expr> visited = new ArrayList<Expr>();
    Expr result = ExprWalker.walk(apply, new WalkFn() {
      @Override
      public Expr visit(Expr e, WalkOrder order) {
        visited.add(e);
        if (order == WalkOrder.POST_ORDER && e == f) {
          return null;
        }
        return e;
      }
    });

    assertNull("Abort propagates to the root", result);
    assertFalse("Argument never visited", visited.contains(x));
    assertEquals("Root pre, callee pre, callee post only",
                 Arrays.<Expr>asList(apply, f, f), visited);
  }

  @Test
  public void testRejectSkipsOnlyThatSubtree() {
    IntegerLiteral hidden = lit("3");
    final TupleExpr middle = tuple(hidden);
    SequenceExpr seq = ctx.createSequence(Arrays.<Expr>asList(
                      tuple(lit("1"), lit("2")), middle, tuple(lit("4"))));

    final List<String> calls = new ArrayList<String>();
    Expr result = ExprWalker.walk(seq, new WalkFn() {
      @Override
      public Expr visit(Expr e, WalkOrder order) {
        calls.add(order + ":" + label(e));
        if (order == WalkOrder.PRE_ORDER && e == middle) {
          return null;
        }
        return e;
      }
    });

    assertSame("Walk completes with the original tree", seq, result);
    assertSame(middle, seq.getElement(1));
    assertFalse("Children of rejected node unvisited",
                calls.contains("PRE_ORDER:3"));
    assertEquals("No post-order for rejected node",
                 2, countOf(calls, "POST_ORDER:TUPLE"));
    assertTrue(calls.contains("POST_ORDER:1"));
    assertTrue(calls.contains("POST_ORDER:2"));
    assertTrue(calls.contains("POST_ORDER:4"));
    assertEquals("POST_ORDER:SEQUENCE", calls.get(calls.size() - 1));
  }

  private static int countOf(List<String> calls, String call) {
    int count = 0;
    for (String c: calls) {
      if (c.equals(call)) {
        count++;
      }
    }
    return count;
  }

  @Test
  public void testRewriteReplacesChildSlots() {
    TupleExpr t = tuple(lit("1"), lit("2"), lit("1"));
    ApplyExpr apply = ctx.createApply(ref("g"), t, Types.INT);

    Expr result = ExprWalker.walk(apply, new TreeWalker() {
      @Override
      protected Expr walkToParent(Expr e) {
        if (e instanceof IntegerLiteral &&
            ((IntegerLiteral)e).getText().equals("1")) {
          return ctx.createIntegerLiteral("42", e.getStartLoc(), Types.INT);
        }
        return e;
      }
    });

    assertSame(apply, result);
    assertEquals("42", ((IntegerLiteral)t.getElement(0)).getText());
    assertEquals("2", ((IntegerLiteral)t.getElement(1)).getText());
    assertEquals("42", ((IntegerLiteral)t.getElement(2)).getText());
  }

  @Test
  public void testRootReplacement() {
    Expr root = lit("7");
    final Expr replacement = lit("8");
    Expr result = ExprWalker.walk(root, new TreeWalker() {
      @Override
      protected Expr walkToParent(Expr e) {
        return replacement;
      }
    });
    assertSame(replacement, result);
  }

  @Test
  public void testAbortKeepsEarlierRewrites() {
    SequenceExpr seq = ctx.createSequence(Arrays.<Expr>asList(
                                  lit("1"), ref("stop"), lit("3")));
    Expr result = ExprWalker.walk(seq, new TreeWalker() {
      @Override
      protected Expr walkToParent(Expr e) {
        String text = label(e);
        if (text.equals("1")) {
          return ref("one");
        } else if (text.equals("stop")) {
          return null;
        }
        return e;
      }
    });
    assertNull(result);
    assertEquals("one", label(seq.getElement(0)));
    assertEquals("3", label(seq.getElement(2)));
  }

  @Test
  public void testBraceDeclarationInitializers() {
    ValueDecl decl = new ValueDecl("v", ctx.loc(2, 5), Types.INT, lit("1"));
    ValueDecl noInit = new ValueDecl("w", ctx.loc(3, 5), Types.INT);
    BraceExpr brace = ctx.createBrace(ctx.loc(2, 1), Arrays.asList(
        BraceElement.ofDecl(decl), BraceElement.ofDecl(noInit),
        BraceElement.ofExpr(lit("1"))), ctx.loc(4, 1));

    ExprWalker.walk(brace, new TreeWalker() {
      @Override
      protected Expr walkToParent(Expr e) {
        if (label(e).equals("1")) {
          return lit("2");
        }
        return e;
      }
    });

    assertEquals("2", label(decl.getInit()));
    assertNull(noInit.getInit());
    assertEquals("2", label(brace.getElement(2).getExpr()));
  }

  @Test
  public void testDefaultPlaceholdersSkipped() {
    TupleExpr t = tuple(lit("1"), lit("2"));
    t.setElement(0, null);
    Recorder rec = new Recorder();
    assertSame(t, ExprWalker.walk(t, rec));
    assertEquals(Arrays.asList("pre:TUPLE", "pre:2", "post:2", "post:TUPLE"),
                 rec.calls);
    assertNull(t.getElement(0));
  }

  @Test
  public void testClosureAndMemberChildren() {
    Expr base = lit("1");
    Expr dot = ctx.createUnresolvedDot(base, ctx.loc(1, 2), "foo",
                                       ctx.loc(1, 3));
    Expr elt = ctx.createTupleElement(dot, ctx.loc(1, 6), 0, ctx.loc(1, 7),
                                      Types.INT);
    Expr closure = ctx.createClosure(elt, null);
    Recorder rec = new Recorder();
    ExprWalker.walk(closure, rec);
    assertEquals(Arrays.asList("pre:CLOSURE", "pre:TUPLE_ELEMENT",
        "pre:UNRESOLVED_DOT", "pre:1", "post:1", "post:UNRESOLVED_DOT",
        "post:TUPLE_ELEMENT", "post:CLOSURE"), rec.calls);
  }

  @Test
  public void testWalkOrFail() {
    exception.expect(WalkAbortedError.class);
    ExprWalker.walkOrFail(lit("1"), new TreeWalker() {
      @Override
      protected Expr walkToParent(Expr e) {
        return null;
      }
    });
  }
}
