package exm.sema.frontend.typecheck;

import static exm.sema.frontend.typecheck.TupleReconciler.FieldBinding.boundTo;
import static exm.sema.frontend.typecheck.TupleReconciler.FieldBinding.useDefault;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.sema.ast.ASTContext;
import exm.sema.ast.Expr;
import exm.sema.ast.Exprs.TupleExpr;
import exm.sema.common.exceptions.SemaRuntimeError;
import exm.sema.common.lang.Types;
import exm.sema.common.lang.Types.BuiltinType;
import exm.sema.common.lang.Types.TupleType;
import exm.sema.common.lang.Types.TupleTypeElt;
import exm.sema.frontend.typecheck.TupleReconciler.FieldBinding;
import exm.sema.frontend.typecheck.TupleReconciler.Reconciliation;

public class TupleReconcilerTest {

  private static final BuiltinType FLOAT = new BuiltinType("Float");

  private final ASTContext ctx = new ASTContext("reconciler.test");

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static List<String> names(String ...names) {
    return Arrays.asList(names);
  }

  private TupleExpr intTuple(List<String> names) {
    List<Expr> elts = new ArrayList<Expr>();
    for (int i = 0; i < names.size(); i++) {
      elts.add(ctx.createIntegerLiteral(Integer.toString(i),
                                ctx.loc(1, 2 + i), Types.INT));
    }
    return ctx.createTuple(ctx.loc(1, 1), elts, names, ctx.loc(1, 20));
  }

  @Test
  public void testNamedSwizzle() {
    TupleType dest = TupleType.make(TupleTypeElt.named("x", Types.INT),
                                    TupleTypeElt.named("y", Types.INT));
    Reconciliation r = TupleReconciler.reconcileLiteral(
                                    intTuple(names("y", "x")), dest);
    assertEquals(ConversionRank.IDENTITY, r.rank);
    assertEquals("x takes element 1, y takes element 0",
                 Arrays.asList(boundTo(1), boundTo(0)), r.bindings);
  }

  @Test
  public void testDefaultBinding() {
    TupleType dest = TupleType.make(TupleTypeElt.named("a", Types.INT),
                                    TupleTypeElt.withDefault("b", Types.INT));
    Reconciliation r = TupleReconciler.reconcileLiteral(
                                    intTuple(names((String)null)), dest);
    assertTrue(r.isValid());
    assertEquals(Arrays.asList(boundTo(0), useDefault()), r.bindings);
  }

  @Test
  public void testPositionalSkipsNamedSources() {
    // (b: _, _) to (a: Int = 0, b: Int, Int = 0)
    TupleType dest = TupleType.make(
        TupleTypeElt.withDefault("a", Types.INT),
        TupleTypeElt.named("b", Types.INT),
        TupleTypeElt.withDefault(null, Types.INT));
    List<FieldBinding> bindings = TupleReconciler.matchElements(
                                    names("b", null), dest);
    assertEquals(Arrays.asList(boundTo(1), boundTo(0), useDefault()),
                 bindings);
  }

  @Test
  public void testUnmatchedNameFailsInsteadOfBindingPositionally() {
    // Named source element "z" is never a positional candidate
    TupleType dest = TupleType.makeUnnamed(Types.INT);
    assertNull(TupleReconciler.matchElements(names("z"), dest));
  }

  @Test
  public void testDuplicateNamesTakeFirstUnused() {
    TupleType dest = TupleType.make(TupleTypeElt.named("x", Types.INT),
                                    TupleTypeElt.named("x", Types.INT));
    assertEquals(Arrays.asList(boundTo(0), boundTo(1)),
        TupleReconciler.matchElements(names("x", "x"), dest));
  }

  @Test
  public void testArityFailure() {
    TupleType dest = TupleType.makeUnnamed(Types.INT, Types.INT, Types.INT);
    Reconciliation r = TupleReconciler.reconcileLiteral(
                                    intTuple(names(null, null)), dest);
    assertFalse(r.isValid());
    assertNull("No bindings when elements don't line up", r.bindings);
  }

  @Test
  public void testUnusedSourceFailure() {
    TupleType dest = TupleType.makeUnnamed(Types.INT);
    Reconciliation r = TupleReconciler.reconcileLiteral(
                                    intTuple(names(null, null)), dest);
    assertEquals(ConversionRank.INVALID, r.rank);
  }

  @Test
  public void testEmptySourceAllDefaults() {
    TupleType dest = TupleType.make(TupleTypeElt.withDefault("a", FLOAT));
    Reconciliation r = TupleReconciler.reconcileLiteral(
                                    intTuple(names()), dest);
    assertEquals(ConversionRank.IDENTITY, r.rank);
    assertEquals(Arrays.asList(useDefault()), r.bindings);
  }

  @Test
  public void testLiteralElementMismatch() {
    TupleType dest = TupleType.makeUnnamed(Types.INT, FLOAT);
    Reconciliation r = TupleReconciler.reconcileLiteral(
                                    intTuple(names(null, null)), dest);
    assertEquals(ConversionRank.INVALID, r.rank);
    assertEquals("Elements still lined up",
                 Arrays.asList(boundTo(0), boundTo(1)), r.bindings);
  }

  @Test
  public void testDefaultPlaceholderElementSkipped() {
    TupleExpr src = intTuple(names(null, null));
    src.setElement(1, null);
    TupleType dest = TupleType.makeUnnamed(Types.INT, FLOAT);
    assertEquals(ConversionRank.IDENTITY,
                 TupleReconciler.reconcileLiteral(src, dest).rank);
  }

  @Test
  public void testStructuralRequiresExactTypes() {
    TupleType src = TupleType.make(TupleTypeElt.named("b", FLOAT),
                                   TupleTypeElt.named("a", Types.INT));
    TupleType dest = TupleType.make(TupleTypeElt.named("a", Types.INT),
                                    TupleTypeElt.named("b", FLOAT));
    Reconciliation r = TupleReconciler.reconcileStructural(src, dest);
    assertEquals(ConversionRank.IDENTITY, r.rank);
    assertEquals(Arrays.asList(boundTo(1), boundTo(0)), r.bindings);

    TupleType wrong = TupleType.make(TupleTypeElt.named("a", FLOAT),
                                     TupleTypeElt.named("b", FLOAT));
    assertEquals(ConversionRank.INVALID,
                 TupleReconciler.reconcileStructural(src, wrong).rank);
  }

  @Test
  public void testDefaultHasNoSourceIndex() {
    exception.expect(SemaRuntimeError.class);
    useDefault().getSourceIndex();
  }
}
