package exm.sema.common.lang;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import exm.sema.common.exceptions.SemaRuntimeError;
import exm.sema.common.lang.Types.BuiltinType;
import exm.sema.common.lang.Types.DependentType;
import exm.sema.common.lang.Types.FunctionType;
import exm.sema.common.lang.Types.NameAliasType;
import exm.sema.common.lang.Types.TupleType;
import exm.sema.common.lang.Types.TupleTypeElt;
import exm.sema.common.lang.Types.Type;

public class TypesTest {

  private static final Type MY_INT = new NameAliasType("MyInt", Types.INT);

  @Test
  public void testAliasCanonical() {
    assertFalse("Sugar is part of the spelled type",
                MY_INT.equals(Types.INT));
    assertTrue(Types.canonicalEquals(MY_INT, Types.INT));
    assertSame(Types.INT, MY_INT.getCanonicalType());
  }

  @Test
  public void testTupleCanonical() {
    TupleType sugared = TupleType.make(TupleTypeElt.named("a", MY_INT),
                                       TupleTypeElt.withDefault("b", Types.INT));
    TupleType plain = TupleType.make(TupleTypeElt.named("a", Types.INT),
                                     TupleTypeElt.named("b", Types.INT));
    assertTrue("Defaults and sugar don't affect canonical equality",
               Types.canonicalEquals(sugared, plain));

    TupleType renamed = TupleType.make(TupleTypeElt.named("a", Types.INT),
                                       TupleTypeElt.named("c", Types.INT));
    assertFalse("Names do", Types.canonicalEquals(plain, renamed));
    assertFalse(Types.canonicalEquals(plain,
                        TupleType.makeUnnamed(Types.INT, Types.INT)));
    assertSame("No new object if nothing to strip",
               plain, plain.getCanonicalType());
  }

  @Test
  public void testFunctionCanonical() {
    Type f1 = new FunctionType(Types.EMPTY_TUPLE, MY_INT);
    Type f2 = new FunctionType(Types.EMPTY_TUPLE, Types.INT);
    assertTrue(Types.canonicalEquals(f1, f2));
    assertFalse(f1.equals(f2));
  }

  @Test
  public void testQueriesLookThroughAliases() {
    Type pair = new NameAliasType("Pair",
                        TupleType.makeUnnamed(Types.INT, Types.INT));
    assertTrue(Types.isTuple(pair));
    assertEquals(2, Types.getAsTuple(pair).numFields());
    assertNull(Types.getAsFunction(pair));

    Type thunk = new NameAliasType("Thunk",
                        new FunctionType(Types.EMPTY_TUPLE, Types.INT));
    assertTrue(Types.isFunction(thunk));
    assertEquals(Types.INT, Types.getAsFunction(thunk).getResult());

    assertTrue(Types.isDependent(DependentType.INSTANCE));
    assertFalse(Types.isDependent(Types.INT));
  }

  @Test
  public void testScalarInitField() {
    assertEquals(1, TupleType.make(TupleTypeElt.withDefault("a", Types.INT),
        TupleTypeElt.named("b", Types.INT)).getFieldForScalarInit());
    assertEquals("Two required fields", -1,
        TupleType.makeUnnamed(Types.INT, Types.INT).getFieldForScalarInit());
    assertEquals("All defaulted", -1,
        TupleType.make(TupleTypeElt.withDefault("a", Types.INT))
                 .getFieldForScalarInit());
    assertEquals(-1, Types.EMPTY_TUPLE.getFieldForScalarInit());
  }

  @Test
  public void testNamedElementId() {
    TupleType t = TupleType.make(TupleTypeElt.unnamed(Types.INT),
                                 TupleTypeElt.named("y", Types.INT));
    assertEquals(1, t.getNamedElementId("y"));
    assertEquals(-1, t.getNamedElementId("x"));
  }

  @Test
  public void testToString() {
    TupleType t = TupleType.make(TupleTypeElt.named("x", Types.INT),
        TupleTypeElt.withDefault("y", new BuiltinType("Float")));
    assertEquals("(x: Int, y: Float = default)", t.toString());
    assertEquals("() -> Int",
        new FunctionType(Types.EMPTY_TUPLE, Types.INT).toString());
  }

  @Test(expected = SemaRuntimeError.class)
  public void testCompareWithNonType() {
    Types.INT.equals("Int");
  }
}
