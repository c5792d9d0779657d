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
package exm.sema.common.lang;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.sema.common.exceptions.SemaRuntimeError;

/**
 * This module provides the type definitions consumed by expression
 * checking, along with convenience functions for inspecting them.
 *
 * Only the parts needed to rank conversions are modelled: named builtin
 * types, alias sugar, tuples, functions and the unresolved type.
 * Exact comparisons always go through the canonical type.
 */
public class Types {

  private enum StructureType
  {
    BUILTIN,
    /** Sugar: a name for another type */
    NAME_ALIAS,
    TUPLE,
    FUNCTION,
    /** Not yet resolved by type checking */
    DEPENDENT,
  }

  /**
   * Base class for all types.
   */
  public abstract static class Type {

    abstract StructureType structureType();

    /**
     * @return the type with all sugar removed at every level
     */
    public abstract Type getCanonicalType();

    /**
     * @return the type with top-level sugar removed
     */
    public Type desugar() {
      return this;
    }

    /** Prints out a description of type for user */
    @Override
    public abstract String toString();

    /** equals is required */
    @Override
    public abstract boolean equals(Object o);

    /** hashcode is required */
    @Override
    public abstract int hashCode();
  }

  /**
   * A type known to the compiler by name, e.g. Int
   */
  public static class BuiltinType extends Type {
    private final String name;

    public BuiltinType(String name) {
      assert(name != null);
      this.name = name;
    }

    public String getName() {
      return name;
    }

    @Override
    StructureType structureType() {
      return StructureType.BUILTIN;
    }

    @Override
    public Type getCanonicalType() {
      return this;
    }

    @Override
    public String toString() {
      return name;
    }

    @Override
    public boolean equals(Object other) {
      checkTypeComparison(other);
      if (!(other instanceof BuiltinType)) {
        return false;
      }
      return ((BuiltinType)other).name.equals(name);
    }

    @Override
    public int hashCode() {
      return BuiltinType.class.hashCode() + 13 * name.hashCode();
    }
  }

  /**
   * Alternative name for another type.  Two aliases of the same type
   * are distinct types but have the same canonical type.
   */
  public static class NameAliasType extends Type {
    private final String name;
    private final Type underlying;

    public NameAliasType(String name, Type underlying) {
      assert(name != null);
      assert(underlying != null);
      this.name = name;
      this.underlying = underlying;
    }

    public String getName() {
      return name;
    }

    public Type getUnderlying() {
      return underlying;
    }

    @Override
    StructureType structureType() {
      return StructureType.NAME_ALIAS;
    }

    @Override
    public Type getCanonicalType() {
      return underlying.getCanonicalType();
    }

    @Override
    public Type desugar() {
      return underlying.desugar();
    }

    @Override
    public String toString() {
      return name;
    }

    @Override
    public boolean equals(Object other) {
      checkTypeComparison(other);
      if (!(other instanceof NameAliasType)) {
        return false;
      }
      NameAliasType otherT = (NameAliasType)other;
      return otherT.name.equals(name) && otherT.underlying.equals(underlying);
    }

    @Override
    public int hashCode() {
      return underlying.hashCode() + 13 *
          (NameAliasType.class.hashCode() + 13 * name.hashCode());
    }
  }

  /**
   * A field of a tuple type.  Name is null if the field is positional.
   */
  public static class TupleTypeElt {
    private final String name;
    private final Type type;
    private final boolean hasDefault;

    public TupleTypeElt(String name, Type type, boolean hasDefault) {
      assert(type != null);
      assert(name == null || name.length() > 0) : "Use null for no name";
      this.name = name;
      this.type = type;
      this.hasDefault = hasDefault;
    }

    public static TupleTypeElt unnamed(Type type) {
      return new TupleTypeElt(null, type, false);
    }

    public static TupleTypeElt named(String name, Type type) {
      return new TupleTypeElt(name, type, false);
    }

    public static TupleTypeElt withDefault(String name, Type type) {
      return new TupleTypeElt(name, type, true);
    }

    public String getName() {
      return name;
    }

    public boolean hasName() {
      return name != null;
    }

    public Type getType() {
      return type;
    }

    public boolean hasDefault() {
      return hasDefault;
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder();
      if (name != null) {
        sb.append(name).append(": ");
      }
      sb.append(type);
      if (hasDefault) {
        sb.append(" = default");
      }
      return sb.toString();
    }
  }

  public static class TupleType extends Type {
    private final ImmutableList<TupleTypeElt> fields;

    public TupleType(List<TupleTypeElt> fields) {
      this.fields = ImmutableList.copyOf(fields);
    }

    public static TupleType make(TupleTypeElt ...fields) {
      return new TupleType(Arrays.asList(fields));
    }

    /**
     * Tuple with positional fields and no defaults
     */
    public static TupleType makeUnnamed(Type ...fieldTypes) {
      List<TupleTypeElt> fields = new ArrayList<TupleTypeElt>();
      for (Type t: fieldTypes) {
        fields.add(TupleTypeElt.unnamed(t));
      }
      return new TupleType(fields);
    }

    public List<TupleTypeElt> getFields() {
      return fields;
    }

    public int numFields() {
      return fields.size();
    }

    public TupleTypeElt getField(int i) {
      return fields.get(i);
    }

    public Type getElementType(int i) {
      return fields.get(i).getType();
    }

    /**
     * A scalar can initialize this tuple if exactly one field lacks a
     * default value.
     * @return index of that field, or -1 if there isn't exactly one
     */
    public int getFieldForScalarInit() {
      int fieldWithoutDefault = -1;
      for (int i = 0; i < fields.size(); i++) {
        if (fields.get(i).hasDefault()) {
          continue;
        }
        if (fieldWithoutDefault != -1) {
          return -1;
        }
        fieldWithoutDefault = i;
      }
      return fieldWithoutDefault;
    }

    /**
     * @return index of the field with this name, or -1 if none
     */
    public int getNamedElementId(String name) {
      for (int i = 0; i < fields.size(); i++) {
        if (name.equals(fields.get(i).getName())) {
          return i;
        }
      }
      return -1;
    }

    @Override
    StructureType structureType() {
      return StructureType.TUPLE;
    }

    @Override
    public Type getCanonicalType() {
      boolean differences = false;
      List<TupleTypeElt> canonFields =
                  new ArrayList<TupleTypeElt>(fields.size());
      for (TupleTypeElt field: fields) {
        Type canon = field.getType().getCanonicalType();
        if (canon != field.getType()) {
          differences = true;
          canonFields.add(new TupleTypeElt(field.getName(), canon,
                                           field.hasDefault()));
        } else {
          canonFields.add(field);
        }
      }
      // Avoid creating identical type objects
      return differences ? new TupleType(canonFields) : this;
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder();
      boolean first = true;
      sb.append("(");
      for (TupleTypeElt field: fields) {
        if (first) {
          first = false;
        } else {
          sb.append(", ");
        }
        sb.append(field.toString());
      }
      sb.append(")");
      return sb.toString();
    }

    /**
     * Field names and types must match.  Defaults are not part of
     * the type's identity.
     */
    @Override
    public boolean equals(Object other) {
      checkTypeComparison(other);
      if (!(other instanceof TupleType)) {
        return false;
      }
      TupleType otherTT = (TupleType)other;
      if (this.fields.size() != otherTT.fields.size()) {
        return false;
      }
      for (int i = 0; i < this.fields.size(); i++) {
        TupleTypeElt field1 = this.fields.get(i);
        TupleTypeElt field2 = otherTT.fields.get(i);
        if (field1.hasName() != field2.hasName() ||
            (field1.hasName() && !field1.getName().equals(field2.getName()))) {
          return false;
        }
        if (!field1.getType().equals(field2.getType())) {
          return false;
        }
      }
      return true;
    }

    @Override
    public int hashCode() {
      int hash = TupleType.class.hashCode();
      for (TupleTypeElt field: fields) {
        hash = hash * 13 + field.getType().hashCode();
        if (field.hasName()) {
          hash = hash * 13 + field.getName().hashCode();
        }
      }
      return hash;
    }
  }

  /**
   * Function types take a single input (usually a tuple) and produce
   * a single result.
   */
  public static class FunctionType extends Type {
    private final Type input;
    private final Type result;

    public FunctionType(Type input, Type result) {
      assert(input != null);
      assert(result != null);
      this.input = input;
      this.result = result;
    }

    public Type getInput() {
      return input;
    }

    public Type getResult() {
      return result;
    }

    @Override
    StructureType structureType() {
      return StructureType.FUNCTION;
    }

    @Override
    public Type getCanonicalType() {
      Type canonInput = input.getCanonicalType();
      Type canonResult = result.getCanonicalType();
      if (canonInput == input && canonResult == result) {
        return this;
      }
      return new FunctionType(canonInput, canonResult);
    }

    @Override
    public String toString() {
      return input + " -> " + result;
    }

    @Override
    public boolean equals(Object other) {
      checkTypeComparison(other);
      if (!(other instanceof FunctionType)) {
        return false;
      }
      FunctionType otherFT = (FunctionType)other;
      return input.equals(otherFT.input) && result.equals(otherFT.result);
    }

    @Override
    public int hashCode() {
      return FunctionType.class.hashCode() +
          13 * (input.hashCode() + 13 * result.hashCode());
    }
  }

  /**
   * Type of an expression that hasn't been resolved yet.
   * Singleton.
   */
  public static class DependentType extends Type {
    public static final DependentType INSTANCE = new DependentType();

    private DependentType() {
    }

    @Override
    StructureType structureType() {
      return StructureType.DEPENDENT;
    }

    @Override
    public Type getCanonicalType() {
      return this;
    }

    @Override
    public String toString() {
      return "<<dependent type>>";
    }

    @Override
    public boolean equals(Object other) {
      checkTypeComparison(other);
      return other == this;
    }

    @Override
    public int hashCode() {
      return DependentType.class.hashCode();
    }
  }

  private static void checkTypeComparison(Object other) {
    if (!(other instanceof Type)) {
      throw new SemaRuntimeError("Comparing type with non-type object: "
                                  + other);
    }
  }

  /**
   * Exact match after stripping all sugar
   */
  public static boolean canonicalEquals(Type t1, Type t2) {
    return t1.getCanonicalType().equals(t2.getCanonicalType());
  }

  public static boolean isTuple(Type t) {
    return t.desugar().structureType() == StructureType.TUPLE;
  }

  public static boolean isFunction(Type t) {
    return t.desugar().structureType() == StructureType.FUNCTION;
  }

  public static boolean isDependent(Type t) {
    return t.desugar().structureType() == StructureType.DEPENDENT;
  }

  /**
   * @return the tuple type underneath any sugar, or null if not a tuple
   */
  public static TupleType getAsTuple(Type t) {
    Type desugared = t.desugar();
    if (desugared.structureType() == StructureType.TUPLE) {
      return (TupleType)desugared;
    }
    return null;
  }

  /**
   * @return the function type underneath any sugar, or null if not a
   *         function
   */
  public static FunctionType getAsFunction(Type t) {
    Type desugared = t.desugar();
    if (desugared.structureType() == StructureType.FUNCTION) {
      return (FunctionType)desugared;
    }
    return null;
  }

  public static final BuiltinType INT = new BuiltinType("Int");

  public static final TupleType EMPTY_TUPLE =
                    new TupleType(ImmutableList.<TupleTypeElt>of());
}
