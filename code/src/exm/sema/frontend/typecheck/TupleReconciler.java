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
package exm.sema.frontend.typecheck;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.sema.ast.Expr;
import exm.sema.ast.Exprs.TupleExpr;
import exm.sema.common.exceptions.SemaRuntimeError;
import exm.sema.common.lang.Types;
import exm.sema.common.lang.Types.TupleType;
import exm.sema.common.lang.Types.TupleTypeElt;
import exm.sema.common.lang.Types.Type;

/**
 * Matches the elements of a source tuple up with the fields of a
 * destination tuple type.
 *
 * Named destination fields are first matched with source elements of the
 * same name, in any position.  Remaining fields then take the remaining
 * unnamed source elements in order, falling back to the field's default
 * value once the source runs out.  Every source element must be used.
 *
 * E.g. (y: 4, x: 3) converts to (x: Int, y: Int) by swapping elements.
 */
public class TupleReconciler {

  /**
   * Where a destination field gets its value from.
   */
  public static final class FieldBinding {
    private static final int DEFAULT_INDEX = -1;

    private static final FieldBinding USE_DEFAULT =
                                  new FieldBinding(DEFAULT_INDEX);

    private final int sourceIndex;

    private FieldBinding(int sourceIndex) {
      this.sourceIndex = sourceIndex;
    }

    public static FieldBinding boundTo(int sourceIndex) {
      assert(sourceIndex >= 0);
      return new FieldBinding(sourceIndex);
    }

    public static FieldBinding useDefault() {
      return USE_DEFAULT;
    }

    public boolean isDefault() {
      return sourceIndex == DEFAULT_INDEX;
    }

    public int getSourceIndex() {
      if (isDefault()) {
        throw new SemaRuntimeError("Field is bound to its default value");
      }
      return sourceIndex;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof FieldBinding)) {
        return false;
      }
      return ((FieldBinding)obj).sourceIndex == sourceIndex;
    }

    @Override
    public int hashCode() {
      return sourceIndex;
    }

    @Override
    public String toString() {
      return isDefault() ? "UseDefault" : "BoundTo(" + sourceIndex + ")";
    }
  }

  /**
   * Outcome of reconciling a source with a destination tuple.
   */
  public static final class Reconciliation {
    private static final Reconciliation FAILED =
                new Reconciliation(ConversionRank.INVALID, null);

    public final ConversionRank rank;

    /** One per destination field; null if elements couldn't be matched */
    public final List<FieldBinding> bindings;

    private Reconciliation(ConversionRank rank, List<FieldBinding> bindings) {
      this.rank = rank;
      this.bindings = bindings;
    }

    public boolean isValid() {
      return rank.isValid();
    }

    @Override
    public String toString() {
      return rank + " " + bindings;
    }
  }

  /**
   * Bind destination fields to source elements by name, then position.
   * @param sourceNames name of each source element, null if unnamed
   * @param dest
   * @return binding for each destination field, or null if some field
   *        can't be bound or some source element is left over
   */
  public static List<FieldBinding> matchElements(List<String> sourceNames,
                                                 TupleType dest) {
    int numSource = sourceNames.size();
    boolean[] used = new boolean[numSource];
    FieldBinding[] bindings = new FieldBinding[dest.numFields()];

    // Named fields first, from any position
    for (int i = 0; i < dest.numFields(); i++) {
      TupleTypeElt destElt = dest.getField(i);
      if (!destElt.hasName()) {
        continue;
      }
      for (int j = 0; j < numSource; j++) {
        if (!used[j] && destElt.getName().equals(sourceNames.get(j))) {
          bindings[i] = FieldBinding.boundTo(j);
          used[j] = true;
          break;
        }
      }
    }

    // Then unresolved fields, in order, from leftover unnamed elements
    int nextInput = 0;
    for (int i = 0; i < dest.numFields(); i++) {
      if (bindings[i] != null) {
        continue;
      }

      while (nextInput < numSource &&
             (used[nextInput] || sourceNames.get(nextInput) != null)) {
        nextInput++;
      }

      if (nextInput == numSource) {
        // Ran out: e.g. (1, 2) to (Int, Int, Int)
        if (!dest.getField(i).hasDefault()) {
          return null;
        }
        bindings[i] = FieldBinding.useDefault();
        continue;
      }

      bindings[i] = FieldBinding.boundTo(nextInput);
      used[nextInput] = true;
      nextInput++;
    }

    // Extra arguments are never dropped
    for (int j = 0; j < numSource; j++) {
      if (!used[j]) {
        return null;
      }
    }

    for (int i = 0; i < bindings.length; i++) {
      if (bindings[i] == null) {
        throw new SemaRuntimeError("Destination field " + i + " of "
                                   + dest + " was not bound");
      }
    }
    return ImmutableList.copyOf(bindings);
  }

  /**
   * Reconcile a tuple literal with a tuple type.  Each bound element may
   * itself be converted to its field's type; the result is the worst
   * rank among the elements.
   */
  public static Reconciliation reconcileLiteral(TupleExpr src,
                                                TupleType dest) {
    List<String> names = new ArrayList<String>(src.getNumElements());
    for (int i = 0; i < src.getNumElements(); i++) {
      names.add(src.getElementName(i));
    }
    List<FieldBinding> bindings = matchElements(names, dest);
    if (bindings == null) {
      return Reconciliation.FAILED;
    }

    ConversionRank rank = ConversionRank.IDENTITY;
    for (int i = 0; i < bindings.size(); i++) {
      FieldBinding binding = bindings.get(i);
      if (binding.isDefault()) {
        continue;
      }
      Expr elt = src.getElement(binding.getSourceIndex());
      if (elt == null) {
        // Already filled in with a default value
        continue;
      }
      rank = ConversionRank.worst(rank,
          ConversionRanker.getConversionRank(elt, dest.getElementType(i)));
      if (rank == ConversionRank.INVALID) {
        break;
      }
    }
    return new Reconciliation(rank, bindings);
  }

  /**
   * Reconcile a tuple-typed value that isn't a literal with a tuple type.
   * Fields may be permuted but each value must already have exactly
   * the field's type.
   */
  public static Reconciliation reconcileStructural(TupleType srcType,
                                                   TupleType dest) {
    List<String> names = new ArrayList<String>(srcType.numFields());
    for (TupleTypeElt field: srcType.getFields()) {
      names.add(field.getName());
    }
    List<FieldBinding> bindings = matchElements(names, dest);
    if (bindings == null) {
      return Reconciliation.FAILED;
    }

    for (int i = 0; i < bindings.size(); i++) {
      FieldBinding binding = bindings.get(i);
      if (binding.isDefault()) {
        continue;
      }
      Type srcEltType = srcType.getElementType(binding.getSourceIndex());
      if (!Types.canonicalEquals(srcEltType, dest.getElementType(i))) {
        return new Reconciliation(ConversionRank.INVALID, bindings);
      }
    }
    return new Reconciliation(ConversionRank.IDENTITY, bindings);
  }
}
