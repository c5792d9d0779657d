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

import org.apache.log4j.Logger;

import exm.sema.ast.Expr;
import exm.sema.ast.Exprs.TupleExpr;
import exm.sema.common.Logging;
import exm.sema.common.Settings;
import exm.sema.common.exceptions.SemaRuntimeError;
import exm.sema.common.lang.Types;
import exm.sema.common.lang.Types.FunctionType;
import exm.sema.common.lang.Types.TupleType;
import exm.sema.common.lang.Types.Type;
import exm.sema.frontend.typecheck.TupleReconciler.Reconciliation;

/**
 * Decides whether an expression can be implicitly converted to a type,
 * and how expensive the conversion is.
 *
 * Read-only over the tree: safe to call repeatedly as long as nothing
 * is rewriting the same nodes at the time.
 */
public class ConversionRanker {

  private static final Logger logger = Logging.getSemaLogger();

  /**
   * Return the conversion rank for converting a value e to destType.
   * @param e a type-checked expression
   * @param destType a resolved type
   * @return INVALID if there is no implicit conversion
   */
  public static ConversionRank getConversionRank(Expr e, Type destType) {
    if (destType == null || Types.isDependent(destType)) {
      throw new SemaRuntimeError("Result of conversion can't be dependent: "
                                 + destType);
    }
    if (e.getType() == null) {
      throw new SemaRuntimeError("Ranking conversion of untyped "
                              + e.getKind() + " at " + e.getStartLoc());
    }

    ConversionRank rank = rankConversion(e, destType);
    if (logger.isTraceEnabled() &&
        Settings.getBooleanUnchecked(Settings.LOG_CONVERSIONS)) {
      logger.trace("Conversion of " + e.getKind() + " at " + e.getStartLoc()
          + " from " + e.getType() + " to " + destType + ": " + rank);
    }
    return rank;
  }

  private static ConversionRank rankConversion(Expr e, Type destType) {
    // Exact matches are identity conversions
    if (Types.canonicalEquals(e.getType(), destType)) {
      return ConversionRank.IDENTITY;
    }

    TupleExpr tupleExpr = null;
    if (e instanceof TupleExpr) {
      tupleExpr = (TupleExpr)e;
      if (tupleExpr.isGroupingParen()) {
        return getConversionRank(tupleExpr.getElement(0), destType);
      }
    }

    TupleType destTT = Types.getAsTuple(destType);
    if (destTT != null) {
      if (tupleExpr != null) {
        return TupleReconciler.reconcileLiteral(tupleExpr, destTT).rank;
      }

      // Scalar to tuple, e.g. 4 to (a: Int = 4, b: Int)
      int scalarField = destTT.getFieldForScalarInit();
      if (scalarField != -1) {
        return getConversionRank(e, destTT.getElementType(scalarField));
      }

      TupleType srcTT = Types.getAsTuple(e.getType());
      if (srcTT != null) {
        Reconciliation r = TupleReconciler.reconcileStructural(srcTT, destTT);
        return r.rank;
      }
      return ConversionRank.INVALID;
    }

    // Auto-closure: e becomes the body of a closure returning it
    FunctionType destFT = Types.getAsFunction(destType);
    if (destFT != null) {
      if (getConversionRank(e, destFT.getResult()) ==
                                        ConversionRank.INVALID) {
        return ConversionRank.INVALID;
      }
      return ConversionRank.AUTO_CLOSURE;
    }

    return ConversionRank.INVALID;
  }
}
