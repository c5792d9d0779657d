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

/**
 * Cost of an implicit conversion, ordered from best to worst.
 * INVALID means there is no implicit conversion.
 */
public enum ConversionRank {
  /** Types match exactly, or differ only by tuple field permutation */
  IDENTITY,
  /** Value has to be wrapped in a closure that produces it */
  AUTO_CLOSURE,
  INVALID;

  public boolean isValid() {
    return this != INVALID;
  }

  /**
   * @return the worse of the two ranks
   */
  public static ConversionRank worst(ConversionRank r1, ConversionRank r2) {
    return r1.compareTo(r2) >= 0 ? r1 : r2;
  }
}
