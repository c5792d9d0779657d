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

import exm.sema.common.lang.Types.Type;

/**
 * Declarations as far as expressions need them: a name, a location and,
 * for values, a type and an optional initializer.
 */
public class Decls {

  public abstract static class Decl {
    private final String name;
    private final SourceLoc loc;

    protected Decl(String name, SourceLoc loc) {
      assert(name != null);
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
    public String toString() {
      return name;
    }
  }

  /**
   * A named value, e.g. a variable or function.
   */
  public static class ValueDecl extends Decl {
    private Type type;
    private Expr init;

    public ValueDecl(String name, SourceLoc loc, Type type, Expr init) {
      super(name, loc);
      this.type = type;
      this.init = init;
    }

    public ValueDecl(String name, SourceLoc loc, Type type) {
      this(name, loc, type, null);
    }

    public Type getType() {
      return type;
    }

    public void setType(Type type) {
      this.type = type;
    }

    /**
     * @return initializer expression, or null if none
     */
    public Expr getInit() {
      return init;
    }

    public void setInit(Expr init) {
      this.init = init;
    }
  }

  /**
   * A named type, e.g. the left hand side of a scoped identifier
   */
  public static class TypeDecl extends Decl {
    private final Type declaredType;

    public TypeDecl(String name, SourceLoc loc, Type declaredType) {
      super(name, loc);
      this.declaredType = declaredType;
    }

    public Type getDeclaredType() {
      return declaredType;
    }
  }
}
