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

/**
 * Simple immutable class to record a position in a source file.
 * Line and column are 1-based; 0 means unknown.
 */
public class SourceLoc {
  public static final SourceLoc UNKNOWN = new SourceLoc("<unknown>", 0, 0);

  public final String file;
  public final int line;
  public final int column;

  public SourceLoc(String file, int line, int column) {
    super();
    this.file = file;
    this.line = line;
    this.column = column;
  }

  public boolean isValid() {
    return line > 0;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof SourceLoc)) {
      return false;
    }
    SourceLoc other = (SourceLoc)obj;
    return file.equals(other.file) && line == other.line &&
           column == other.column;
  }

  @Override
  public int hashCode() {
    return file.hashCode() + 31 * (line + 31 * column);
  }

  @Override
  public String toString() {
    return file + ":" + line + ":" + column;
  }
}
