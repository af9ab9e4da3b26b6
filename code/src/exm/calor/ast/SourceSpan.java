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
package exm.calor.ast;

/**
 * Location of a syntax element in an input file.  Immutable.
 */
public class SourceSpan {
  public static final SourceSpan UNKNOWN =
                        new SourceSpan("<unknown>", 0, 0, 0, 0);

  private final String file;
  private final int line;
  private final int column;
  private final int start;
  private final int length;

  public SourceSpan(String file, int line, int column, int start,
                    int length) {
    this.file = file;
    this.line = line;
    this.column = column;
    this.start = start;
    this.length = length;
  }

  public SourceSpan(String file, int line, int column) {
    this(file, line, column, 0, 0);
  }

  public String getFile() {
    return file;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }

  public int getStart() {
    return start;
  }

  public int getLength() {
    return length;
  }

  @Override
  public String toString() {
    return file + ":" + line + ":" + column;
  }
}
