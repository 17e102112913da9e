/*
 * Copyright 2025 The Retrospect Authors
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
 * limitations under the License.
 */

package org.blockgen.code;

import com.google.common.base.Preconditions;

/**
 * A location in the program being translated. Every Atom, Register, statement, and terminator
 * records the Position that was current when it was created; positions are only used for
 * diagnostics.
 *
 * @param source the name of the source file (or other description of where the code came from)
 * @param line a 1-based line number, or 0 if unknown
 * @param column a 1-based column number, or 0 if unknown
 */
public record Position(String source, int line, int column) {

  /** Used for code that the translation synthesized rather than read from a source file. */
  public static final Position INTERNAL = new Position("<internal>", 0, 0);

  public Position {
    Preconditions.checkNotNull(source);
    Preconditions.checkArgument(line >= 0 && column >= 0);
  }

  /** Returns a Position that only identifies a source, without line or column. */
  public static Position of(String source) {
    return new Position(source, 0, 0);
  }

  @Override
  public String toString() {
    if (line == 0) {
      return source;
    } else if (column == 0) {
      return source + ":" + line;
    }
    return source + ":" + line + ":" + column;
  }
}
