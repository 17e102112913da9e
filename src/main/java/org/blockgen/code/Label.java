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

/** Identifies a block that receives no implicit input value. Labels are compared by identity. */
public final class Label implements BlockId {
  private final int id;

  /** Identifies the build that created this Label. */
  final Generator.Scope scope;

  Label(Generator.Scope scope, int id) {
    this.scope = scope;
    this.id = id;
  }

  @Override
  public int id() {
    return id;
  }

  @Override
  public String toString() {
    return "L" + id;
  }
}
