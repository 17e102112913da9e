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

/**
 * A Register is a mutable, typed storage location. Unlike {@link Atom}s, Registers may be assigned
 * any number of times (with {@link Stmt.SetReg}) and read with {@link AtomValue.ReadReg}; a later
 * conversion to SSA form is expected to replace them with block inputs.
 *
 * <p>Register ids are drawn from the same counter as Atom ids, so the two never collide. Reading a
 * Register that has not yet been assigned is not detected while building.
 */
public final class Register {
  public final int id;
  public final Position position;
  public final Type type;

  /** Identifies the build that created this Register. */
  final Generator.Scope scope;

  Register(Generator.Scope scope, int id, Position position, Type type) {
    this.scope = scope;
    this.id = id;
    this.position = position;
    this.type = type;
  }

  @Override
  public String toString() {
    return "r" + id;
  }
}
