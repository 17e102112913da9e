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
 * Identifies a block that receives exactly one implicit input: its {@link #atom}, whose type is
 * fixed when the LambdaLabel is created. Every branch to a lambda block passes a value of that type
 * (see {@link Terminator.JumpToLambda}, {@link Terminator.MaybeBranch}, and {@link
 * Terminator.VariantBranch}); this is how control flow paths that compute different values merge.
 */
public final class LambdaLabel implements BlockId {
  private final int id;

  /** The value received by this label's block. */
  public final Atom atom;

  /** Identifies the build that created this LambdaLabel. */
  final Generator.Scope scope;

  LambdaLabel(Generator.Scope scope, int id, int atomId, Position position, Type type) {
    this.scope = scope;
    this.id = id;
    this.atom = new Atom(scope, atomId, position, Atom.Source.LAMBDA_ARG, type, this);
  }

  @Override
  public int id() {
    return id;
  }

  /** The type of value this label's block receives. */
  public Type type() {
    return atom.type();
  }

  @Override
  public String toString() {
    return "L" + id;
  }
}
