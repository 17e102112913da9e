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

import org.jspecify.annotations.Nullable;

/**
 * An Atom is an immutable value in the graph being built: a function argument, the implicit input
 * of a lambda block, or the result of a {@link Stmt.DefineAtom} statement. Each Atom has an id that
 * is unique within the build that created it (shared with {@link Register} ids).
 *
 * <p>Atoms are compared by identity.
 */
public final class Atom implements Expr {

  /** How an Atom's value is determined. */
  public enum Source {
    /** Defined by a {@link Stmt.DefineAtom} statement. */
    ASSIGNED,
    /** One of the function's arguments, an input of the entry block. */
    FUNCTION_INPUT,
    /** The implicit input of a {@link LambdaLabel}'s block. */
    LAMBDA_ARG
  }

  public final int id;
  public final Position position;
  public final Source source;
  private final Type type;

  /** Non-null iff {@link #source} is LAMBDA_ARG. */
  private final @Nullable LambdaLabel lambdaLabel;

  /** Identifies the build that created this Atom. */
  final Generator.Scope scope;

  Atom(
      Generator.Scope scope,
      int id,
      Position position,
      Source source,
      Type type,
      @Nullable LambdaLabel lambdaLabel) {
    assert (source == Source.LAMBDA_ARG) == (lambdaLabel != null);
    this.scope = scope;
    this.id = id;
    this.position = position;
    this.source = source;
    this.type = type;
    this.lambdaLabel = lambdaLabel;
  }

  @Override
  public Type type() {
    return type;
  }

  /** If this Atom is the input of a lambda block, returns its label; otherwise returns null. */
  public @Nullable LambdaLabel lambdaLabel() {
    return lambdaLabel;
  }

  @Override
  public String toString() {
    return "$" + id;
  }
}
