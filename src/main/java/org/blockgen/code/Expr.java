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
 * An Expr is either an {@link Atom} (a value that has already been computed) or an {@link App}
 * (an operator applied to sub-expressions, not yet evaluated).
 *
 * <p>Exprs are immutable and may be shared, but sharing does not avoid recomputation: each time an
 * App is passed to the {@link Generator} it is flattened again, emitting new statements. Use
 * {@link Generator#forceEvaluation} to compute a value once and reuse the resulting Atom.
 */
public sealed interface Expr permits Atom, App {

  /** The type of the value this expression evaluates to. */
  Type type();
}
