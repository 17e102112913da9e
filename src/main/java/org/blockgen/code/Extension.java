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

import com.google.common.collect.ImmutableList;

/**
 * A language-specific operation that the client translation wants to appear as a statement (for
 * example, because it has side effects that an {@link Op} may not have). The builder treats it as
 * opaque: it only flattens the operands and records the result type.
 */
public interface Extension {

  /** A short name, used when printing. */
  String name();

  /** The operands, which will be flattened to Atoms in order. */
  ImmutableList<Expr> operands();

  /** The type of the value produced by this operation. */
  Type resultType();
}
