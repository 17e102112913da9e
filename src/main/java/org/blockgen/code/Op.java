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
 * An Op is a pure operator that can be applied to zero or more operands to form an {@link App}.
 * Ops are supplied by the client translation; {@link Ops} defines the ones the builder itself needs
 * and a few common ones.
 */
public interface Op {

  /** A short name, used when printing. */
  String name();

  /**
   * Returns the type of the result of applying this Op to operands of the given types, or throws an
   * IllegalArgumentException if the operand types are not acceptable.
   */
  Type resultType(ImmutableList<Type> argTypes);
}
