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
import org.jspecify.annotations.Nullable;

/**
 * The client's translation of one function body, run by {@link CfgBuilder#defineFunction}.
 *
 * @param <S> the type of the per-block state carried by the Generator
 */
@FunctionalInterface
public interface FunctionDef<S> {

  /**
   * Emits the function's blocks using {@code gen}, starting in the entry block; {@code args} are
   * the function's arguments. If a block is still current when this returns, it is terminated by
   * returning the result (which must then be non-null and have the function's return type). If the
   * definition terminated all of its blocks itself, the result is ignored and may be null.
   */
  @Nullable Expr define(Generator<S> gen, ImmutableList<Atom> args);
}
