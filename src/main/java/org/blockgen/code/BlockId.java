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
 * Identifies a {@link Block}: either a {@link Label} (a block with no implicit input) or a {@link
 * LambdaLabel} (a block that receives one value from each of its predecessors). Label ids and
 * lambda label ids are drawn from the same counter, so {@link #id} is unique within a build.
 */
public sealed interface BlockId permits Label, LambdaLabel {

  /** The block's id; the entry block of every function has id 0. */
  int id();
}
