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
import org.blockgen.util.StringUtil;
import org.jspecify.annotations.Nullable;

/**
 * A Cfg is the result of building a function: its handle, and its blocks in the order they were
 * sealed. The first block is not necessarily the entry block (nested block definitions may be sealed
 * before the block that branches to them); use {@link #entryBlock}.
 */
public final class Cfg {
  public final FnHandle handle;
  private final ImmutableList<Block> blocks;

  Cfg(FnHandle handle, ImmutableList<Block> blocks) {
    this.handle = handle;
    this.blocks = blocks;
  }

  public ImmutableList<Block> blocks() {
    return blocks;
  }

  /** Returns the block with the given id, or null if there is none. */
  public @Nullable Block block(BlockId id) {
    for (Block b : blocks) {
      if (b.id == id) {
        return b;
      }
    }
    return null;
  }

  /** Returns the block with id 0, or null if the function has no entry block. */
  public @Nullable Block entryBlock() {
    for (Block b : blocks) {
      if (b.id.id() == 0) {
        return b;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(StringUtil.joinElements(handle.name + "(", ")", handle.argTypes()))
        .append(" -> ")
        .append(handle.returnType())
        .append("\n");
    Position prevPosition = null;
    for (Block b : blocks) {
      prevPosition = b.print(sb, prevPosition);
    }
    return sb.toString();
  }
}
