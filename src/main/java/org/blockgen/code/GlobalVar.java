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

import com.google.common.base.Preconditions;

/**
 * A global variable, read and written with {@link AtomValue.ReadGlobal} and {@link
 * Stmt.WriteGlobal}. Unlike Registers, GlobalVars are not owned by a single build and may be shared
 * by any number of functions. GlobalVars are compared by identity.
 */
public final class GlobalVar {
  public final String name;
  public final Type type;

  public GlobalVar(String name, Type type) {
    this.name = Preconditions.checkNotNull(name);
    this.type = Preconditions.checkNotNull(type);
  }

  @Override
  public String toString() {
    return "@" + name;
  }
}
