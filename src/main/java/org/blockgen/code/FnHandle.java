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
import com.google.common.collect.ImmutableList;

/**
 * Identifies a function and its signature. {@link CfgBuilder#defineFunction} uses the handle's
 * argument types to create the entry block's inputs, and checks the function's result against its
 * return type. FnHandles are compared by identity.
 */
public final class FnHandle {
  public final String name;
  private final ImmutableList<Type> argTypes;
  private final Type returnType;

  public FnHandle(String name, ImmutableList<Type> argTypes, Type returnType) {
    this.name = Preconditions.checkNotNull(name);
    this.argTypes = argTypes;
    this.returnType = Preconditions.checkNotNull(returnType);
  }

  public ImmutableList<Type> argTypes() {
    return argTypes;
  }

  public Type returnType() {
    return returnType;
  }

  /** The type of an expression that evaluates to this handle. */
  public Type type() {
    return Type.functionHandle(argTypes, returnType);
  }

  @Override
  public String toString() {
    return name;
  }
}
