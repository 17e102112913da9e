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
import org.blockgen.util.StringUtil;

/**
 * An application of an {@link Op} to a list of operand expressions. The result type is computed
 * (and the operand types checked) when the App is created.
 */
public final class App implements Expr {
  public final Op op;
  private final ImmutableList<Expr> operands;
  private final Type type;

  private App(Op op, ImmutableList<Expr> operands, Type type) {
    this.op = op;
    this.operands = operands;
    this.type = type;
  }

  /** Applies {@code op} to the given operands; throws IllegalArgumentException if ill-typed. */
  public static App of(Op op, Expr... operands) {
    return of(op, ImmutableList.copyOf(operands));
  }

  /** Applies {@code op} to the given operands; throws IllegalArgumentException if ill-typed. */
  public static App of(Op op, ImmutableList<Expr> operands) {
    ImmutableList<Type> argTypes =
        operands.stream().map(Expr::type).collect(ImmutableList.toImmutableList());
    Type type = op.resultType(argTypes);
    Preconditions.checkNotNull(type, "%s returned no result type", op.name());
    return new App(op, operands, type);
  }

  /** Returns an App with no operands that evaluates to the given constant. */
  public static App constant(Type type, Object value) {
    return of(Ops.constant(type, value));
  }

  public ImmutableList<Expr> operands() {
    return operands;
  }

  @Override
  public Type type() {
    return type;
  }

  @Override
  public String toString() {
    if (operands.isEmpty()) {
      return op.name();
    }
    return StringUtil.joinElements(op.name() + "(", ")", operands);
  }
}
