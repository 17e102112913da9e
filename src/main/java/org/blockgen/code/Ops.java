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
import java.util.function.Function;
import org.blockgen.util.StringUtil;

/**
 * Static-only class defining the Ops that the {@link Generator} depends on ({@link #NOT} for branch
 * simplification, {@link #FROM_JUST} for unchecked unwrapping) along with constants and a small
 * set of common operators.
 */
public class Ops {

  private Ops() {}

  /**
   * An Op whose result type is computed by a function of the operand types. The function should
   * throw an IllegalArgumentException if the operand types are not acceptable.
   */
  private static class TypedOp implements Op {
    final String name;
    final Function<ImmutableList<Type>, Type> typing;

    TypedOp(String name, Function<ImmutableList<Type>, Type> typing) {
      this.name = name;
      this.typing = typing;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public Type resultType(ImmutableList<Type> argTypes) {
      return typing.apply(argTypes);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** A zero-operand Op that evaluates to a fixed value. */
  public static final class Constant extends TypedOp {
    public final Object value;

    Constant(Type type, Object value) {
      super(
          (value instanceof String s) ? StringUtil.escape(s) : String.valueOf(value),
          argTypes -> {
            checkArgTypes("constant", argTypes);
            return type;
          });
      this.value = value;
    }
  }

  /** Returns an Op with no operands whose result is {@code value}. */
  public static Constant constant(Type type, Object value) {
    switch (type.kind) {
      case BOOL -> Preconditions.checkArgument(value instanceof Boolean, "Not a Bool: %s", value);
      case INTEGER ->
          Preconditions.checkArgument(
              value instanceof Integer || value instanceof Long, "Not an Integer: %s", value);
      case STRING ->
          Preconditions.checkArgument(value instanceof String, "Not a String: %s", value);
      default -> {
        // Constants of other types are the client's business.
      }
    }
    return new Constant(type, value);
  }

  /**
   * Returns an Op that takes operands of exactly the given types and returns {@code result}.
   * Intended for client translations that need simple monomorphic operators.
   */
  public static Op fixed(String name, Type result, Type... argTypes) {
    return new TypedOp(
        name,
        actual -> {
          checkArgTypes(name, actual, argTypes);
          return result;
        });
  }

  /** Throws an IllegalArgumentException unless {@code actual} matches {@code expected}. */
  static void checkArgTypes(String name, ImmutableList<Type> actual, Type... expected) {
    Preconditions.checkArgument(
        actual.equals(ImmutableList.copyOf(expected)),
        "%s expects %s, got %s",
        name,
        ImmutableList.copyOf(expected),
        actual);
  }

  public static final Op NOT = fixed("not", Type.BOOL, Type.BOOL);
  public static final Op AND = fixed("and", Type.BOOL, Type.BOOL, Type.BOOL);
  public static final Op OR = fixed("or", Type.BOOL, Type.BOOL, Type.BOOL);

  public static final Op INTEGER_ADD = fixed("add", Type.INTEGER, Type.INTEGER, Type.INTEGER);
  public static final Op INTEGER_SUB = fixed("sub", Type.INTEGER, Type.INTEGER, Type.INTEGER);
  public static final Op INTEGER_LT = fixed("lt", Type.BOOL, Type.INTEGER, Type.INTEGER);
  public static final Op INTEGER_EQ = fixed("eq", Type.BOOL, Type.INTEGER, Type.INTEGER);

  public static final Op STRING_CONCAT =
      fixed("concat", Type.STRING, Type.STRING, Type.STRING);

  /** Wraps a value of any type as a present optional value. */
  public static final Op JUST =
      new TypedOp(
          "just",
          argTypes -> {
            Preconditions.checkArgument(argTypes.size() == 1, "just expects one operand");
            return Type.maybe(argTypes.get(0));
          });

  /**
   * Extracts the payload of an optional value that the caller asserts is present; the second
   * operand is the message to report if that assertion turns out to be wrong when the program runs.
   */
  public static final Op FROM_JUST =
      new TypedOp(
          "fromJust",
          argTypes -> {
            Preconditions.checkArgument(
                argTypes.size() == 2
                    && argTypes.get(0).is(Type.Kind.MAYBE)
                    && argTypes.get(1).equals(Type.STRING),
                "fromJust expects (Maybe, String), got %s",
                argTypes);
            return argTypes.get(0).elementType();
          });

  /** Returns an Op with no operands whose result is an absent value of the given maybe type. */
  public static Op nothing(Type elementType) {
    Type result = Type.maybe(elementType);
    return new TypedOp(
        "nothing",
        argTypes -> {
          checkArgTypes("nothing", argTypes);
          return result;
        });
  }

  /** Returns an Op that injects a value into case {@code index} of the given variant type. */
  public static Op inject(Type variant, int index) {
    Type caseType = variant.caseTypes().get(index);
    return new TypedOp(
        "inject" + index,
        argTypes -> {
          checkArgTypes("inject" + index, argTypes, caseType);
          return variant;
        });
  }
}
