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
import java.util.Objects;

/**
 * A Type is the runtime tag carried by every {@link Expr}, {@link Atom}, {@link Register}, and
 * {@link LambdaLabel}. Types are compared structurally; the builder checks them wherever a value is
 * created or routed to a block.
 *
 * <p>Parameterized types (maybe, variant, reference, function handle) are created with the static
 * factory methods; {@link #opaque} lets a client translation introduce additional base types.
 */
public final class Type {

  /** The kinds of Type. */
  public enum Kind {
    UNIT,
    BOOL,
    INTEGER,
    STRING,
    MAYBE,
    VARIANT,
    REFERENCE,
    FUNCTION_HANDLE,
    OPAQUE
  }

  public static final Type UNIT = new Type(Kind.UNIT, null, ImmutableList.of());
  public static final Type BOOL = new Type(Kind.BOOL, null, ImmutableList.of());
  public static final Type INTEGER = new Type(Kind.INTEGER, null, ImmutableList.of());
  public static final Type STRING = new Type(Kind.STRING, null, ImmutableList.of());

  public final Kind kind;

  /** Only non-null for OPAQUE types. */
  private final String name;

  /**
   * For MAYBE and REFERENCE, the element type; for VARIANT, the case types; for FUNCTION_HANDLE, the
   * argument types followed by the return type. Empty for all other kinds.
   */
  private final ImmutableList<Type> params;

  private Type(Kind kind, String name, ImmutableList<Type> params) {
    this.kind = kind;
    this.name = name;
    this.params = params;
  }

  /** Returns the type of an optional value of the given type. */
  public static Type maybe(Type element) {
    return new Type(Kind.MAYBE, null, ImmutableList.of(element));
  }

  /** Returns the type of a mutable reference cell holding values of the given type. */
  public static Type reference(Type element) {
    return new Type(Kind.REFERENCE, null, ImmutableList.of(element));
  }

  /** Returns a tagged union with one case for each of the given types (at least one). */
  public static Type variant(Type... cases) {
    return variant(ImmutableList.copyOf(cases));
  }

  /** Returns a tagged union with one case for each of the given types (at least one). */
  public static Type variant(ImmutableList<Type> cases) {
    Preconditions.checkArgument(!cases.isEmpty(), "A variant needs at least one case");
    return new Type(Kind.VARIANT, null, cases);
  }

  /** Returns the type of a handle to a function with the given signature. */
  public static Type functionHandle(ImmutableList<Type> argTypes, Type returnType) {
    return new Type(
        Kind.FUNCTION_HANDLE,
        null,
        ImmutableList.<Type>builder().addAll(argTypes).add(returnType).build());
  }

  /** Returns a base type that is only equal to other opaque types with the same name. */
  public static Type opaque(String name) {
    return new Type(Kind.OPAQUE, Preconditions.checkNotNull(name), ImmutableList.of());
  }

  /** Returns the element type of a MAYBE or REFERENCE type. */
  public Type elementType() {
    Preconditions.checkState(
        kind == Kind.MAYBE || kind == Kind.REFERENCE, "%s has no element type", this);
    return params.get(0);
  }

  /** Returns the case types of a VARIANT type. */
  public ImmutableList<Type> caseTypes() {
    Preconditions.checkState(kind == Kind.VARIANT, "%s is not a variant", this);
    return params;
  }

  /** Returns the argument types of a FUNCTION_HANDLE type. */
  public ImmutableList<Type> argTypes() {
    Preconditions.checkState(kind == Kind.FUNCTION_HANDLE, "%s is not a function handle", this);
    return params.subList(0, params.size() - 1);
  }

  /** Returns the return type of a FUNCTION_HANDLE type. */
  public Type returnType() {
    Preconditions.checkState(kind == Kind.FUNCTION_HANDLE, "%s is not a function handle", this);
    return params.get(params.size() - 1);
  }

  public boolean is(Kind kind) {
    return this.kind == kind;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Type type
        && kind == type.kind
        && Objects.equals(name, type.name)
        && params.equals(type.params);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, name, params);
  }

  @Override
  public String toString() {
    return switch (kind) {
      case UNIT -> "Unit";
      case BOOL -> "Bool";
      case INTEGER -> "Integer";
      case STRING -> "String";
      case MAYBE -> "Maybe(" + params.get(0) + ")";
      case REFERENCE -> "Ref(" + params.get(0) + ")";
      case VARIANT -> "Variant" + params;
      case FUNCTION_HANDLE -> "Fn" + argTypes() + " -> " + returnType();
      case OPAQUE -> name;
    };
  }
}
