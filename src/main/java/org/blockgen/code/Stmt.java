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
 * A Stmt is one of the non-terminal steps of a {@link Block}. Stmts only refer to Atoms (never to
 * unevaluated expressions); the type-compatibility of their operands is checked when they are
 * created.
 */
public sealed interface Stmt {

  /** The Atoms this statement reads. */
  ImmutableList<Atom> atoms();

  /** Defines a new Atom as the result of an {@link AtomValue}. */
  record DefineAtom(Atom atom, AtomValue value) implements Stmt {
    public DefineAtom {
      Preconditions.checkArgument(atom.source == Atom.Source.ASSIGNED);
      Preconditions.checkArgument(atom.type().equals(value.type()));
    }

    @Override
    public ImmutableList<Atom> atoms() {
      return value.atoms();
    }

    @Override
    public String toString() {
      return atom + " = " + value;
    }
  }

  /** Stores an Atom in a register. */
  record SetReg(Register register, Atom value) implements Stmt {
    public SetReg {
      checkType(register.type, value);
    }

    @Override
    public ImmutableList<Atom> atoms() {
      return ImmutableList.of(value);
    }

    @Override
    public String toString() {
      return register + " := " + value;
    }
  }

  /** Stores an Atom in a global variable. */
  record WriteGlobal(GlobalVar global, Atom value) implements Stmt {
    public WriteGlobal {
      checkType(global.type, value);
    }

    @Override
    public ImmutableList<Atom> atoms() {
      return ImmutableList.of(value);
    }

    @Override
    public String toString() {
      return global + " := " + value;
    }
  }

  /** Stores an Atom in a reference cell. */
  record WriteRef(Atom ref, Atom value) implements Stmt {
    public WriteRef {
      checkType(Type.reference(value.type()), ref);
    }

    @Override
    public ImmutableList<Atom> atoms() {
      return ImmutableList.of(ref, value);
    }

    @Override
    public String toString() {
      return "writeRef " + ref + " " + value;
    }
  }

  /** Returns a reference cell to the uninitialized state. */
  record DropRef(Atom ref) implements Stmt {
    public DropRef {
      Preconditions.checkArgument(ref.type().is(Type.Kind.REFERENCE), "Not a reference: %s", ref);
    }

    @Override
    public ImmutableList<Atom> atoms() {
      return ImmutableList.of(ref);
    }

    @Override
    public String toString() {
      return "dropRef " + ref;
    }
  }

  /** Prints a string, for debugging the translated program. */
  record Print(Atom message) implements Stmt {
    public Print {
      checkType(Type.STRING, message);
    }

    @Override
    public ImmutableList<Atom> atoms() {
      return ImmutableList.of(message);
    }

    @Override
    public String toString() {
      return "print " + message;
    }
  }

  /** Fails with {@code message} if {@code condition} is false when the program runs. */
  record Assert(Atom condition, Atom message) implements Stmt {
    public Assert {
      checkType(Type.BOOL, condition);
      checkType(Type.STRING, message);
    }

    @Override
    public ImmutableList<Atom> atoms() {
      return ImmutableList.of(condition, message);
    }

    @Override
    public String toString() {
      return "assert " + condition + " " + message;
    }
  }

  /** Throws an IllegalArgumentException if {@code value} does not have the expected type. */
  static void checkType(Type expected, Expr value) {
    Preconditions.checkArgument(
        value.type().equals(expected), "Expected %s, got %s (%s)", expected, value, value.type());
  }
}
