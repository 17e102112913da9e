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
 * The right hand side of a {@link Stmt.DefineAtom}: an operation whose operands have all been
 * flattened to Atoms, and which produces a single new value.
 */
public sealed interface AtomValue {

  /** The type of the value produced. */
  Type type();

  /** The Atoms this operation reads. */
  default ImmutableList<Atom> atoms() {
    return ImmutableList.of();
  }

  /** Applies an Op to already-computed operands. */
  record EvalApp(Op op, ImmutableList<Atom> operands, Type type) implements AtomValue {
    @Override
    public ImmutableList<Atom> atoms() {
      return operands;
    }

    @Override
    public String toString() {
      return operands.isEmpty()
          ? op.name()
          : StringUtil.joinElements(op.name() + "(", ")", operands);
    }
  }

  /** Reads the current value of a global variable. */
  record ReadGlobal(GlobalVar global) implements AtomValue {
    @Override
    public Type type() {
      return global.type;
    }

    @Override
    public String toString() {
      return "readGlobal " + global;
    }
  }

  /** Reads the current value of a register. */
  record ReadReg(Register register) implements AtomValue {
    @Override
    public Type type() {
      return register.type;
    }

    @Override
    public String toString() {
      return "readReg " + register;
    }
  }

  /** Allocates a reference cell with the given initial contents. */
  record NewRef(Atom contents) implements AtomValue {
    @Override
    public Type type() {
      return Type.reference(contents.type());
    }

    @Override
    public ImmutableList<Atom> atoms() {
      return ImmutableList.of(contents);
    }

    @Override
    public String toString() {
      return "newRef " + contents;
    }
  }

  /** Allocates a reference cell with no contents; reading it before a write is a runtime error. */
  record NewEmptyRef(Type elementType) implements AtomValue {
    @Override
    public Type type() {
      return Type.reference(elementType);
    }

    @Override
    public String toString() {
      return "newEmptyRef " + elementType;
    }
  }

  /** Reads the current contents of a reference cell. */
  record ReadRef(Atom ref) implements AtomValue {
    public ReadRef {
      Preconditions.checkArgument(ref.type().is(Type.Kind.REFERENCE), "Not a reference: %s", ref);
    }

    @Override
    public Type type() {
      return ref.type().elementType();
    }

    @Override
    public ImmutableList<Atom> atoms() {
      return ImmutableList.of(ref);
    }

    @Override
    public String toString() {
      return "readRef " + ref;
    }
  }

  /** Calls the function identified by a function handle value. */
  record Call(Atom fn, ImmutableList<Atom> args) implements AtomValue {
    public Call {
      checkCall(fn, args);
    }

    @Override
    public Type type() {
      return fn.type().returnType();
    }

    @Override
    public ImmutableList<Atom> atoms() {
      return ImmutableList.<Atom>builder().add(fn).addAll(args).build();
    }

    @Override
    public String toString() {
      return StringUtil.joinElements("call " + fn + "(", ")", args);
    }
  }

  /** Evaluates a client-defined {@link Extension}. */
  record EvalExt(Extension extension, ImmutableList<Atom> operands) implements AtomValue {
    @Override
    public Type type() {
      return extension.resultType();
    }

    @Override
    public ImmutableList<Atom> atoms() {
      return operands;
    }

    @Override
    public String toString() {
      return StringUtil.joinElements(extension.name() + "(", ")", operands);
    }
  }

  /**
   * Throws an IllegalArgumentException unless {@code fn} is a function handle that accepts {@code
   * args}.
   */
  static void checkCall(Atom fn, ImmutableList<Atom> args) {
    Type fnType = fn.type();
    Preconditions.checkArgument(
        fnType.is(Type.Kind.FUNCTION_HANDLE), "Not a function handle: %s (%s)", fn, fnType);
    ImmutableList<Type> argTypes =
        args.stream().map(Atom::type).collect(ImmutableList.toImmutableList());
    Preconditions.checkArgument(
        argTypes.equals(fnType.argTypes()),
        "%s expects arguments %s, got %s",
        fn,
        fnType.argTypes(),
        argTypes);
  }
}
