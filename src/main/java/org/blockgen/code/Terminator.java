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
 * The final step of every {@link Block}: transfers control to other blocks, returns from the
 * function, or reports an error. Terminators with a lambda label target carry the value passed to
 * it; those values are checked against the label's type when the Terminator is created.
 */
public sealed interface Terminator {

  /** The blocks that control may be transferred to, in order. */
  ImmutableList<BlockId> successors();

  /** The Atoms this terminator reads. */
  ImmutableList<Atom> atoms();

  /** Unconditionally continues at a block with no input. */
  record Jump(Label target) implements Terminator {
    @Override
    public ImmutableList<BlockId> successors() {
      return ImmutableList.of(target);
    }

    @Override
    public ImmutableList<Atom> atoms() {
      return ImmutableList.of();
    }

    @Override
    public String toString() {
      return "jump " + target;
    }
  }

  /** Unconditionally continues at a lambda block, passing it {@code value}. */
  record JumpToLambda(LambdaLabel target, Atom value) implements Terminator {
    public JumpToLambda {
      Stmt.checkType(target.type(), value);
    }

    @Override
    public ImmutableList<BlockId> successors() {
      return ImmutableList.of(target);
    }

    @Override
    public ImmutableList<Atom> atoms() {
      return ImmutableList.of(value);
    }

    @Override
    public String toString() {
      return "jump " + target + "(" + value + ")";
    }
  }

  /** Continues at {@code ifTrue} or {@code ifFalse} depending on a Bool. */
  record Branch(Atom condition, Label ifTrue, Label ifFalse) implements Terminator {
    public Branch {
      Stmt.checkType(Type.BOOL, condition);
    }

    @Override
    public ImmutableList<BlockId> successors() {
      return ImmutableList.of(ifTrue, ifFalse);
    }

    @Override
    public ImmutableList<Atom> atoms() {
      return ImmutableList.of(condition);
    }

    @Override
    public String toString() {
      return "branch " + condition + " " + ifTrue + " " + ifFalse;
    }
  }

  /** Returns from the function. */
  record Return(Atom value) implements Terminator {
    @Override
    public ImmutableList<BlockId> successors() {
      return ImmutableList.of();
    }

    @Override
    public ImmutableList<Atom> atoms() {
      return ImmutableList.of(value);
    }

    @Override
    public String toString() {
      return "return " + value;
    }
  }

  /**
   * Marks a fatal error in the translated program. This is a well-formed way to end a block; it does
   * not indicate a problem with the graph.
   */
  record ReportError(Atom message) implements Terminator {
    public ReportError {
      Stmt.checkType(Type.STRING, message);
    }

    @Override
    public ImmutableList<BlockId> successors() {
      return ImmutableList.of();
    }

    @Override
    public ImmutableList<Atom> atoms() {
      return ImmutableList.of(message);
    }

    @Override
    public String toString() {
      return "error " + message;
    }
  }

  /**
   * If {@code maybe} has a value continues at {@code ifJust} (passing it the payload), otherwise
   * continues at {@code ifNothing}.
   */
  record MaybeBranch(Atom maybe, LambdaLabel ifJust, Label ifNothing) implements Terminator {
    public MaybeBranch {
      Preconditions.checkArgument(maybe.type().is(Type.Kind.MAYBE), "Not a Maybe: %s", maybe);
      Preconditions.checkArgument(
          ifJust.type().equals(maybe.type().elementType()),
          "%s expects %s, but %s has type %s",
          ifJust,
          ifJust.type(),
          maybe,
          maybe.type());
    }

    @Override
    public ImmutableList<BlockId> successors() {
      return ImmutableList.of(ifJust, ifNothing);
    }

    @Override
    public ImmutableList<Atom> atoms() {
      return ImmutableList.of(maybe);
    }

    @Override
    public String toString() {
      return "maybeBranch " + maybe + " " + ifJust + " " + ifNothing;
    }
  }

  /**
   * Continues at the lambda label corresponding to the variant's case, passing it the case's
   * payload. There must be exactly one label for each case of the variant type.
   */
  record VariantBranch(Atom variant, ImmutableList<LambdaLabel> cases) implements Terminator {
    public VariantBranch {
      Preconditions.checkArgument(
          variant.type().is(Type.Kind.VARIANT), "Not a variant: %s", variant);
      ImmutableList<Type> caseTypes = variant.type().caseTypes();
      Preconditions.checkArgument(
          cases.size() == caseTypes.size(),
          "%s has %s cases, but %s labels were given",
          variant,
          caseTypes.size(),
          cases.size());
      for (int i = 0; i < cases.size(); i++) {
        Preconditions.checkArgument(
            cases.get(i).type().equals(caseTypes.get(i)),
            "Case %s of %s has type %s, but %s expects %s",
            i,
            variant,
            caseTypes.get(i),
            cases.get(i),
            cases.get(i).type());
      }
    }

    @Override
    public ImmutableList<BlockId> successors() {
      return ImmutableList.<BlockId>copyOf(cases);
    }

    @Override
    public ImmutableList<Atom> atoms() {
      return ImmutableList.of(variant);
    }

    @Override
    public String toString() {
      return StringUtil.joinElements("variantBranch " + variant + " [", "]", cases);
    }
  }

  /** Calls a function and returns its result as the result of this function. */
  record TailCall(Atom fn, ImmutableList<Atom> args) implements Terminator {
    public TailCall {
      AtomValue.checkCall(fn, args);
    }

    @Override
    public ImmutableList<BlockId> successors() {
      return ImmutableList.of();
    }

    @Override
    public ImmutableList<Atom> atoms() {
      return ImmutableList.<Atom>builder().add(fn).addAll(args).build();
    }

    @Override
    public String toString() {
      return StringUtil.joinElements("tailCall " + fn + "(", ")", args);
    }
  }
}
