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
import com.google.common.collect.ImmutableSet;
import org.blockgen.util.StringUtil;

/**
 * A Block is a sealed basic block: a sequence of {@link Stmt}s followed by exactly one {@link
 * Terminator}. Blocks are created by the {@link Generator} when it terminates the current block, and
 * are immutable after that.
 *
 * <p>A block's inputs are the Atoms that are defined on entry to it: the function arguments for the
 * entry block, the label's {@link LambdaLabel#atom} for a lambda block, and nothing otherwise.
 */
public final class Block {
  public final BlockId id;
  private final ImmutableSet<Atom> inputs;
  private final ImmutableList<Located<Stmt>> statements;
  private final Located<Terminator> terminator;

  Block(
      BlockId id,
      ImmutableSet<Atom> inputs,
      ImmutableList<Located<Stmt>> statements,
      Located<Terminator> terminator) {
    this.id = id;
    this.inputs = inputs;
    this.statements = statements;
    this.terminator = terminator;
  }

  public ImmutableSet<Atom> inputs() {
    return inputs;
  }

  public ImmutableList<Located<Stmt>> statements() {
    return statements;
  }

  public Located<Terminator> terminator() {
    return terminator;
  }

  /** Shorthand for {@code terminator().value().successors()}. */
  public ImmutableList<BlockId> successors() {
    return terminator.value().successors();
  }

  /** The padding used to align the position comments added by {@link #print}. */
  private static final String SRC_PAD = " ".repeat(40);

  /**
   * Appends a listing of this block to {@code sb}, one line for the header and for each step. A
   * step whose position differs from that of the previous step gets the position as a trailing
   * comment. Returns the position of the last step.
   */
  Position print(StringBuilder sb, Position prevPosition) {
    sb.append(id);
    if (!inputs.isEmpty()) {
      sb.append(StringUtil.joinElements("(", ")", inputs));
    }
    sb.append(":\n");
    for (Located<Stmt> stmt : statements) {
      prevPosition = printStep(sb, stmt, prevPosition);
    }
    return printStep(sb, terminator, prevPosition);
  }

  private static Position printStep(StringBuilder sb, Located<?> step, Position prevPosition) {
    String s = "  " + step;
    sb.append(s);
    if (!step.position().equals(prevPosition)) {
      if (s.length() < SRC_PAD.length()) {
        sb.append(SRC_PAD, s.length(), SRC_PAD.length());
      }
      sb.append(" // ").append(step.position());
    }
    sb.append("\n");
    return step.position();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    print(sb, null);
    return sb.toString();
  }
}
