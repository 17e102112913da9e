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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static-only class that checks the well-formedness of a {@link Cfg}.
 *
 * <p>Besides the structural checks, every Atom read by a statement or terminator of a block that
 * is reachable from the entry must be available there: an input of the block, defined earlier in
 * the block, or defined in a block that dominates it. Blocks that cannot be reached from the entry
 * are not checked for this. Registers being assigned before they are read is left to the SSA
 * conversion.
 */
public class CfgValidator {

  private CfgValidator() {}

  /** Returns a description of each problem found in {@code cfg}; empty if there are none. */
  public static ImmutableList<String> check(Cfg cfg) {
    ImmutableList.Builder<String> problems = ImmutableList.builder();
    Set<Integer> ids = new HashSet<>();
    Set<BlockId> defined = Collections.newSetFromMap(new IdentityHashMap<>());
    Set<Atom> atoms = Collections.newSetFromMap(new IdentityHashMap<>());
    for (Block b : cfg.blocks()) {
      if (!ids.add(b.id.id())) {
        problems.add("Duplicate block id " + b.id);
      }
      defined.add(b.id);
      for (Atom input : b.inputs()) {
        if (!atoms.add(input)) {
          problems.add(b.id + ": " + input + " is defined more than once");
        }
      }
      for (Located<Stmt> stmt : b.statements()) {
        if (stmt.value() instanceof Stmt.DefineAtom define && !atoms.add(define.atom())) {
          problems.add(b.id + ": " + define.atom() + " is defined more than once");
        }
      }
    }
    if (cfg.entryBlock() == null) {
      problems.add("No entry block");
    }
    for (Block b : cfg.blocks()) {
      for (BlockId target : b.successors()) {
        if (!defined.contains(target)) {
          problems.add(b.id + ": " + target + " is never defined");
        }
      }
      checkLambdaTypes(b, problems);
    }
    checkAtomsAvailable(cfg, problems);
    return problems.build();
  }

  /** Checks that each Atom used in a reachable block is defined on every path to its use. */
  private static void checkAtomsAvailable(Cfg cfg, ImmutableList.Builder<String> problems) {
    Block entry = cfg.entryBlock();
    if (entry == null) {
      return;
    }
    Map<BlockId, Block> byId = new HashMap<>();
    Map<Atom, BlockId> definedIn = new HashMap<>();
    for (Block b : cfg.blocks()) {
      byId.putIfAbsent(b.id, b);
      for (Atom input : b.inputs()) {
        definedIn.putIfAbsent(input, b.id);
      }
      for (Located<Stmt> stmt : b.statements()) {
        if (stmt.value() instanceof Stmt.DefineAtom define) {
          definedIn.putIfAbsent(define.atom(), b.id);
        }
      }
    }
    Map<BlockId, Set<BlockId>> dominators = dominators(entry, byId);
    for (Block b : cfg.blocks()) {
      Set<BlockId> doms = dominators.get(b.id);
      // Skip unreachable blocks, and all but the first of any blocks with the same id
      if (doms == null || byId.get(b.id) != b) {
        continue;
      }
      Set<Atom> local = new HashSet<>(b.inputs());
      for (Located<Stmt> stmt : b.statements()) {
        for (Atom atom : stmt.value().atoms()) {
          checkAvailable(b, atom, stmt.position(), local, doms, definedIn, problems);
        }
        if (stmt.value() instanceof Stmt.DefineAtom define) {
          local.add(define.atom());
        }
      }
      Located<Terminator> term = b.terminator();
      for (Atom atom : term.value().atoms()) {
        checkAvailable(b, atom, term.position(), local, doms, definedIn, problems);
      }
    }
  }

  private static void checkAvailable(
      Block b,
      Atom atom,
      Position position,
      Set<Atom> local,
      Set<BlockId> doms,
      Map<Atom, BlockId> definedIn,
      ImmutableList.Builder<String> problems) {
    if (local.contains(atom)) {
      return;
    }
    BlockId def = definedIn.get(atom);
    if (def == null) {
      problems.add(String.format("%s: %s is used at %s but never defined", b.id, atom, position));
    } else if (def == b.id || !doms.contains(def)) {
      problems.add(
          String.format(
              "%s: %s is used at %s but is not defined on every path to it",
              b.id, atom, position));
    }
  }

  /**
   * Returns the dominators of each block reachable from {@code entry} (including the block
   * itself). Unreachable blocks have no entry in the result.
   */
  private static Map<BlockId, Set<BlockId>> dominators(Block entry, Map<BlockId, Block> byId) {
    List<Block> reachable = new ArrayList<>();
    Set<BlockId> seen = new HashSet<>();
    Deque<Block> pending = new ArrayDeque<>();
    seen.add(entry.id);
    pending.push(entry);
    while (!pending.isEmpty()) {
      Block b = pending.pop();
      reachable.add(b);
      for (BlockId target : b.successors()) {
        Block next = byId.get(target);
        if (next != null && seen.add(target)) {
          pending.push(next);
        }
      }
    }
    Map<BlockId, List<BlockId>> preds = new HashMap<>();
    for (Block b : reachable) {
      for (BlockId target : b.successors()) {
        if (seen.contains(target)) {
          preds.computeIfAbsent(target, k -> new ArrayList<>()).add(b.id);
        }
      }
    }
    Map<BlockId, Set<BlockId>> result = new HashMap<>();
    for (Block b : reachable) {
      result.put(b.id, (b == entry) ? Set.of(entry.id) : seen);
    }
    boolean changed = true;
    while (changed) {
      changed = false;
      for (Block b : reachable) {
        if (b == entry) {
          continue;
        }
        Set<BlockId> doms = null;
        for (BlockId pred : preds.get(b.id)) {
          if (doms == null) {
            doms = new HashSet<>(result.get(pred));
          } else {
            doms.retainAll(result.get(pred));
          }
        }
        doms.add(b.id);
        if (!doms.equals(result.get(b.id))) {
          result.put(b.id, doms);
          changed = true;
        }
      }
    }
    return result;
  }

  /** Checks that each lambda label reached from {@code b} is passed a value of its type. */
  private static void checkLambdaTypes(Block b, ImmutableList.Builder<String> problems) {
    Terminator term = b.terminator().value();
    if (term instanceof Terminator.JumpToLambda jump) {
      checkLambdaType(b, jump.target(), jump.value().type(), problems);
    } else if (term instanceof Terminator.MaybeBranch branch) {
      checkLambdaType(b, branch.ifJust(), branch.maybe().type().elementType(), problems);
    } else if (term instanceof Terminator.VariantBranch branch) {
      ImmutableList<Type> caseTypes = branch.variant().type().caseTypes();
      for (int i = 0; i < branch.cases().size(); i++) {
        checkLambdaType(b, branch.cases().get(i), caseTypes.get(i), problems);
      }
    }
  }

  private static void checkLambdaType(
      Block b, LambdaLabel target, Type passed, ImmutableList.Builder<String> problems) {
    if (!target.type().equals(passed)) {
      problems.add(
          String.format(
              "%s: %s expects %s, but is passed %s", b.id, target, target.type(), passed));
    }
  }
}
