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

import static com.google.common.truth.Truth.assertThat;
import static org.blockgen.code.GeneratorTest.HELLO;
import static org.blockgen.code.GeneratorTest.ONE;
import static org.blockgen.code.GeneratorTest.POS;
import static org.blockgen.code.GeneratorTest.ZERO;
import static org.blockgen.code.GeneratorTest.steps;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CombinatorsTest {

  private static final Expr TWO = App.constant(Type.INTEGER, 2);

  private CfgBuilder builder;

  @Before
  public void setup() {
    builder = new CfgBuilder();
    builder.verbose = true;
  }

  private Cfg build(Type returnType, ImmutableList<Type> argTypes, FunctionDef<Void> def) {
    return builder.defineFunction(POS, new FnHandle("f", argTypes, returnType), null, def).cfg();
  }

  private static ImmutableList<Integer> blockIds(Cfg cfg) {
    return cfg.blocks().stream().map(b -> b.id.id()).collect(ImmutableList.toImmutableList());
  }

  @Test
  public void ifte() {
    // f(x: Bool) -> Integer = if x then 1 else 2
    Cfg cfg =
        build(
            Type.INTEGER,
            ImmutableList.of(Type.BOOL),
            (gen, args) -> gen.ifte(args.get(0), Type.INTEGER, () -> ONE, () -> TWO));
    assertThat(blockIds(cfg)).containsExactly(0, 1, 2, 3).inOrder();
    Block entry = cfg.blocks().get(0);
    Block ifTrue = cfg.blocks().get(1);
    Block ifFalse = cfg.blocks().get(2);
    Block merge = cfg.blocks().get(3);
    assertThat(entry.statements()).isEmpty();
    Atom x = entry.inputs().asList().get(0);
    assertThat(entry.terminator().value())
        .isEqualTo(new Terminator.Branch(x, (Label) ifTrue.id, (Label) ifFalse.id));
    assertThat(steps(ifTrue)).containsExactly("$2 = 1", "jump L3($2)").inOrder();
    assertThat(steps(ifFalse)).containsExactly("$3 = 2", "jump L3($3)").inOrder();
    Atom mergeAtom = ((LambdaLabel) merge.id).atom;
    assertThat(merge.inputs()).containsExactly(mergeAtom);
    assertThat(merge.statements()).isEmpty();
    assertThat(merge.terminator().value()).isEqualTo(new Terminator.Return(mergeAtom));
  }

  @Test
  public void ifteM() {
    Cfg cfg =
        build(
            Type.INTEGER,
            ImmutableList.of(Type.INTEGER),
            (gen, args) ->
                gen.ifteM(
                    () -> App.of(Ops.INTEGER_LT, args.get(0), gen.forceEvaluation(ZERO)),
                    Type.INTEGER,
                    () -> ZERO,
                    () -> args.get(0)));
    assertThat(steps(cfg.entryBlock()))
        .containsExactly("$1 = 0", "$2 = lt($0, $1)", "branch $2 L1 L2")
        .inOrder();
  }

  @Test
  public void negatedConditionSwapsTargets() {
    FunctionDef<Void> negated =
        (gen, args) -> {
          Label a = gen.newLabel();
          Label b = gen.newLabel();
          gen.terminate(gen.branch(App.of(Ops.NOT, args.get(0)), a, b));
          gen.defineBlock(a, () -> gen.returnFromFunction(ONE));
          gen.defineBlock(b, () -> gen.returnFromFunction(TWO));
          return null;
        };
    FunctionDef<Void> swapped =
        (gen, args) -> {
          Label a = gen.newLabel();
          Label b = gen.newLabel();
          gen.terminate(gen.branch(args.get(0), b, a));
          gen.defineBlock(a, () -> gen.returnFromFunction(ONE));
          gen.defineBlock(b, () -> gen.returnFromFunction(TWO));
          return null;
        };
    Cfg cfg1 = build(Type.INTEGER, ImmutableList.of(Type.BOOL), negated);
    Cfg cfg2 = build(Type.INTEGER, ImmutableList.of(Type.BOOL), swapped);
    assertThat(cfg1.toString()).isEqualTo(cfg2.toString());
    assertThat(steps(cfg1.entryBlock())).containsExactly("branch $0 L2 L1");
  }

  @Test
  public void doubleNegation() {
    Cfg cfg =
        build(
            Type.INTEGER,
            ImmutableList.of(Type.BOOL),
            (gen, args) ->
                gen.ifte(
                    App.of(Ops.NOT, App.of(Ops.NOT, args.get(0))),
                    Type.INTEGER,
                    () -> ONE,
                    () -> TWO));
    assertThat(steps(cfg.entryBlock())).containsExactly("branch $0 L1 L2");
  }

  @Test
  public void ifteStatements() {
    Cfg cfg =
        build(
            Type.INTEGER,
            ImmutableList.of(Type.BOOL),
            (gen, args) -> {
              gen.ifte_(args.get(0), () -> gen.addPrintStmt(HELLO), () -> {});
              return ONE;
            });
    assertThat(blockIds(cfg)).containsExactly(0, 1, 2, 3).inOrder();
    assertThat(steps(cfg.blocks().get(1)))
        .containsExactly("$1 = \"hello\"", "print $1", "jump L3")
        .inOrder();
    assertThat(steps(cfg.blocks().get(2))).containsExactly("jump L3");
    assertThat(steps(cfg.blocks().get(3))).containsExactly("$2 = 1", "return $2").inOrder();
  }

  @Test
  public void whenAndUnless() {
    Cfg when =
        build(
            Type.INTEGER,
            ImmutableList.of(Type.BOOL),
            (gen, args) -> {
              gen.whenCond(args.get(0), () -> gen.addPrintStmt(HELLO));
              return ONE;
            });
    assertThat(blockIds(when)).containsExactly(0, 1, 2).inOrder();
    assertThat(steps(when.blocks().get(0))).containsExactly("branch $0 L1 L2");
    assertThat(steps(when.blocks().get(1)))
        .containsExactly("$1 = \"hello\"", "print $1", "jump L2")
        .inOrder();

    Cfg unless =
        build(
            Type.INTEGER,
            ImmutableList.of(Type.BOOL),
            (gen, args) -> {
              gen.unlessCond(args.get(0), () -> gen.addPrintStmt(HELLO));
              return ONE;
            });
    assertThat(steps(unless.blocks().get(0))).containsExactly("branch $0 L2 L1");
    assertThat(steps(unless.blocks().get(1)))
        .containsExactly("$1 = \"hello\"", "print $1", "jump L2")
        .inOrder();
  }

  @Test
  public void whileLoop() {
    Position condPos = new Position("test.src", 2, 3);
    Position bodyPos = new Position("test.src", 3, 5);
    // while (0 < r) r = r - 1
    Cfg cfg =
        build(
            Type.INTEGER,
            ImmutableList.of(Type.INTEGER),
            (gen, args) -> {
              Register r = gen.newReg(args.get(0));
              gen.whileLoop(
                  condPos,
                  () -> App.of(Ops.INTEGER_LT, ZERO, gen.readReg(r)),
                  bodyPos,
                  () -> gen.modifyReg(r, v -> App.of(Ops.INTEGER_SUB, v, ONE)));
              assertThat(gen.position()).isEqualTo(POS);
              return gen.readReg(r);
            });
    assertThat(blockIds(cfg)).containsExactly(0, 1, 2, 3).inOrder();
    Block entry = cfg.blocks().get(0);
    Block cond = cfg.blocks().get(1);
    Block body = cfg.blocks().get(2);
    Block exit = cfg.blocks().get(3);
    assertThat(steps(entry)).containsExactly("r1 := $0", "jump L1").inOrder();
    assertThat(steps(cond))
        .containsExactly("$2 = readReg r1", "$3 = 0", "$4 = lt($3, $2)", "branch $4 L2 L3")
        .inOrder();
    assertThat(steps(body))
        .containsExactly("$5 = readReg r1", "$6 = 1", "$7 = sub($5, $6)", "r1 := $7", "jump L1")
        .inOrder();
    assertThat(steps(exit)).containsExactly("$8 = readReg r1", "return $8").inOrder();
    assertThat(cond.successors()).containsExactly(body.id, exit.id).inOrder();
    assertThat(body.successors()).containsExactly(cond.id);
    assertThat(cond.terminator().position()).isEqualTo(condPos);
    assertThat(body.terminator().position()).isEqualTo(bodyPos);
    assertThat(exit.terminator().position()).isEqualTo(POS);
  }

  @Test
  public void whileLoopWithEarlyExit() {
    // The body reports an error, so there is no edge back to the condition.
    Cfg cfg =
        build(
            Type.INTEGER,
            ImmutableList.of(Type.BOOL),
            (gen, args) -> {
              gen.whileLoop(() -> args.get(0), () -> gen.reportError(HELLO));
              return ONE;
            });
    assertThat(blockIds(cfg)).containsExactly(0, 1, 2, 3).inOrder();
    assertThat(steps(cfg.blocks().get(2))).containsExactly("$1 = \"hello\"", "error $1").inOrder();
    assertThat(cfg.blocks().get(2).successors()).isEmpty();
  }

  @Test
  public void caseMaybeStatements() {
    List<Atom> payloads = new ArrayList<>();
    Cfg cfg =
        build(
            Type.INTEGER,
            ImmutableList.of(Type.maybe(Type.INTEGER)),
            (gen, args) -> {
              gen.caseMaybe_(
                  args.get(0),
                  payload -> {
                    payloads.add(payload);
                    gen.addPrintStmt(HELLO);
                  },
                  () -> gen.addPrintStmt(App.constant(Type.STRING, "none")));
              return ONE;
            });
    assertThat(payloads).hasSize(1);
    Atom payload = payloads.get(0);
    assertThat(payload.type()).isEqualTo(Type.INTEGER);
    assertThat(payload.source).isEqualTo(Atom.Source.LAMBDA_ARG);
    assertThat(blockIds(cfg)).containsExactly(0, 1, 2, 3).inOrder();
    Block just = cfg.blocks().get(1);
    Block nothing = cfg.blocks().get(2);
    assertThat(steps(cfg.blocks().get(0))).containsExactly("maybeBranch $0 L1 L2");
    assertThat(just.inputs()).containsExactly(payload);
    assertThat(just.successors()).containsExactly(cfg.blocks().get(3).id);
    assertThat(nothing.inputs()).isEmpty();
    assertThat(nothing.successors()).containsExactly(cfg.blocks().get(3).id);
  }

  @Test
  public void caseMaybe() {
    Cfg cfg =
        build(
            Type.INTEGER,
            ImmutableList.of(Type.maybe(Type.INTEGER)),
            (gen, args) ->
                gen.caseMaybe(
                    args.get(0),
                    Type.INTEGER,
                    payload -> App.of(Ops.INTEGER_ADD, payload, ONE),
                    () -> ZERO));
    assertThat(blockIds(cfg)).containsExactly(0, 1, 2, 3).inOrder();
    assertThat(steps(cfg.blocks().get(1)))
        .containsExactly("$3 = 1", "$4 = add($1, $3)", "jump L3($4)")
        .inOrder();
    assertThat(steps(cfg.blocks().get(2))).containsExactly("$5 = 0", "jump L3($5)").inOrder();
    assertThat(steps(cfg.blocks().get(3))).containsExactly("return $2");
  }

  @Test
  public void fromJust() {
    Cfg checked =
        build(
            Type.INTEGER,
            ImmutableList.of(Type.maybe(Type.INTEGER)),
            (gen, args) ->
                gen.fromJustExpr(args.get(0), App.constant(Type.STRING, "missing")));
    assertThat(blockIds(checked)).containsExactly(0, 1, 2, 3).inOrder();
    assertThat(steps(checked.blocks().get(0))).containsExactly("maybeBranch $0 L1 L2");
    assertThat(steps(checked.blocks().get(1))).containsExactly("jump L3($1)");
    assertThat(steps(checked.blocks().get(2)))
        .containsExactly("$3 = \"missing\"", "error $3")
        .inOrder();
    assertThat(steps(checked.blocks().get(3))).containsExactly("return $2");

    Cfg asserted =
        build(
            Type.INTEGER,
            ImmutableList.of(Type.maybe(Type.INTEGER)),
            (gen, args) ->
                gen.assertedJustExpr(args.get(0), App.constant(Type.STRING, "missing")));
    assertThat(asserted.blocks()).hasSize(1);
    assertThat(steps(asserted.blocks().get(0)))
        .containsExactly("$1 = \"missing\"", "$2 = fromJust($0, $1)", "return $2")
        .inOrder();
  }

  @Test
  public void caseVariant() {
    Type variant = Type.variant(Type.INTEGER, Type.STRING);
    ImmutableList<Function<Atom, Expr>> cases = ImmutableList.of(i -> i, s -> ZERO);
    Cfg cfg =
        build(
            Type.INTEGER,
            ImmutableList.of(variant),
            (gen, args) -> gen.caseVariant(args.get(0), Type.INTEGER, cases));
    assertThat(blockIds(cfg)).containsExactly(0, 1, 2, 3).inOrder();
    assertThat(steps(cfg.blocks().get(0))).containsExactly("variantBranch $0 [L1, L2]");
    assertThat(cfg.blocks().get(1).inputs().asList().get(0).type()).isEqualTo(Type.INTEGER);
    assertThat(cfg.blocks().get(2).inputs().asList().get(0).type()).isEqualTo(Type.STRING);
    assertThat(steps(cfg.blocks().get(1))).containsExactly("jump L3($1)");
    assertThat(steps(cfg.blocks().get(2))).containsExactly("$4 = 0", "jump L3($4)").inOrder();
    assertThat(steps(cfg.blocks().get(3))).containsExactly("return $3");
  }

  @Test
  public void caseVariantNeedsOneHandlerPerCase() {
    build(
        Type.INTEGER,
        ImmutableList.of(Type.variant(Type.INTEGER, Type.STRING)),
        (gen, args) -> {
          ImmutableList<Function<Atom, Expr>> cases = ImmutableList.of(i -> i);
          assertThrows(
              IllegalArgumentException.class,
              () -> gen.caseVariant(args.get(0), Type.INTEGER, cases));
          return ONE;
        });
  }

  @Test
  public void tailCall() {
    FnHandle g = new FnHandle("g", ImmutableList.of(Type.INTEGER), Type.BOOL);
    FnHandle h = new FnHandle("h", ImmutableList.of(Type.INTEGER), Type.INTEGER);
    Cfg cfg =
        build(
            Type.BOOL,
            ImmutableList.of(Type.INTEGER),
            (gen, args) -> {
              assertThrows(
                  IllegalArgumentException.class,
                  () -> gen.tailCall(App.constant(h.type(), h), args));
              return gen.terminate(gen.tailCall(App.constant(g.type(), g), args));
            });
    assertThat(steps(cfg.entryBlock())).containsExactly("$1 = g", "tailCall $1($0)").inOrder();
    assertThat(cfg.entryBlock().successors()).isEmpty();
  }

  @Test
  public void divergingBranchSkipsMerge() {
    Cfg cfg =
        build(
            Type.INTEGER,
            ImmutableList.of(Type.BOOL),
            (gen, args) ->
                gen.ifte(
                    args.get(0),
                    Type.INTEGER,
                    () -> ONE,
                    () -> gen.reportError(App.constant(Type.STRING, "boom"))));
    assertThat(blockIds(cfg)).containsExactly(0, 1, 2, 3).inOrder();
    assertThat(steps(cfg.blocks().get(1))).containsExactly("$2 = 1", "jump L3($2)").inOrder();
    assertThat(steps(cfg.blocks().get(2)))
        .containsExactly("$3 = \"boom\"", "error $3")
        .inOrder();
    assertThat(steps(cfg.blocks().get(3))).containsExactly("return $1");
  }

  @Test
  public void nestedIfte() {
    // f(x: Bool, y: Bool) -> Integer = if x then (if y then 1 else 2) else 3
    Cfg cfg =
        build(
            Type.INTEGER,
            ImmutableList.of(Type.BOOL, Type.BOOL),
            (gen, args) ->
                gen.ifte(
                    args.get(0),
                    Type.INTEGER,
                    () -> gen.ifte(args.get(1), Type.INTEGER, () -> ONE, () -> TWO),
                    () -> App.constant(Type.INTEGER, 3)));
    // Blocks are listed in the order they were terminated.
    assertThat(blockIds(cfg)).containsExactly(0, 1, 4, 5, 6, 2, 3).inOrder();
    assertThat(steps(cfg.block(cfg.blocks().get(1).id))).containsExactly("branch $1 L4 L5");
    assertThat(steps(cfg.blocks().get(4))).containsExactly("jump L3($3)");
    assertThat(steps(cfg.blocks().get(5))).containsExactly("$6 = 3", "jump L3($6)").inOrder();
    assertThat(steps(cfg.blocks().get(6))).containsExactly("return $2");
  }

  @Test
  public void whileLoopConditionMustBranchOrTerminate() {
    Position condPos = new Position("test.src", 2, 3);
    builder.validate = false;
    build(
        Type.INTEGER,
        ImmutableList.of(),
        (gen, args) -> {
          IllegalStateException e =
              assertThrows(
                  IllegalStateException.class,
                  () -> gen.whileLoop(condPos, () -> null, condPos, () -> {}));
          assertThat(e)
              .hasMessageThat()
              .isEqualTo("test.src:2:3: the loop condition returned null without terminating");
          assertThat(gen.position()).isEqualTo(POS);
          return null;
        });
  }

  @Test
  public void whileLoopRestoresPositionOnFailure() {
    Position condPos = new Position("test.src", 2, 3);
    Position bodyPos = new Position("test.src", 3, 5);
    builder.validate = false;
    build(
        Type.INTEGER,
        ImmutableList.of(Type.BOOL),
        (gen, args) -> {
          assertThrows(
              UnsupportedOperationException.class,
              () ->
                  gen.whileLoop(
                      condPos,
                      () -> args.get(0),
                      bodyPos,
                      () -> {
                        throw new UnsupportedOperationException();
                      }));
          assertThat(gen.position()).isEqualTo(POS);
          return null;
        });
  }

  @Test
  public void assertedJustNeedsStringMessage() {
    build(
        Type.INTEGER,
        ImmutableList.of(Type.maybe(Type.INTEGER)),
        (gen, args) -> {
          IllegalArgumentException e =
              assertThrows(
                  IllegalArgumentException.class, () -> gen.assertedJustExpr(args.get(0), ONE));
          assertThat(e).hasMessageThat().startsWith("test.src:1:1: assertedJustExpr expects ");
          return ZERO;
        });
  }
}
