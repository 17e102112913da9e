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
import static org.blockgen.code.GeneratorTest.ONE;
import static org.blockgen.code.GeneratorTest.POS;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CfgBuilderTest {

  private static final FnHandle IDENTITY =
      new FnHandle("identity", ImmutableList.of(Type.INTEGER), Type.INTEGER);

  private CfgBuilder builder;

  @Before
  public void setup() {
    builder = new CfgBuilder();
    builder.verbose = true;
  }

  @Test
  public void identity() {
    DefinedFunction fn = builder.defineFunction(POS, IDENTITY, null, (gen, args) -> args.get(0));
    Cfg cfg = fn.cfg();
    assertThat(fn.auxiliaryCfgs()).isEmpty();
    assertThat(cfg.handle).isSameInstanceAs(IDENTITY);
    assertThat(cfg.blocks()).hasSize(1);
    Block entry = cfg.blocks().get(0);
    assertThat(cfg.entryBlock()).isSameInstanceAs(entry);
    assertThat(entry.statements()).isEmpty();
    Atom arg = entry.inputs().asList().get(0);
    assertThat(arg.id).isEqualTo(0);
    assertThat(arg.source).isEqualTo(Atom.Source.FUNCTION_INPUT);
    assertThat(entry.terminator().value()).isEqualTo(new Terminator.Return(arg));
  }

  @Test
  public void listing() {
    Cfg cfg = builder.defineFunction(POS, IDENTITY, null, (gen, args) -> args.get(0)).cfg();
    String returnLine = "  return $0";
    assertThat(cfg.toString())
        .isEqualTo(
            "identity(Integer) -> Integer\n"
                + "L0($0):\n"
                + returnLine
                + " ".repeat(40 - returnLine.length())
                + " // test.src:1:1\n");
  }

  @Test
  public void listingShowsPositionChanges() {
    Position line2 = new Position("test.src", 2, 0);
    Cfg cfg =
        builder
            .defineFunction(
                POS,
                IDENTITY,
                null,
                (gen, args) -> {
                  Atom one = gen.mkAtom(ONE);
                  gen.setPosition(line2);
                  return App.of(Ops.INTEGER_ADD, args.get(0), one);
                })
            .cfg();
    ImmutableList<String> lines = ImmutableList.copyOf(cfg.toString().split("\n"));
    assertThat(lines).hasSize(5);
    assertThat(lines.get(2)).endsWith("// test.src:1:1");
    assertThat(lines.get(3)).endsWith("// test.src:2");
    // Unchanged position, no comment.
    assertThat(lines.get(4)).isEqualTo("  return $2");
  }

  @Test
  public void recordedCfgsInOrder() {
    FnHandle first = new FnHandle("first", ImmutableList.of(), Type.INTEGER);
    FnHandle second = new FnHandle("second", ImmutableList.of(), Type.INTEGER);
    DefinedFunction fn =
        builder.defineFunction(
            POS,
            IDENTITY,
            null,
            (gen, args) -> {
              gen.recordCfg(builder.defineFunction(POS, first, null, (g, a) -> ONE).cfg());
              gen.recordCfg(builder.defineFunction(POS, second, null, (g, a) -> ONE).cfg());
              return args.get(0);
            });
    assertThat(Lists.transform(fn.auxiliaryCfgs(), cfg -> cfg.handle))
        .containsExactly(first, second)
        .inOrder();
  }

  @Test
  public void initialState() {
    builder.defineFunction(
        POS,
        IDENTITY,
        "start",
        (gen, args) -> {
          assertThat(gen.state()).isEqualTo("start");
          return args.get(0);
        });
  }

  @Test
  public void resultMustHaveReturnType() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            builder.defineFunction(
                POS, IDENTITY, null, (gen, args) -> App.constant(Type.STRING, "x")));
  }

  @Test
  public void resultRequiredIfBlockIsOpen() {
    assertThrows(
        IllegalStateException.class,
        () -> builder.defineFunction(POS, IDENTITY, null, (gen, args) -> null));
  }

  @Test
  public void resultIgnoredIfTerminated() {
    Cfg cfg =
        builder
            .defineFunction(
                POS,
                IDENTITY,
                null,
                (gen, args) -> {
                  gen.terminate(gen.returnFromFunction(ONE));
                  return args.get(0);
                })
            .cfg();
    assertThat(GeneratorTest.steps(cfg.entryBlock())).containsExactly("$1 = 1", "return $1");
  }

  @Test
  public void validation() {
    FunctionDef<Void> jumpToNowhere = (gen, args) -> gen.terminate(gen.jump(gen.newLabel()));
    IllegalStateException e =
        assertThrows(
            IllegalStateException.class,
            () -> builder.defineFunction(POS, IDENTITY, null, jumpToNowhere));
    assertThat(e).hasMessageThat().contains("L0: L1 is never defined");

    builder.validate = false;
    Cfg cfg = builder.defineFunction(POS, IDENTITY, null, jumpToNowhere).cfg();
    assertThat(CfgValidator.check(cfg)).containsExactly("L0: L1 is never defined");
  }

  @Test
  public void atomOfUndefinedLambdaBlock() {
    FnHandle constant = new FnHandle("constant", ImmutableList.of(), Type.INTEGER);
    IllegalStateException e =
        assertThrows(
            IllegalStateException.class,
            () ->
                builder.defineFunction(
                    POS, constant, null, (gen, args) -> gen.newLambdaLabel(Type.INTEGER).atom));
    assertThat(e).hasMessageThat().contains("L0: $0 is used at test.src:1:1 but never defined");
  }

  @Test
  public void atomUsedOutsideItsBranch() {
    FnHandle choose = new FnHandle("choose", ImmutableList.of(Type.BOOL), Type.INTEGER);
    List<Atom> assigned = new ArrayList<>();
    // The atom assigned in the true branch is read after the merge, so not on the false path.
    FunctionDef<Void> def =
        (gen, args) -> {
          gen.ifte_(args.get(0), () -> assigned.add(gen.forceEvaluation(ONE)), () -> {});
          return assigned.get(assigned.size() - 1);
        };
    IllegalStateException e =
        assertThrows(
            IllegalStateException.class, () -> builder.defineFunction(POS, choose, null, def));
    String problem = "L3: $1 is used at test.src:1:1 but is not defined on every path to it";
    assertThat(e).hasMessageThat().contains(problem);

    builder.validate = false;
    Cfg cfg = builder.defineFunction(POS, choose, null, def).cfg();
    assertThat(CfgValidator.check(cfg)).containsExactly(problem);
  }
}
