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
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import org.blockgen.code.AtomValue.EvalApp;
import org.blockgen.code.Stmt.DefineAtom;
import org.jspecify.annotations.Nullable;

/**
 * A Generator builds the blocks of a single function. Generators are created by {@link
 * CfgBuilder#defineFunction}, which passes one to the client's {@link FunctionDef}; the client
 * then emits statements into the current block and uses the control flow methods to create new
 * blocks.
 *
 * <p>At any time there is at most one <i>current</i> block, to which statements are appended.
 * Methods that end the current block come in two forms:
 *
 * <ul>
 *   <li>Terminator-valued methods ({@link #jump}, {@link #jumpToLambda}, {@link #branch}, {@link
 *       #returnFromFunction}, {@link #maybeBranch}, {@link #branchVariant}, {@link #tailCall})
 *       evaluate their operands in the current block and return a {@link Terminator}, which the
 *       caller returns from a block body (see {@link #defineBlock}) or passes to {@link
 *       #continueWith}.
 *   <li>Diverging methods ({@link #terminate}, {@link #reportError}, {@link #endCurrentBlock})
 *       seal the current block immediately and return null of whatever type the caller needs. After
 *       one of these there is no current block ({@link #isReachable} returns false) until a new one
 *       is started, and any attempt to add a statement throws an IllegalStateException.
 * </ul>
 *
 * <p>The combinators ({@link #ifte}, {@link #whileLoop}, {@link #caseMaybe}, etc.) check {@link
 * #isReachable} after running each branch, so a branch that diverges simply contributes no edge to
 * the merge block.
 *
 * <p>Each Generator also carries a client-defined per-block state of type {@code S}; changes made
 * to it while defining a nested block are discarded when that definition completes.
 *
 * <p>Generators are not thread-safe, but distinct Generators share no state.
 */
public final class Generator<S> {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /**
   * A token identifying one build; every Atom, Register, and label records the Scope of the
   * Generator that created it, so that values from different builds cannot be mixed.
   */
  static final class Scope {}

  private final Scope scope = new Scope();

  /** The function being built. */
  public final FnHandle handle;

  /** One Atom for each of the function's arguments (with ids 0 through n-1). */
  private final ImmutableList<Atom> args;

  /** The sealed blocks, in the order they were terminated. */
  private final List<Block> blocks = new ArrayList<>();

  /** Every block id that has been started, to detect a label being defined twice. */
  private final Set<BlockId> started = Collections.newSetFromMap(new IdentityHashMap<>());

  /** Graphs saved by {@link #recordCfg}, in the order they were recorded. */
  private final List<Cfg> recorded = new ArrayList<>();

  /** The id of the next Label or LambdaLabel; 0 is reserved for the entry block. */
  private int nextLabel = 1;

  /** The id of the next Atom or Register; starts after the function arguments. */
  private int nextValue;

  /** The block currently accepting statements, or null if there is none. */
  private @Nullable OpenBlock current;

  private Position position;

  private S state;

  /** A block that has been started but not yet terminated. */
  private static final class OpenBlock {
    final BlockId id;
    final ImmutableSet<Atom> inputs;
    final ImmutableList.Builder<Located<Stmt>> statements = ImmutableList.builder();

    OpenBlock(BlockId id, ImmutableSet<Atom> inputs) {
      this.id = id;
      this.inputs = inputs;
    }
  }

  /** Creates a Generator whose current block is the function's entry block. */
  Generator(FnHandle handle, Position position, S initialState) {
    this.handle = handle;
    this.position = position;
    this.state = initialState;
    ImmutableList.Builder<Atom> argsBuilder = ImmutableList.builder();
    for (Type argType : handle.argTypes()) {
      argsBuilder.add(
          new Atom(scope, nextValue++, position, Atom.Source.FUNCTION_INPUT, argType, null));
    }
    this.args = argsBuilder.build();
    Label entry = new Label(scope, 0);
    started.add(entry);
    current = new OpenBlock(entry, ImmutableSet.copyOf(args));
  }

  /** The Atoms representing the function's arguments. */
  public ImmutableList<Atom> args() {
    return args;
  }

  // ------------------------------------------------------------------------------------------
  // Positions and per-block state

  /** Returns the Position that will be attached to new statements, atoms, and registers. */
  public Position position() {
    return position;
  }

  public void setPosition(Position position) {
    this.position = Preconditions.checkNotNull(position);
  }

  /**
   * Runs {@code action} with the current position set to {@code position}, then restores the
   * previous position.
   */
  @CanIgnoreReturnValue
  public <T> T withPosition(Position position, Supplier<T> action) {
    Position saved = this.position;
    setPosition(position);
    try {
      return action.get();
    } finally {
      this.position = saved;
    }
  }

  public S state() {
    return state;
  }

  public void setState(S state) {
    this.state = state;
  }

  // ------------------------------------------------------------------------------------------
  // Identifiers

  private int freshValueId() {
    return nextValue++;
  }

  /** Returns a new Label; its block must later be defined with {@link #defineBlock}. */
  public Label newLabel() {
    return new Label(scope, nextLabel++);
  }

  /**
   * Returns a new LambdaLabel whose block will receive a value of the given type; its block must
   * later be defined with {@link #defineLambdaBlock} or started by {@link #continueWithLambda}.
   */
  public LambdaLabel newLambdaLabel(Type type) {
    Preconditions.checkNotNull(type);
    return new LambdaLabel(scope, nextLabel++, freshValueId(), position, type);
  }

  // ------------------------------------------------------------------------------------------
  // Checks

  /** Returns the current block, or throws an IllegalStateException if there is none. */
  private OpenBlock open() {
    Preconditions.checkState(
        current != null,
        "%s: no current block (the previous block was already terminated)",
        position);
    return current;
  }

  /** True if there is a current block, i.e. the last block was not terminated. */
  public boolean isReachable() {
    return current != null;
  }

  private void checkOwned(Atom atom) {
    Preconditions.checkArgument(
        atom.scope == scope, "%s: %s was created by a different build", position, atom);
  }

  private void checkOwned(Register register) {
    Preconditions.checkArgument(
        register.scope == scope, "%s: %s was created by a different build", position, register);
  }

  private void checkOwned(BlockId id) {
    Scope idScope = (id instanceof Label label) ? label.scope : ((LambdaLabel) id).scope;
    Preconditions.checkArgument(
        idScope == scope, "%s: %s was created by a different build", position, id);
  }

  private void checkType(Type expected, Expr expr, String what) {
    Preconditions.checkArgument(
        expr.type().equals(expected),
        "%s: %s expects %s, got %s of type %s",
        position,
        what,
        expected,
        expr,
        expr.type());
  }

  private void checkKind(Type.Kind expected, Expr expr, String what) {
    Preconditions.checkArgument(
        expr.type().is(expected),
        "%s: %s expects a %s, got %s of type %s",
        position,
        what,
        expected,
        expr,
        expr.type());
  }

  // ------------------------------------------------------------------------------------------
  // Blocks

  private void addStmt(Stmt stmt) {
    open().statements.add(new Located<>(position, stmt));
  }

  /** Makes the block with the given id the current block. */
  private void startBlock(BlockId id) {
    assert current == null;
    Preconditions.checkState(started.add(id), "%s: block %s was already defined", position, id);
    ImmutableSet<Atom> inputs =
        (id instanceof LambdaLabel lambda) ? ImmutableSet.of(lambda.atom) : ImmutableSet.of();
    current = new OpenBlock(id, inputs);
  }

  /** Ends the current block with the given terminator and adds it to the sealed blocks. */
  private void terminateBlock(Terminator term) {
    OpenBlock b = open();
    term.successors().forEach(this::checkOwned);
    term.atoms().forEach(this::checkOwned);
    blocks.add(new Block(b.id, b.inputs, b.statements.build(), new Located<>(position, term)));
    current = null;
    logger.atFinest().log("%s: sealed %s with %s", position, b.id, term);
  }

  /**
   * Defines the block for {@code label} by running {@code body} with it as the current block. The
   * body must either return the Terminator for the block (which may be a different block from the
   * one it started with, if the body used {@link #continueWith}), or end it with a diverging method
   * and return null.
   *
   * <p>The current block (if any), position, and state are saved before running {@code body}, and
   * restored after.
   */
  public void defineBlock(Label label, Supplier<@Nullable Terminator> body) {
    checkOwned(label);
    defineSomeBlock(label, body);
  }

  /**
   * Like {@link #defineBlock}, but for a lambda label; {@code body} is passed the block's input.
   */
  public void defineLambdaBlock(LambdaLabel label, Function<Atom, @Nullable Terminator> body) {
    checkOwned(label);
    defineSomeBlock(label, () -> body.apply(label.atom));
  }

  private void defineSomeBlock(BlockId id, Supplier<@Nullable Terminator> body) {
    OpenBlock savedBlock = current;
    Position savedPosition = position;
    S savedState = state;
    current = null;
    try {
      startBlock(id);
      Terminator term = body.get();
      if (term != null) {
        Preconditions.checkState(
            current != null,
            "%s: the body of %s already terminated its block, but returned %s",
            position,
            id,
            term);
        terminateBlock(term);
      } else {
        Preconditions.checkState(
            current == null, "%s: the body of %s did not terminate its block", position, id);
      }
    } finally {
      current = savedBlock;
      position = savedPosition;
      state = savedState;
    }
  }

  /**
   * Ends the current block with {@code term}, then runs {@code then} (which may define other
   * blocks) to get the label of the next block, and makes that the current block. There is no
   * current block while {@code then} runs, so it cannot add statements.
   */
  public void continueWith(Terminator term, Supplier<Label> then) {
    terminateBlock(term);
    Label next = then.get();
    checkOwned(next);
    startBlock(next);
  }

  /**
   * Like {@link #continueWith}, but the next block has a lambda label; returns the Atom that the
   * new current block receives.
   */
  public Atom continueWithLambda(Terminator term, Supplier<LambdaLabel> then) {
    terminateBlock(term);
    LambdaLabel next = then.get();
    checkOwned(next);
    startBlock(next);
    return next.atom;
  }

  /**
   * Ends the current block with {@code term}, then runs {@code then} (which may define other
   * blocks). There is no current block afterwards. Always returns null.
   */
  @CanIgnoreReturnValue
  public <T> @Nullable T endCurrentBlock(Terminator term, Runnable then) {
    terminateBlock(term);
    then.run();
    assert current == null;
    return null;
  }

  /** Ends the current block with {@code term}. There is no current block afterwards. */
  @CanIgnoreReturnValue
  public <T> @Nullable T terminate(Terminator term) {
    terminateBlock(term);
    return null;
  }

  /**
   * Ends the current block with a {@link Terminator.ReportError}. This represents a failure of the
   * program being translated; the resulting graph is still well formed.
   */
  @CanIgnoreReturnValue
  public <T> @Nullable T reportError(Expr message) {
    checkType(Type.STRING, message, "reportError");
    return terminate(new Terminator.ReportError(mkAtom(message)));
  }

  // ------------------------------------------------------------------------------------------
  // Terminators

  public Terminator jump(Label target) {
    return new Terminator.Jump(target);
  }

  /** Evaluates {@code value} and returns a jump that passes it to {@code target}. */
  public Terminator jumpToLambda(LambdaLabel target, Expr value) {
    checkType(target.type(), value, target.toString());
    return new Terminator.JumpToLambda(target, mkAtom(value));
  }

  /**
   * Evaluates {@code condition} and returns a branch to {@code ifTrue} or {@code ifFalse}. If
   * {@code condition} is a negation, branches on the negated expression with the targets swapped
   * instead of computing the negation.
   */
  public Terminator branch(Expr condition, Label ifTrue, Label ifFalse) {
    checkType(Type.BOOL, condition, "branch");
    if (condition instanceof App app && app.op == Ops.NOT) {
      return branch(app.operands().get(0), ifFalse, ifTrue);
    }
    return new Terminator.Branch(mkAtom(condition), ifTrue, ifFalse);
  }

  /** Evaluates {@code result} and returns a terminator that returns it from the function. */
  public Terminator returnFromFunction(Expr result) {
    checkType(handle.returnType(), result, "return from " + handle);
    return new Terminator.Return(mkAtom(result));
  }

  /**
   * Evaluates {@code maybe} and returns a terminator that passes its payload to {@code ifJust} or
   * continues at {@code ifNothing}.
   */
  public Terminator maybeBranch(Expr maybe, LambdaLabel ifJust, Label ifNothing) {
    checkKind(Type.Kind.MAYBE, maybe, "maybeBranch");
    checkType(maybe.type().elementType(), ifJust.atom, ifJust.toString());
    return new Terminator.MaybeBranch(mkAtom(maybe), ifJust, ifNothing);
  }

  /**
   * Evaluates {@code variant} and returns a terminator that passes its payload to the label for
   * its case; {@code cases} must have one label for each case of the variant's type.
   */
  public Terminator branchVariant(Expr variant, List<LambdaLabel> cases) {
    checkKind(Type.Kind.VARIANT, variant, "branchVariant");
    ImmutableList<Type> caseTypes = variant.type().caseTypes();
    Preconditions.checkArgument(
        cases.size() == caseTypes.size(),
        "%s: %s has %s cases, got %s labels",
        position,
        variant,
        caseTypes.size(),
        cases.size());
    for (int i = 0; i < cases.size(); i++) {
      checkType(caseTypes.get(i), cases.get(i).atom, cases.get(i).toString());
    }
    return new Terminator.VariantBranch(mkAtom(variant), ImmutableList.copyOf(cases));
  }

  /**
   * Evaluates {@code fn} and {@code args} and returns a terminator that calls the function and
   * returns its result; the function's return type must match that of the function being built.
   */
  public Terminator tailCall(Expr fn, List<? extends Expr> args) {
    checkCallTypes(fn, args);
    Preconditions.checkArgument(
        fn.type().returnType().equals(handle.returnType()),
        "%s: tail call from %s to %s of type %s",
        position,
        handle,
        fn,
        fn.type());
    Atom fnAtom = mkAtom(fn);
    return new Terminator.TailCall(fnAtom, mkAtoms(args));
  }

  // ------------------------------------------------------------------------------------------
  // Statements

  /**
   * Returns an Atom with the value of {@code expr}. If {@code expr} is already an Atom it is
   * returned unchanged; otherwise each of its operands is converted to an Atom (left to right) and
   * a {@link DefineAtom} statement is added to the current block.
   */
  public Atom mkAtom(Expr expr) {
    if (expr instanceof Atom atom) {
      checkOwned(atom);
      return atom;
    }
    App app = (App) expr;
    ImmutableList<Atom> operands = mkAtoms(app.operands());
    return freshAtom(new EvalApp(app.op, operands, app.type()));
  }

  private ImmutableList<Atom> mkAtoms(List<? extends Expr> exprs) {
    ImmutableList.Builder<Atom> builder = ImmutableList.builderWithExpectedSize(exprs.size());
    for (Expr e : exprs) {
      builder.add(mkAtom(e));
    }
    return builder.build();
  }

  /**
   * Evaluates {@code expr} now, and returns an Atom that can be used to refer to the result without
   * evaluating it again.
   */
  public Atom forceEvaluation(Expr expr) {
    return mkAtom(expr);
  }

  /** Adds a {@link DefineAtom} statement for {@code value} and returns the new Atom. */
  private Atom freshAtom(AtomValue value) {
    Preconditions.checkState(current != null, "%s: no current block", position);
    Atom atom =
        new Atom(scope, freshValueId(), position, Atom.Source.ASSIGNED, value.type(), null);
    addStmt(new DefineAtom(atom, value));
    return atom;
  }

  public Atom readGlobal(GlobalVar global) {
    return freshAtom(new AtomValue.ReadGlobal(global));
  }

  public void writeGlobal(GlobalVar global, Expr value) {
    checkType(global.type, value, global.toString());
    addStmt(new Stmt.WriteGlobal(global, mkAtom(value)));
  }

  /** Allocates a new reference cell containing {@code contents}. */
  public Atom newRef(Expr contents) {
    return freshAtom(new AtomValue.NewRef(mkAtom(contents)));
  }

  /** Allocates a new reference cell with no contents. */
  public Atom newEmptyRef(Type elementType) {
    return freshAtom(new AtomValue.NewEmptyRef(elementType));
  }

  public Atom readRef(Expr ref) {
    checkKind(Type.Kind.REFERENCE, ref, "readRef");
    return freshAtom(new AtomValue.ReadRef(mkAtom(ref)));
  }

  public void writeRef(Expr ref, Expr value) {
    checkType(Type.reference(value.type()), ref, "writeRef");
    Atom refAtom = mkAtom(ref);
    addStmt(new Stmt.WriteRef(refAtom, mkAtom(value)));
  }

  /**
   * Returns a reference cell to its uninitialized state; it can still be written, and read after
   * being written.
   */
  public void dropRef(Expr ref) {
    checkKind(Type.Kind.REFERENCE, ref, "dropRef");
    addStmt(new Stmt.DropRef(mkAtom(ref)));
  }

  /** Returns a new Register, initialized to {@code initialValue}. */
  public Register newReg(Expr initialValue) {
    Atom value = mkAtom(initialValue);
    Register result = newUnassignedReg(value.type());
    addStmt(new Stmt.SetReg(result, value));
    return result;
  }

  /**
   * Returns a new Register with no initial value. Reading it before it has been assigned is an
   * error that will only be detected when the graph is converted to SSA form.
   */
  public Register newUnassignedReg(Type type) {
    Preconditions.checkNotNull(type);
    return new Register(scope, freshValueId(), position, type);
  }

  /** Returns a new Atom with the current value of {@code register}. */
  public Atom readReg(Register register) {
    checkOwned(register);
    return freshAtom(new AtomValue.ReadReg(register));
  }

  public void assignReg(Register register, Expr value) {
    checkOwned(register);
    checkType(register.type, value, register.toString());
    addStmt(new Stmt.SetReg(register, mkAtom(value)));
  }

  /** Sets {@code register} to the result of applying {@code update} to its current value. */
  public void modifyReg(Register register, UnaryOperator<Expr> update) {
    Atom value = readReg(register);
    assignReg(register, update.apply(value));
  }

  /** Adds a statement that evaluates a client-defined {@link Extension}, and returns its result. */
  public Atom extensionStmt(Extension extension) {
    ImmutableList<Atom> operands = mkAtoms(extension.operands());
    return freshAtom(new AtomValue.EvalExt(extension, operands));
  }

  /** Adds a statement that prints {@code message} when the program runs. */
  public void addPrintStmt(Expr message) {
    checkType(Type.STRING, message, "print");
    addStmt(new Stmt.Print(mkAtom(message)));
  }

  /** Adds a statement that fails with {@code message} if {@code condition} is false. */
  public void assertExpr(Expr condition, Expr message) {
    checkType(Type.BOOL, condition, "assert");
    checkType(Type.STRING, message, "assert");
    Atom conditionAtom = mkAtom(condition);
    addStmt(new Stmt.Assert(conditionAtom, mkAtom(message)));
  }

  /** Calls the function that {@code fn} evaluates to, and returns its result. */
  public Atom call(Expr fn, List<? extends Expr> args) {
    checkCallTypes(fn, args);
    Atom fnAtom = mkAtom(fn);
    return freshAtom(new AtomValue.Call(fnAtom, mkAtoms(args)));
  }

  private void checkCallTypes(Expr fn, List<? extends Expr> args) {
    checkKind(Type.Kind.FUNCTION_HANDLE, fn, "call");
    ImmutableList<Type> argTypes = fn.type().argTypes();
    Preconditions.checkArgument(
        args.size() == argTypes.size(),
        "%s: %s expects %s arguments, got %s",
        position,
        fn,
        argTypes.size(),
        args.size());
    for (int i = 0; i < args.size(); i++) {
      checkType(argTypes.get(i), args.get(i), "argument " + i + " of " + fn);
    }
  }

  /**
   * Saves a graph built for a nested or anonymous function while translating this one; it will be
   * returned with this function's graph.
   */
  public void recordCfg(Cfg cfg) {
    recorded.add(Preconditions.checkNotNull(cfg));
  }

  // ------------------------------------------------------------------------------------------
  // Combinators

  /**
   * Returns a jump to {@code merge} passing {@code result}, or null if the current block has
   * already been terminated (in which case {@code result} is ignored).
   */
  private @Nullable Terminator jumpIfReachable(LambdaLabel merge, @Nullable Expr result) {
    if (current == null) {
      return null;
    }
    Preconditions.checkState(
        result != null, "%s: a branch to %s returned null without terminating", position, merge);
    return jumpToLambda(merge, result);
  }

  private @Nullable Terminator jumpIfReachable(Label merge) {
    return (current == null) ? null : jump(merge);
  }

  /**
   * If-then-else producing a value: branches on {@code condition}, evaluates {@code ifTrue} or
   * {@code ifFalse} in a new block, and continues in a merge block that receives the result (of
   * the given type).
   */
  public Atom ifte(
      Expr condition,
      Type type,
      Supplier<@Nullable Expr> ifTrue,
      Supplier<@Nullable Expr> ifFalse) {
    Label trueLabel = newLabel();
    Label falseLabel = newLabel();
    return continueWithLambda(
        branch(condition, trueLabel, falseLabel),
        () -> {
          LambdaLabel merge = newLambdaLabel(type);
          defineBlock(trueLabel, () -> jumpIfReachable(merge, ifTrue.get()));
          defineBlock(falseLabel, () -> jumpIfReachable(merge, ifFalse.get()));
          return merge;
        });
  }

  /** Like {@link #ifte}, but first runs {@code condition} to compute the condition. */
  public Atom ifteM(
      Supplier<Expr> condition,
      Type type,
      Supplier<@Nullable Expr> ifTrue,
      Supplier<@Nullable Expr> ifFalse) {
    return ifte(condition.get(), type, ifTrue, ifFalse);
  }

  /** If-then-else for statements. */
  public void ifte_(Expr condition, Runnable ifTrue, Runnable ifFalse) {
    Label trueLabel = newLabel();
    Label falseLabel = newLabel();
    continueWith(
        branch(condition, trueLabel, falseLabel),
        () -> {
          Label merge = newLabel();
          defineBlock(
              trueLabel,
              () -> {
                ifTrue.run();
                return jumpIfReachable(merge);
              });
          defineBlock(
              falseLabel,
              () -> {
                ifFalse.run();
                return jumpIfReachable(merge);
              });
          return merge;
        });
  }

  /** Runs {@code body} only if {@code condition} is true. */
  public void whenCond(Expr condition, Runnable body) {
    Label trueLabel = newLabel();
    Label merge = newLabel();
    continueWith(
        branch(condition, trueLabel, merge),
        () -> {
          defineBlock(
              trueLabel,
              () -> {
                body.run();
                return jumpIfReachable(merge);
              });
          return merge;
        });
  }

  /** Runs {@code body} only if {@code condition} is false. */
  public void unlessCond(Expr condition, Runnable body) {
    Label falseLabel = newLabel();
    Label merge = newLabel();
    continueWith(
        branch(condition, merge, falseLabel),
        () -> {
          defineBlock(
              falseLabel,
              () -> {
                body.run();
                return jumpIfReachable(merge);
              });
          return merge;
        });
  }

  /**
   * Dispatches on an optional value: if it is present {@code onJust} is run with its payload,
   * otherwise {@code onNothing} is run; either way the result (of type {@code resultType}) is
   * passed to a merge block, which becomes the current block.
   */
  public Atom caseMaybe(
      Expr maybe,
      Type resultType,
      Function<Atom, @Nullable Expr> onJust,
      Supplier<@Nullable Expr> onNothing) {
    checkKind(Type.Kind.MAYBE, maybe, "caseMaybe");
    LambdaLabel justLabel = newLambdaLabel(maybe.type().elementType());
    Label nothingLabel = newLabel();
    return continueWithLambda(
        maybeBranch(maybe, justLabel, nothingLabel),
        () -> {
          LambdaLabel merge = newLambdaLabel(resultType);
          defineLambdaBlock(justLabel, payload -> jumpIfReachable(merge, onJust.apply(payload)));
          defineBlock(nothingLabel, () -> jumpIfReachable(merge, onNothing.get()));
          return merge;
        });
  }

  /** Like {@link #caseMaybe}, for statements. */
  public void caseMaybe_(Expr maybe, Consumer<Atom> onJust, Runnable onNothing) {
    checkKind(Type.Kind.MAYBE, maybe, "caseMaybe_");
    LambdaLabel justLabel = newLambdaLabel(maybe.type().elementType());
    Label nothingLabel = newLabel();
    continueWith(
        maybeBranch(maybe, justLabel, nothingLabel),
        () -> {
          Label merge = newLabel();
          defineLambdaBlock(
              justLabel,
              payload -> {
                onJust.accept(payload);
                return jumpIfReachable(merge);
              });
          defineBlock(
              nothingLabel,
              () -> {
                onNothing.run();
                return jumpIfReachable(merge);
              });
          return merge;
        });
  }

  /**
   * Returns the payload of an optional value, branching to a block that reports {@code message} as
   * an error if it is absent.
   */
  public Atom fromJustExpr(Expr maybe, Expr message) {
    checkKind(Type.Kind.MAYBE, maybe, "fromJustExpr");
    checkType(Type.STRING, message, "fromJustExpr");
    Type elementType = maybe.type().elementType();
    LambdaLabel justLabel = newLambdaLabel(elementType);
    Label nothingLabel = newLabel();
    return continueWithLambda(
        maybeBranch(maybe, justLabel, nothingLabel),
        () -> {
          LambdaLabel merge = newLambdaLabel(elementType);
          defineLambdaBlock(justLabel, payload -> jumpToLambda(merge, payload));
          defineBlock(nothingLabel, () -> reportError(message));
          return merge;
        });
  }

  /**
   * Returns the payload of an optional value that the caller knows to be present, without a
   * branch; {@code message} is only used if that turns out to be wrong when the program runs.
   * Callers that have not established that the value is present should use {@link #fromJustExpr}.
   */
  public Atom assertedJustExpr(Expr maybe, Expr message) {
    checkKind(Type.Kind.MAYBE, maybe, "assertedJustExpr");
    checkType(Type.STRING, message, "assertedJustExpr");
    return forceEvaluation(App.of(Ops.FROM_JUST, maybe, message));
  }

  /**
   * Dispatches on a variant: runs the element of {@code cases} corresponding to the variant's case
   * with its payload, and passes the result (of type {@code resultType}) to a merge block, which
   * becomes the current block.
   */
  public Atom caseVariant(
      Expr variant, Type resultType, List<Function<Atom, @Nullable Expr>> cases) {
    checkKind(Type.Kind.VARIANT, variant, "caseVariant");
    Preconditions.checkArgument(
        cases.size() == variant.type().caseTypes().size(),
        "%s: %s has %s cases, got %s handlers",
        position,
        variant,
        variant.type().caseTypes().size(),
        cases.size());
    ImmutableList.Builder<LambdaLabel> labels = ImmutableList.builder();
    for (Type caseType : variant.type().caseTypes()) {
      labels.add(newLambdaLabel(caseType));
    }
    ImmutableList<LambdaLabel> caseLabels = labels.build();
    return continueWithLambda(
        branchVariant(variant, caseLabels),
        () -> {
          LambdaLabel merge = newLambdaLabel(resultType);
          for (int i = 0; i < caseLabels.size(); i++) {
            Function<Atom, @Nullable Expr> body = cases.get(i);
            defineLambdaBlock(
                caseLabels.get(i), payload -> jumpIfReachable(merge, body.apply(payload)));
          }
          return merge;
        });
  }

  /**
   * Adds a loop: a condition block (at {@code conditionPosition}) that branches to either the body
   * block (at {@code bodyPosition}) or an exit block, with the body jumping back to the condition.
   * The exit block becomes the current block.
   */
  public void whileLoop(
      Position conditionPosition,
      Supplier<@Nullable Expr> condition,
      Position bodyPosition,
      Runnable body) {
    Label conditionLabel = newLabel();
    Label bodyLabel = newLabel();
    Label exitLabel = newLabel();
    continueWith(
        jump(conditionLabel),
        () -> {
          Position saved = position;
          try {
            position = conditionPosition;
            defineBlock(
                conditionLabel,
                () -> {
                  Expr test = condition.get();
                  if (current == null) {
                    return null;
                  }
                  Preconditions.checkState(
                      test != null,
                      "%s: the loop condition returned null without terminating",
                      position);
                  return branch(test, bodyLabel, exitLabel);
                });
            position = bodyPosition;
            defineBlock(
                bodyLabel,
                () -> {
                  body.run();
                  return jumpIfReachable(conditionLabel);
                });
          } finally {
            position = saved;
          }
          return exitLabel;
        });
  }

  /** Like {@link #whileLoop(Position, Supplier, Position, Runnable)}, at the current position. */
  public void whileLoop(Supplier<@Nullable Expr> condition, Runnable body) {
    whileLoop(position, condition, position, body);
  }

  // ------------------------------------------------------------------------------------------
  // Completion

  /**
   * Called by {@link CfgBuilder} when the client's definition has finished: if there is still a
   * current block it is terminated by returning {@code result}. Returns the completed graph.
   */
  Cfg finish(@Nullable Expr result) {
    if (current != null) {
      Preconditions.checkState(
          result != null, "%s: %s returned null without terminating its block", position, handle);
      terminateBlock(returnFromFunction(result));
    }
    return new Cfg(handle, ImmutableList.copyOf(blocks));
  }

  /** The graphs passed to {@link #recordCfg}, in the order they were recorded. */
  ImmutableList<Cfg> recordedCfgs() {
    return ImmutableList.copyOf(recorded);
  }
}
