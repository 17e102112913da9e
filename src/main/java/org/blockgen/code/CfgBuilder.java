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

import static com.google.common.flogger.LazyArgs.lazy;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import java.util.logging.Level;

/**
 * Builds control flow graphs for functions. A CfgBuilder holds only configuration, and may be used
 * for any number of (possibly concurrent) calls to {@link #defineFunction}.
 */
public class CfgBuilder {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** If true, each completed graph is logged at INFO rather than FINE. */
  public boolean verbose;

  /**
   * If true (the default), each completed graph is checked with {@link CfgValidator}, and an
   * IllegalStateException is thrown if it has any problems.
   */
  public boolean validate = true;

  /**
   * Builds the graph for a function. Creates a Generator whose current block is the entry block,
   * with one input Atom for each of {@code handle}'s argument types, and runs {@code def} with it.
   */
  public <S> DefinedFunction defineFunction(
      Position position, FnHandle handle, S initialState, FunctionDef<S> def) {
    Generator<S> gen = new Generator<>(handle, position, initialState);
    Expr result = def.define(gen, gen.args());
    Cfg cfg = gen.finish(result);
    ImmutableList<Cfg> auxiliary = gen.recordedCfgs();
    if (validate) {
      ImmutableList<String> problems = CfgValidator.check(cfg);
      if (!problems.isEmpty()) {
        throw new IllegalStateException(
            String.format(
                "%s: invalid graph for %s:\n  %s\n%s",
                position, handle, Joiner.on("\n  ").join(problems), cfg));
      }
    }
    logger.at(verbose ? Level.INFO : Level.FINE).log("Built %s:\n%s", handle, cfg);
    if (!auxiliary.isEmpty()) {
      logger.atFinest().log(
          "%s recorded %s:\n%s",
          handle,
          auxiliary.size(),
          lazy(() -> Joiner.on("\n").join(auxiliary)));
    }
    return new DefinedFunction(cfg, auxiliary);
  }
}
