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

/**
 * The result of {@link CfgBuilder#defineFunction}: the function's graph, and any graphs that were
 * recorded (with {@link Generator#recordCfg}) while building it, in the order they were recorded.
 */
public record DefinedFunction(Cfg cfg, ImmutableList<Cfg> auxiliaryCfgs) {}
