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

package org.blockgen.util;

import com.google.common.collect.Streams;
import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;
import java.util.stream.Collectors;

/** Static-only class with methods for building and escaping strings. */
public class StringUtil {

  private StringUtil() {}

  /**
   * Constructs a string by calling {@code String.valueOf()} on each element, separating them with
   * {@code ", "}, and adding the given prefix and suffix.
   */
  public static String joinElements(String prefix, String suffix, Iterable<?> elements) {
    return Streams.stream(elements)
        .map(String::valueOf)
        .collect(Collectors.joining(", ", prefix, suffix));
  }

  private static final Escaper ESCAPER =
      Escapers.builder()
          .addEscape('"', "\\\"")
          .addEscape('\\', "\\\\")
          .addEscape('\b', "\\b")
          .addEscape('\t', "\\t")
          .addEscape('\n', "\\n")
          .addEscape('\f', "\\f")
          .addEscape('\r', "\\r")
          .build();

  /** Given a string, returns an equivalent quoted string literal. */
  public static String escape(String s) {
    if (s == null) {
      return "null";
    }
    return "\"" + ESCAPER.escape(s) + "\"";
  }
}
