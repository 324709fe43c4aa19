/*
 * Copyright 2025 The WgslMorph Authors
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

package org.wgslmorph.transform;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Weighted random choice between alternatives. Alternatives are thunks, so only the chosen one is
 * built.
 */
public final class Choice {

  /** One alternative; a weight of zero excludes it. */
  public record Option<T>(int weight, Supplier<T> thunk) {}

  public static <T> Option<T> option(int weight, Supplier<T> thunk) {
    return new Option<>(weight, thunk);
  }

  /**
   * Picks one of {@code options} with probability proportional to its weight and returns the
   * result of its thunk.
   *
   * @throws IllegalArgumentException if every weight is zero
   */
  @SafeVarargs
  public static <T> T choose(FuzzerSettings settings, Option<T>... options) {
    return choose(settings, ImmutableList.copyOf(options));
  }

  public static <T> T choose(FuzzerSettings settings, List<Option<T>> options) {
    List<Supplier<T>> slots = new ArrayList<>();
    for (Option<T> option : options) {
      for (int i = 0; i < option.weight(); i++) {
        slots.add(option.thunk());
      }
    }
    return settings.randomElement(slots).get();
  }

  private Choice() {}
}
