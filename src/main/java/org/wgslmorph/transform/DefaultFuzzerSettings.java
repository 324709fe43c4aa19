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

import com.google.common.hash.Hashing;
import java.util.Random;

/**
 * {@link FuzzerSettings} backed by a {@link Random}, with every weight and probability at its
 * default. An instance owns the id counter, so a single instance should be used for a whole
 * pipeline run and not shared between runs.
 */
public class DefaultFuzzerSettings implements FuzzerSettings {

  private final Random generator;
  private int nextId = 1;

  public DefaultFuzzerSettings(Random generator) {
    this.generator = generator;
  }

  /**
   * Seeds the generator with a hash of {@code seed}. {@link Random} alone draws the same first
   * small values for neighbouring seeds, so a sweep over seeds would explore little.
   */
  public DefaultFuzzerSettings(long seed) {
    this(new Random(Hashing.murmur3_128().hashLong(seed).asLong()));
  }

  @Override
  public int getUniqueId() {
    return nextId++;
  }

  @Override
  public int randomInt(int limit) {
    return generator.nextInt(limit);
  }

  @Override
  public double randomDouble() {
    return generator.nextDouble();
  }

  @Override
  public boolean randomBool() {
    return generator.nextBoolean();
  }
}
