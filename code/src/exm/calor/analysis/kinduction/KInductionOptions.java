/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.calor.analysis.kinduction;

/**
 * Bounds on the k-induction search.  Immutable.
 */
public class KInductionOptions {
  public static final int DEFAULT_MAX_K = 10;
  public static final int DEFAULT_TIMEOUT_MS = 10000;

  public static final KInductionOptions DEFAULT = new KInductionOptions();

  private final int maxK;
  private final int timeoutMs;
  private final boolean useInvariantTemplates;

  /**
   * @param maxK largest k to try
   * @param timeoutMs solver timeout per query, also the wall-clock budget
   *        for proving one candidate
   * @param useInvariantTemplates if false, only the loop's own range
   *        is tried as a candidate
   */
  public KInductionOptions(int maxK, int timeoutMs,
                           boolean useInvariantTemplates) {
    this.maxK = maxK;
    this.timeoutMs = timeoutMs;
    this.useInvariantTemplates = useInvariantTemplates;
  }

  public KInductionOptions() {
    this(DEFAULT_MAX_K, DEFAULT_TIMEOUT_MS, true);
  }

  public KInductionOptions withTimeout(int newTimeoutMs) {
    return new KInductionOptions(maxK, newTimeoutMs, useInvariantTemplates);
  }

  public int maxK() {
    return maxK;
  }

  public int timeoutMs() {
    return timeoutMs;
  }

  public boolean useInvariantTemplates() {
    return useInvariantTemplates;
  }

  @Override
  public String toString() {
    return "maxK=" + maxK + " timeoutMs=" + timeoutMs +
           " templates=" + useInvariantTemplates;
  }
}
