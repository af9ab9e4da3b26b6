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
 * Outcome of trying to prove one candidate invariant
 */
public class KInductionResult {
  private final KInductionStatus status;
  private final int k;
  private final InvariantCandidate invariant;
  private final String counterexample;
  private final long durationMillis;

  public KInductionResult(KInductionStatus status, int k,
        InvariantCandidate invariant, String counterexample,
        long durationMillis) {
    this.status = status;
    this.k = k;
    this.invariant = invariant;
    this.counterexample = counterexample;
    this.durationMillis = durationMillis;
  }

  public KInductionStatus getStatus() {
    return status;
  }

  public boolean isProven() {
    return status == KInductionStatus.PROVEN;
  }

  /** k at which the proof succeeded, or the last k tried */
  public int getK() {
    return k;
  }

  /** May be null */
  public InvariantCandidate getInvariant() {
    return invariant;
  }

  /** Null unless DISPROVEN */
  public String getCounterexample() {
    return counterexample;
  }

  public long getDurationMillis() {
    return durationMillis;
  }

  @Override
  public String toString() {
    String s = status + " k=" + k;
    if (invariant != null) {
      s += " " + invariant.getText();
    }
    if (counterexample != null) {
      s += " (" + counterexample + ")";
    }
    return s;
  }
}
