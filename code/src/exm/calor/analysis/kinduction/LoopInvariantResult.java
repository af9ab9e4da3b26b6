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
 * Outcome of invariant synthesis for one loop
 */
public class LoopInvariantResult {

  public static enum Outcome {
    SYNTHESIZED, FAILED, UNSUPPORTED;
  }

  private final Outcome outcome;
  private final InvariantCandidate invariant;
  private final KInductionResult proof;
  private final String message;

  private LoopInvariantResult(Outcome outcome, InvariantCandidate invariant,
                              KInductionResult proof, String message) {
    this.outcome = outcome;
    this.invariant = invariant;
    this.proof = proof;
    this.message = message;
  }

  public static LoopInvariantResult synthesized(KInductionResult proof) {
    InvariantCandidate inv = proof.getInvariant();
    return new LoopInvariantResult(Outcome.SYNTHESIZED, inv, proof,
              "Invariant synthesized and proven: " + inv.getText());
  }

  public static LoopInvariantResult failed(String message) {
    return new LoopInvariantResult(Outcome.FAILED, null, null, message);
  }

  public static LoopInvariantResult unsupported(String message) {
    return new LoopInvariantResult(Outcome.UNSUPPORTED, null, null, message);
  }

  public Outcome getOutcome() {
    return outcome;
  }

  public boolean isSuccess() {
    return outcome == Outcome.SYNTHESIZED;
  }

  public InvariantCandidate getInvariant() {
    return invariant;
  }

  public KInductionResult getProof() {
    return proof;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public String toString() {
    return outcome + ": " + message;
  }
}
