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
package exm.calor.analysis;

/**
 * Counts of findings from one run of the verification pass
 */
public class VerificationResult {
  private final int functionsAnalyzed;
  private final int dataflowIssues;
  private final int bugPatternsFound;
  private final int taintVulnerabilities;
  private final int loopInvariantsSynthesized;
  private final long durationMillis;

  public VerificationResult(int functionsAnalyzed, int dataflowIssues,
      int bugPatternsFound, int taintVulnerabilities,
      int loopInvariantsSynthesized, long durationMillis) {
    this.functionsAnalyzed = functionsAnalyzed;
    this.dataflowIssues = dataflowIssues;
    this.bugPatternsFound = bugPatternsFound;
    this.taintVulnerabilities = taintVulnerabilities;
    this.loopInvariantsSynthesized = loopInvariantsSynthesized;
    this.durationMillis = durationMillis;
  }

  public int getFunctionsAnalyzed() {
    return functionsAnalyzed;
  }

  public int getDataflowIssues() {
    return dataflowIssues;
  }

  public int getBugPatternsFound() {
    return bugPatternsFound;
  }

  public int getTaintVulnerabilities() {
    return taintVulnerabilities;
  }

  public int getLoopInvariantsSynthesized() {
    return loopInvariantsSynthesized;
  }

  public long getDurationMillis() {
    return durationMillis;
  }

  @Override
  public String toString() {
    return functionsAnalyzed + " functions: " + dataflowIssues +
        " dataflow issues, " + bugPatternsFound + " bug patterns, " +
        taintVulnerabilities + " taint vulnerabilities, " +
        loopInvariantsSynthesized + " loop invariants (" + durationMillis +
        "ms)";
  }
}
