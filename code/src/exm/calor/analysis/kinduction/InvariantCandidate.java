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

import exm.calor.solver.Formula;

/**
 * A candidate loop invariant: the formula given to the prover plus
 * the source-like text used in diagnostics.
 */
public class InvariantCandidate {
  private final String templateName;
  private final String text;
  private final Formula formula;

  public InvariantCandidate(String templateName, String text,
                            Formula formula) {
    this.templateName = templateName;
    this.text = text;
    this.formula = formula;
  }

  public String getTemplateName() {
    return templateName;
  }

  /** e.g. "0 <= i && i <= 10" */
  public String getText() {
    return text;
  }

  public Formula getFormula() {
    return formula;
  }

  @Override
  public String toString() {
    return templateName + ": " + text;
  }
}
