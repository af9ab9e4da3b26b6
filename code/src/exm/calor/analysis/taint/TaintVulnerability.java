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
package exm.calor.analysis.taint;

import exm.calor.ast.SourceSpan;
import exm.calor.diagnostics.DiagnosticCode;
import exm.calor.diagnostics.Severity;

/**
 * Flow of a tainted value into a sink.
 */
public class TaintVulnerability {
  private final TaintSinkKind sink;
  private final TaintLabel label;
  private final String sinkTarget;
  private final String sinkArgument;
  private final SourceSpan sinkLocation;

  public TaintVulnerability(TaintSinkKind sink, TaintLabel label,
      String sinkTarget, String sinkArgument, SourceSpan sinkLocation) {
    this.sink = sink;
    this.label = label;
    this.sinkTarget = sinkTarget;
    this.sinkArgument = sinkArgument;
    this.sinkLocation = sinkLocation;
  }

  public TaintSinkKind getSink() {
    return sink;
  }

  public TaintSource getSource() {
    return label.source;
  }

  public TaintLabel getLabel() {
    return label;
  }

  /** Name of sink function called */
  public String getSinkTarget() {
    return sinkTarget;
  }

  /** Variable passed to sink, or "expression" */
  public String getSinkArgument() {
    return sinkArgument;
  }

  public SourceSpan getSinkLocation() {
    return sinkLocation;
  }

  public DiagnosticCode getCode() {
    return sink.code();
  }

  public String getMessage() {
    return sink.message(label.source);
  }

  public Severity getSeverity() {
    return Severity.WARNING;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof TaintVulnerability)) {
      return false;
    }
    TaintVulnerability other = (TaintVulnerability) o;
    return sink == other.sink && label.equals(other.label) &&
           sinkTarget.equals(other.sinkTarget) &&
           sinkArgument.equals(other.sinkArgument) &&
           sinkLocation == other.sinkLocation;
  }

  @Override
  public int hashCode() {
    int h = sink.hashCode();
    h = h * 31 + label.hashCode();
    h = h * 31 + sinkTarget.hashCode();
    return h * 31 + sinkArgument.hashCode();
  }

  @Override
  public String toString() {
    return getMessage() + " (" + label.origin + " -> " + sinkTarget + ")";
  }
}
