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
package exm.calor.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import exm.calor.ast.SourceSpan;

/**
 * Append-only collection of diagnostics shared by all passes of a
 * compilation.  Appends may come from several threads.
 */
public class DiagnosticBag {
  private final List<Diagnostic> diagnostics =
                          new CopyOnWriteArrayList<Diagnostic>();

  public void add(Diagnostic diagnostic) {
    assert(diagnostic != null);
    diagnostics.add(diagnostic);
  }

  public void report(SourceSpan span, DiagnosticCode code, String message,
                     Severity severity) {
    add(new Diagnostic(code, message, span, severity));
  }

  public void reportError(SourceSpan span, DiagnosticCode code,
                          String message) {
    report(span, code, message, Severity.ERROR);
  }

  public void reportWarning(SourceSpan span, DiagnosticCode code,
                            String message) {
    report(span, code, message, Severity.WARNING);
  }

  public void reportInfo(SourceSpan span, DiagnosticCode code,
                         String message) {
    report(span, code, message, Severity.INFO);
  }

  public int size() {
    return diagnostics.size();
  }

  public boolean hasErrors() {
    for (Diagnostic d: diagnostics) {
      if (d.isError()) {
        return true;
      }
    }
    return false;
  }

  /**
   * @return number of diagnostics with the given code
   */
  public int count(DiagnosticCode code) {
    int n = 0;
    for (Diagnostic d: diagnostics) {
      if (d.getCode() == code) {
        n++;
      }
    }
    return n;
  }

  public List<Diagnostic> withCode(DiagnosticCode code) {
    List<Diagnostic> res = new ArrayList<Diagnostic>();
    for (Diagnostic d: diagnostics) {
      if (d.getCode() == code) {
        res.add(d);
      }
    }
    return res;
  }

  /**
   * @return snapshot of diagnostics in the order reported
   */
  public List<Diagnostic> getDiagnostics() {
    return Collections.unmodifiableList(
                              new ArrayList<Diagnostic>(diagnostics));
  }

  /**
   * @return diagnostics added since the bag had the given size
   */
  public List<Diagnostic> since(int mark) {
    List<Diagnostic> snapshot = getDiagnostics();
    return snapshot.subList(Math.min(mark, snapshot.size()), snapshot.size());
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Diagnostic d: diagnostics) {
      sb.append(d.toString()).append('\n');
    }
    return sb.toString();
  }
}
