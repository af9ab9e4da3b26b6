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

import exm.calor.ast.SourceSpan;

/**
 * A single message for the user.  Immutable.
 */
public class Diagnostic {
  private final DiagnosticCode code;
  private final String message;
  private final SourceSpan span;
  private final Severity severity;

  public Diagnostic(DiagnosticCode code, String message, SourceSpan span,
                    Severity severity) {
    this.code = code;
    this.message = message;
    this.span = span == null ? SourceSpan.UNKNOWN : span;
    this.severity = severity;
  }

  public DiagnosticCode getCode() {
    return code;
  }

  public String getMessage() {
    return message;
  }

  public SourceSpan getSpan() {
    return span;
  }

  public Severity getSeverity() {
    return severity;
  }

  public boolean isError() {
    return severity == Severity.ERROR;
  }

  @Override
  public String toString() {
    return span.getFile() + "(" + span.getLine() + "," + span.getColumn() +
           "): " + severity.label() + " " + code.id() + ": " + message;
  }
}
