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

import exm.calor.diagnostics.DiagnosticCode;

/**
 * Operations that must not receive untrusted data
 */
public enum TaintSinkKind {
  SQL_QUERY(DiagnosticCode.SQL_INJECTION, "Potential SQL injection",
            "SQL query"),
  COMMAND_EXECUTION(DiagnosticCode.COMMAND_INJECTION,
            "Potential command injection", "command execution"),
  FILE_PATH(DiagnosticCode.PATH_TRAVERSAL, "Potential path traversal",
            "file path"),
  HTML_OUTPUT(DiagnosticCode.CROSS_SITE_SCRIPTING, "Potential XSS",
            "HTML output");

  private final DiagnosticCode code;
  private final String problem;
  private final String description;

  private TaintSinkKind(DiagnosticCode code, String problem,
                        String description) {
    this.code = code;
    this.problem = problem;
    this.description = description;
  }

  public DiagnosticCode code() {
    return code;
  }

  /**
   * @return e.g. "Potential SQL injection: tainted data from user input
   *    flows to SQL query"
   */
  public String message(TaintSource source) {
    return problem + ": tainted data from " + source.description() +
           " flows to " + description;
  }
}
