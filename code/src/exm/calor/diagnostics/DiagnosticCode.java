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

/**
 * Stable diagnostic identifiers.  The id strings are part of the
 * tool output and must not change.
 */
public enum DiagnosticCode {
  // Binding and contracts
  UNDEFINED_REFERENCE("Calor0200"),
  DUPLICATE_DEFINITION("Calor0201"),
  TYPE_MISMATCH("Calor0202"),
  INVALID_REFERENCE("Calor0203"),
  QUANTIFIER_NON_INTEGER_TYPE("Calor0324"),
  QUANTIFIER_NESTED_COMPLEXITY("Calor0325"),

  // Dataflow
  UNINITIALIZED_VARIABLE("Calor0900"),
  DEAD_STORE("Calor0902"),

  // Bug patterns
  DIVISION_BY_ZERO("Calor0920"),
  INDEX_OUT_OF_BOUNDS("Calor0921"),
  NULL_DEREFERENCE("Calor0922"),
  INTEGER_OVERFLOW("Calor0923"),

  // Loop analysis
  LOOP_INVARIANT_SYNTHESIZED("Calor0950"),
  LOOP_INVARIANT_UNKNOWN("Calor0951"),
  POTENTIAL_INFINITE_LOOP("Calor0952"),

  // Security
  TAINTED_SINK("Calor0980"),
  SQL_INJECTION("Calor0981"),
  COMMAND_INJECTION("Calor0982"),
  PATH_TRAVERSAL("Calor0983"),
  CROSS_SITE_SCRIPTING("Calor0984");

  private final String id;

  private DiagnosticCode(String id) {
    this.id = id;
  }

  public String id() {
    return id;
  }
}
