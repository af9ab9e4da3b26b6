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

import static exm.calor.binding.BoundBuilders.*;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;

import exm.calor.ast.BinaryOperator;
import exm.calor.binding.BoundTree.BoundFunction;
import exm.calor.binding.VariableSymbol;
import exm.calor.diagnostics.Diagnostic;
import exm.calor.diagnostics.DiagnosticBag;
import exm.calor.diagnostics.DiagnosticCode;
import exm.calor.diagnostics.Severity;

public class TaintAnalysisTest {

  @Test
  public void testParameterToSqlSink() {
    VariableSymbol userInput = param("userInput", "STRING");
    VariableSymbol sqlText = local("sqlText", "STRING");
    BoundFunction f = function("lookup", params(userInput),
        bind(sqlText, bin(BinaryOperator.ADD, str("SELECT * FROM t WHERE id = "),
                          ref(userInput))),
        callStmt("sql.execute", ref(sqlText)));

    List<TaintVulnerability> vulns = new TaintAnalysis().analyze(f);
    assertEquals(1, vulns.size());
    TaintVulnerability v = vulns.get(0);
    assertEquals(TaintSinkKind.SQL_QUERY, v.getSink());
    assertEquals(TaintSource.USER_INPUT, v.getSource());
    assertEquals("userInput", v.getLabel().origin);
    assertEquals("sql.execute", v.getSinkTarget());
    assertEquals("sqlText", v.getSinkArgument());
    assertEquals(DiagnosticCode.SQL_INJECTION, v.getCode());
  }

  @Test
  public void testSanitizedValueIsTrusted() {
    VariableSymbol userInput = param("userInput", "STRING");
    VariableSymbol safe = local("safe", "STRING");
    BoundFunction f = function("lookup", params(userInput),
        bind(safe, call("sql.escape", ref(userInput))),
        callStmt("db.query", ref(safe)));
    assertTrue(new TaintAnalysis().analyze(f).isEmpty());
  }

  @Test
  public void testSourceCallToCommandSink() {
    VariableSymbol body = local("body", "STRING");
    BoundFunction f = function("deploy",
        bind(body, call("http.get", str("http://example.com/script"))),
        callStmt("os.exec", bin(BinaryOperator.ADD, str("sh -c "),
                                ref(body))));

    List<TaintVulnerability> vulns = new TaintAnalysis().analyze(f);
    assertEquals(1, vulns.size());
    assertEquals(TaintSinkKind.COMMAND_EXECUTION, vulns.get(0).getSink());
    assertEquals(TaintSource.NETWORK_INPUT, vulns.get(0).getSource());
    assertEquals("expression", vulns.get(0).getSinkArgument());
  }

  @Test
  public void testUntrustedParameterNames() {
    TaintAnalysis ta = new TaintAnalysis();
    assertEquals(TaintSource.USER_INPUT, ta.parameterSource("requestBody"));
    assertEquals(TaintSource.FILE_READ, ta.parameterSource("fileName"));
    assertEquals(TaintSource.ENVIRONMENT, ta.parameterSource("envHome"));
    assertNull(ta.parameterSource("count"));
    // "data" alone is not a source, only data that was read
    assertEquals(TaintSource.FILE_READ, ta.parameterSource("readData"));
    assertNull(ta.parameterSource("metadata"));
  }

  @Test
  public void testDisabledDetection() {
    TaintAnalysisOptions noSql = new TaintAnalysisOptions(true, true, true,
        true, false, true, true, true);
    VariableSymbol userInput = param("userInput", "STRING");
    BoundFunction f = function("lookup", params(userInput),
        callStmt("sql.execute", ref(userInput)));
    assertTrue(new TaintAnalysis(noSql).analyze(f).isEmpty());
    assertEquals(1, new TaintAnalysis().analyze(f).size());
  }

  @Test
  public void testUntrackedSource() {
    TaintAnalysisOptions noUser = new TaintAnalysisOptions(false, true, true,
        true, true, true, true, true);
    VariableSymbol userInput = param("userInput", "STRING");
    BoundFunction f = function("lookup", params(userInput),
        callStmt("sql.execute", ref(userInput)));
    assertTrue(new TaintAnalysis(noUser).analyze(f).isEmpty());
  }

  @Test
  public void testTaintCarriedAroundLoop() {
    VariableSymbol userInput = param("userInput", "STRING");
    VariableSymbol a = local("a", "STRING");
    VariableSymbol b = local("b", "STRING");
    VariableSymbol n = local("n");
    BoundFunction f = function("shuffle", params(userInput),
        bind(a, str("")),
        bind(b, str("")),
        bind(n, lit(0)),
        whileLoop(bin(BinaryOperator.LESS_THAN, ref(n), lit(3)),
            callStmt("db.execute", ref(a)),
            assign(a, ref(b)),
            assign(b, ref(userInput)),
            assign(n, bin(BinaryOperator.ADD, ref(n), lit(1)))));

    List<TaintVulnerability> vulns = new TaintAnalysis().analyze(f);
    assertEquals(1, vulns.size());
    assertEquals("a", vulns.get(0).getSinkArgument());
  }

  @Test
  public void testDiagnosticsReported() {
    VariableSymbol userInput = param("userInput", "STRING");
    BoundFunction f = function("render", params(userInput),
        callStmt("response.write", ref(userInput)),
        callStmt("response.write", call("html.encode", ref(userInput))));

    DiagnosticBag bag = new DiagnosticBag();
    assertEquals(1, new TaintAnalysis().analyze(f, bag));
    assertEquals(1, bag.size());
    Diagnostic d = bag.getDiagnostics().get(0);
    assertEquals(DiagnosticCode.CROSS_SITE_SCRIPTING, d.getCode());
    assertEquals(Severity.WARNING, d.getSeverity());
    assertEquals("Potential XSS: tainted data from user input flows to " +
                 "HTML output", d.getMessage());
  }
}
