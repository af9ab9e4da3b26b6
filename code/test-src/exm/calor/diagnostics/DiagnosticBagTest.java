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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;

import exm.calor.ast.SourceSpan;

public class DiagnosticBagTest {

  private static final SourceSpan SPAN = new SourceSpan("main.calr", 3, 7);

  @Test
  public void testOrderAndCounts() {
    DiagnosticBag bag = new DiagnosticBag();
    bag.reportWarning(SPAN, DiagnosticCode.DEAD_STORE, "first");
    bag.reportInfo(SPAN, DiagnosticCode.DIVISION_BY_ZERO, "second");
    assertFalse(bag.hasErrors());
    bag.reportError(SPAN, DiagnosticCode.DIVISION_BY_ZERO, "third");
    assertTrue(bag.hasErrors());

    assertEquals(3, bag.size());
    assertEquals(2, bag.count(DiagnosticCode.DIVISION_BY_ZERO));
    List<Diagnostic> divs = bag.withCode(DiagnosticCode.DIVISION_BY_ZERO);
    assertEquals("second", divs.get(0).getMessage());
    assertEquals(Severity.ERROR, divs.get(1).getSeverity());
    assertEquals("first", bag.getDiagnostics().get(0).getMessage());
  }

  @Test
  public void testSince() {
    DiagnosticBag bag = new DiagnosticBag();
    bag.reportWarning(SPAN, DiagnosticCode.DEAD_STORE, "old");
    int mark = bag.size();
    bag.reportWarning(SPAN, DiagnosticCode.DEAD_STORE, "new");
    List<Diagnostic> added = bag.since(mark);
    assertEquals(1, added.size());
    assertEquals("new", added.get(0).getMessage());
    assertEquals(0, bag.since(10).size());
  }

  @Test(expected=UnsupportedOperationException.class)
  public void testSnapshotIsReadOnly() {
    DiagnosticBag bag = new DiagnosticBag();
    bag.getDiagnostics().add(new Diagnostic(DiagnosticCode.DEAD_STORE, "x",
                                            SPAN, Severity.WARNING));
  }

  @Test
  public void testFormat() {
    Diagnostic d = new Diagnostic(DiagnosticCode.DEAD_STORE,
        "Value assigned to 'x' is never read", SPAN, Severity.WARNING);
    assertEquals("main.calr(3,7): warning Calor0902: " +
                 "Value assigned to 'x' is never read", d.toString());
    assertFalse(d.isError());
    // Missing span is replaced
    assertEquals(SourceSpan.UNKNOWN, new Diagnostic(DiagnosticCode.DEAD_STORE,
        "x", null, Severity.INFO).getSpan());
  }
}
