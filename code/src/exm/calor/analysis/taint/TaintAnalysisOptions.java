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

/**
 * Source kinds tracked and sink kinds detected.  Immutable.
 */
public class TaintAnalysisOptions {
  public static final TaintAnalysisOptions DEFAULT =
      new TaintAnalysisOptions(true, true, true, true, true, true, true, true);

  private final boolean trackUserInput;
  private final boolean trackFileReads;
  private final boolean trackNetworkInput;
  private final boolean trackEnvironment;
  private final boolean detectSqlInjection;
  private final boolean detectCommandInjection;
  private final boolean detectPathTraversal;
  private final boolean detectXss;

  public TaintAnalysisOptions(boolean trackUserInput, boolean trackFileReads,
      boolean trackNetworkInput, boolean trackEnvironment,
      boolean detectSqlInjection, boolean detectCommandInjection,
      boolean detectPathTraversal, boolean detectXss) {
    this.trackUserInput = trackUserInput;
    this.trackFileReads = trackFileReads;
    this.trackNetworkInput = trackNetworkInput;
    this.trackEnvironment = trackEnvironment;
    this.detectSqlInjection = detectSqlInjection;
    this.detectCommandInjection = detectCommandInjection;
    this.detectPathTraversal = detectPathTraversal;
    this.detectXss = detectXss;
  }

  public boolean isTracked(TaintSource source) {
    switch (source) {
      case USER_INPUT:
        return trackUserInput;
      case FILE_READ:
        return trackFileReads;
      case NETWORK_INPUT:
        return trackNetworkInput;
      case ENVIRONMENT:
        return trackEnvironment;
      default:
        return true;
    }
  }

  public boolean isDetected(TaintSinkKind sink) {
    switch (sink) {
      case SQL_QUERY:
        return detectSqlInjection;
      case COMMAND_EXECUTION:
        return detectCommandInjection;
      case FILE_PATH:
        return detectPathTraversal;
      case HTML_OUTPUT:
        return detectXss;
      default:
        return true;
    }
  }
}
