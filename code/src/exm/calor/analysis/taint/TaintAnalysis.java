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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;

import exm.calor.ast.SourceSpan;
import exm.calor.binding.BoundExpression;
import exm.calor.binding.BoundStatement;
import exm.calor.binding.BoundTree.BoundFunction;
import exm.calor.binding.VariableSymbol;
import exm.calor.common.Logging;
import exm.calor.diagnostics.DiagnosticBag;

/**
 * Tracks untrusted values from parameters and source calls through
 * bindings and assignments to sink calls.
 *
 * Flow-insensitive within a function: once tainted, a variable stays
 * tainted.  Loop bodies are revisited until no new taint appears.
 */
public class TaintAnalysis {

  private static final String[] USER_INPUT_PARAMS = {
    "input", "request", "query", "param", "arg", "user", "form"
  };
  private static final String[] FILE_PARAMS = { "file", "content" };
  private static final String[] ENV_PARAMS = { "env", "config" };

  private static final String[] USER_INPUT_CALLS = {
    "readline", "read_input", "getinput", "prompt", "request.get",
    "request.query", "request.param", "request.body"
  };
  private static final String[] FILE_CALLS = {
    "file.read", "read_file", "fs.read", "io.read"
  };
  private static final String[] NETWORK_CALLS = {
    "http.get", "fetch", "socket.read", "recv"
  };
  private static final String[] ENV_CALLS = {
    "env.get", "getenv", "environment.get"
  };

  private static final String[] SQL_SINKS = {
    "sql.execute", "sql.query", "db.execute", "db.query", "db.raw",
    "execute_sql"
  };
  private static final String[] COMMAND_SINKS = {
    "exec", "system", "shell", "spawn", "popen", "run_command"
  };
  private static final String[] PATH_SINKS = {
    "file.open", "file.read", "file.write", "file.delete", "fs.read",
    "fs.write", "path.join"
  };
  private static final String[] HTML_SINKS = {
    "html.write", "response.write", "innerhtml", "document.write"
  };

  private static final String[] SANITIZERS = {
    "escape", "sanitize", "encode", "quote", "parameterize"
  };

  private final TaintAnalysisOptions options;
  private final Logger logger;

  /** Per-function state, reset by analyze() */
  private SetMultimap<String, TaintLabel> tainted;
  private Set<TaintVulnerability> found;

  public TaintAnalysis(TaintAnalysisOptions options, Logger logger) {
    this.options = options;
    this.logger = logger;
  }

  public TaintAnalysis(TaintAnalysisOptions options) {
    this(options, Logging.getCalorLogger());
  }

  public TaintAnalysis() {
    this(TaintAnalysisOptions.DEFAULT);
  }

  /**
   * @return vulnerabilities in order found
   */
  public List<TaintVulnerability> analyze(BoundFunction function) {
    tainted = LinkedHashMultimap.create();
    found = new LinkedHashSet<TaintVulnerability>();
    try {
      for (VariableSymbol param: function.getSymbol().getParameters()) {
        TaintSource source = parameterSource(param.getName());
        if (source != null) {
          tainted.put(param.getName(),
                  new TaintLabel(source, param.getName(), function.getSpan()));
        }
      }
      analyzeStatements(function.getBody());
      if (logger.isTraceEnabled()) {
        logger.trace("Tainted variables in " + function.getName() + ": " +
                     tainted.keySet());
      }
      return new ArrayList<TaintVulnerability>(found);
    } finally {
      tainted = null;
      found = null;
    }
  }

  /**
   * Analyze and report each vulnerability as a warning
   * @return number of vulnerabilities
   */
  public int analyze(BoundFunction function, DiagnosticBag diagnostics) {
    List<TaintVulnerability> vulns = analyze(function);
    for (TaintVulnerability v: vulns) {
      diagnostics.report(v.getSinkLocation(), v.getCode(), v.getMessage(),
                         v.getSeverity());
    }
    return vulns.size();
  }

  private static boolean containsAny(String target, String[] patterns) {
    for (String p: patterns) {
      if (StringUtils.containsIgnoreCase(target, p)) {
        return true;
      }
    }
    return false;
  }

  private TaintSource tracked(TaintSource source) {
    return options.isTracked(source) ? source : null;
  }

  TaintSource parameterSource(String name) {
    if (containsAny(name, USER_INPUT_PARAMS)) {
      return tracked(TaintSource.USER_INPUT);
    } else if (containsAny(name, FILE_PARAMS) ||
               (StringUtils.containsIgnoreCase(name, "data") &&
                StringUtils.containsIgnoreCase(name, "read"))) {
      return tracked(TaintSource.FILE_READ);
    } else if (containsAny(name, ENV_PARAMS)) {
      return tracked(TaintSource.ENVIRONMENT);
    }
    return null;
  }

  TaintSource callSource(String target) {
    if (containsAny(target, USER_INPUT_CALLS)) {
      return tracked(TaintSource.USER_INPUT);
    } else if (containsAny(target, FILE_CALLS)) {
      return tracked(TaintSource.FILE_READ);
    } else if (containsAny(target, NETWORK_CALLS)) {
      return tracked(TaintSource.NETWORK_INPUT);
    } else if (containsAny(target, ENV_CALLS)) {
      return tracked(TaintSource.ENVIRONMENT);
    }
    return null;
  }

  TaintSinkKind sinkKind(String target) {
    TaintSinkKind kind = null;
    if (containsAny(target, SQL_SINKS)) {
      kind = TaintSinkKind.SQL_QUERY;
    } else if (containsAny(target, COMMAND_SINKS)) {
      kind = TaintSinkKind.COMMAND_EXECUTION;
    } else if (containsAny(target, PATH_SINKS)) {
      kind = TaintSinkKind.FILE_PATH;
    } else if (containsAny(target, HTML_SINKS)) {
      kind = TaintSinkKind.HTML_OUTPUT;
    }
    return kind != null && options.isDetected(kind) ? kind : null;
  }

  static boolean isSanitizer(String target) {
    return containsAny(target, SANITIZERS);
  }

  private void analyzeStatements(List<BoundStatement> stmts) {
    for (BoundStatement stmt: stmts) {
      analyzeStatement(stmt);
    }
  }

  private void analyzeStatement(BoundStatement stmt) {
    switch (stmt.kind()) {
      case BIND: {
        BoundStatement.Bind bind = (BoundStatement.Bind) stmt;
        if (bind.initializer() != null) {
          analyzeExpression(bind.initializer());
          tainted.putAll(bind.variable().getName(),
                         labels(bind.initializer()));
        }
        break;
      }
      case ASSIGN: {
        BoundStatement.Assign assign = (BoundStatement.Assign) stmt;
        analyzeExpression(assign.value());
        tainted.putAll(assign.variable().getName(), labels(assign.value()));
        break;
      }
      case CALL: {
        BoundStatement.Call call = (BoundStatement.Call) stmt;
        analyzeCall(call.target(), call.args(), call.span());
        break;
      }
      case RETURN: {
        BoundExpression value = ((BoundStatement.Return) stmt).value();
        if (value != null) {
          analyzeExpression(value);
        }
        break;
      }
      case IF: {
        BoundStatement.If ifStmt = (BoundStatement.If) stmt;
        analyzeExpression(ifStmt.condition());
        analyzeStatements(ifStmt.thenBody());
        for (BoundStatement.ElseIf elseIf: ifStmt.elseIfs()) {
          analyzeExpression(elseIf.condition);
          analyzeStatements(elseIf.body);
        }
        if (ifStmt.elseBody() != null) {
          analyzeStatements(ifStmt.elseBody());
        }
        break;
      }
      case WHILE: {
        BoundStatement.While w = (BoundStatement.While) stmt;
        analyzeExpression(w.condition());
        analyzeLoopBody(w.body());
        break;
      }
      case FOR: {
        BoundStatement.For f = (BoundStatement.For) stmt;
        analyzeExpression(f.from());
        analyzeExpression(f.to());
        if (f.step() != null) {
          analyzeExpression(f.step());
        }
        analyzeLoopBody(f.body());
        break;
      }
      default:
        break;
    }
  }

  /**
   * Taint from a later iteration can reach an earlier statement
   */
  private void analyzeLoopBody(List<BoundStatement> body) {
    int size;
    do {
      size = tainted.size();
      analyzeStatements(body);
    } while (tainted.size() != size);
  }

  private void analyzeExpression(BoundExpression expr) {
    switch (expr.kind()) {
      case CALL: {
        BoundExpression.Call call = (BoundExpression.Call) expr;
        analyzeCall(call.target(), call.args(), call.span());
        break;
      }
      case BINARY:
        analyzeExpression(((BoundExpression.Binary) expr).left());
        analyzeExpression(((BoundExpression.Binary) expr).right());
        break;
      case UNARY:
        analyzeExpression(((BoundExpression.Unary) expr).operand());
        break;
      default:
        break;
    }
  }

  private void analyzeCall(String target, List<BoundExpression> args,
                           SourceSpan span) {
    TaintSinkKind sink = sinkKind(target);
    if (sink != null) {
      for (BoundExpression arg: args) {
        String argName = arg.kind() ==
              BoundExpression.BoundExpressionKind.VARIABLE ?
              ((BoundExpression.Variable) arg).name() : "expression";
        for (TaintLabel label: labels(arg)) {
          found.add(new TaintVulnerability(sink, label, target, argName,
                                           span));
        }
      }
    }
    for (BoundExpression arg: args) {
      analyzeExpression(arg);
    }
  }

  /**
   * @return taint carried by the value of an expression
   */
  private Set<TaintLabel> labels(BoundExpression expr) {
    Set<TaintLabel> res = new LinkedHashSet<TaintLabel>();
    addLabels(expr, res);
    return res;
  }

  private void addLabels(BoundExpression expr, Set<TaintLabel> acc) {
    switch (expr.kind()) {
      case VARIABLE:
        acc.addAll(tainted.get(((BoundExpression.Variable) expr).name()));
        break;
      case BINARY:
        addLabels(((BoundExpression.Binary) expr).left(), acc);
        addLabels(((BoundExpression.Binary) expr).right(), acc);
        break;
      case UNARY:
        addLabels(((BoundExpression.Unary) expr).operand(), acc);
        break;
      case CALL: {
        BoundExpression.Call call = (BoundExpression.Call) expr;
        if (isSanitizer(call.target())) {
          break;
        }
        TaintSource source = callSource(call.target());
        if (source != null) {
          acc.add(new TaintLabel(source, call.target(), call.span()));
        }
        for (BoundExpression arg: call.args()) {
          addLabels(arg, acc);
        }
        break;
      }
      default:
        // Literals are trusted
        break;
    }
  }
}
