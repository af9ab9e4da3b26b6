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
package exm.calor.contracts;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.calor.ast.Expression;
import exm.calor.ast.Expression.Binary;
import exm.calor.ast.Expression.FieldAccess;
import exm.calor.ast.Expression.FieldInit;
import exm.calor.ast.Expression.Quantifier;
import exm.calor.ast.Expression.QuantifierVariable;
import exm.calor.ast.Expression.RecordCreation;
import exm.calor.ast.Expression.Unary;
import exm.calor.ast.Expression.Wrapper;
import exm.calor.ast.SyntaxTree;
import exm.calor.ast.SyntaxTree.Contract;
import exm.calor.ast.SyntaxTree.Ensures;
import exm.calor.ast.SyntaxTree.Parameter;
import exm.calor.ast.SyntaxTree.Requires;
import exm.calor.ast.UnaryOperator;
import exm.calor.cnf.SemanticType;
import exm.calor.common.Logging;
import exm.calor.diagnostics.DiagnosticBag;
import exm.calor.diagnostics.DiagnosticCode;

/**
 * Static checks on requires/ensures clauses.  Runs before binding, so the
 * only names it knows are the function's parameters and, in
 * postconditions of functions with an output, {@code result}.
 *
 * Problems are reported to the diagnostic bag; nothing is thrown.
 */
public class ContractVerifier {

  public static final String RESULT_NAME = "result";

  private static final Set<String> INTEGER_TYPE_NAMES = new HashSet<String>(
      Arrays.asList("INT", "I8", "I16", "I32", "I64",
                    "U8", "U16", "U32", "U64", "LONG", "SHORT", "BYTE",
                    "UINT", "ULONG", "USHORT", "SBYTE"));

  private final DiagnosticBag diagnostics;
  private final Logger logger;

  public ContractVerifier(DiagnosticBag diagnostics, Logger logger) {
    this.diagnostics = diagnostics;
    this.logger = logger;
  }

  public ContractVerifier(DiagnosticBag diagnostics) {
    this(diagnostics, Logging.getCalorLogger());
  }

  public void verify(SyntaxTree.Module module) {
    for (SyntaxTree.Function f: module.functions()) {
      verifyFunction(f);
    }
  }

  public void verifyFunction(SyntaxTree.Function function) {
    if (logger.isTraceEnabled()) {
      logger.trace("Checking contracts of " + function.name());
    }
    Set<String> params = new HashSet<String>();
    for (Parameter p: function.parameters()) {
      params.add(p.name());
    }

    for (Requires pre: function.preconditions()) {
      verifyPrecondition(pre, params);
    }

    Set<String> postNames = new HashSet<String>(params);
    if (function.hasOutput()) {
      postNames.add(RESULT_NAME);
    }
    for (Ensures post: function.postconditions()) {
      verifyPostcondition(post, postNames, function.hasOutput());
    }
  }

  private void verifyPrecondition(Requires pre, Set<String> params) {
    checkBoolean(pre, "Precondition");
    for (String name: collectReferences(pre.condition())) {
      if (!params.contains(name)) {
        diagnostics.reportError(pre.span(),
            DiagnosticCode.UNDEFINED_REFERENCE,
            "Precondition can only reference parameters. " +
            "Unknown identifier: '" + name + "'");
      }
    }
    checkQuantifiers(pre.condition(), 0);
  }

  private void verifyPostcondition(Ensures post, Set<String> allowed,
                                   boolean hasOutput) {
    checkBoolean(post, "Postcondition");
    for (String name: collectReferences(post.condition())) {
      if (allowed.contains(name)) {
        continue;
      }
      if (name.equals(RESULT_NAME) && !hasOutput) {
        diagnostics.reportError(post.span(),
            DiagnosticCode.INVALID_REFERENCE,
            "Cannot reference 'result' in postcondition of void function");
      } else {
        diagnostics.reportError(post.span(),
            DiagnosticCode.UNDEFINED_REFERENCE,
            "Postcondition can only reference parameters and 'result'. " +
            "Unknown identifier: '" + name + "'");
      }
    }
    checkQuantifiers(post.condition(), 0);
  }

  private void checkBoolean(Contract contract, String what) {
    SemanticType type = inferType(contract.condition());
    if (type != null && type != SemanticType.BOOL) {
      diagnostics.reportError(contract.span(), DiagnosticCode.TYPE_MISMATCH,
          what + " must be a boolean expression, got " + type);
    }
  }

  /**
   * Structural type inference for contract conditions.
   * @return the type, or null if it cannot be known before binding
   */
  static SemanticType inferType(Expression e) {
    switch (e.kind()) {
      case INT_LITERAL:
        return SemanticType.INT;
      case FLOAT_LITERAL:
        return SemanticType.FLOAT;
      case BOOL_LITERAL:
        return SemanticType.BOOL;
      case STRING_LITERAL:
        return SemanticType.STRING;
      case BINARY: {
        Binary b = (Binary) e;
        if (b.op().isBoolean()) {
          return SemanticType.BOOL;
        }
        return inferType(b.left());
      }
      case UNARY: {
        Unary u = (Unary) e;
        if (u.op() == UnaryOperator.NOT) {
          return SemanticType.BOOL;
        }
        return inferType(u.operand());
      }
      case IMPLICATION:
      case FORALL:
      case EXISTS:
        return SemanticType.BOOL;
      default:
        return null;
    }
  }

  /**
   * Names referenced by a contract condition, in order of first use.
   * Only binary operations, option/result wrappers, field access targets
   * and record field values are searched.
   */
  static Set<String> collectReferences(Expression e) {
    Set<String> refs = new LinkedHashSet<String>();
    collectReferences(e, refs);
    return refs;
  }

  private static void collectReferences(Expression e, Set<String> refs) {
    switch (e.kind()) {
      case REFERENCE:
        refs.add(((Expression.Reference) e).name());
        break;
      case BINARY: {
        Binary b = (Binary) e;
        collectReferences(b.left(), refs);
        collectReferences(b.right(), refs);
        break;
      }
      case SOME:
      case OK:
      case ERR:
        collectReferences(((Wrapper) e).value(), refs);
        break;
      case FIELD_ACCESS:
        collectReferences(((FieldAccess) e).target(), refs);
        break;
      case RECORD_CREATION:
        for (FieldInit field: ((RecordCreation) e).fields()) {
          collectReferences(field.value, refs);
        }
        break;
      default:
        // Other shapes contribute no references
        break;
    }
  }

  /**
   * Flag quantifiers over non-integer domains and nested quantifiers,
   * which are expensive to verify.
   * @param depth bound variables of enclosing quantifiers; each bound
   *        variable adds one level, so forall (i, j) is already nested
   */
  private void checkQuantifiers(Expression e, int depth) {
    List<Expression> children = new ArrayList<Expression>();
    switch (e.kind()) {
      case FORALL:
      case EXISTS: {
        Quantifier q = (Quantifier) e;
        for (QuantifierVariable v: q.boundVariables()) {
          if (v.typeName == null ||
              !INTEGER_TYPE_NAMES.contains(v.typeName.trim().toUpperCase())) {
            diagnostics.reportWarning(e.span(),
                DiagnosticCode.QUANTIFIER_NON_INTEGER_TYPE,
                "Quantifier variable '" + v.name + "' has non-integer type '"
                + v.typeName + "'; only integer ranges can be verified");
          }
        }
        int nested = depth + q.boundVariables().size();
        if (nested > 1) {
          diagnostics.reportInfo(e.span(),
              DiagnosticCode.QUANTIFIER_NESTED_COMPLEXITY,
              "Nested quantifier with " + nested + " bound variables may " +
              "result in O(n^" + nested + ") runtime checks");
        }
        checkQuantifiers(q.body(), nested);
        return;
      }
      case BINARY:
        children.add(((Binary) e).left());
        children.add(((Binary) e).right());
        break;
      case UNARY:
        children.add(((Unary) e).operand());
        break;
      case IMPLICATION:
        children.add(((Expression.Implication) e).antecedent());
        children.add(((Expression.Implication) e).consequent());
        break;
      case CONDITIONAL: {
        Expression.Conditional c = (Expression.Conditional) e;
        children.add(c.condition());
        children.add(c.whenTrue());
        children.add(c.whenFalse());
        break;
      }
      default:
        break;
    }
    for (Expression child: children) {
      checkQuantifiers(child, depth);
    }
  }
}
