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
package exm.calor.cnf;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.calor.cnf.CnfStatement.Assign;
import exm.calor.cnf.CnfStatement.Branch;
import exm.calor.cnf.CnfStatement.Goto;
import exm.calor.cnf.CnfStatement.Label;
import exm.calor.cnf.CnfStatement.Return;
import exm.calor.cnf.CnfStatement.Throw;
import exm.calor.cnf.CnfTree.Function;
import exm.calor.cnf.CnfTree.Module;
import exm.calor.common.exceptions.CalorRuntimeError;

/**
 * Perform some sanity checks on normal form:
 * - Labels are unique within each function
 * - Every branch/goto target is a label of the same function
 * - Every label is the target of some branch/goto
 * - No compound expression is nested inside another
 */
public class CnfValidator {

  public static void validate(Logger logger, Module module) {
    for (Function fn: module.functions()) {
      validate(logger, fn);
    }
  }

  public static void validate(Logger logger, Function fn) {
    List<CnfStatement> stmts = fn.allStatements();
    checkLabels(fn, stmts);
    checkThreeAddress(fn, stmts);
    if (logger.isTraceEnabled()) {
      logger.trace("Validated " + fn.name() + ": " + stmts.size() +
                   " statements");
    }
  }

  private static void checkLabels(Function fn, List<CnfStatement> stmts) {
    Set<String> defined = new HashSet<String>();
    Set<String> referenced = new HashSet<String>();
    for (CnfStatement stmt: stmts) {
      switch (stmt.type()) {
        case LABEL: {
          String name = ((Label) stmt).name();
          if (!defined.add(name)) {
            throw new CalorRuntimeError("Duplicate label " + name + " in " +
                                        fn.name());
          }
          break;
        }
        case BRANCH: {
          Branch b = (Branch) stmt;
          referenced.add(b.trueLabel());
          referenced.add(b.falseLabel());
          break;
        }
        case GOTO:
          referenced.add(((Goto) stmt).label());
          break;
        default:
          break;
      }
    }

    for (String target: referenced) {
      if (!defined.contains(target)) {
        throw new CalorRuntimeError("Jump to undefined label " + target +
                                    " in " + fn.name());
      }
    }
    for (String label: defined) {
      if (!referenced.contains(label)) {
        throw new CalorRuntimeError("Label " + label + " never referenced in "
                                    + fn.name());
      }
    }
  }

  private static void checkThreeAddress(Function fn,
                                        List<CnfStatement> stmts) {
    for (CnfStatement stmt: stmts) {
      switch (stmt.type()) {
        case ASSIGN: {
          CnfExpression value = ((Assign) stmt).value();
          for (CnfExpression operand: value.getOperands()) {
            checkAtomic(fn, stmt, operand);
          }
          break;
        }
        case BRANCH:
          checkAtomic(fn, stmt, ((Branch) stmt).condition());
          break;
        case RETURN: {
          CnfExpression value = ((Return) stmt).value();
          if (value != null) {
            checkAtomic(fn, stmt, value);
          }
          break;
        }
        case THROW:
          checkAtomic(fn, stmt, ((Throw) stmt).value());
          break;
        default:
          break;
      }
    }
  }

  private static void checkAtomic(Function fn, CnfStatement stmt,
                                  CnfExpression expr) {
    if (!expr.isAtomic()) {
      throw new CalorRuntimeError("Non-atomic expression " + expr + " in " +
                                  "statement '" + stmt + "' of " + fn.name());
    }
  }
}
