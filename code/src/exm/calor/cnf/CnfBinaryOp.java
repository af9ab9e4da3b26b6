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

import exm.calor.ast.BinaryOperator;
import exm.calor.common.exceptions.CalorRuntimeError;

/**
 * Binary operators that survive lowering.  Logical AND/OR do not appear
 * in the normal form: they become branches.
 */
public enum CnfBinaryOp {
  ADD("+"),
  SUBTRACT("-"),
  MULTIPLY("*"),
  DIVIDE("/"),
  MODULO("%"),
  POWER("**"),
  EQUAL("=="),
  NOT_EQUAL("!="),
  LESS_THAN("<"),
  LESS_OR_EQUAL("<="),
  GREATER_THAN(">"),
  GREATER_OR_EQUAL(">="),
  BITWISE_AND("&"),
  BITWISE_OR("|"),
  BITWISE_XOR("^"),
  LEFT_SHIFT("<<"),
  RIGHT_SHIFT(">>");

  private final String symbol;

  private CnfBinaryOp(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() {
    return symbol;
  }

  public static CnfBinaryOp fromSource(BinaryOperator op) {
    switch (op) {
      case ADD: return ADD;
      case SUBTRACT: return SUBTRACT;
      case MULTIPLY: return MULTIPLY;
      case DIVIDE: return DIVIDE;
      case MODULO: return MODULO;
      case POWER: return POWER;
      case EQUAL: return EQUAL;
      case NOT_EQUAL: return NOT_EQUAL;
      case LESS_THAN: return LESS_THAN;
      case LESS_OR_EQUAL: return LESS_OR_EQUAL;
      case GREATER_THAN: return GREATER_THAN;
      case GREATER_OR_EQUAL: return GREATER_OR_EQUAL;
      case BITWISE_AND: return BITWISE_AND;
      case BITWISE_OR: return BITWISE_OR;
      case BITWISE_XOR: return BITWISE_XOR;
      case LEFT_SHIFT: return LEFT_SHIFT;
      case RIGHT_SHIFT: return RIGHT_SHIFT;
      default:
        throw new CalorRuntimeError("No normal form operator for " + op);
    }
  }
}
