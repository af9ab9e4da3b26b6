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
package exm.calor.ast;

/**
 * Binary operators of the structured language.  AND and OR are the only
 * short-circuiting operators.
 */
public enum BinaryOperator {
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
  AND("&&"),
  OR("||"),
  BITWISE_AND("&"),
  BITWISE_OR("|"),
  BITWISE_XOR("^"),
  LEFT_SHIFT("<<"),
  RIGHT_SHIFT(">>");

  private final String symbol;

  private BinaryOperator(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() {
    return symbol;
  }

  public boolean isComparison() {
    switch (this) {
      case EQUAL:
      case NOT_EQUAL:
      case LESS_THAN:
      case LESS_OR_EQUAL:
      case GREATER_THAN:
      case GREATER_OR_EQUAL:
        return true;
      default:
        return false;
    }
  }

  public boolean isLogical() {
    return this == AND || this == OR;
  }

  /**
   * @return true if the operator yields a boolean regardless of operand
   *         types
   */
  public boolean isBoolean() {
    return isComparison() || isLogical();
  }
}
