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

import exm.calor.ast.UnaryOperator;
import exm.calor.common.exceptions.CalorRuntimeError;

public enum CnfUnaryOp {
  NEGATE("-"),
  NOT("!"),
  BITWISE_NOT("~");

  private final String symbol;

  private CnfUnaryOp(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() {
    return symbol;
  }

  public static CnfUnaryOp fromSource(UnaryOperator op) {
    switch (op) {
      case NEGATE: return NEGATE;
      case NOT: return NOT;
      case BITWISE_NOT: return BITWISE_NOT;
      default:
        throw new CalorRuntimeError("No normal form operator for " + op);
    }
  }
}
