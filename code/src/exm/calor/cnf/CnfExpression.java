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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.calor.common.exceptions.CalorRuntimeError;

/**
 * Normal form expression.  Every expression carries its semantic type.
 *
 * Literals and variable references are atomic; the other kinds only
 * appear as the right hand side of an assignment, with atomic operands.
 */
public class CnfExpression {

  public static enum ExprKind {
    LITERAL,
    VARIABLE_REF,
    BINARY_OP,
    UNARY_OP,
    CALL,
  }

  public final ExprKind kind;
  private final SemanticType type;

  /** Storage for expression, dependent on kind */
  private final Object literal;
  private final String name;
  private final CnfBinaryOp binaryOp;
  private final CnfUnaryOp unaryOp;
  private final List<CnfExpression> operands;

  /**
   * Private constructor so that it can only be built using static builder
   * methods (below)
   */
  private CnfExpression(ExprKind kind, SemanticType type, Object literal,
      String name, CnfBinaryOp binaryOp, CnfUnaryOp unaryOp,
      List<CnfExpression> operands) {
    this.kind = kind;
    this.type = type;
    this.literal = literal;
    this.name = name;
    this.binaryOp = binaryOp;
    this.unaryOp = unaryOp;
    this.operands = operands == null ? Collections.<CnfExpression>emptyList()
        : Collections.unmodifiableList(new ArrayList<CnfExpression>(operands));
  }

  public static CnfExpression createLiteral(Object value, SemanticType type) {
    return new CnfExpression(ExprKind.LITERAL, type, value, null, null, null,
                             null);
  }

  public static CnfExpression createIntLit(long v) {
    return createLiteral(v, SemanticType.INT);
  }

  public static CnfExpression createLongLit(long v) {
    return createLiteral(v, SemanticType.LONG);
  }

  public static CnfExpression createFloatLit(float v) {
    return createLiteral(v, SemanticType.FLOAT);
  }

  public static CnfExpression createDoubleLit(double v) {
    return createLiteral(v, SemanticType.DOUBLE);
  }

  public static CnfExpression createBoolLit(boolean v) {
    return createLiteral(v, SemanticType.BOOL);
  }

  public static CnfExpression createStringLit(String v) {
    assert(v != null);
    return createLiteral(v, SemanticType.STRING);
  }

  public static CnfExpression createVar(String name, SemanticType type) {
    assert(name != null);
    return new CnfExpression(ExprKind.VARIABLE_REF, type, null, name, null,
                             null, null);
  }

  public static CnfExpression createBinaryOp(CnfBinaryOp op,
        CnfExpression left, CnfExpression right, SemanticType type) {
    return new CnfExpression(ExprKind.BINARY_OP, type, null, null, op, null,
                             Arrays.asList(left, right));
  }

  public static CnfExpression createUnaryOp(CnfUnaryOp op,
        CnfExpression operand, SemanticType type) {
    return new CnfExpression(ExprKind.UNARY_OP, type, null, null, null, op,
                             Arrays.asList(operand));
  }

  public static CnfExpression createCall(String target,
        List<CnfExpression> args, SemanticType type) {
    return new CnfExpression(ExprKind.CALL, type, null, target, null, null,
                             args);
  }

  public ExprKind getKind() {
    return kind;
  }

  public SemanticType getType() {
    return type;
  }

  public boolean isAtomic() {
    return kind == ExprKind.LITERAL || kind == ExprKind.VARIABLE_REF;
  }

  public Object getLiteralValue() {
    if (kind == ExprKind.LITERAL) {
      return literal;
    } else {
      throw new CalorRuntimeError("getLiteralValue for non-literal " + kind);
    }
  }

  public String getVarName() {
    if (kind == ExprKind.VARIABLE_REF) {
      return name;
    } else {
      throw new CalorRuntimeError("getVarName for non-variable " + kind);
    }
  }

  public String getCallTarget() {
    if (kind == ExprKind.CALL) {
      return name;
    } else {
      throw new CalorRuntimeError("getCallTarget for non-call " + kind);
    }
  }

  public CnfBinaryOp getBinaryOp() {
    if (kind == ExprKind.BINARY_OP) {
      return binaryOp;
    } else {
      throw new CalorRuntimeError("getBinaryOp for " + kind);
    }
  }

  public CnfUnaryOp getUnaryOp() {
    if (kind == ExprKind.UNARY_OP) {
      return unaryOp;
    } else {
      throw new CalorRuntimeError("getUnaryOp for " + kind);
    }
  }

  public CnfExpression getLeft() {
    if (kind == ExprKind.BINARY_OP) {
      return operands.get(0);
    } else {
      throw new CalorRuntimeError("getLeft for " + kind);
    }
  }

  public CnfExpression getRight() {
    if (kind == ExprKind.BINARY_OP) {
      return operands.get(1);
    } else {
      throw new CalorRuntimeError("getRight for " + kind);
    }
  }

  public CnfExpression getOperand() {
    if (kind == ExprKind.UNARY_OP) {
      return operands.get(0);
    } else {
      throw new CalorRuntimeError("getOperand for " + kind);
    }
  }

  public List<CnfExpression> getArgs() {
    if (kind == ExprKind.CALL) {
      return operands;
    } else {
      throw new CalorRuntimeError("getArgs for " + kind);
    }
  }

  /**
   * @return direct sub-expressions (operands or call arguments)
   */
  public List<CnfExpression> getOperands() {
    return operands;
  }

  @Override
  public String toString() {
    switch (kind) {
      case LITERAL:
        if (type == SemanticType.STRING) {
          return "\"" + literal + "\"";
        } else if (type == SemanticType.LONG) {
          return literal + "L";
        }
        return String.valueOf(literal);
      case VARIABLE_REF:
        return name;
      case BINARY_OP:
        return getLeft() + " " + binaryOp.symbol() + " " + getRight();
      case UNARY_OP:
        return unaryOp.symbol() + getOperand();
      case CALL:
        return name + "(" + StringUtils.join(operands, ", ") + ")";
      default:
        throw new CalorRuntimeError("Unknown expression kind " + kind);
    }
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = kind.hashCode();
    result = prime * result + (type == null ? 0 : type.hashCode());
    result = prime * result + (literal == null ? 0 : literal.hashCode());
    result = prime * result + (name == null ? 0 : name.hashCode());
    result = prime * result + (binaryOp == null ? 0 : binaryOp.hashCode());
    result = prime * result + (unaryOp == null ? 0 : unaryOp.hashCode());
    result = prime * result + operands.hashCode();
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof CnfExpression)) {
      return false;
    }
    CnfExpression other = (CnfExpression) obj;
    return kind == other.kind && type == other.type &&
        (literal == null ? other.literal == null :
                           literal.equals(other.literal)) &&
        (name == null ? other.name == null : name.equals(other.name)) &&
        binaryOp == other.binaryOp && unaryOp == other.unaryOp &&
        operands.equals(other.operands);
  }
}
