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
package exm.calor.binding;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.calor.ast.BinaryOperator;
import exm.calor.ast.SourceSpan;
import exm.calor.ast.UnaryOperator;

/**
 * Expressions after name resolution.  Every expression knows the name of
 * its type as computed by the binder.
 */
public abstract class BoundExpression {

  public static enum BoundExpressionKind {
    VARIABLE,
    INT_LITERAL,
    FLOAT_LITERAL,
    BOOL_LITERAL,
    STRING_LITERAL,
    BINARY,
    UNARY,
    CALL,
  }

  public final BoundExpressionKind kind;
  private final SourceSpan span;

  protected BoundExpression(BoundExpressionKind kind, SourceSpan span) {
    this.kind = kind;
    this.span = span;
  }

  public BoundExpressionKind kind() {
    return kind;
  }

  public SourceSpan span() {
    return span;
  }

  public abstract String typeName();

  public static class Variable extends BoundExpression {
    private final VariableSymbol variable;

    public Variable(SourceSpan span, VariableSymbol variable) {
      super(BoundExpressionKind.VARIABLE, span);
      this.variable = variable;
    }

    public VariableSymbol variable() {
      return variable;
    }

    public String name() {
      return variable.getName();
    }

    @Override
    public String typeName() {
      return variable.getTypeName();
    }

    @Override
    public String toString() {
      return variable.getName();
    }
  }

  public static class IntLiteral extends BoundExpression {
    private final long value;

    public IntLiteral(SourceSpan span, long value) {
      super(BoundExpressionKind.INT_LITERAL, span);
      this.value = value;
    }

    public long value() {
      return value;
    }

    @Override
    public String typeName() {
      return "INT";
    }

    @Override
    public String toString() {
      return Long.toString(value);
    }
  }

  public static class FloatLiteral extends BoundExpression {
    private final double value;

    public FloatLiteral(SourceSpan span, double value) {
      super(BoundExpressionKind.FLOAT_LITERAL, span);
      this.value = value;
    }

    public double value() {
      return value;
    }

    @Override
    public String typeName() {
      return "FLOAT";
    }

    @Override
    public String toString() {
      return Double.toString(value);
    }
  }

  public static class BoolLiteral extends BoundExpression {
    private final boolean value;

    public BoolLiteral(SourceSpan span, boolean value) {
      super(BoundExpressionKind.BOOL_LITERAL, span);
      this.value = value;
    }

    public boolean value() {
      return value;
    }

    @Override
    public String typeName() {
      return "BOOL";
    }

    @Override
    public String toString() {
      return Boolean.toString(value);
    }
  }

  public static class StringLiteral extends BoundExpression {
    private final String value;

    public StringLiteral(SourceSpan span, String value) {
      super(BoundExpressionKind.STRING_LITERAL, span);
      this.value = value;
    }

    public String value() {
      return value;
    }

    @Override
    public String typeName() {
      return "STRING";
    }

    @Override
    public String toString() {
      return "\"" + value + "\"";
    }
  }

  public static class Binary extends BoundExpression {
    private final BinaryOperator op;
    private final BoundExpression left;
    private final BoundExpression right;
    private final String typeName;

    public Binary(SourceSpan span, BinaryOperator op, BoundExpression left,
                  BoundExpression right, String typeName) {
      super(BoundExpressionKind.BINARY, span);
      this.op = op;
      this.left = left;
      this.right = right;
      this.typeName = typeName;
    }

    public BinaryOperator op() {
      return op;
    }

    public BoundExpression left() {
      return left;
    }

    public BoundExpression right() {
      return right;
    }

    @Override
    public String typeName() {
      return typeName;
    }

    @Override
    public String toString() {
      return "(" + left + " " + op.symbol() + " " + right + ")";
    }
  }

  public static class Unary extends BoundExpression {
    private final UnaryOperator op;
    private final BoundExpression operand;
    private final String typeName;

    public Unary(SourceSpan span, UnaryOperator op, BoundExpression operand,
                 String typeName) {
      super(BoundExpressionKind.UNARY, span);
      this.op = op;
      this.operand = operand;
      this.typeName = typeName;
    }

    public UnaryOperator op() {
      return op;
    }

    public BoundExpression operand() {
      return operand;
    }

    @Override
    public String typeName() {
      return typeName;
    }

    @Override
    public String toString() {
      return op.symbol() + operand;
    }
  }

  public static class Call extends BoundExpression {
    private final String target;
    private final List<BoundExpression> args;
    private final String typeName;

    public Call(SourceSpan span, String target, List<BoundExpression> args,
                String typeName) {
      super(BoundExpressionKind.CALL, span);
      this.target = target;
      this.args = Collections.unmodifiableList(
                            new ArrayList<BoundExpression>(args));
      this.typeName = typeName;
    }

    public String target() {
      return target;
    }

    public List<BoundExpression> args() {
      return args;
    }

    @Override
    public String typeName() {
      return typeName;
    }

    @Override
    public String toString() {
      return target + "(" + StringUtils.join(args, ", ") + ")";
    }
  }
}
