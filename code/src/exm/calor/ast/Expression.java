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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Expressions of the structured tree.  Each concrete class is identified
 * by an {@link ExpressionKind}; consumers switch on the kind and cast.
 * Expressions are immutable.
 */
public abstract class Expression {

  public static enum ExpressionKind {
    INT_LITERAL,
    FLOAT_LITERAL,
    BOOL_LITERAL,
    STRING_LITERAL,
    REFERENCE,
    BINARY,
    UNARY,
    CALL,
    CONDITIONAL,
    SOME,
    NONE,
    OK,
    ERR,
    FIELD_ACCESS,
    RECORD_CREATION,
    ARRAY_ACCESS,
    FORALL,
    EXISTS,
    IMPLICATION,
  }

  public final ExpressionKind kind;
  private final SourceSpan span;

  protected Expression(ExpressionKind kind, SourceSpan span) {
    this.kind = kind;
    this.span = span;
  }

  public ExpressionKind kind() {
    return kind;
  }

  public SourceSpan span() {
    return span;
  }

  public static IntLiteral intLit(long value) {
    return new IntLiteral(SourceSpan.UNKNOWN, value);
  }

  public static FloatLiteral floatLit(double value) {
    return new FloatLiteral(SourceSpan.UNKNOWN, value);
  }

  public static BoolLiteral boolLit(boolean value) {
    return new BoolLiteral(SourceSpan.UNKNOWN, value);
  }

  public static StringLiteral stringLit(String value) {
    return new StringLiteral(SourceSpan.UNKNOWN, value);
  }

  public static Reference ref(String name) {
    return new Reference(SourceSpan.UNKNOWN, name);
  }

  public static Binary binary(BinaryOperator op, Expression left,
                              Expression right) {
    return new Binary(SourceSpan.UNKNOWN, op, left, right);
  }

  public static Unary unary(UnaryOperator op, Expression operand) {
    return new Unary(SourceSpan.UNKNOWN, op, operand);
  }

  public static Call call(String target, Expression ...args) {
    return new Call(SourceSpan.UNKNOWN, target, Arrays.asList(args));
  }

  public static class IntLiteral extends Expression {
    private final long value;

    public IntLiteral(SourceSpan span, long value) {
      super(ExpressionKind.INT_LITERAL, span);
      this.value = value;
    }

    public long value() {
      return value;
    }

    @Override
    public String toString() {
      return Long.toString(value);
    }
  }

  public static class FloatLiteral extends Expression {
    private final double value;

    public FloatLiteral(SourceSpan span, double value) {
      super(ExpressionKind.FLOAT_LITERAL, span);
      this.value = value;
    }

    public double value() {
      return value;
    }

    @Override
    public String toString() {
      return Double.toString(value);
    }
  }

  public static class BoolLiteral extends Expression {
    private final boolean value;

    public BoolLiteral(SourceSpan span, boolean value) {
      super(ExpressionKind.BOOL_LITERAL, span);
      this.value = value;
    }

    public boolean value() {
      return value;
    }

    @Override
    public String toString() {
      return Boolean.toString(value);
    }
  }

  public static class StringLiteral extends Expression {
    private final String value;

    public StringLiteral(SourceSpan span, String value) {
      super(ExpressionKind.STRING_LITERAL, span);
      this.value = value;
    }

    public String value() {
      return value;
    }

    @Override
    public String toString() {
      return "\"" + value + "\"";
    }
  }

  public static class Reference extends Expression {
    private final String name;

    public Reference(SourceSpan span, String name) {
      super(ExpressionKind.REFERENCE, span);
      this.name = name;
    }

    public String name() {
      return name;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  public static class Binary extends Expression {
    private final BinaryOperator op;
    private final Expression left;
    private final Expression right;

    public Binary(SourceSpan span, BinaryOperator op, Expression left,
                  Expression right) {
      super(ExpressionKind.BINARY, span);
      this.op = op;
      this.left = left;
      this.right = right;
    }

    public BinaryOperator op() {
      return op;
    }

    public Expression left() {
      return left;
    }

    public Expression right() {
      return right;
    }

    @Override
    public String toString() {
      return "(" + left + " " + op.symbol() + " " + right + ")";
    }
  }

  public static class Unary extends Expression {
    private final UnaryOperator op;
    private final Expression operand;

    public Unary(SourceSpan span, UnaryOperator op, Expression operand) {
      super(ExpressionKind.UNARY, span);
      this.op = op;
      this.operand = operand;
    }

    public UnaryOperator op() {
      return op;
    }

    public Expression operand() {
      return operand;
    }

    @Override
    public String toString() {
      return op.symbol() + operand;
    }
  }

  public static class Call extends Expression {
    private final String target;
    private final List<Expression> args;

    public Call(SourceSpan span, String target, List<Expression> args) {
      super(ExpressionKind.CALL, span);
      this.target = target;
      this.args = Collections.unmodifiableList(
                                  new ArrayList<Expression>(args));
    }

    public String target() {
      return target;
    }

    public List<Expression> args() {
      return args;
    }

    @Override
    public String toString() {
      return target + "(" + StringUtils.join(args, ", ") + ")";
    }
  }

  public static class Conditional extends Expression {
    private final Expression condition;
    private final Expression whenTrue;
    private final Expression whenFalse;

    public Conditional(SourceSpan span, Expression condition,
                       Expression whenTrue, Expression whenFalse) {
      super(ExpressionKind.CONDITIONAL, span);
      this.condition = condition;
      this.whenTrue = whenTrue;
      this.whenFalse = whenFalse;
    }

    public Expression condition() {
      return condition;
    }

    public Expression whenTrue() {
      return whenTrue;
    }

    public Expression whenFalse() {
      return whenFalse;
    }

    @Override
    public String toString() {
      return "(" + condition + " ? " + whenTrue + " : " + whenFalse + ")";
    }
  }

  /**
   * Option/result wrappers: SOME(value), OK(value) and ERR(value)
   */
  public static class Wrapper extends Expression {
    private final Expression value;

    public Wrapper(SourceSpan span, ExpressionKind kind, Expression value) {
      super(kind, span);
      assert(kind == ExpressionKind.SOME || kind == ExpressionKind.OK ||
             kind == ExpressionKind.ERR) : kind;
      this.value = value;
    }

    public Expression value() {
      return value;
    }

    @Override
    public String toString() {
      return kind.name() + "(" + value + ")";
    }
  }

  public static class NoneLiteral extends Expression {
    public NoneLiteral(SourceSpan span) {
      super(ExpressionKind.NONE, span);
    }

    @Override
    public String toString() {
      return "NONE";
    }
  }

  public static class FieldAccess extends Expression {
    private final Expression target;
    private final String field;

    public FieldAccess(SourceSpan span, Expression target, String field) {
      super(ExpressionKind.FIELD_ACCESS, span);
      this.target = target;
      this.field = field;
    }

    public Expression target() {
      return target;
    }

    public String field() {
      return field;
    }

    @Override
    public String toString() {
      return target + "." + field;
    }
  }

  public static class FieldInit {
    public final String name;
    public final Expression value;

    public FieldInit(String name, Expression value) {
      this.name = name;
      this.value = value;
    }

    @Override
    public String toString() {
      return name + ": " + value;
    }
  }

  public static class RecordCreation extends Expression {
    private final String typeName;
    private final List<FieldInit> fields;

    public RecordCreation(SourceSpan span, String typeName,
                          List<FieldInit> fields) {
      super(ExpressionKind.RECORD_CREATION, span);
      this.typeName = typeName;
      this.fields = Collections.unmodifiableList(
                                  new ArrayList<FieldInit>(fields));
    }

    public String typeName() {
      return typeName;
    }

    public List<FieldInit> fields() {
      return fields;
    }

    @Override
    public String toString() {
      return typeName + "{" + StringUtils.join(fields, ", ") + "}";
    }
  }

  public static class ArrayAccess extends Expression {
    private final Expression array;
    private final Expression index;

    public ArrayAccess(SourceSpan span, Expression array, Expression index) {
      super(ExpressionKind.ARRAY_ACCESS, span);
      this.array = array;
      this.index = index;
    }

    public Expression array() {
      return array;
    }

    public Expression index() {
      return index;
    }

    @Override
    public String toString() {
      return array + "[" + index + "]";
    }
  }

  public static class QuantifierVariable {
    public final String name;
    public final String typeName;

    public QuantifierVariable(String name, String typeName) {
      this.name = name;
      this.typeName = typeName;
    }

    @Override
    public String toString() {
      return name + ":" + typeName;
    }
  }

  /**
   * FORALL or EXISTS over one or more bound variables
   */
  public static class Quantifier extends Expression {
    private final List<QuantifierVariable> boundVariables;
    private final Expression body;

    public Quantifier(SourceSpan span, ExpressionKind kind,
                      List<QuantifierVariable> boundVariables,
                      Expression body) {
      super(kind, span);
      assert(kind == ExpressionKind.FORALL || kind == ExpressionKind.EXISTS);
      this.boundVariables = Collections.unmodifiableList(
                      new ArrayList<QuantifierVariable>(boundVariables));
      this.body = body;
    }

    public List<QuantifierVariable> boundVariables() {
      return boundVariables;
    }

    public Expression body() {
      return body;
    }

    @Override
    public String toString() {
      return kind.name().toLowerCase() + " " +
             StringUtils.join(boundVariables, ", ") + ". " + body;
    }
  }

  public static class Implication extends Expression {
    private final Expression antecedent;
    private final Expression consequent;

    public Implication(SourceSpan span, Expression antecedent,
                       Expression consequent) {
      super(ExpressionKind.IMPLICATION, span);
      this.antecedent = antecedent;
      this.consequent = consequent;
    }

    public Expression antecedent() {
      return antecedent;
    }

    public Expression consequent() {
      return consequent;
    }

    @Override
    public String toString() {
      return "(" + antecedent + " -> " + consequent + ")";
    }
  }
}
