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
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Normal form statements.  Control flow is expressed with labels,
 * branches and gotos; only TRY keeps nested structure.
 */
public abstract class CnfStatement {

  public static enum StatementType {
    ASSIGN,
    BRANCH,
    GOTO,
    LABEL,
    RETURN,
    THROW,
    TRY,
    SEQUENCE,
  }

  public final StatementType type;

  protected CnfStatement(StatementType type) {
    this.type = type;
  }

  public StatementType type() {
    return type;
  }

  /**
   * @return nested statement lists of this statement, empty for all
   *         but SEQUENCE and TRY
   */
  public List<Sequence> nestedSequences() {
    return Collections.emptyList();
  }

  public static class Assign extends CnfStatement {
    private final String target;
    private final CnfExpression value;
    private final SemanticType targetType;

    public Assign(String target, CnfExpression value,
                  SemanticType targetType) {
      super(StatementType.ASSIGN);
      this.target = target;
      this.value = value;
      this.targetType = targetType;
    }

    public String target() {
      return target;
    }

    public CnfExpression value() {
      return value;
    }

    public SemanticType targetType() {
      return targetType;
    }

    @Override
    public String toString() {
      return target + " = " + value;
    }

    @Override
    public int hashCode() {
      return 31 * (31 * target.hashCode() + value.hashCode()) +
             targetType.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Assign)) {
        return false;
      }
      Assign other = (Assign) obj;
      return target.equals(other.target) && value.equals(other.value) &&
             targetType == other.targetType;
    }
  }

  public static class Branch extends CnfStatement {
    private final CnfExpression condition;
    private final String trueLabel;
    private final String falseLabel;

    public Branch(CnfExpression condition, String trueLabel,
                  String falseLabel) {
      super(StatementType.BRANCH);
      this.condition = condition;
      this.trueLabel = trueLabel;
      this.falseLabel = falseLabel;
    }

    public CnfExpression condition() {
      return condition;
    }

    public String trueLabel() {
      return trueLabel;
    }

    public String falseLabel() {
      return falseLabel;
    }

    @Override
    public String toString() {
      return "branch " + condition + " -> " + trueLabel + ", " + falseLabel;
    }

    @Override
    public int hashCode() {
      return 31 * (31 * condition.hashCode() + trueLabel.hashCode()) +
             falseLabel.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Branch)) {
        return false;
      }
      Branch other = (Branch) obj;
      return condition.equals(other.condition) &&
             trueLabel.equals(other.trueLabel) &&
             falseLabel.equals(other.falseLabel);
    }
  }

  public static class Goto extends CnfStatement {
    private final String label;

    public Goto(String label) {
      super(StatementType.GOTO);
      this.label = label;
    }

    public String label() {
      return label;
    }

    @Override
    public String toString() {
      return "goto " + label;
    }

    @Override
    public int hashCode() {
      return label.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Goto && label.equals(((Goto) obj).label);
    }
  }

  public static class Label extends CnfStatement {
    private final String name;

    public Label(String name) {
      super(StatementType.LABEL);
      this.name = name;
    }

    public String name() {
      return name;
    }

    @Override
    public String toString() {
      return name + ":";
    }

    @Override
    public int hashCode() {
      return name.hashCode() + 1;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Label && name.equals(((Label) obj).name);
    }
  }

  public static class Return extends CnfStatement {
    private final CnfExpression value;

    public Return(CnfExpression value) {
      super(StatementType.RETURN);
      this.value = value;
    }

    /** @return returned value, or null */
    public CnfExpression value() {
      return value;
    }

    @Override
    public String toString() {
      return value == null ? "return" : "return " + value;
    }

    @Override
    public int hashCode() {
      return value == null ? 7 : value.hashCode() + 7;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Return)) {
        return false;
      }
      Return other = (Return) obj;
      return value == null ? other.value == null : value.equals(other.value);
    }
  }

  public static class Throw extends CnfStatement {
    private final CnfExpression value;

    public Throw(CnfExpression value) {
      super(StatementType.THROW);
      this.value = value;
    }

    public CnfExpression value() {
      return value;
    }

    @Override
    public String toString() {
      return "throw " + value;
    }

    @Override
    public int hashCode() {
      return value.hashCode() + 11;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Throw && value.equals(((Throw) obj).value);
    }
  }

  public static class Sequence extends CnfStatement {
    private final List<CnfStatement> statements;

    public Sequence(List<CnfStatement> statements) {
      super(StatementType.SEQUENCE);
      this.statements = Collections.unmodifiableList(
                              new ArrayList<CnfStatement>(statements));
    }

    public List<CnfStatement> statements() {
      return statements;
    }

    @Override
    public List<Sequence> nestedSequences() {
      return Collections.singletonList(this);
    }

    @Override
    public String toString() {
      return "{ " + StringUtils.join(statements, "; ") + " }";
    }

    @Override
    public int hashCode() {
      return statements.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Sequence &&
             statements.equals(((Sequence) obj).statements);
    }
  }

  public static class CatchClause {
    public final String exceptionType;
    /** null if the exception is not bound to a variable */
    public final String variableName;
    public final Sequence body;

    public CatchClause(String exceptionType, String variableName,
                       Sequence body) {
      this.exceptionType = exceptionType;
      this.variableName = variableName;
      this.body = body;
    }

    @Override
    public String toString() {
      return "catch " + exceptionType +
             (variableName == null ? "" : " " + variableName) + " " + body;
    }

    @Override
    public int hashCode() {
      return toString().hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof CatchClause)) {
        return false;
      }
      CatchClause other = (CatchClause) obj;
      return StringUtils.equals(exceptionType, other.exceptionType) &&
             StringUtils.equals(variableName, other.variableName) &&
             body.equals(other.body);
    }
  }

  public static class Try extends CnfStatement {
    private final Sequence body;
    private final List<CatchClause> catchClauses;
    private final Sequence finallyBody;

    public Try(Sequence body, List<CatchClause> catchClauses,
               Sequence finallyBody) {
      super(StatementType.TRY);
      this.body = body;
      this.catchClauses = Collections.unmodifiableList(
                              new ArrayList<CatchClause>(catchClauses));
      this.finallyBody = finallyBody;
    }

    public Sequence body() {
      return body;
    }

    public List<CatchClause> catchClauses() {
      return catchClauses;
    }

    /** @return finally body, or null */
    public Sequence finallyBody() {
      return finallyBody;
    }

    @Override
    public List<Sequence> nestedSequences() {
      List<Sequence> res = new ArrayList<Sequence>();
      res.add(body);
      for (CatchClause c: catchClauses) {
        res.add(c.body);
      }
      if (finallyBody != null) {
        res.add(finallyBody);
      }
      return res;
    }

    @Override
    public String toString() {
      return "try " + body + " " + StringUtils.join(catchClauses, " ") +
             (finallyBody == null ? "" : " finally " + finallyBody);
    }

    @Override
    public int hashCode() {
      return 31 * (31 * body.hashCode() + catchClauses.hashCode()) +
             (finallyBody == null ? 0 : finallyBody.hashCode());
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Try)) {
        return false;
      }
      Try other = (Try) obj;
      return body.equals(other.body) &&
             catchClauses.equals(other.catchClauses) &&
             (finallyBody == null ? other.finallyBody == null :
                                    finallyBody.equals(other.finallyBody));
    }
  }

  /**
   * Flatten nested sequences (including TRY parts) into a single list,
   * in textual order.  The TRY statement itself is included before its
   * parts.
   */
  public static List<CnfStatement> flatten(List<CnfStatement> stmts) {
    List<CnfStatement> res = new ArrayList<CnfStatement>();
    flatten(stmts, res);
    return res;
  }

  private static void flatten(List<CnfStatement> stmts,
                              List<CnfStatement> res) {
    for (CnfStatement stmt: stmts) {
      if (stmt.type != StatementType.SEQUENCE) {
        res.add(stmt);
      }
      for (Sequence nested: stmt.nestedSequences()) {
        flatten(nested.statements(), res);
      }
    }
  }
}
