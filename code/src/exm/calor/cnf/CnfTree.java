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
 * Containers of the normal form: modules, functions and parameters.
 * Built once by lowering and not modified afterwards.
 */
public class CnfTree {

  public static final String DEFAULT_SEMANTICS_VERSION = "1.0.0";

  public static class Module {
    private final String id;
    private final String name;
    private final String semanticsVersion;
    private final List<Function> functions;

    public Module(String id, String name, String semanticsVersion,
                  List<Function> functions) {
      this.id = id;
      this.name = name;
      this.semanticsVersion = semanticsVersion;
      this.functions = Collections.unmodifiableList(
                                  new ArrayList<Function>(functions));
    }

    public String id() {
      return id;
    }

    public String name() {
      return name;
    }

    public String semanticsVersion() {
      return semanticsVersion;
    }

    public List<Function> functions() {
      return functions;
    }

    public Function lookupFunction(String name) {
      for (Function f: functions) {
        if (f.name().equals(name)) {
          return f;
        }
      }
      return null;
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder();
      sb.append("module ").append(name).append(" (")
        .append(semanticsVersion).append(")\n");
      for (Function f: functions) {
        sb.append(f).append('\n');
      }
      return sb.toString();
    }
  }

  public static class Parameter {
    public final String name;
    public final SemanticType type;

    public Parameter(String name, SemanticType type) {
      this.name = name;
      this.type = type;
    }

    @Override
    public String toString() {
      return name + ":" + type;
    }

    @Override
    public int hashCode() {
      return 31 * name.hashCode() + type.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Parameter)) {
        return false;
      }
      Parameter other = (Parameter) obj;
      return name.equals(other.name) && type == other.type;
    }
  }

  public static class Function {
    private final String id;
    private final String name;
    private final List<Parameter> parameters;
    private final SemanticType returnType;
    private final List<CnfStatement> body;

    public Function(String id, String name, List<Parameter> parameters,
                    SemanticType returnType, List<CnfStatement> body) {
      this.id = id;
      this.name = name;
      this.parameters = Collections.unmodifiableList(
                                  new ArrayList<Parameter>(parameters));
      this.returnType = returnType;
      this.body = Collections.unmodifiableList(
                                  new ArrayList<CnfStatement>(body));
    }

    public String id() {
      return id;
    }

    public String name() {
      return name;
    }

    public List<Parameter> parameters() {
      return parameters;
    }

    public SemanticType returnType() {
      return returnType;
    }

    public List<CnfStatement> body() {
      return body;
    }

    /**
     * @return all statements, with nested TRY parts expanded in place
     */
    public List<CnfStatement> allStatements() {
      return CnfStatement.flatten(body);
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder();
      sb.append("function ").append(name).append("(")
        .append(StringUtils.join(parameters, ", ")).append(") : ")
        .append(returnType).append(" {\n");
      for (CnfStatement stmt: body) {
        sb.append("  ").append(stmt).append('\n');
      }
      sb.append("}");
      return sb.toString();
    }

    @Override
    public int hashCode() {
      return 31 * (31 * id.hashCode() + parameters.hashCode()) +
             body.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Function)) {
        return false;
      }
      Function other = (Function) obj;
      return id.equals(other.id) && name.equals(other.name) &&
             parameters.equals(other.parameters) &&
             returnType == other.returnType && body.equals(other.body);
    }
  }
}
