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

/**
 * A resolved variable: local binding, loop variable or parameter.
 * Compared by identity: two declarations with the same name are
 * different symbols.
 */
public class VariableSymbol {
  private final String name;
  private final String typeName;
  private final boolean mutable;
  private final boolean parameter;

  public VariableSymbol(String name, String typeName, boolean mutable,
                        boolean parameter) {
    this.name = name;
    this.typeName = typeName;
    this.mutable = mutable;
    this.parameter = parameter;
  }

  public String getName() {
    return name;
  }

  public String getTypeName() {
    return typeName;
  }

  public boolean isMutable() {
    return mutable;
  }

  public boolean isParameter() {
    return parameter;
  }

  @Override
  public String toString() {
    return name + ":" + typeName;
  }
}
