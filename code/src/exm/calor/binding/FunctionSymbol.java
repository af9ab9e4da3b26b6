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

public class FunctionSymbol {
  private final String name;
  private final String returnTypeName;
  private final List<VariableSymbol> parameters;

  public FunctionSymbol(String name, String returnTypeName,
                        List<VariableSymbol> parameters) {
    this.name = name;
    this.returnTypeName = returnTypeName;
    this.parameters = Collections.unmodifiableList(
                            new ArrayList<VariableSymbol>(parameters));
  }

  public String getName() {
    return name;
  }

  /** @return return type name, "VOID" for functions without output */
  public String getReturnTypeName() {
    return returnTypeName;
  }

  public List<VariableSymbol> getParameters() {
    return parameters;
  }

  @Override
  public String toString() {
    return name + parameters + " : " + returnTypeName;
  }
}
