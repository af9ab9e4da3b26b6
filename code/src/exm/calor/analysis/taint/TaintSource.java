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
package exm.calor.analysis.taint;

/**
 * Where untrusted data comes from
 */
public enum TaintSource {
  USER_INPUT("user input"),
  FILE_READ("file read"),
  NETWORK_INPUT("network input"),
  ENVIRONMENT("environment"),
  DATABASE_RESULT("database result"),
  EXTERNAL_API("external API");

  private final String description;

  private TaintSource(String description) {
    this.description = description;
  }

  public String description() {
    return description;
  }
}
