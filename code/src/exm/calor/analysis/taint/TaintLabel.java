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

import exm.calor.ast.SourceSpan;

/**
 * Record of where a tainted value originated
 */
public class TaintLabel {
  public final TaintSource source;
  /** Parameter name or source call target */
  public final String origin;
  public final SourceSpan location;

  public TaintLabel(TaintSource source, String origin, SourceSpan location) {
    this.source = source;
    this.origin = origin;
    this.location = location;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof TaintLabel)) {
      return false;
    }
    TaintLabel other = (TaintLabel) o;
    return source == other.source && origin.equals(other.origin) &&
           (location == null ? other.location == null
                             : location.equals(other.location));
  }

  @Override
  public int hashCode() {
    return (source.hashCode() * 31 + origin.hashCode()) * 31 +
           (location == null ? 0 : location.hashCode());
  }

  @Override
  public String toString() {
    return source + "(" + origin + ")";
  }
}
