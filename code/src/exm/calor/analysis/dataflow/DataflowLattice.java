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
package exm.calor.analysis.dataflow;

/**
 * Join semi-lattice of dataflow facts.  Implementations must make
 * {@link #bottom()} an identity of {@link #join(Object, Object)}, and
 * facts must implement equals.
 */
public interface DataflowLattice<T> {

  /** Facts for a block not yet reached */
  public T bottom();

  /** Facts at function entry (forward) or exit (backward) */
  public T top();

  public T join(T a, T b);

  public boolean lessOrEqual(T a, T b);
}
