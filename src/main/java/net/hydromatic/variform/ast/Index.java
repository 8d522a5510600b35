/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.variform.ast;

import java.util.concurrent.atomic.AtomicInteger;

/** Free index.
 *
 * <p>An index that occurs twice in a product is summed over (Einstein
 * convention). Two indices are equal if they have the same count; a new index
 * gets a count that has not been used before. */
public final class Index extends IndexBase implements Comparable<Index> {
  private static final AtomicInteger COUNTER = new AtomicInteger();

  public final int count;

  private Index(int count) {
    this.count = count;
  }

  /** Creates an index that is distinct from every other index. */
  public static Index create() {
    return new Index(COUNTER.getAndIncrement());
  }

  /** Creates an array of {@code n} distinct indices. */
  public static Index[] indices(int n) {
    final Index[] indices = new Index[n];
    for (int i = 0; i < n; i++) {
      indices[i] = create();
    }
    return indices;
  }

  @Override public boolean isFixed() {
    return false;
  }

  @Override public int compareTo(Index o) {
    return Integer.compare(count, o.count);
  }

  @Override public int hashCode() {
    return count;
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Index
        && ((Index) o).count == count;
  }

  @Override public String toString() {
    return "i" + count;
  }
}

// End Index.java
