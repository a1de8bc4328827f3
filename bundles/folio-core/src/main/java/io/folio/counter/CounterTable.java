/*
 * Copyright (c) 2023, Folio Contributors
 *
 * All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 *     * Redistributions of source code must retain the above copyright
 *       notice, this list of conditions and the following disclaimer.
 *     * Redistributions in binary form must reproduce the above copyright
 *       notice, this list of conditions and the following disclaimer in the
 *       documentation and/or other materials provided with the distribution.
 *     * Neither the name of the <organization> nor the
 *       names of its contributors may be used to endorse or promote products
 *       derived from this software without specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND
 * ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED
 * WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE
 * DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE FOR ANY
 * DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES
 * (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES;
 * LOSS OF USE, DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND
 * ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF THIS
 * SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */

package io.folio.counter;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;

import static java.util.Objects.requireNonNull;

/**
 * The CSS counters a single frame owns, in the order they were first set. Values of absent
 * counters read as {@code 0}.
 *
 * <p>
 * A table never looks at other frames; scoping (which frame owns a counter) is resolved by the
 * frame decorators before they touch a table.
 * </p>
 */
public final class CounterTable {

  /** Counter used when no identifier is given. */
  public static final String DEFAULT_COUNTER = "-folio-default-counter";

  private final Object2IntLinkedOpenHashMap<String> values;

  public CounterTable() {
    values = new Object2IntLinkedOpenHashMap<>();
    values.defaultReturnValue(0);
  }

  /**
   * Determines if this table owns counter {@code id}.
   *
   * @param id the counter identifier
   * @return {@code true} if the counter has been set on this table
   */
  public boolean contains(final String id) {
    return values.containsKey(requireNonNull(id));
  }

  public int get(final String id) {
    return values.getInt(requireNonNull(id));
  }

  public void set(final String id, final int value) {
    values.put(requireNonNull(id), value);
  }

  /**
   * Adds {@code delta} to counter {@code id}, creating it at {@code 0} first if needed.
   *
   * @param id the counter identifier
   * @param delta the amount to add, may be negative
   * @return the new value
   */
  public int add(final String id, final int delta) {
    return values.addTo(requireNonNull(id), delta) + delta;
  }

  /**
   * Replaces the content of this table with a copy of {@code other}.
   *
   * @param other the table to copy
   */
  public void copyFrom(final CounterTable other) {
    if (other == this) {
      return;
    }
    values.clear();
    values.putAll(other.values);
  }

  public void clear() {
    values.clear();
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  public int size() {
    return values.size();
  }

  /**
   * Snapshot of the counters in insertion order.
   *
   * @return immutable copy of the current values
   */
  public ImmutableMap<String, Integer> asMap() {
    final ImmutableMap.Builder<String, Integer> builder = ImmutableMap.builderWithExpectedSize(values.size());
    for (final Object2IntMap.Entry<String> entry : values.object2IntEntrySet()) {
      builder.put(entry.getKey(), entry.getIntValue());
    }
    return builder.build();
  }

  @Override
  public boolean equals(final Object obj) {
    return obj instanceof CounterTable && values.equals(((CounterTable) obj).values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("counters", values).toString();
  }
}
