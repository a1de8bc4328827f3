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

import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class CounterTableTest {

  private CounterTable table;

  @BeforeEach
  public void setUp() {
    table = new CounterTable();
  }

  @Test
  public void testAbsentCountersReadAsZero() {
    assertTrue(table.isEmpty());
    assertEquals(0, table.get("chapter"));
    assertFalse(table.contains("chapter"));
  }

  @Test
  public void testAddCreatesAndAccumulates() {
    assertEquals(1, table.add("chapter", 1));
    assertEquals(3, table.add("chapter", 2));
    assertEquals(-1, table.add("section", -1));
    assertTrue(table.contains("chapter"));
    assertEquals(2, table.size());
  }

  @Test
  public void testSetAndInsertionOrder() {
    table.set("b", 2);
    table.set("a", 1);
    table.set("b", 5);
    assertEquals(ImmutableMap.of("b", 5, "a", 1), table.asMap());
    assertEquals("[b, a]", table.asMap().keySet().toString());
  }

  @Test
  public void testCopyFromIsIndependent() {
    table.set("page", 4);
    final CounterTable copy = new CounterTable();
    copy.set("stale", 1);
    copy.copyFrom(table);
    assertEquals(table, copy);
    assertFalse(copy.contains("stale"));

    table.add("page", 1);
    assertEquals(4, copy.get("page"));
    assertNotEquals(table, copy);
  }

  @Test
  public void testClear() {
    table.set(CounterTable.DEFAULT_COUNTER, 3);
    table.clear();
    assertTrue(table.isEmpty());
    assertEquals(0, table.get(CounterTable.DEFAULT_COUNTER));
  }

  @Test
  public void testNullIdentifierIsRejected() {
    assertThrows(NullPointerException.class, () -> table.add(null, 1));
  }
}
