// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.utils;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;

public class WorkListTest {

  @Test
  public void testEachItemProcessedOnce() {
    WorkList<String> workList = WorkList.newEqualityWorkList(ImmutableList.of("a", "b", "a"));
    assertEquals(2, workList.size());
    List<String> processed = new ArrayList<>();
    workList.process(
        item -> {
          processed.add(item);
          if (item.equals("a")) {
            workList.addIfNotSeen(ImmutableList.of("b", "c"));
          }
        });
    assertThat(processed, contains("a", "b", "c"));
    assertFalse(workList.hasNext());
    assertThat(workList.getSeenSet(), contains("a", "b", "c"));
  }

  @Test
  public void testSeen() {
    WorkList<String> workList = WorkList.newEqualityWorkList();
    assertTrue(workList.addIfNotSeen("a"));
    assertFalse(workList.addIfNotSeen("a"));
    assertEquals("a", workList.next());
    assertTrue(workList.isSeen("a"));
    assertFalse(workList.addIfNotSeen("a"));
    assertFalse(workList.hasNext());
  }
}
