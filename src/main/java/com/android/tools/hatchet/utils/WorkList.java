// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.utils;

import com.google.common.collect.Sets;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.Set;
import java.util.function.Consumer;

/**
 * A FIFO work list that remembers every item it has seen, so that each item is processed at most
 * once. The seen set is ordered by insertion.
 */
public class WorkList<T> {

  private final Deque<T> workingList = new ArrayDeque<>();
  private final Set<T> seen = Sets.newLinkedHashSet();

  public static <T> WorkList<T> newEqualityWorkList() {
    return new WorkList<>();
  }

  public static <T> WorkList<T> newEqualityWorkList(Iterable<? extends T> items) {
    WorkList<T> workList = new WorkList<>();
    workList.addIfNotSeen(items);
    return workList;
  }

  private WorkList() {}

  public void addIfNotSeen(Iterable<? extends T> items) {
    items.forEach(this::addIfNotSeen);
  }

  public boolean addIfNotSeen(T item) {
    if (seen.add(item)) {
      workingList.addLast(item);
      return true;
    }
    return false;
  }

  public boolean hasNext() {
    return !workingList.isEmpty();
  }

  public T next() {
    assert hasNext();
    return workingList.removeFirst();
  }

  public void process(Consumer<T> consumer) {
    while (hasNext()) {
      consumer.accept(next());
    }
  }

  public boolean isSeen(T item) {
    return seen.contains(item);
  }

  public int size() {
    return workingList.size();
  }

  public Set<T> getSeenSet() {
    return Collections.unmodifiableSet(seen);
  }
}
