package com.mk.fx.qa.dbstress.series;

import com.mk.fx.qa.dbstress.model.Sample;
import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-capacity ring of samples in insertion order. Appending to a full series overwrites the
 * oldest sample. Not thread-safe; {@link BoundedSeriesStore} guards each instance.
 */
final class Series {

  private final Sample[] ring;
  private int head;
  private int size;

  Series(int capacity) {
    if (capacity <= 0) throw new IllegalArgumentException("Capacity must be > 0");
    this.ring = new Sample[capacity];
  }

  void append(Sample sample) {
    int tail = (head + size) % ring.length;
    ring[tail] = sample;
    if (size < ring.length) {
      size++;
    } else {
      head = (head + 1) % ring.length;
    }
  }

  List<Sample> toList() {
    List<Sample> copy = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      copy.add(ring[(head + i) % ring.length]);
    }
    return List.copyOf(copy);
  }

  boolean isEmpty() {
    return size == 0;
  }

  int size() {
    return size;
  }
}
