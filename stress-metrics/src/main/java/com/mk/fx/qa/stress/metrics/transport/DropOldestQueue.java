package com.mk.fx.qa.stress.metrics.transport;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO that never rejects: offering to a full queue evicts the oldest element. Producers
 * never wait; consumers may wait for an element.
 */
final class DropOldestQueue<T> {

  private final int capacity;
  private final Deque<T> items;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();

  DropOldestQueue(int capacity) {
    if (capacity <= 0) throw new IllegalArgumentException("Capacity must be > 0");
    this.capacity = capacity;
    this.items = new ArrayDeque<>(capacity);
  }

  /**
   * Appends {@code item}.
   *
   * @return the evicted element, if the queue was full
   */
  Optional<T> offer(T item) {
    lock.lock();
    try {
      T evicted = items.size() >= capacity ? items.pollFirst() : null;
      items.addLast(item);
      notEmpty.signal();
      return Optional.ofNullable(evicted);
    } finally {
      lock.unlock();
    }
  }

  /** Takes the oldest element, waiting up to {@code timeout}; null if none arrived. */
  T poll(Duration timeout) throws InterruptedException {
    long nanos = timeout.toNanos();
    lock.lockInterruptibly();
    try {
      while (items.isEmpty()) {
        if (nanos <= 0) return null;
        nanos = notEmpty.awaitNanos(nanos);
      }
      return items.pollFirst();
    } finally {
      lock.unlock();
    }
  }

  int size() {
    lock.lock();
    try {
      return items.size();
    } finally {
      lock.unlock();
    }
  }

  int capacity() {
    return capacity;
  }
}
