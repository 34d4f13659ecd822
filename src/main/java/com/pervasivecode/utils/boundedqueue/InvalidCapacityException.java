package com.pervasivecode.utils.boundedqueue;

/** Thrown when a queue is created (or configured) with a capacity that is not positive. */
public class InvalidCapacityException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final int capacity;

  public InvalidCapacityException(int capacity) {
    super(String.format("Capacity must be at least 1. Got %d", capacity));
    this.capacity = capacity;
  }

  /** The rejected capacity value. */
  public int capacity() {
    return capacity;
  }
}
