package com.obsidiandynamics.dreadlock.mutex;

public interface Mutex {
  boolean tryAcquire();

  void release();

  default Object primitive() {
    return this;
  }
}
