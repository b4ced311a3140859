package com.obsidiandynamics.dreadlock.mutex;

import java.util.*;
import java.util.concurrent.locks.*;

public final class LockMutex implements Mutex {
  private final Lock lock;

  public LockMutex(Lock lock) {
    this.lock = Objects.requireNonNull(lock);
  }

  @Override
  public boolean tryAcquire() {
    return lock.tryLock();
  }

  @Override
  public void release() {
    lock.unlock();
  }

  @Override
  public Lock primitive() {
    return lock;
  }

  @Override
  public String toString() {
    return LockMutex.class.getSimpleName() + "[lock=" + lock + ']';
  }
}
