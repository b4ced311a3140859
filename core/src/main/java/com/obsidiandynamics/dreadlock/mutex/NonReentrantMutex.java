package com.obsidiandynamics.dreadlock.mutex;

import java.util.concurrent.atomic.*;

public final class NonReentrantMutex implements Mutex {
  private final AtomicBoolean locked = new AtomicBoolean();

  @Override
  public boolean tryAcquire() {
    return locked.compareAndSet(false, true);
  }

  @Override
  public void release() {
    if (! locked.compareAndSet(true, false)) {
      throw new IllegalMonitorStateException("Not acquired");
    }
  }

  public boolean isLocked() {
    return locked.get();
  }

  @Override
  public String toString() {
    return NonReentrantMutex.class.getSimpleName() + "[locked=" + isLocked() + ']';
  }
}
