package com.obsidiandynamics.dreadlock.mutex;

import java.lang.ref.*;
import java.util.*;
import java.util.concurrent.locks.*;

public final class MutexRef implements Comparable<MutexRef> {
  private static final Object monitor = new Object();

  // values are weak as each ref holds its primitive strongly
  private static final Map<Object, WeakReference<MutexRef>> refs = new WeakHashMap<>();

  private static long nextId;

  private final long id;

  private final Mutex mutex;

  MutexRef(long id, Mutex mutex) {
    this.id = id;
    this.mutex = Objects.requireNonNull(mutex);
  }

  /**
   * Obtains the identity of the primitive behind the given mutex. Wrapping the same primitive
   * again, even through a different adapter, yields the same id for as long as the first ref is
   * reachable.
   *
   * @param mutex The mutex to wrap.
   * @return The {@link MutexRef}.
   */
  public static MutexRef wrap(Mutex mutex) {
    final var primitive = Objects.requireNonNull(mutex.primitive());
    synchronized (monitor) {
      final var existing = refs.get(primitive);
      if (existing != null) {
        final var ref = existing.get();
        if (ref != null) {
          return ref;
        }
      }
      final var ref = new MutexRef(nextId++, mutex);
      refs.put(primitive, new WeakReference<>(ref));
      return ref;
    }
  }

  public static MutexRef wrap(Lock lock) {
    return wrap(new LockMutex(lock));
  }

  public static MutexRef create() {
    return wrap(new NonReentrantMutex());
  }

  public long id() {
    return id;
  }

  public Mutex mutex() {
    return mutex;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    } else if (o instanceof MutexRef) {
      final var that = (MutexRef) o;
      return id == that.id;
    } else {
      return false;
    }
  }

  @Override
  public int hashCode() {
    return Long.hashCode(id);
  }

  @Override
  public String toString() {
    return MutexRef.class.getSimpleName() + "[id=" + id + ", mutex=" + mutex + ']';
  }

  @Override
  public int compareTo(MutexRef o) {
    return Long.compare(id, o.id);
  }
}
