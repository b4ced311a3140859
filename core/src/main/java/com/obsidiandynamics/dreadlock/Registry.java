package com.obsidiandynamics.dreadlock;

import com.obsidiandynamics.dreadlock.mutex.*;

import java.util.*;

public final class Registry {
  public static final class Attempt {
    public enum Kind {
      ACQUIRED,
      REENTRANT,
      CONTENDED
    }

    private static final Attempt ACQUIRED = new Attempt(Kind.ACQUIRED, null);

    private final Kind kind;

    private final LockRecord holder;

    private Attempt(Kind kind, LockRecord holder) {
      this.kind = kind;
      this.holder = holder;
    }

    public Kind getKind() {
      return kind;
    }

    public Optional<LockRecord> getHolder() {
      return Optional.ofNullable(holder);
    }

    @Override
    public String toString() {
      return Attempt.class.getSimpleName() + "[kind=" + kind + ", holder=" + holder + ']';
    }
  }

  private static final Registry GLOBAL = new Registry();

  private final Object monitor = new Object();

  private final Map<Long, LockRecord> records = new HashMap<>();

  public static Registry global() {
    return GLOBAL;
  }

  public boolean tryClaim(long mutexId, long holderId, Location location) {
    Objects.requireNonNull(location);
    synchronized (monitor) {
      return records.putIfAbsent(mutexId, new LockRecord(holderId, location)) == null;
    }
  }

  public Optional<LockRecord> lookup(long mutexId) {
    synchronized (monitor) {
      return Optional.ofNullable(records.get(mutexId));
    }
  }

  public boolean isHeldBy(long mutexId, long holderId) {
    synchronized (monitor) {
      final var record = records.get(mutexId);
      return record != null && record.isHeldBy(holderId);
    }
  }

  public ReleaseOutcome release(long mutexId, long holderId) {
    synchronized (monitor) {
      final var record = records.get(mutexId);
      if (record == null) {
        return ReleaseOutcome.notLocked();
      } else if (! record.isHeldBy(holderId)) {
        return ReleaseOutcome.notOwner(record);
      } else {
        records.remove(mutexId);
        return ReleaseOutcome.released(record);
      }
    }
  }

  /**
   * Peeks at the registry and, if no record exists, attempts a non-blocking acquire of the real
   * mutex, claiming it on success. The three steps are atomic with respect to other registry
   * operations.
   *
   * @param ref The mutex.
   * @param holderId The identity of the acquiring handle.
   * @param location Where the acquisition is taking place.
   * @return The outcome of the attempt.
   */
  public Attempt tryAcquire(MutexRef ref, long holderId, Location location) {
    Objects.requireNonNull(location);
    synchronized (monitor) {
      final var existing = records.get(ref.id());
      if (existing != null) {
        return new Attempt(existing.isHeldBy(holderId) ? Attempt.Kind.REENTRANT : Attempt.Kind.CONTENDED, existing);
      } else if (ref.mutex().tryAcquire()) {
        records.put(ref.id(), new LockRecord(holderId, location));
        return Attempt.ACQUIRED;
      } else {
        return new Attempt(Attempt.Kind.CONTENDED, null);
      }
    }
  }

  /**
   * Verifies that {@code holderId} owns the mutex and, if so, removes its record and releases the
   * real mutex before any other party may observe the registry. The real mutex is left untouched
   * for any other outcome.
   *
   * @param ref The mutex.
   * @param holderId The identity of the releasing handle.
   * @return The outcome of the release.
   */
  public ReleaseOutcome release(MutexRef ref, long holderId) {
    synchronized (monitor) {
      final var record = records.get(ref.id());
      if (record == null) {
        return ReleaseOutcome.notLocked();
      } else if (! record.isHeldBy(holderId)) {
        return ReleaseOutcome.notOwner(record);
      }

      // the record survives if the real mutex refuses the release
      ref.mutex().release();
      records.remove(ref.id());
      return ReleaseOutcome.released(record);
    }
  }

  public int size() {
    synchronized (monitor) {
      return records.size();
    }
  }

  @Override
  public String toString() {
    synchronized (monitor) {
      return Registry.class.getSimpleName() + "[records=" + records + ']';
    }
  }
}
