package com.obsidiandynamics.dreadlock;

import com.obsidiandynamics.dreadlock.LockDisciplineException.*;
import com.obsidiandynamics.dreadlock.mutex.*;
import com.obsidiandynamics.dreadlock.report.*;

import java.util.concurrent.atomic.*;

/**
 * An instrumented use of a single mutex, confined to the thread that created it. The mutex is
 * only ever acquired without blocking; while contended, the handle polls the {@link Registry} at a
 * fixed interval until it acquires or the deadlock timeout elapses. The wait cannot be cancelled.
 */
public final class LockHandle implements AutoCloseable {
  public enum State {
    UNLOCKED,
    ACQUIRING,
    HELD
  }

  static final Location DEFAULT_DESTRUCT_LOCATION = Location.of("LockHandle.close()", -1);

  private static final AtomicLong nextHandleId = new AtomicLong();

  private final long handleId = nextHandleId.getAndIncrement();

  private final Dreadlock.Options options;

  private final Registry registry;

  private final ReportSink sink;

  private final MutexRef ref;

  private final String name;

  private final boolean deferred;

  private Location destructLocation;

  private volatile State state = State.UNLOCKED;

  LockHandle(Dreadlock dreadlock, MutexRef ref, String name, boolean deferred) {
    options = dreadlock.getOptions();
    registry = dreadlock.getRegistry();
    sink = dreadlock.getSink();
    this.ref = ref;
    this.name = name;
    this.deferred = deferred;
  }

  public boolean lock() {
    return lock(Location.caller());
  }

  /**
   * Acquires the mutex, waiting for up to the deadlock timeout if it is held elsewhere.<p>
   *
   * If this handle already holds the mutex, the illegal re-lock is reported and passed to the
   * fault handler; the mutex remains held from the earlier lock. If the deadlock timeout elapses,
   * the deadlock is reported, and passed to the fault handler if {@code assertOnDeadlock} is set.
   * Should the fault handler return, this method returns {@code false}, and a timed-out caller is
   * left <em>without</em> the mutex. It may retry.
   *
   * @param location Where the lock is being taken.
   * @return Whether this call acquired the mutex.
   */
  public boolean lock(Location location) {
    final var at = relativise(location);
    if (options.verbose) {
      sink.report(LockEvent.locking(name, handleId, at));
    }

    final var attempt = registry.tryAcquire(ref, handleId, at);
    switch (attempt.getKind()) {
      case ACQUIRED:
        state = State.HELD;
        return true;

      case REENTRANT:
        fault(LockEvent.illegalReentry(name, handleId, at, attempt.getHolder().orElseThrow()), Reason.ILLEGAL_REENTRY);
        return false;

      case CONTENDED:
        final var holder = attempt.getHolder().orElse(null);
        if (options.verbose) {
          sink.report(LockEvent.lockAttempt(name, handleId, at, holder));
        }
        state = State.ACQUIRING;
        return awaitAcquisition(at, holder);

      default:
        throw new UnsupportedOperationException("Unsupported attempt " + attempt);
    }
  }

  private boolean awaitAcquisition(Location at, LockRecord initialHolder) {
    final var startTime = System.nanoTime();
    var holder = initialHolder;
    var reportedPerformance = false;
    var interrupted = false;
    try {
      while (true) {
        try {
          //noinspection BusyWait
          Thread.sleep(options.pollIntervalNanos / 1_000_000, (int) (options.pollIntervalNanos % 1_000_000));
        } catch (InterruptedException e) {
          interrupted = true;
        }

        final var attempt = registry.tryAcquire(ref, handleId, at);
        if (attempt.getKind() == Registry.Attempt.Kind.ACQUIRED) {
          state = State.HELD;
          return true;
        }

        // a mutex locked from outside the registry has no record; keep naming the last known holder
        holder = attempt.getHolder().orElse(holder);

        final var elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        if (elapsedMs >= options.deadlockTimeoutMs) {
          break;
        } else if (options.performanceTimeoutMs != 0 && ! reportedPerformance && elapsedMs >= options.performanceTimeoutMs) {
          sink.report(LockEvent.performanceWarning(name, handleId, at, holder, options.performanceTimeoutMs));
          reportedPerformance = true;
        }
      }
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }

    if (registry.isHeldBy(ref.id(), handleId)) {
      state = State.HELD;
      return true;
    }

    state = State.UNLOCKED;
    final var deadlock = LockEvent.deadlock(name, handleId, at, holder, options.deadlockTimeoutMs);
    if (options.assertOnDeadlock) {
      fault(deadlock, Reason.DEADLOCK_TIMED_OUT);
    } else {
      sink.report(deadlock);
    }
    return false;
  }

  public void unlock() {
    unlock(Location.caller());
  }

  public void unlock(Location location) {
    final var at = relativise(location);
    final var outcome = registry.release(ref, handleId);
    switch (outcome.getKind()) {
      case RELEASED:
        state = State.UNLOCKED;
        if (options.verbose) {
          sink.report(LockEvent.unlock(name, handleId, at, outcome.getRecord().orElseThrow()));
        }
        break;

      case NOT_LOCKED:
        fault(LockEvent.unownedUnlock(name, handleId, at), Reason.UNLOCK_OF_UNOWNED);
        break;

      case NOT_OWNER:
        fault(LockEvent.illegalUnlock(name, handleId, at, outcome.getRecord().orElseThrow()), Reason.ILLEGAL_UNLOCK);
        break;

      default:
        throw new UnsupportedOperationException("Unsupported outcome " + outcome);
    }
  }

  public void recordDestructLocation(Location location) {
    destructLocation = location;
  }

  @Override
  public void close() {
    if (registry.isHeldBy(ref.id(), handleId)) {
      unlock(destructLocation != null ? destructLocation : DEFAULT_DESTRUCT_LOCATION);
    }
  }

  private Location relativise(Location location) {
    return options.shortModuleNames ? location.shortModuleName() : location;
  }

  private void fault(LockEvent event, Reason reason) {
    sink.report(event);
    options.faultHandler.accept(new LockDisciplineException(reason, event.render(false)));
  }

  public boolean isHeld() {
    return registry.isHeldBy(ref.id(), handleId);
  }

  public State getState() {
    return state;
  }

  public long getHandleId() {
    return handleId;
  }

  public String getName() {
    return name;
  }

  public MutexRef getMutexRef() {
    return ref;
  }

  public boolean isDeferred() {
    return deferred;
  }

  @Override
  public String toString() {
    return LockHandle.class.getSimpleName() + "[handleId=" + handleId + ", name=" + name + ", ref=" + ref +
        ", deferred=" + deferred + ", state=" + state + ']';
  }
}
