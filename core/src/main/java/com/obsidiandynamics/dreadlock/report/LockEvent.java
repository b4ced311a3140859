package com.obsidiandynamics.dreadlock.report;

import com.obsidiandynamics.dreadlock.*;

import java.util.*;

public final class LockEvent {
  public static final String TAG = "[[ Dreadlock ]]";

  public enum Severity {
    INFO,
    WARN,
    ERROR
  }

  public enum Kind {
    LOCKING(Severity.INFO),
    LOCK_ATTEMPT(Severity.INFO),
    ILLEGAL_REENTRY(Severity.ERROR),
    PERFORMANCE_WARNING(Severity.WARN),
    DEADLOCK(Severity.ERROR),
    UNLOCK(Severity.INFO),
    ILLEGAL_UNLOCK(Severity.ERROR),
    UNOWNED_UNLOCK(Severity.ERROR);

    private final Severity severity;

    Kind(Severity severity) {
      this.severity = severity;
    }

    public Severity getSeverity() {
      return severity;
    }
  }

  private final Kind kind;

  private final String mutexName;

  private final long actorId;

  private final Location location;

  private final LockRecord other;

  private final long thresholdMs;

  private LockEvent(Kind kind, String mutexName, long actorId, Location location, LockRecord other, long thresholdMs) {
    this.kind = kind;
    this.mutexName = Objects.requireNonNull(mutexName);
    this.actorId = actorId;
    this.location = Objects.requireNonNull(location);
    this.other = other;
    this.thresholdMs = thresholdMs;
  }

  public static LockEvent locking(String mutexName, long actorId, Location location) {
    return new LockEvent(Kind.LOCKING, mutexName, actorId, location, null, 0);
  }

  public static LockEvent lockAttempt(String mutexName, long actorId, Location location, LockRecord holder) {
    return new LockEvent(Kind.LOCK_ATTEMPT, mutexName, actorId, location, holder, 0);
  }

  public static LockEvent illegalReentry(String mutexName, long actorId, Location location, LockRecord holder) {
    return new LockEvent(Kind.ILLEGAL_REENTRY, mutexName, actorId, location, Objects.requireNonNull(holder), 0);
  }

  public static LockEvent performanceWarning(String mutexName, long actorId, Location location, LockRecord holder, long thresholdMs) {
    return new LockEvent(Kind.PERFORMANCE_WARNING, mutexName, actorId, location, holder, thresholdMs);
  }

  public static LockEvent deadlock(String mutexName, long actorId, Location location, LockRecord holder, long timeoutMs) {
    return new LockEvent(Kind.DEADLOCK, mutexName, actorId, location, holder, timeoutMs);
  }

  public static LockEvent unlock(String mutexName, long actorId, Location location, LockRecord released) {
    return new LockEvent(Kind.UNLOCK, mutexName, actorId, location, Objects.requireNonNull(released), 0);
  }

  public static LockEvent illegalUnlock(String mutexName, long actorId, Location location, LockRecord holder) {
    return new LockEvent(Kind.ILLEGAL_UNLOCK, mutexName, actorId, location, Objects.requireNonNull(holder), 0);
  }

  public static LockEvent unownedUnlock(String mutexName, long actorId, Location location) {
    return new LockEvent(Kind.UNOWNED_UNLOCK, mutexName, actorId, location, null, 0);
  }

  public Kind getKind() {
    return kind;
  }

  public String getMutexName() {
    return mutexName;
  }

  public long getActorId() {
    return actorId;
  }

  public Location getLocation() {
    return location;
  }

  public Optional<LockRecord> getOther() {
    return Optional.ofNullable(other);
  }

  public long getThresholdMs() {
    return thresholdMs;
  }

  public String render(boolean continuation) {
    final var sb = new StringBuilder(TAG).append(' ');
    switch (kind) {
      case LOCKING:
        sb.append("Locking ").append(mutexName).append(" in module ").append(location);
        break;
      case LOCK_ATTEMPT:
        sb.append("Attempting to lock mutex ").append(mutexName).append(" in module ").append(location);
        appendHolder(sb, continuation);
        break;
      case ILLEGAL_REENTRY:
        sb.append("Illegal lock of mutex ").append(mutexName).append(" in module ").append(location).append(" when already held!");
        appendHolder(sb, continuation);
        break;
      case PERFORMANCE_WARNING:
        sb.append("Waited for ").append(mutexName).append(" in module ").append(location)
            .append(" longer than ").append(thresholdMs).append("ms; definite performance issue, potential deadlock");
        appendHolder(sb, continuation);
        break;
      case DEADLOCK:
        sb.append("Deadlock detected on mutex ").append(mutexName).append(" in module ").append(location)
            .append(" after ").append(thresholdMs).append("ms");
        appendHolder(sb, continuation);
        break;
      case UNLOCK:
        sb.append("Unlocking mutex ").append(mutexName).append(" in module ").append(location);
        appendSeparator(sb, continuation).append("locked in module ").append(other.acquiredAt());
        break;
      case ILLEGAL_UNLOCK:
        sb.append("Illegal unlock of mutex ").append(mutexName).append(" by ").append(actorId).append(" in module ").append(location);
        appendSeparator(sb, continuation).append("lock currently held by ").append(other.holderId())
            .append(" in module ").append(other.acquiredAt());
        break;
      case UNOWNED_UNLOCK:
        sb.append("Attempt to unlock unowned mutex ").append(mutexName).append(" in module ").append(location);
        break;
      default:
        throw new UnsupportedOperationException("Unsupported event kind " + kind);
    }
    return sb.toString();
  }

  private void appendHolder(StringBuilder sb, boolean continuation) {
    if (other != null) {
      appendSeparator(sb, continuation).append("currently locked in module ").append(other.acquiredAt());
    }
  }

  private static StringBuilder appendSeparator(StringBuilder sb, boolean continuation) {
    return sb.append(continuation ? ";\n   ... " : "; ");
  }

  @Override
  public String toString() {
    return LockEvent.class.getSimpleName() + "[kind=" + kind + ", mutexName=" + mutexName + ", actorId=" + actorId +
        ", location=" + location + ", other=" + other + ", thresholdMs=" + thresholdMs + ']';
  }
}
