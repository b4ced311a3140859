package com.obsidiandynamics.dreadlock;

import java.util.*;

public final class ReleaseOutcome {
  public enum Kind {
    RELEASED,
    NOT_LOCKED,
    NOT_OWNER
  }

  private static final ReleaseOutcome NOT_LOCKED = new ReleaseOutcome(Kind.NOT_LOCKED, null);

  private final Kind kind;

  private final LockRecord record;

  private ReleaseOutcome(Kind kind, LockRecord record) {
    this.kind = kind;
    this.record = record;
  }

  static ReleaseOutcome released(LockRecord removed) {
    return new ReleaseOutcome(Kind.RELEASED, Objects.requireNonNull(removed));
  }

  static ReleaseOutcome notLocked() {
    return NOT_LOCKED;
  }

  static ReleaseOutcome notOwner(LockRecord holder) {
    return new ReleaseOutcome(Kind.NOT_OWNER, Objects.requireNonNull(holder));
  }

  public Kind getKind() {
    return kind;
  }

  public Optional<LockRecord> getRecord() {
    return Optional.ofNullable(record);
  }

  @Override
  public String toString() {
    return ReleaseOutcome.class.getSimpleName() + "[kind=" + kind + ", record=" + record + ']';
  }
}
