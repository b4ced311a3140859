package com.obsidiandynamics.dreadlock;

public final class LockDisciplineException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  public enum Reason {
    ILLEGAL_REENTRY,
    UNLOCK_OF_UNOWNED,
    ILLEGAL_UNLOCK,
    DEADLOCK_TIMED_OUT
  }

  private final Reason reason;

  public LockDisciplineException(Reason reason, String m) {
    super(m, null);
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }
}
