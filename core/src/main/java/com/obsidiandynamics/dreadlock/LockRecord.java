package com.obsidiandynamics.dreadlock;

import java.util.*;

public final class LockRecord {
  private final long holderId;

  private final Location acquiredAt;

  public LockRecord(long holderId, Location acquiredAt) {
    this.holderId = holderId;
    this.acquiredAt = Objects.requireNonNull(acquiredAt);
  }

  public long holderId() {
    return holderId;
  }

  public Location acquiredAt() {
    return acquiredAt;
  }

  public boolean isHeldBy(long handleId) {
    return holderId == handleId;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    } else if (o instanceof LockRecord) {
      final var that = (LockRecord) o;
      return holderId == that.holderId && acquiredAt.equals(that.acquiredAt);
    } else {
      return false;
    }
  }

  @Override
  public int hashCode() {
    return 31 * Long.hashCode(holderId) + acquiredAt.hashCode();
  }

  @Override
  public String toString() {
    return LockRecord.class.getSimpleName() + "[holderId=" + holderId + ", acquiredAt=" + acquiredAt + ']';
  }
}
