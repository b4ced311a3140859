package com.obsidiandynamics.dreadlock;

import java.util.function.*;

public final class Faults {
  private Faults() {}

  public static void raise(LockDisciplineException fault) {
    throw fault;
  }

  public static void ignore(LockDisciplineException fault) {}

  public static Consumer<LockDisciplineException> halt(int status) {
    return fault -> Runtime.getRuntime().halt(status);
  }
}
