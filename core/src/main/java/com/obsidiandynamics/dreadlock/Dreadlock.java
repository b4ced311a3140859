package com.obsidiandynamics.dreadlock;

import com.obsidiandynamics.dreadlock.mutex.*;
import com.obsidiandynamics.dreadlock.report.*;
import com.obsidiandynamics.dreadlock.util.*;

import java.util.*;
import java.util.function.*;

public final class Dreadlock {
  public static class Options {
    public boolean assertOnDeadlock = true;

    // zero disables the warning
    public long performanceTimeoutMs = 1_000;

    public long deadlockTimeoutMs = 5_000;

    public boolean shortModuleNames = true;

    public boolean verbose;

    public long pollIntervalNanos = 500_000;

    public Consumer<LockDisciplineException> faultHandler = Faults::raise;

    void validate() {
      Assert.isArgument(performanceTimeoutMs >= 0, () -> "Performance timeout cannot be negative");
      Assert.isArgument(deadlockTimeoutMs > 0, () -> "Deadlock timeout must exceed 0");
      Assert.isArgument(pollIntervalNanos > 0, () -> "Poll interval must exceed 0");
      Assert.isNotNull(faultHandler, () -> "Fault handler cannot be null");
    }

    @Override
    public String toString() {
      return Options.class.getSimpleName() + "[assertOnDeadlock=" + assertOnDeadlock +
          ", performanceTimeoutMs=" + performanceTimeoutMs + ", deadlockTimeoutMs=" + deadlockTimeoutMs +
          ", shortModuleNames=" + shortModuleNames + ", verbose=" + verbose + ", pollIntervalNanos=" + pollIntervalNanos + ']';
    }
  }

  private final Options options;

  private final Registry registry;

  private final ReportSink sink;

  public Dreadlock(Options options, Registry registry, ReportSink sink) {
    options.validate();
    this.options = options;
    this.registry = Objects.requireNonNull(registry);
    this.sink = Objects.requireNonNull(sink);
  }

  public Dreadlock(Options options) {
    this(options, Registry.global(), ReportSink.console(! options.shortModuleNames));
  }

  public static Dreadlock withDefaults() {
    return new Dreadlock(new Options());
  }

  public LockHandle create(MutexRef ref, String name) {
    return create(ref, name, Location.caller(), false);
  }

  public LockHandle createDeferred(MutexRef ref, String name) {
    return create(ref, name, Location.caller(), true);
  }

  /**
   * Creates a handle over the given mutex.
   *
   * @param ref The mutex.
   * @param name The name under which the mutex is reported.
   * @param location The location of the creating scope.
   * @param deferred If {@code false}, the handle locks the mutex at {@code location} before returning.
   * @return The handle.
   */
  public LockHandle create(MutexRef ref, String name, Location location, boolean deferred) {
    final var handle = new LockHandle(this, ref, name, deferred);
    if (! deferred) {
      handle.lock(location);
    }
    return handle;
  }

  Options getOptions() {
    return options;
  }

  Registry getRegistry() {
    return registry;
  }

  ReportSink getSink() {
    return sink;
  }

  @Override
  public String toString() {
    return Dreadlock.class.getSimpleName() + "[options=" + options + ", sink=" + sink + ']';
  }
}
