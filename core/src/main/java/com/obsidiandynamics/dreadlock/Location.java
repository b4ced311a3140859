package com.obsidiandynamics.dreadlock;

import com.obsidiandynamics.dreadlock.util.*;

import java.util.*;
import java.util.regex.*;

public final class Location {
  private static final Pattern PATH_SEPARATORS = Pattern.compile("[\\\\/]+");

  private static final StackWalker walker = StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);

  private static final Set<Class<?>> INTERNAL_FRAMES = Set.of(Location.class, LockHandle.class, Dreadlock.class);

  private static final Location UNKNOWN = new Location("<unknown>", -1);

  private final String module;

  private final int line;

  private Location(String module, int line) {
    this.module = module;
    this.line = line;
  }

  public static Location of(String module, int line) {
    Assert.isNotNull(module, Assert.withMessage("Module cannot be null"));
    return new Location(module, line);
  }

  public static Location unknown() {
    return UNKNOWN;
  }

  public static Location caller() {
    return walker.walk(frames -> frames
        .filter(frame -> !INTERNAL_FRAMES.contains(frame.getDeclaringClass()))
        .findFirst())
        .map(frame -> new Location(frame.getFileName() != null ? frame.getFileName() : frame.getClassName(),
                                   frame.getLineNumber()))
        .orElse(UNKNOWN);
  }

  public String module() {
    return module;
  }

  public int line() {
    return line;
  }

  public Location shortModuleName() {
    final var parts = PATH_SEPARATORS.split(module);
    final var baseName = parts.length == 0 ? module : parts[parts.length - 1];
    return baseName.equals(module) ? this : new Location(baseName, line);
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    } else if (o instanceof Location) {
      final var that = (Location) o;
      return line == that.line && module.equals(that.module);
    } else {
      return false;
    }
  }

  @Override
  public int hashCode() {
    return 31 * module.hashCode() + line;
  }

  @Override
  public String toString() {
    return module + ":" + line;
  }
}
