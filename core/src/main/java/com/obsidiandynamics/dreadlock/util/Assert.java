package com.obsidiandynamics.dreadlock.util;

import java.util.function.*;

public final class Assert {
  private Assert() {}

  public static Supplier<String> withMessage(String message) {
    return () -> message;
  }

  public static <X extends Throwable> void that(boolean condition, Function<String, X> errorMaker, Supplier<String> messageBuilder) throws X {
    if (! condition) {
      throw errorMaker.apply(messageBuilder.get());
    }
  }

  public static void isArgument(boolean condition, Supplier<String> messageBuilder) {
    that(condition, IllegalArgumentException::new, messageBuilder);
  }

  public static <T> T isNotNull(T obj, Supplier<String> messageBuilder) {
    that(obj != null, NullPointerException::new, messageBuilder);
    return obj;
  }
}
