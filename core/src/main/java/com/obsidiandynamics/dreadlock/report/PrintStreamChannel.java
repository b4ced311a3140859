package com.obsidiandynamics.dreadlock.report;

import java.io.*;
import java.util.*;

public final class PrintStreamChannel implements ReportChannel {
  private final PrintStream out;

  public PrintStreamChannel() {
    this(System.out);
  }

  public PrintStreamChannel(PrintStream out) {
    this.out = Objects.requireNonNull(out);
  }

  @Override
  public void emit(LockEvent event, String text) {
    out.format("%s%n", text);
    out.flush();
  }
}
