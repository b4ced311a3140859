package com.obsidiandynamics.dreadlock.report;

import java.util.*;

public final class ReportSink {
  private final Object monitor = new Object();

  private final boolean continuation;

  private final List<ReportChannel> channels;

  public ReportSink(boolean continuation, List<ReportChannel> channels) {
    this.continuation = continuation;
    this.channels = List.copyOf(channels);
  }

  public ReportSink(boolean continuation, ReportChannel... channels) {
    this(continuation, Arrays.asList(channels));
  }

  public static ReportSink console(boolean continuation) {
    return new ReportSink(continuation, new PrintStreamChannel());
  }

  public void report(LockEvent event) {
    final var text = event.render(continuation);
    synchronized (monitor) {
      for (var channel : channels) {
        channel.emit(event, text);
      }
    }
  }

  @Override
  public String toString() {
    return ReportSink.class.getSimpleName() + "[continuation=" + continuation + ", channels=" + channels + ']';
  }
}
