package com.obsidiandynamics.dreadlock.report;

@FunctionalInterface
public interface ReportChannel {
  void emit(LockEvent event, String text);
}
