package com.obsidiandynamics.dreadlock.report;

import org.slf4j.*;

import java.util.*;

public final class Slf4jChannel implements ReportChannel {
  private final Logger logger;

  public Slf4jChannel() {
    this(LoggerFactory.getLogger(Slf4jChannel.class));
  }

  public Slf4jChannel(Logger logger) {
    this.logger = Objects.requireNonNull(logger);
  }

  @Override
  public void emit(LockEvent event, String text) {
    switch (event.getKind().getSeverity()) {
      case INFO:
        logger.info(text);
        break;
      case WARN:
        logger.warn(text);
        break;
      case ERROR:
        logger.error(text);
        break;
      default:
        throw new UnsupportedOperationException("Unsupported severity " + event.getKind().getSeverity());
    }
  }
}
