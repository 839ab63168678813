package ca.gc.cra.kestrel.support;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.LoggerFactory;

/** Attaches a Logback {@link ListAppender} to one logger until closed. */
public final class LogCapture implements AutoCloseable {
  private final Logger logger;
  private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
  private final Level previousLevel;

  private LogCapture(Class<?> type) {
    logger = (Logger) LoggerFactory.getLogger(type);
    previousLevel = logger.getLevel();
    logger.setLevel(Level.DEBUG);
    appender.start();
    logger.addAppender(appender);
  }

  public static LogCapture of(Class<?> type) {
    return new LogCapture(type);
  }

  public List<ILoggingEvent> events() {
    return List.copyOf(appender.list);
  }

  public List<ILoggingEvent> events(Level level) {
    return appender.list.stream().filter(e -> e.getLevel() == level).collect(Collectors.toList());
  }

  public boolean contains(Level level, String fragment) {
    return appender.list.stream()
        .anyMatch(e -> e.getLevel() == level && e.getFormattedMessage().contains(fragment));
  }

  @Override
  public void close() {
    logger.detachAppender(appender);
    logger.setLevel(previousLevel);
    appender.stop();
  }
}
