package com.phoenixgateway.client.log;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link GatewayLogger} backed by SLF4J. */
public class Slf4jLogger implements GatewayLogger {

  private final Logger logger;

  public Slf4jLogger(Class<?> clazz) {
    this.logger = LoggerFactory.getLogger(clazz);
  }

  public Slf4jLogger(String name) {
    this.logger = LoggerFactory.getLogger(name);
  }

  @Override
  public void trace(String message) {
    logger.trace(message);
  }

  @Override
  public void trace(String format, Object... arguments) {
    logger.trace(format, arguments);
  }

  @Override
  public void debug(String message) {
    logger.debug(message);
  }

  @Override
  public void debug(String format, Object... arguments) {
    logger.debug(format, arguments);
  }

  @Override
  public void info(String message) {
    logger.info(message);
  }

  @Override
  public void info(String format, Object... arguments) {
    logger.info(format, arguments);
  }

  @Override
  public void warn(String message) {
    logger.warn(message);
  }

  @Override
  public void warn(String format, Object... arguments) {
    logger.warn(format, arguments);
  }

  @Override
  public void error(String message) {
    logger.error(message);
  }

  @Override
  public void error(String format, Object... arguments) {
    logger.error(format, arguments);
  }

  @Override
  public void error(Throwable throwable, String message) {
    logger.error(message, throwable);
  }

  @Override
  public void error(Throwable throwable, String format, Object... arguments) {
    Object[] withThrowable = new Object[arguments.length + 1];
    System.arraycopy(arguments, 0, withThrowable, 0, arguments.length);
    withThrowable[arguments.length] = throwable;
    logger.error(format, withThrowable);
  }

  @Override
  public boolean isDebugEnabled() {
    return logger.isDebugEnabled();
  }
}
