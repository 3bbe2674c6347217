package com.phoenixgateway.client.log;

/**
 * Logging facade used throughout the gateway client. Messages accept SLF4J style {@code {}}
 * placeholders; a trailing {@link Throwable} argument is logged with its stack trace.
 */
public interface GatewayLogger {

  void trace(String message);

  void trace(String format, Object... arguments);

  void debug(String message);

  void debug(String format, Object... arguments);

  void info(String message);

  void info(String format, Object... arguments);

  void warn(String message);

  void warn(String format, Object... arguments);

  void error(String message);

  void error(String format, Object... arguments);

  void error(Throwable throwable, String message);

  void error(Throwable throwable, String format, Object... arguments);

  boolean isDebugEnabled();
}
