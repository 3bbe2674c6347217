package com.phoenixgateway.client.log;

/** Factory for {@link GatewayLogger} instances. */
public class GatewayLoggerFactory {

  private GatewayLoggerFactory() {
    // Prevent instantiation
  }

  public static GatewayLogger getLogger(Class<?> clazz) {
    return new Slf4jLogger(clazz);
  }

  public static GatewayLogger getLogger(String name) {
    return new Slf4jLogger(name);
  }
}
