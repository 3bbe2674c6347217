package com.phoenixgateway.client.dbclient.impl.jdbc;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/** Seam over {@link DriverManager} so the driver transport can be exercised without a driver. */
public interface JdbcConnectionFactory {

  JdbcConnectionFactory DRIVER_MANAGER = new JdbcConnectionFactory() {};

  /** Whether the named driver class can be loaded from the current class path. */
  default boolean isDriverAvailable(String driverClassName) {
    try {
      Class.forName(driverClassName);
      return true;
    } catch (ClassNotFoundException | LinkageError e) {
      return false;
    }
  }

  default Connection connect(String url, Properties properties) throws SQLException {
    return DriverManager.getConnection(url, properties);
  }
}
