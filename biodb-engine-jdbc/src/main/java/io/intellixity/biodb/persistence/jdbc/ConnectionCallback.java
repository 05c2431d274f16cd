package io.intellixity.biodb.persistence.jdbc;

import java.io.IOException;
import java.sql.Connection;
import java.sql.SQLException;

/** Raw connection access for driver-specific paths (bulk copy). Must not close the connection. */
@FunctionalInterface
public interface ConnectionCallback<T> {
  T doInConnection(Connection connection) throws SQLException, IOException;
}
