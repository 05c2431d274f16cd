package io.intellixity.biodb.persistence.jdbc.bind;

import java.sql.PreparedStatement;
import java.sql.SQLException;

/** Binds one parameter value. The first binder in a chain that supports the value wins. */
public interface JdbcBinder {
  boolean supports(Object value);

  void bind(PreparedStatement ps, int position1Based, Object value) throws SQLException;
}
