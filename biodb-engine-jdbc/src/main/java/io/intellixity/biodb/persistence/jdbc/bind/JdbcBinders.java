package io.intellixity.biodb.persistence.jdbc.bind;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Ordered binder chain.\n
 *
 * Dialect binders are evaluated before the base JDBC binders; the last base binder falls back to
 * {@link PreparedStatement#setObject(int, Object)}.\n
 */
public final class JdbcBinders {
  private static final List<JdbcBinder> BASE = List.of(
      new NullBinder(),
      new BytesBinder(),
      new InstantBinder(),
      new SetObjectBinder()
  );

  private final List<JdbcBinder> chain;

  private JdbcBinders(List<JdbcBinder> chain) {
    this.chain = List.copyOf(chain);
  }

  public static JdbcBinders defaults() {
    return new JdbcBinders(BASE);
  }

  public static JdbcBinders withDialectBinders(Collection<JdbcBinder> dialectBinders) {
    List<JdbcBinder> out = new ArrayList<>(dialectBinders);
    out.addAll(BASE);
    return new JdbcBinders(out);
  }

  public void bindAll(PreparedStatement ps, List<Object> params) throws SQLException {
    for (int i = 0; i < params.size(); i++) {
      bind(ps, i + 1, params.get(i));
    }
  }

  public void bind(PreparedStatement ps, int position1Based, Object value) throws SQLException {
    for (JdbcBinder b : chain) {
      if (b.supports(value)) {
        b.bind(ps, position1Based, value);
        return;
      }
    }
    throw new IllegalStateException("No binder for " + value.getClass().getName());
  }

  static final class NullBinder implements JdbcBinder {
    @Override public boolean supports(Object value) { return value == null; }

    @Override
    public void bind(PreparedStatement ps, int pos, Object value) throws SQLException {
      ps.setNull(pos, Types.NULL);
    }
  }

  static final class BytesBinder implements JdbcBinder {
    @Override public boolean supports(Object value) { return value instanceof byte[]; }

    @Override
    public void bind(PreparedStatement ps, int pos, Object value) throws SQLException {
      ps.setBytes(pos, (byte[]) value);
    }
  }

  static final class InstantBinder implements JdbcBinder {
    @Override public boolean supports(Object value) { return value instanceof Instant; }

    @Override
    public void bind(PreparedStatement ps, int pos, Object value) throws SQLException {
      ps.setTimestamp(pos, Timestamp.from((Instant) value));
    }
  }

  static final class SetObjectBinder implements JdbcBinder {
    @Override public boolean supports(Object value) { return true; }

    @Override
    public void bind(PreparedStatement ps, int pos, Object value) throws SQLException {
      ps.setObject(pos, value);
    }
  }
}
