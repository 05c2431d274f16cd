package io.intellixity.biodb.persistence.record;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical value forms for record fields.\n
 *
 * Integral numbers are held as {@link Long} (or {@link BigInteger} past the long range), floating
 * point as {@link Double}, text as {@link String}, collections as unmodifiable lists and
 * string-keyed maps as unmodifiable ordered maps. Anything else is kept as given.\n
 */
public final class FieldValues {
  private FieldValues() {}

  public static Object normalize(Object v) {
    if (v == null || v instanceof String || v instanceof Boolean || v instanceof Long || v instanceof Double) return v;
    if (v instanceof Integer || v instanceof Short || v instanceof Byte) return ((Number) v).longValue();
    if (v instanceof Float f) return f.doubleValue();
    if (v instanceof BigInteger b) return b.bitLength() < Long.SIZE ? (Object) b.longValue() : b;
    if (v instanceof CharSequence || v instanceof Character) return v.toString();
    if (v instanceof Collection<?> c) {
      List<Object> out = new ArrayList<>(c.size());
      for (Object o : c) out.add(normalize(o));
      return Collections.unmodifiableList(out);
    }
    if (v instanceof Map<?, ?> m && stringKeys(m)) {
      Map<String, Object> out = new LinkedHashMap<>();
      m.forEach((k, o) -> out.put((String) k, normalize(o)));
      return Collections.unmodifiableMap(out);
    }
    return v;
  }

  /**
   * Path of the first value (depth-first) that does not come back unchanged from JSON text, or
   * null when every value is JSON-native. Expects normalized values.
   */
  public static String firstNonJsonValue(Map<String, ?> fields) {
    for (Map.Entry<String, ?> e : fields.entrySet()) {
      String bad = nonJson(e.getKey(), e.getValue());
      if (bad != null) return bad;
    }
    return null;
  }

  private static String nonJson(String path, Object v) {
    if (v == null || v instanceof String || v instanceof Boolean || v instanceof Long || v instanceof BigInteger) {
      return null;
    }
    if (v instanceof Double d) return d.isNaN() || d.isInfinite() ? path + " (" + d + ")" : null;
    if (v instanceof List<?> l) {
      for (int i = 0; i < l.size(); i++) {
        String bad = nonJson(path + "[" + i + "]", l.get(i));
        if (bad != null) return bad;
      }
      return null;
    }
    if (v instanceof Map<?, ?> m && stringKeys(m)) {
      for (Map.Entry<?, ?> e : m.entrySet()) {
        String bad = nonJson(path + "." + e.getKey(), e.getValue());
        if (bad != null) return bad;
      }
      return null;
    }
    return path + " (" + v.getClass().getName() + ")";
  }

  private static boolean stringKeys(Map<?, ?> m) {
    for (Object k : m.keySet()) {
      if (!(k instanceof String)) return false;
    }
    return true;
  }
}
