package io.intellixity.biodb.persistence.record;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable domain record: an ordered field map.\n
 *
 * The persistence layer only reads {@link #ACCESSION}; every other field belongs to the codec
 * that stores the record. Values are held in {@link FieldValues} canonical form, so a record built
 * with {@code 3} and one decoded from JSON {@code 3} are equal.\n
 */
public record SequenceRecord(Map<String, Object> fields) {
  public static final String ACCESSION = "accession";

  public SequenceRecord {
    Objects.requireNonNull(fields, "fields");
    Map<String, Object> copy = new LinkedHashMap<>();
    fields.forEach((k, v) -> copy.put(k, FieldValues.normalize(v)));
    fields = Collections.unmodifiableMap(copy);
  }

  public static SequenceRecord of(Map<String, ?> fields) {
    return new SequenceRecord(new LinkedHashMap<>(fields));
  }

  public static Builder builder(String accession) {
    return new Builder().with(ACCESSION, accession);
  }

  /** Accession as text, or null when the record carries none. */
  public String accession() {
    Object v = fields.get(ACCESSION);
    return v == null ? null : String.valueOf(v);
  }

  public Object get(String field) {
    return fields.get(field);
  }

  public String getString(String field) {
    Object v = fields.get(field);
    return v == null ? null : String.valueOf(v);
  }

  public boolean has(String field) {
    return fields.containsKey(field);
  }

  public SequenceRecord with(String field, Object value) {
    Map<String, Object> m = new LinkedHashMap<>(fields);
    m.put(Objects.requireNonNull(field, "field"), value);
    return new SequenceRecord(m);
  }

  public static final class Builder {
    private final Map<String, Object> fields = new LinkedHashMap<>();

    private Builder() {}

    public Builder with(String field, Object value) {
      fields.put(Objects.requireNonNull(field, "field"), value);
      return this;
    }

    public SequenceRecord build() {
      return new SequenceRecord(fields);
    }
  }
}
