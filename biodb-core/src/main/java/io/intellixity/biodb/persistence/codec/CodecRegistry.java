package io.intellixity.biodb.persistence.codec;

import io.intellixity.biodb.persistence.error.BiodbException;
import io.intellixity.biodb.persistence.error.DecodeException;
import io.intellixity.biodb.persistence.error.EncodeException;
import io.intellixity.biodb.persistence.error.OperationContext;
import io.intellixity.biodb.persistence.error.UnknownTypeException;
import io.intellixity.biodb.persistence.mapping.Row;
import io.intellixity.biodb.persistence.record.SequenceRecord;
import io.intellixity.biodb.persistence.schema.TableSchema;
import io.intellixity.biodb.persistence.util.BiodbFactoriesLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Record type tag to {@link SequenceCodec}.\n
 *
 * Built once at startup and immutable afterwards, so lookups need no locking. The
 * {@value #DEFAULT_TAG} codec ({@link JsonSourceCodec}) is always present unless replaced
 * explicitly. Unknown tags fail with {@link UnknownTypeException}.\n
 */
public final class CodecRegistry {
  private static final Logger log = LoggerFactory.getLogger(CodecRegistry.class);

  public static final String DEFAULT_TAG = "default";

  private final Map<String, SequenceCodec> byTag;

  private CodecRegistry(Map<String, SequenceCodec> byTag) {
    this.byTag = Collections.unmodifiableMap(new LinkedHashMap<>(byTag));
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Only the default codec. */
  public static CodecRegistry defaults() {
    return builder().build();
  }

  /** Default codec plus every {@link CodecProvider} on the classpath. */
  public static CodecRegistry discovered() {
    return builder().discover().build();
  }

  public SequenceCodec get(String tag) {
    SequenceCodec c = tag == null ? null : byTag.get(tag);
    if (c == null) {
      throw new UnknownTypeException("No codec registered for tag '" + tag + "'; known tags " + byTag.keySet(),
          OperationContext.of("codec-lookup", null, tag));
    }
    return c;
  }

  public boolean contains(String tag) {
    return byTag.containsKey(tag);
  }

  public Set<String> tags() {
    return byTag.keySet();
  }

  public static final class Builder {
    private final Map<String, SequenceCodec> codecs = new LinkedHashMap<>();
    private boolean defaultReplaced;

    private Builder() {
      codecs.put(DEFAULT_TAG, new JsonSourceCodec());
    }

    public Builder register(SequenceCodec codec) {
      Objects.requireNonNull(codec, "codec");
      String tag = codec.tag();
      if (tag == null || tag.isBlank()) throw new IllegalArgumentException("codec tag is required");
      if (DEFAULT_TAG.equals(tag) && !defaultReplaced) {
        defaultReplaced = true;
      } else if (codecs.containsKey(tag)) {
        throw new IllegalArgumentException("Duplicate codec tag: " + tag);
      }
      codecs.put(tag, codec);
      return this;
    }

    /**
     * Registers a codec from its three functions.\n
     * {@code encodeFn} receives whole batches; {@code decodeFn} one row at a time.
     */
    public Builder register(String tag,
                            Supplier<TableSchema> schemaFn,
                            Function<Collection<SequenceRecord>, List<Map<String, Object>>> encodeFn,
                            Function<Row, SequenceRecord> decodeFn) {
      return register(new FunctionCodec(tag,
          Objects.requireNonNull(schemaFn, "schemaFn"),
          Objects.requireNonNull(encodeFn, "encodeFn"),
          Objects.requireNonNull(decodeFn, "decodeFn")));
    }

    public Builder discover() {
      return discover(Thread.currentThread().getContextClassLoader());
    }

    public Builder discover(ClassLoader cl) {
      for (CodecProvider p : BiodbFactoriesLoader.load(CodecProvider.class, cl)) {
        for (SequenceCodec c : p.codecs()) {
          log.debug("biodb.codec discovered tag={} provider={}", c.tag(), p.getClass().getName());
          register(c);
        }
      }
      return this;
    }

    public CodecRegistry build() {
      return new CodecRegistry(codecs);
    }
  }

  static final class FunctionCodec implements SequenceCodec {
    private final String tag;
    private final Supplier<TableSchema> schemaFn;
    private final Function<Collection<SequenceRecord>, List<Map<String, Object>>> encodeFn;
    private final Function<Row, SequenceRecord> decodeFn;

    FunctionCodec(String tag,
                  Supplier<TableSchema> schemaFn,
                  Function<Collection<SequenceRecord>, List<Map<String, Object>>> encodeFn,
                  Function<Row, SequenceRecord> decodeFn) {
      this.tag = tag;
      this.schemaFn = schemaFn;
      this.encodeFn = encodeFn;
      this.decodeFn = decodeFn;
    }

    @Override public String tag() { return tag; }
    @Override public TableSchema schema() { return schemaFn.get(); }

    @Override
    public Map<String, Object> encode(SequenceRecord record) {
      List<Map<String, Object>> rows = encodeAll(List.of(record));
      if (rows.size() != 1) {
        throw new EncodeException("Encoder produced " + rows.size() + " rows for one record",
            OperationContext.of("encode", null, tag));
      }
      return rows.get(0);
    }

    @Override
    public List<Map<String, Object>> encodeAll(Collection<SequenceRecord> records) {
      List<Map<String, Object>> rows;
      try {
        rows = encodeFn.apply(records);
      } catch (BiodbException e) {
        throw e;
      } catch (RuntimeException e) {
        throw new EncodeException("Encoder failed", OperationContext.of("encode", null, tag), e);
      }
      if (rows == null) throw new EncodeException("Encoder returned null", OperationContext.of("encode", null, tag));
      return rows;
    }

    @Override
    public SequenceRecord decode(Row row) {
      SequenceRecord r;
      try {
        r = decodeFn.apply(row);
      } catch (BiodbException e) {
        throw e;
      } catch (RuntimeException e) {
        throw new DecodeException("Decoder failed", OperationContext.of("decode", null, tag), e);
      }
      if (r == null) throw new DecodeException("Decoder returned null", OperationContext.of("decode", null, tag));
      return r;
    }
  }
}
