package io.intellixity.biodb.persistence.codec;

import java.util.Collection;

/** Contributes codecs, discovered via {@code META-INF/biodb.factories}. */
public interface CodecProvider {
  Collection<SequenceCodec> codecs();
}
