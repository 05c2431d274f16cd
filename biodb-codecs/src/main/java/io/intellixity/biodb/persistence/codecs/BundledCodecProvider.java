package io.intellixity.biodb.persistence.codecs;

import io.intellixity.biodb.persistence.codec.CodecProvider;
import io.intellixity.biodb.persistence.codec.SequenceCodec;

import java.util.Collection;
import java.util.List;

/** Registers {@link FastaCodec} and {@link UniprotCodec}. */
public final class BundledCodecProvider implements CodecProvider {
  @Override
  public Collection<SequenceCodec> codecs() {
    return List.of(new FastaCodec(), new UniprotCodec());
  }
}
