package io.intellixity.biodb.persistence.codec;

import java.util.Collection;
import java.util.List;

/** Listed twice in the test biodb.factories to check de-duplication. */
public final class NoteCodecProvider implements CodecProvider {
  @Override
  public Collection<SequenceCodec> codecs() {
    return List.of(CodecRegistryTest.noteCodec());
  }
}
