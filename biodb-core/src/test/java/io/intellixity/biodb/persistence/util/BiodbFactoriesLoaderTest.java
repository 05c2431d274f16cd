package io.intellixity.biodb.persistence.util;

import io.intellixity.biodb.persistence.codec.CodecProvider;
import io.intellixity.biodb.persistence.codec.NoteCodecProvider;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class BiodbFactoriesLoaderTest {
  @Test
  void loadsListedImplementationsOnce() {
    List<CodecProvider> providers = BiodbFactoriesLoader.load(CodecProvider.class);
    assertEquals(1, providers.size());
    assertInstanceOf(NoteCodecProvider.class, providers.get(0));
  }

  @Test
  void unlistedTypeYieldsNothing() {
    assertTrue(BiodbFactoriesLoader.load(Runnable.class).isEmpty());
  }
}
