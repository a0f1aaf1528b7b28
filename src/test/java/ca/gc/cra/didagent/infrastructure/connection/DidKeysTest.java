package ca.gc.cra.didagent.infrastructure.connection;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.didagent.domain.connection.AgentIdentity;
import ca.gc.cra.didagent.domain.util.Base58;
import java.util.Arrays;
import java.util.HexFormat;
import org.junit.jupiter.api.Test;

class DidKeysTest {
  // RFC 8032 section 7.1, test 1
  private static final byte[] SECRET =
      HexFormat.of().parseHex("9d61b19deffd5a60ba844af492ec2cc44449c5697b326919703bac031cae7f60");
  private static final byte[] PUBLIC =
      HexFormat.of().parseHex("d75a980182b10ab7d54bfed3c964073a0ee172f3daa62325af021a68f707511a");

  @Test
  void publicKeyMatchesRfc8032Vector() {
    assertArrayEquals(PUBLIC, DidKeys.publicKey(SECRET));
  }

  @Test
  void identityEncodesVerkeyAndDidPrefix() {
    AgentIdentity identity = DidKeys.fromSeed(SECRET);

    assertEquals(Base58.encode(PUBLIC), identity.verkey());
    assertEquals(Base58.encode(Arrays.copyOf(PUBLIC, 16)), identity.did());
  }

  @Test
  void sameSeedYieldsSameIdentity() {
    byte[] seed = "00000000000000000000000000000My1".getBytes();

    assertEquals(DidKeys.fromSeed(seed), DidKeys.fromSeed(seed.clone()));
  }

  @Test
  void randomIdentitiesDiffer() {
    assertNotEquals(DidKeys.random(), DidKeys.random());
  }

  @Test
  void rejectsSeedOfWrongLength() {
    assertThrows(IllegalArgumentException.class, () -> DidKeys.fromSeed(new byte[31]));
  }
}
