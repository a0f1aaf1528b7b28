package ca.gc.cra.didagent.infrastructure.connection;

import ca.gc.cra.didagent.domain.connection.AgentIdentity;
import ca.gc.cra.didagent.domain.util.Base58;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.SecureRandom;
import java.security.spec.NamedParameterSpec;
import java.util.Arrays;
import java.util.Objects;

/**
 * Ed25519 key derivation for DIDs.
 *
 * <p>A 32-byte seed is used directly as the Ed25519 private key, so the same seed always yields
 * the same verification key. The DID is the Base58 encoding of the first 16 bytes of the
 * verification key.</p>
 */
public final class DidKeys {
  public static final int SEED_LENGTH = 32;
  private static final int PUBLIC_KEY_LENGTH = 32;
  private static final int DID_BYTES = 16;
  private static final SecureRandom RANDOM = new SecureRandom();

  private DidKeys() {}

  /**
   * Derives the identity for {@code seed}.
   *
   * @param seed 32 bytes
   * @return DID and Base58 verkey
   * @throws IllegalArgumentException if {@code seed} is not 32 bytes
   * @throws IllegalStateException if the JDK offers no Ed25519 support
   */
  public static AgentIdentity fromSeed(byte[] seed) {
    Objects.requireNonNull(seed, "seed");
    if (seed.length != SEED_LENGTH) {
      throw new IllegalArgumentException("Seed must be " + SEED_LENGTH + " bytes, got " + seed.length);
    }
    byte[] verkey = publicKey(seed);
    return new AgentIdentity(Base58.encode(Arrays.copyOf(verkey, DID_BYTES)), Base58.encode(verkey));
  }

  /**
   * @return an identity from a fresh random seed
   */
  public static AgentIdentity random() {
    byte[] seed = new byte[SEED_LENGTH];
    RANDOM.nextBytes(seed);
    return fromSeed(seed);
  }

  /**
   * Returns the raw 32-byte Ed25519 public key for {@code seed}.
   */
  static byte[] publicKey(byte[] seed) {
    try {
      KeyPairGenerator generator = KeyPairGenerator.getInstance("Ed25519");
      generator.initialize(NamedParameterSpec.ED25519, new SeedSource(seed));
      KeyPair pair = generator.generateKeyPair();
      byte[] encoded = pair.getPublic().getEncoded();
      // X.509 SubjectPublicKeyInfo; the raw key is the trailing 32 bytes
      return Arrays.copyOfRange(encoded, encoded.length - PUBLIC_KEY_LENGTH, encoded.length);
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("Ed25519 key generation unavailable", ex);
    }
  }

  /** Random source that hands the seed to the key generator as the private key bytes. */
  private static final class SeedSource extends SecureRandom {
    private static final long serialVersionUID = 1L;
    private final byte[] seed;

    private SeedSource(byte[] seed) {
      this.seed = seed.clone();
    }

    @Override
    public void nextBytes(byte[] bytes) {
      System.arraycopy(seed, 0, bytes, 0, Math.min(seed.length, bytes.length));
    }
  }
}
