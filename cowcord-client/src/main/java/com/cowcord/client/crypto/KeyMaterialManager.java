package com.cowcord.client.crypto;

import com.cowcord.client.config.RemoteAuthClientConfig;
import com.cowcord.client.exceptions.CryptoException;
import java.io.IOException;
import java.math.BigInteger;
import java.security.SecureRandom;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.bouncycastle.asn1.ASN1Encoding;
import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.RSAKeyPairGenerator;
import org.bouncycastle.crypto.params.RSAKeyGenerationParameters;
import org.bouncycastle.crypto.params.RSAKeyParameters;
import org.bouncycastle.crypto.util.SubjectPublicKeyInfoFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates the ephemeral RSA keypair used for one gateway connection.
 * <p>
 * The gateway encrypts every secret it sends (nonce, user payload, token) with RSA-OAEP
 * against the public key the client hands over in {@code init}, using SHA-256 for both the OAEP
 * digest and MGF1.  A keypair lives exactly as long as one connection; every reconnect calls
 * {@link #generate()} again.
 */
@Singleton
public class KeyMaterialManager {

  private static final Logger log = LoggerFactory.getLogger(KeyMaterialManager.class);

  private static final BigInteger PUBLIC_EXPONENT = BigInteger.valueOf(0x10001);
  // Miller-Rabin certainty for prime generation.
  private static final int PRIME_CERTAINTY = 112;

  private final int keySize;
  private final SecureRandom random;

  /**
   * Instantiates a new Key material manager.
   *
   * @param config the client config
   */
  @Inject
  public KeyMaterialManager(final RemoteAuthClientConfig config) {
    this(config.rsaKeySize(), new SecureRandom());
  }

  /**
   * Instantiates a new Key material manager with an explicit random source.
   *
   * @param keySize the RSA modulus size in bits
   * @param random  the random source
   */
  public KeyMaterialManager(final int keySize, final SecureRandom random) {
    log.info("KeyMaterialManager({})", keySize);
    this.keySize = keySize;
    this.random = random;
  }

  /**
   * SHA-256 of the DER-encoded public key.
   *
   * @param publicKeyBytes DER SubjectPublicKeyInfo
   * @return the 32-byte digest
   */
  public static byte[] fingerprintOf(final byte[] publicKeyBytes) {
    SHA256Digest digest = new SHA256Digest();
    digest.update(publicKeyBytes, 0, publicKeyBytes.length);
    byte[] out = new byte[digest.getDigestSize()];
    digest.doFinal(out, 0);
    return out;
  }

  /**
   * Generates a fresh keypair.
   *
   * @return the session key pair
   * @throws CryptoException if the key cannot be generated or encoded
   */
  public SessionKeyPair generate() {
    log.debug("generate()");
    try {
      RSAKeyPairGenerator generator = new RSAKeyPairGenerator();
      generator.init(new RSAKeyGenerationParameters(PUBLIC_EXPONENT, random, keySize, PRIME_CERTAINTY));
      AsymmetricCipherKeyPair keyPair = generator.generateKeyPair();
      byte[] encodedPublicKey = SubjectPublicKeyInfoFactory
          .createSubjectPublicKeyInfo(keyPair.getPublic())
          .getEncoded(ASN1Encoding.DER);
      return new SessionKeyPair((RSAKeyParameters) keyPair.getPrivate(), encodedPublicKey);
    } catch (IOException | RuntimeException e) {
      throw new CryptoException("Unable to generate RSA key pair", e);
    }
  }
}
