package com.cowcord.client.crypto;

import com.cowcord.client.exceptions.CryptoException;
import java.security.MessageDigest;
import java.util.Base64;
import org.bouncycastle.crypto.DataLengthException;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.encodings.OAEPEncoding;
import org.bouncycastle.crypto.engines.RSABlindedEngine;
import org.bouncycastle.crypto.params.RSAKeyParameters;

/**
 * The keypair of one gateway connection.  Holds the private key; never shared between
 * connections and never serialized.
 */
public final class SessionKeyPair {

  private static final Base64.Encoder B64 = Base64.getEncoder();
  private static final Base64.Decoder B64D = Base64.getDecoder();
  private static final Base64.Encoder B64URL = Base64.getUrlEncoder().withoutPadding();
  private static final Base64.Decoder B64URLD = Base64.getUrlDecoder();

  private final RSAKeyParameters privateKey;
  private final byte[] encodedPublicKey;

  SessionKeyPair(final RSAKeyParameters privateKey, final byte[] encodedPublicKey) {
    if (!privateKey.isPrivate()) {
      throw new IllegalArgumentException("Expected an RSA private key");
    }
    this.privateKey = privateKey;
    this.encodedPublicKey = encodedPublicKey.clone();
  }

  /**
   * DER SubjectPublicKeyInfo of the public key.
   *
   * @return a copy of the encoded public key
   */
  public byte[] encodedPublicKey() {
    return encodedPublicKey.clone();
  }

  /**
   * The public key as sent in the {@code init} message.
   *
   * @return standard base64 of the DER public key
   */
  public String encodedPublicKeyBase64() {
    return B64.encodeToString(encodedPublicKey);
  }

  /**
   * The local fingerprint as the gateway encodes it.
   *
   * @return base64url, unpadded, of SHA-256 over the DER public key
   */
  public String fingerprint() {
    return B64URL.encodeToString(KeyMaterialManager.fingerprintOf(encodedPublicKey));
  }

  /**
   * Compares a gateway-supplied fingerprint with the local one in constant time.
   *
   * @param received base64url fingerprint from {@code pending_remote_init}
   * @return true if it names this keypair's public key
   */
  public boolean fingerprintMatches(final String received) {
    if (received == null) {
      return false;
    }
    byte[] receivedBytes;
    try {
      receivedBytes = B64URLD.decode(received);
    } catch (IllegalArgumentException e) {
      return false;
    }
    return MessageDigest.isEqual(KeyMaterialManager.fingerprintOf(encodedPublicKey), receivedBytes);
  }

  /**
   * RSA-OAEP (SHA-256, MGF1-SHA-256, empty label) decryption.
   *
   * @param ciphertext the ciphertext, exactly one RSA block
   * @return the plaintext
   * @throws CryptoException if the length does not fit the key or the padding is invalid
   */
  public byte[] decrypt(final byte[] ciphertext) {
    OAEPEncoding cipher = new OAEPEncoding(new RSABlindedEngine(), new SHA256Digest(), new SHA256Digest(), null);
    cipher.init(false, privateKey);
    if (ciphertext.length == 0 || ciphertext.length > cipher.getInputBlockSize()) {
      throw new CryptoException("Ciphertext length " + ciphertext.length
          + " does not fit a " + privateKey.getModulus().bitLength() + "-bit key", null);
    }
    try {
      return cipher.processBlock(ciphertext, 0, ciphertext.length);
    } catch (InvalidCipherTextException | DataLengthException e) {
      throw new CryptoException("OAEP decryption failed", e);
    }
  }

  /**
   * Decodes standard base64 and decrypts.
   *
   * @param ciphertextBase64 base64 ciphertext as carried in gateway and API payloads
   * @return the plaintext
   * @throws CryptoException if the value is not base64 or does not decrypt
   */
  public byte[] decryptBase64(final String ciphertextBase64) {
    if (ciphertextBase64 == null || ciphertextBase64.isBlank()) {
      throw new CryptoException("Missing ciphertext", null);
    }
    byte[] ciphertext;
    try {
      ciphertext = B64D.decode(ciphertextBase64);
    } catch (IllegalArgumentException e) {
      throw new CryptoException("Invalid base64 ciphertext", e);
    }
    return decrypt(ciphertext);
  }

  @Override
  public String toString() {
    return "SessionKeyPair[fingerprint=" + fingerprint() + "]";
  }
}
