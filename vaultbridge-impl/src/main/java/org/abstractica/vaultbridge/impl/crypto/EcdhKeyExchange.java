package org.abstractica.vaultbridge.impl.crypto;

import javax.crypto.KeyAgreement;
import java.security.AlgorithmParameters;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.interfaces.ECPublicKey;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.ECParameterSpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Arrays;
import java.util.Objects;

/**
 * P-256 Elliptic Curve Diffie-Hellman key exchange.
 *
 * <p>Holds one key pair and computes shared secrets with peer public keys.
 * Public keys travel in their standard X.509 SubjectPublicKeyInfo (SPKI)
 * DER encoding.</p>
 */
public final class EcdhKeyExchange
{
    private static final String ALGORITHM = "EC";
    private static final String AGREEMENT = "ECDH";
    private static final String CURVE = "secp256r1";

    /** Length of the symmetric key taken from the shared secret. */
    public static final int KEY_LENGTH = 32;

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final ECParameterSpec P256 = curveParameters();

    private final KeyPair keyPair;

    /**
     * Creates a key exchange with a freshly generated key pair.
     */
    public EcdhKeyExchange()
    {
        this(generateKeyPair());
    }

    /**
     * Creates a key exchange over an existing P-256 key pair.
     *
     * @param keyPair the key pair
     */
    public EcdhKeyExchange(KeyPair keyPair)
    {
        this.keyPair = Objects.requireNonNull(keyPair, "keyPair");
        if (!(keyPair.getPublic() instanceof ECPublicKey publicKey))
        {
            throw new IllegalArgumentException("Not an EC key pair: " + keyPair.getPublic().getAlgorithm());
        }
        requireP256(publicKey);
    }

    /**
     * Generates a new P-256 key pair.
     *
     * @return the key pair
     */
    public static KeyPair generateKeyPair()
    {
        try
        {
            KeyPairGenerator generator = KeyPairGenerator.getInstance(ALGORITHM);
            generator.initialize(new ECGenParameterSpec(CURVE), RANDOM);
            return generator.generateKeyPair();
        }
        catch (GeneralSecurityException e)
        {
            throw new IllegalStateException("Failed to generate P-256 key pair", e);
        }
    }

    /**
     * Returns the key pair.
     *
     * @return the key pair
     */
    public KeyPair getKeyPair()
    {
        return keyPair;
    }

    /**
     * Returns the public key in SPKI DER encoding.
     *
     * @return encoded public key
     */
    public byte[] getPublicKey()
    {
        return keyPair.getPublic().getEncoded();
    }

    /**
     * Computes the shared secret with the peer's public key.
     *
     * @param peerPublicKey the peer's public key
     * @return the raw ECDH shared secret (32 bytes for P-256)
     */
    public byte[] computeSharedSecret(PublicKey peerPublicKey)
    {
        Objects.requireNonNull(peerPublicKey, "peerPublicKey");
        try
        {
            KeyAgreement keyAgreement = KeyAgreement.getInstance(AGREEMENT);
            keyAgreement.init(keyPair.getPrivate());
            keyAgreement.doPhase(peerPublicKey, true);
            return keyAgreement.generateSecret();
        }
        catch (GeneralSecurityException e)
        {
            throw new IllegalArgumentException("Key agreement failed", e);
        }
    }

    /**
     * Computes the symmetric key shared with the peer: the first 32 bytes of
     * the ECDH shared secret.
     *
     * @param peerPublicKey the peer's public key
     * @return 32-byte AES key
     */
    public byte[] deriveKey(PublicKey peerPublicKey)
    {
        return deriveKey(computeSharedSecret(peerPublicKey));
    }

    /**
     * Takes the first 32 bytes of a shared secret as the symmetric key.
     *
     * @param sharedSecret the shared secret
     * @return 32-byte AES key
     */
    public static byte[] deriveKey(byte[] sharedSecret)
    {
        Objects.requireNonNull(sharedSecret, "sharedSecret");
        if (sharedSecret.length < KEY_LENGTH)
        {
            throw new IllegalArgumentException(
                    "Shared secret must be at least " + KEY_LENGTH + " bytes: " + sharedSecret.length);
        }
        return Arrays.copyOf(sharedSecret, KEY_LENGTH);
    }

    /**
     * Decodes a P-256 public key from its SPKI DER encoding.
     *
     * @param encoded the encoded key
     * @return the public key
     * @throws IllegalArgumentException if the bytes are not a valid P-256 public key
     */
    public static PublicKey decodePublicKey(byte[] encoded)
    {
        Objects.requireNonNull(encoded, "encoded");
        PublicKey key;
        try
        {
            KeyFactory keyFactory = KeyFactory.getInstance(ALGORITHM);
            key = keyFactory.generatePublic(new X509EncodedKeySpec(encoded));
        }
        catch (GeneralSecurityException e)
        {
            throw new IllegalArgumentException("Invalid EC public key", e);
        }
        requireP256((ECPublicKey) key);
        return key;
    }

    private static void requireP256(ECPublicKey key)
    {
        ECParameterSpec params = key.getParams();
        if (!P256.getCurve().equals(params.getCurve())
                || !P256.getOrder().equals(params.getOrder())
                || !P256.getGenerator().equals(params.getGenerator())
                || P256.getCofactor() != params.getCofactor())
        {
            throw new IllegalArgumentException("Public key is not on curve " + CURVE);
        }
    }

    private static ECParameterSpec curveParameters()
    {
        try
        {
            AlgorithmParameters parameters = AlgorithmParameters.getInstance(ALGORITHM);
            parameters.init(new ECGenParameterSpec(CURVE));
            return parameters.getParameterSpec(ECParameterSpec.class);
        }
        catch (GeneralSecurityException e)
        {
            throw new IllegalStateException("P-256 parameters unavailable", e);
        }
    }
}
