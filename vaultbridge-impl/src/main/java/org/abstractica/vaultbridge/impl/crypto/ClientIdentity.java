package org.abstractica.vaultbridge.impl.crypto;

import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.MessageDigest;
import java.security.PublicKey;
import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Long-term identity of a bridge client.
 *
 * <p>The client id is the lowercase hex of the first 16 bytes of SHA-256
 * over the SPKI encoding of the public key, so it is stable for as long as
 * the key pair is. The identity is created once and never rotated.</p>
 */
public final class ClientIdentity
{
    private static final int CLIENT_ID_BYTES = 16;

    private final EcdhKeyExchange keyExchange;
    private final byte[] publicKey;
    private final String clientId;

    private ClientIdentity(EcdhKeyExchange keyExchange)
    {
        this.keyExchange = keyExchange;
        this.publicKey = keyExchange.getPublicKey();
        this.clientId = deriveClientId(publicKey);
    }

    /**
     * Generates a new identity.
     *
     * @return the identity
     */
    public static ClientIdentity generate()
    {
        return new ClientIdentity(new EcdhKeyExchange());
    }

    /**
     * Wraps an existing P-256 key pair.
     *
     * @param keyPair the key pair
     * @return the identity
     */
    public static ClientIdentity fromKeyPair(KeyPair keyPair)
    {
        return new ClientIdentity(new EcdhKeyExchange(keyPair));
    }

    /**
     * Derives the client id from an SPKI-encoded public key.
     *
     * @param encodedPublicKey the encoded public key
     * @return 32 lowercase hex characters
     */
    public static String deriveClientId(byte[] encodedPublicKey)
    {
        Objects.requireNonNull(encodedPublicKey, "encodedPublicKey");
        try
        {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(encodedPublicKey);
            return HexFormat.of().formatHex(Arrays.copyOf(hash, CLIENT_ID_BYTES));
        }
        catch (GeneralSecurityException e)
        {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public String getClientId()
    {
        return clientId;
    }

    /**
     * Returns the public key in SPKI DER encoding.
     *
     * @return a copy of the encoded key
     */
    public byte[] getPublicKey()
    {
        return publicKey.clone();
    }

    /**
     * Returns the public key as base64 SPKI, the form used on the wire.
     *
     * @return base64 public key
     */
    public String getPublicKeyBase64()
    {
        return Base64.getEncoder().encodeToString(publicKey);
    }

    /**
     * Computes the symmetric key shared with a sender's ephemeral key.
     *
     * @param senderPublicKey the sender's public key
     * @return 32-byte AES key
     */
    public byte[] deriveKey(PublicKey senderPublicKey)
    {
        return keyExchange.deriveKey(senderPublicKey);
    }

    /**
     * Decrypts an envelope addressed to this identity.
     *
     * @param sealed the envelope
     * @return the plaintext
     * @throws org.abstractica.vaultbridge.DecryptionException if the envelope does not authenticate
     */
    public byte[] open(SealedEnvelope sealed)
    {
        return EnvelopeCipher.open(sealed, keyExchange);
    }

    @Override
    public String toString()
    {
        return "ClientIdentity[" + clientId + "]";
    }
}
