package org.abstractica.vaultbridge.impl.crypto;

import org.abstractica.vaultbridge.DecryptionException;

import java.util.Base64;
import java.util.Objects;

/**
 * Encrypted payload together with what the recipient needs to open it.
 *
 * @param ciphertext      encrypted payload with the GCM tag appended
 * @param iv              12-byte IV
 * @param senderPublicKey the sender's public key (SPKI DER)
 */
public record SealedEnvelope(byte[] ciphertext, byte[] iv, byte[] senderPublicKey)
{
    public SealedEnvelope
    {
        Objects.requireNonNull(ciphertext, "ciphertext");
        Objects.requireNonNull(iv, "iv");
        Objects.requireNonNull(senderPublicKey, "senderPublicKey");
    }

    /**
     * Decodes the base64 fields of a wire envelope.
     *
     * @param ciphertext      base64 ciphertext with tag
     * @param iv              base64 IV
     * @param senderPublicKey base64 SPKI sender key
     * @return the envelope
     * @throws DecryptionException if a field is missing or not valid base64
     */
    public static SealedEnvelope fromBase64(String ciphertext, String iv, String senderPublicKey)
    {
        if (ciphertext == null || iv == null || senderPublicKey == null)
        {
            throw new DecryptionException("Envelope is missing message, iv or publicKey");
        }
        try
        {
            Base64.Decoder decoder = Base64.getDecoder();
            return new SealedEnvelope(
                    decoder.decode(ciphertext),
                    decoder.decode(iv),
                    decoder.decode(senderPublicKey));
        }
        catch (IllegalArgumentException e)
        {
            throw new DecryptionException("Envelope field is not valid base64", e);
        }
    }

    public String ciphertextBase64()
    {
        return Base64.getEncoder().encodeToString(ciphertext);
    }

    public String ivBase64()
    {
        return Base64.getEncoder().encodeToString(iv);
    }

    public String senderPublicKeyBase64()
    {
        return Base64.getEncoder().encodeToString(senderPublicKey);
    }
}
