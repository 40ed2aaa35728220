package org.abstractica.vaultbridge.impl.crypto;

import org.abstractica.vaultbridge.DecryptionException;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.util.Objects;

/**
 * AES-256-GCM encryption of single-use envelopes.
 *
 * <p>Sealing generates a fresh ephemeral P-256 key pair, agrees a key with the
 * recipient's long-term public key and encrypts under a random 12-byte IV.
 * The ephemeral private key is dropped when {@link #seal} returns, so each
 * envelope has its own key.</p>
 *
 * <p>Ciphertext layout:</p>
 * <pre>
 * [encrypted payload: variable][auth tag: 16 bytes]
 * </pre>
 */
public final class EnvelopeCipher
{
    private static final String ALGORITHM = "AES/GCM/NoPadding";
    public static final int IV_LENGTH = 12;
    public static final int TAG_LENGTH = 16;

    private static final SecureRandom RANDOM = new SecureRandom();

    private EnvelopeCipher() {}

    /**
     * Encrypts a payload for the recipient with a fresh ephemeral key.
     *
     * @param plaintext the payload
     * @param recipient the recipient's long-term public key
     * @return the sealed envelope
     */
    public static SealedEnvelope seal(byte[] plaintext, PublicKey recipient)
    {
        return seal(plaintext, recipient, new EcdhKeyExchange());
    }

    /**
     * Encrypts a payload for the recipient with the given ephemeral key exchange.
     *
     * @param plaintext the payload
     * @param recipient the recipient's public key
     * @param ephemeral the sender's single-use key exchange
     * @return the sealed envelope
     */
    public static SealedEnvelope seal(byte[] plaintext, PublicKey recipient, EcdhKeyExchange ephemeral)
    {
        Objects.requireNonNull(plaintext, "plaintext");
        Objects.requireNonNull(recipient, "recipient");
        Objects.requireNonNull(ephemeral, "ephemeral");

        byte[] key = ephemeral.deriveKey(recipient);
        byte[] iv = new byte[IV_LENGTH];
        RANDOM.nextBytes(iv);

        byte[] ciphertext = encrypt(key, iv, plaintext);
        return new SealedEnvelope(ciphertext, iv, ephemeral.getPublicKey());
    }

    /**
     * Decrypts an envelope with the recipient's key exchange.
     *
     * @param sealed    the envelope
     * @param recipient the recipient's key exchange
     * @return the plaintext
     * @throws DecryptionException if the sender key is invalid or the envelope does not authenticate
     */
    public static byte[] open(SealedEnvelope sealed, EcdhKeyExchange recipient)
    {
        Objects.requireNonNull(sealed, "sealed");
        Objects.requireNonNull(recipient, "recipient");

        byte[] key;
        try
        {
            PublicKey sender = EcdhKeyExchange.decodePublicKey(sealed.senderPublicKey());
            key = recipient.deriveKey(sender);
        }
        catch (IllegalArgumentException e)
        {
            throw new DecryptionException("Invalid sender public key", e);
        }

        return decrypt(key, sealed.iv(), sealed.ciphertext());
    }

    /**
     * Encrypts with AES-256-GCM.
     *
     * @param key       32-byte key
     * @param iv        12-byte IV
     * @param plaintext the data to encrypt
     * @return ciphertext with the 16-byte tag appended
     */
    public static byte[] encrypt(byte[] key, byte[] iv, byte[] plaintext)
    {
        checkKey(key);
        if (iv.length != IV_LENGTH)
        {
            throw new IllegalArgumentException("IV must be " + IV_LENGTH + " bytes");
        }

        try
        {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"),
                    new GCMParameterSpec(TAG_LENGTH * 8, iv));
            return cipher.doFinal(plaintext);
        }
        catch (GeneralSecurityException e)
        {
            throw new IllegalStateException("Encryption failed", e);
        }
    }

    /**
     * Decrypts and authenticates AES-256-GCM ciphertext.
     *
     * @param key        32-byte key
     * @param iv         12-byte IV
     * @param ciphertext ciphertext with the 16-byte tag appended
     * @return the plaintext
     * @throws DecryptionException if the input is malformed or the tag does not verify
     */
    public static byte[] decrypt(byte[] key, byte[] iv, byte[] ciphertext)
    {
        checkKey(key);
        if (iv == null || iv.length != IV_LENGTH)
        {
            throw new DecryptionException("IV must be " + IV_LENGTH + " bytes");
        }
        if (ciphertext == null || ciphertext.length < TAG_LENGTH)
        {
            throw new DecryptionException("Ciphertext too short");
        }

        try
        {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"),
                    new GCMParameterSpec(TAG_LENGTH * 8, iv));
            return cipher.doFinal(ciphertext);
        }
        catch (GeneralSecurityException e)
        {
            throw new DecryptionException("Decryption failed: " + e.getMessage(), e);
        }
    }

    private static void checkKey(byte[] key)
    {
        Objects.requireNonNull(key, "key");
        if (key.length != EcdhKeyExchange.KEY_LENGTH)
        {
            throw new IllegalArgumentException("Key must be " + EcdhKeyExchange.KEY_LENGTH + " bytes");
        }
    }
}
