package org.abstractica.vaultbridge;

/**
 * An inbound envelope could not be authenticated, decrypted or parsed.
 *
 * <p>The client logs and drops such messages; the channel stays open.</p>
 */
public class DecryptionException extends BridgeException
{
    public DecryptionException(String message)
    {
        super(message);
    }

    public DecryptionException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
