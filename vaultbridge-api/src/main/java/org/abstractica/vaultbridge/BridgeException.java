package org.abstractica.vaultbridge;

/**
 * Base class for failures reported by a bridge client.
 *
 * <p>Asynchronous operations complete their futures exceptionally with a
 * subclass of this exception.</p>
 */
public abstract class BridgeException extends RuntimeException
{
    protected BridgeException(String message)
    {
        super(message);
    }

    protected BridgeException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
