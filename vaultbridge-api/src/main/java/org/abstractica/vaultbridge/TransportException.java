package org.abstractica.vaultbridge;

/**
 * The transport could not be opened, is not open, failed to send, or was closed
 * while a request was outstanding.
 */
public class TransportException extends BridgeException
{
    public TransportException(String message)
    {
        super(message);
    }

    public TransportException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
