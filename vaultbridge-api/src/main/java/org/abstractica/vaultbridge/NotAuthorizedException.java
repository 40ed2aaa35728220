package org.abstractica.vaultbridge;

/**
 * A request was attempted while the client was not paired.
 */
public class NotAuthorizedException extends BridgeException
{
    private final ConnectionStatus status;

    public NotAuthorizedException(ConnectionStatus status)
    {
        super("Not authorized (status: " + status + ")");
        this.status = status;
    }

    /**
     * Returns the status the client was in when the request was rejected.
     *
     * @return the status
     */
    public ConnectionStatus getStatus()
    {
        return status;
    }
}
