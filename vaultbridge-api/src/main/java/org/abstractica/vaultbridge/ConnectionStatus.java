package org.abstractica.vaultbridge;

/**
 * Pairing status of a bridge client.
 *
 * <p>There is no terminal status. After {@link #DISCONNECTED} a new
 * connection attempt starts again at {@link #CONNECTING}.</p>
 */
public enum ConnectionStatus
{
    /** No open transport. Initial status. */
    DISCONNECTED("disconnected"),

    /** Transport is being opened and the handshake has not been answered yet. */
    CONNECTING("connecting"),

    /** Handshake answered; the peer neither authorized the client nor holds a pending approval. */
    CONNECTED("connected"),

    /** Handshake answered; the user has not yet approved or denied this client. */
    PENDING_APPROVAL("pending_approval"),

    /** Client is authorized and may send encrypted requests. */
    PAIRED("paired");

    private final String wireName;

    ConnectionStatus(String wireName)
    {
        this.wireName = wireName;
    }

    /**
     * Returns the lowercase name used by the bridge and in logs.
     *
     * @return wire name
     */
    public String getWireName()
    {
        return wireName;
    }

    @Override
    public String toString()
    {
        return wireName;
    }
}
