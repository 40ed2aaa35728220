package org.abstractica.vaultbridge.impl.protocol;

/**
 * Keepalive sent by the client.
 */
public record Ping() implements BridgeMessage
{
    @Override
    public MessageType type()
    {
        return MessageType.PING;
    }
}
