package org.abstractica.vaultbridge.impl.protocol;

/**
 * Keepalive answer from the bridge. Ignored by the client.
 */
public record Pong() implements BridgeMessage
{
    @Override
    public MessageType type()
    {
        return MessageType.PONG;
    }
}
