package org.abstractica.vaultbridge.impl.protocol;

/**
 * Error reported by the bridge. Does not close the connection by itself.
 *
 * @param code    error code
 * @param message human readable description
 */
public record ErrorMessage(String code, String message) implements BridgeMessage
{
    @Override
    public MessageType type()
    {
        return MessageType.ERROR;
    }
}
