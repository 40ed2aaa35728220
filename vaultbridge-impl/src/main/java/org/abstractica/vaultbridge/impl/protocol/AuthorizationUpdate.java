package org.abstractica.vaultbridge.impl.protocol;

/**
 * Sent by the vault when the user approves or denies the client.
 *
 * @param authorized the decision
 */
public record AuthorizationUpdate(boolean authorized) implements BridgeMessage
{
    @Override
    public MessageType type()
    {
        return MessageType.AUTHORIZATION_UPDATE;
    }
}
