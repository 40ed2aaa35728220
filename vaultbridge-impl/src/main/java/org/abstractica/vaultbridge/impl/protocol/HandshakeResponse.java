package org.abstractica.vaultbridge.impl.protocol;

/**
 * The vault's answer to a handshake.
 *
 * @param serverPublicKey the vault's long-term public key, base64 SPKI (may be null)
 * @param authorized      whether the client is already approved
 * @param pendingApproval whether an approval prompt is waiting for the user
 */
public record HandshakeResponse(
        String serverPublicKey,
        boolean authorized,
        boolean pendingApproval
) implements BridgeMessage
{
    @Override
    public MessageType type()
    {
        return MessageType.HANDSHAKE_RESPONSE;
    }
}
