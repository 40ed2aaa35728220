package org.abstractica.vaultbridge.impl.protocol;

/**
 * Message types of the bridge wire protocol, identified by the {@code type} field.
 */
public enum MessageType
{
    // Plaintext pairing messages
    HANDSHAKE("handshake", Handshake.class),
    HANDSHAKE_RESPONSE("handshakeResponse", HandshakeResponse.class),
    AUTHORIZATION_UPDATE("authorizationUpdate", AuthorizationUpdate.class),

    // Encrypted envelopes
    REQUEST("request", Request.class),
    RESPONSE("response", Response.class),

    // Control
    ERROR("error", ErrorMessage.class),
    PING("ping", Ping.class),
    PONG("pong", Pong.class);

    private final String wireName;
    private final Class<? extends BridgeMessage> messageClass;

    MessageType(String wireName, Class<? extends BridgeMessage> messageClass)
    {
        this.wireName = wireName;
        this.messageClass = messageClass;
    }

    /**
     * Returns the value of the {@code type} field for this message type.
     *
     * @return the wire name
     */
    public String getWireName()
    {
        return wireName;
    }

    /**
     * Returns the record class carrying this message type.
     *
     * @return the message class
     */
    public Class<? extends BridgeMessage> getMessageClass()
    {
        return messageClass;
    }

    /**
     * Looks up a message type by its wire name.
     *
     * @param wireName the {@code type} field value
     * @return the message type
     * @throws IllegalArgumentException if the name is unknown
     */
    public static MessageType fromWireName(String wireName)
    {
        for (MessageType type : values())
        {
            if (type.wireName.equals(wireName))
            {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown message type: " + wireName);
    }
}
