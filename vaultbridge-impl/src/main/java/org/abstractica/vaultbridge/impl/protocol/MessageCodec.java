package org.abstractica.vaultbridge.impl.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.abstractica.vaultbridge.DecryptionException;
import org.abstractica.vaultbridge.action.VaultAction;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Encodes and decodes bridge messages and encrypted request/response bodies.
 *
 * <p>Messages are JSON objects whose {@code type} field selects the record
 * class. Unknown fields are ignored and null fields are not written.</p>
 */
public final class MessageCodec
{
    public static final String TYPE_FIELD = "type";
    public static final String REQUEST_ID_FIELD = "requestId";

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build();

    private MessageCodec() {}

    /**
     * Returns the shared object mapper.
     *
     * @return the mapper
     */
    public static ObjectMapper mapper()
    {
        return MAPPER;
    }

    // ========== Messages ==========

    /**
     * Encodes a message as JSON text with its {@code type} field first.
     *
     * @param message the message
     * @return JSON text
     */
    public static String encode(BridgeMessage message)
    {
        Objects.requireNonNull(message, "message");

        ObjectNode node = MAPPER.createObjectNode();
        node.put(TYPE_FIELD, message.type().getWireName());
        node.setAll((ObjectNode) MAPPER.valueToTree(message));
        return write(node);
    }

    /**
     * Decodes a JSON message.
     *
     * @param text JSON text
     * @return the decoded message
     * @throws IllegalArgumentException if the text is not valid JSON, has no known
     *                                  {@code type}, or does not match the type's fields
     */
    public static BridgeMessage decode(String text)
    {
        Objects.requireNonNull(text, "text");

        JsonNode node;
        try
        {
            node = MAPPER.readTree(text);
        }
        catch (JsonProcessingException e)
        {
            throw new IllegalArgumentException("Malformed JSON message: " + e.getOriginalMessage(), e);
        }

        if (node == null || !node.isObject())
        {
            throw new IllegalArgumentException("Message must be a JSON object");
        }

        JsonNode typeNode = node.get(TYPE_FIELD);
        if (typeNode == null || !typeNode.isTextual())
        {
            throw new IllegalArgumentException("Message has no type");
        }

        MessageType type = MessageType.fromWireName(typeNode.asText());
        return switch (type)
        {
            case PING -> new Ping();
            case PONG -> new Pong();
            default -> readMessage(node, type);
        };
    }

    private static BridgeMessage readMessage(JsonNode node, MessageType type)
    {
        try
        {
            return MAPPER.treeToValue(node, type.getMessageClass());
        }
        catch (JsonProcessingException e)
        {
            throw new IllegalArgumentException(
                    "Invalid " + type.getWireName() + " message: " + e.getOriginalMessage(), e);
        }
    }

    // ========== Encrypted bodies ==========

    /**
     * Builds the JSON body of a request: the action's fields plus {@code requestId}.
     *
     * @param action    the action
     * @param requestId the correlation id
     * @return the body
     */
    public static ObjectNode requestBody(VaultAction action, String requestId)
    {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(requestId, "requestId");

        ObjectNode body = MAPPER.valueToTree(action);
        body.put(REQUEST_ID_FIELD, requestId);
        return body;
    }

    /**
     * Serializes a body as UTF-8 JSON.
     *
     * @param body the body
     * @return UTF-8 bytes
     */
    public static byte[] writeBody(JsonNode body)
    {
        return write(body).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Parses a decrypted body.
     *
     * @param plaintext UTF-8 JSON bytes
     * @return the JSON object
     * @throws DecryptionException if the plaintext is not a JSON object
     */
    public static ObjectNode readBody(byte[] plaintext)
    {
        JsonNode node;
        try
        {
            node = MAPPER.readTree(plaintext);
        }
        catch (IOException e)
        {
            throw new DecryptionException("Decrypted payload is not valid JSON", e);
        }

        if (node == null || !node.isObject())
        {
            throw new DecryptionException("Decrypted payload is not a JSON object");
        }
        return (ObjectNode) node;
    }

    private static String write(JsonNode node)
    {
        try
        {
            return MAPPER.writeValueAsString(node);
        }
        catch (JsonProcessingException e)
        {
            throw new IllegalStateException("Failed to serialize JSON", e);
        }
    }
}
