package org.abstractica.vaultbridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;
import java.util.Optional;

/**
 * A decrypted response from the vault.
 *
 * <p>Extensions answer with a body of the form
 * {@code {"success": bool, "data": ..., "error": "...", "requestId": "..."}};
 * the accessors below read those fields, and {@link #body()} exposes the
 * full decrypted object.</p>
 *
 * @param requestId the id of the request this response answers
 * @param body      the decrypted JSON object
 */
public record VaultResponse(String requestId, ObjectNode body)
{
    public VaultResponse
    {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(body, "body");
    }

    /**
     * Returns the {@code success} flag of the response body.
     *
     * @return true if the extension reported success
     */
    public boolean success()
    {
        return body.path("success").asBoolean(false);
    }

    /**
     * Returns the {@code data} field of the response body.
     *
     * @return the data node, or empty if absent or null
     */
    public Optional<JsonNode> data()
    {
        JsonNode data = body.get("data");
        return data == null || data.isNull() ? Optional.empty() : Optional.of(data);
    }

    /**
     * Returns the {@code error} field of the response body.
     *
     * @return the error message, or empty
     */
    public Optional<String> error()
    {
        JsonNode error = body.get("error");
        return error == null || error.isNull() ? Optional.empty() : Optional.of(error.asText());
    }
}
