package org.abstractica.vaultbridge;

import java.util.Objects;

/**
 * Routing metadata naming the vault extension that should handle a request.
 *
 * <p>The bridge uses the extension's public key and name to dispatch the
 * decrypted action to the right handler. The key is passed through as
 * the text the extension publishes; the client never parses it.</p>
 *
 * @param publicKey the extension's published public key
 * @param name      the extension name, e.g. {@code haex-pass}
 */
public record ExtensionTarget(String publicKey, String name)
{
    public ExtensionTarget
    {
        Objects.requireNonNull(publicKey, "publicKey");
        Objects.requireNonNull(name, "name");
        if (publicKey.isBlank())
        {
            throw new IllegalArgumentException("Extension public key must not be blank");
        }
        if (name.isBlank())
        {
            throw new IllegalArgumentException("Extension name must not be blank");
        }
    }
}
