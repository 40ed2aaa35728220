/**
 * Vault bridge client implementation module.
 *
 * <p>Provides the default implementation of the vault bridge API.</p>
 */
module vaultbridge.impl
{
    requires transitive vaultbridge.api;
    requires com.fasterxml.jackson.core;
    requires com.fasterxml.jackson.databind;
    requires java.net.http;
    requires org.slf4j;

    // Export factory implementation and transports for external use
    exports org.abstractica.vaultbridge.impl.client;
    exports org.abstractica.vaultbridge.impl.transport;

    // Export wire messages and crypto for tooling and key handling
    exports org.abstractica.vaultbridge.impl.protocol;
    exports org.abstractica.vaultbridge.impl.crypto;

    opens org.abstractica.vaultbridge.impl.protocol to com.fasterxml.jackson.databind;
}
