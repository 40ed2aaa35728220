/**
 * Vault bridge client API module.
 *
 * <p>Provides the client interface, connection state types and the typed
 * vault actions sent over the encrypted bridge.</p>
 */
module vaultbridge.api
{
    requires transitive com.fasterxml.jackson.annotation;
    requires transitive com.fasterxml.jackson.databind;

    exports org.abstractica.vaultbridge;
    exports org.abstractica.vaultbridge.action;

    // Actions become request bodies through Jackson
    opens org.abstractica.vaultbridge.action to com.fasterxml.jackson.databind;
}
