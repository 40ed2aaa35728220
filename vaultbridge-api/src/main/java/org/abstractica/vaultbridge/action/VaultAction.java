package org.abstractica.vaultbridge.action;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Set;

/**
 * Actions a paired client can ask the vault's password extension to perform.
 *
 * <p>Each record is serialized as the JSON body of an encrypted request; the
 * client adds the {@code requestId} field before encrypting. {@link #validate()}
 * runs before encryption, so a malformed action is never sent.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public sealed interface VaultAction permits
        VaultAction.GetItems,
        VaultAction.GetTotp,
        VaultAction.CreateItem,
        VaultAction.UpdateItem,
        VaultAction.GetPasswordConfig,
        VaultAction.GetPasswordPresets,
        VaultAction.PasskeyCreate,
        VaultAction.PasskeyGet,
        VaultAction.PasskeyList
{
    Set<String> OTP_ALGORITHMS = Set.of("SHA1", "SHA256", "SHA512");

    /**
     * Returns the wire name of this action, e.g. {@code get-items}.
     *
     * @return the action method
     */
    String method();

    /**
     * Checks the action's fields.
     *
     * @throws IllegalArgumentException if a required field is missing or a value is out of range
     */
    void validate();

    /**
     * Looks up entries (logins) for a URL.
     *
     * @param url    the page URL to match
     * @param fields field names to return, or null for all
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record GetItems(String url, List<String> fields) implements VaultAction
    {
        public GetItems(String url)
        {
            this(url, null);
        }

        @Override
        public String method()
        {
            return "get-items";
        }

        @Override
        public void validate()
        {
            requireText(url, "url");
        }
    }

    /**
     * Requests the current TOTP code of an entry.
     *
     * @param entryId the entry id
     */
    record GetTotp(String entryId) implements VaultAction
    {
        @Override
        public String method()
        {
            return "get-totp";
        }

        @Override
        public void validate()
        {
            requireText(entryId, "entryId");
        }
    }

    /**
     * Creates a new entry.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record CreateItem(
            String title,
            String url,
            String username,
            String password,
            String otpSecret,
            Integer otpDigits,
            Integer otpPeriod,
            String otpAlgorithm,
            String groupId,
            List<KeyValue> keyValues
    ) implements VaultAction
    {
        public CreateItem(String title, String url, String username, String password)
        {
            this(title, url, username, password, null, null, null, null, null, null);
        }

        @Override
        public String method()
        {
            return "create-item";
        }

        @Override
        public void validate()
        {
            requireText(title, "title");
            validateOtp(otpDigits, otpPeriod, otpAlgorithm);
            validateKeyValues(keyValues);
        }
    }

    /**
     * Updates fields of an existing entry. Null fields are left unchanged.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record UpdateItem(
            String entryId,
            String title,
            String url,
            String username,
            String password,
            String otpSecret,
            Integer otpDigits,
            Integer otpPeriod,
            String otpAlgorithm,
            String groupId,
            List<KeyValue> keyValues
    ) implements VaultAction
    {
        @Override
        public String method()
        {
            return "update-item";
        }

        @Override
        public void validate()
        {
            requireText(entryId, "entryId");
            validateOtp(otpDigits, otpPeriod, otpAlgorithm);
            validateKeyValues(keyValues);
        }
    }

    /**
     * Requests the password generator configuration.
     */
    record GetPasswordConfig() implements VaultAction
    {
        @Override
        public String method()
        {
            return "get-password-config";
        }

        @Override
        public void validate()
        {
        }
    }

    /**
     * Requests all password generator presets.
     */
    record GetPasswordPresets() implements VaultAction
    {
        @Override
        public String method()
        {
            return "get-password-presets";
        }

        @Override
        public void validate()
        {
        }
    }

    /**
     * Registers a new passkey (WebAuthn registration).
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record PasskeyCreate(
            String relyingPartyId,
            String relyingPartyName,
            String userId,
            String userName,
            String userDisplayName,
            String challenge
    ) implements VaultAction
    {
        @Override
        public String method()
        {
            return "passkey-create";
        }

        @Override
        public void validate()
        {
            requireText(relyingPartyId, "relyingPartyId");
            requireText(userName, "userName");
            requireText(challenge, "challenge");
        }
    }

    /**
     * Authenticates with a passkey (WebAuthn assertion).
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record PasskeyGet(String relyingPartyId, String challenge, List<String> allowCredentials)
            implements VaultAction
    {
        @Override
        public String method()
        {
            return "passkey-get";
        }

        @Override
        public void validate()
        {
            requireText(relyingPartyId, "relyingPartyId");
            requireText(challenge, "challenge");
        }
    }

    /**
     * Lists passkeys, optionally for a single relying party.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record PasskeyList(String relyingPartyId) implements VaultAction
    {
        @Override
        public String method()
        {
            return "passkey-list";
        }

        @Override
        public void validate()
        {
        }
    }

    /**
     * Custom key/value field of an entry.
     */
    record KeyValue(String key, String value) {}

    private static void requireText(String value, String field)
    {
        if (value == null || value.isBlank())
        {
            throw new IllegalArgumentException(field + " is required");
        }
    }

    private static void validateOtp(Integer digits, Integer period, String algorithm)
    {
        if (digits != null && (digits < 6 || digits > 8))
        {
            throw new IllegalArgumentException("otpDigits must be 6-8: " + digits);
        }
        if (period != null && period <= 0)
        {
            throw new IllegalArgumentException("otpPeriod must be positive: " + period);
        }
        if (algorithm != null && !OTP_ALGORITHMS.contains(algorithm))
        {
            throw new IllegalArgumentException("Unsupported otpAlgorithm: " + algorithm);
        }
    }

    private static void validateKeyValues(List<KeyValue> keyValues)
    {
        if (keyValues == null)
        {
            return;
        }
        for (KeyValue keyValue : keyValues)
        {
            if (keyValue == null || keyValue.key() == null || keyValue.key().isBlank())
            {
                throw new IllegalArgumentException("keyValues entries need a key");
            }
        }
    }
}
