package org.abstractica.vaultbridge.action;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for VaultAction method names and validation.
 */
class VaultActionTest
{
    @Test
    void methodNames()
    {
        assertEquals("get-items", new VaultAction.GetItems("https://a").method());
        assertEquals("get-totp", new VaultAction.GetTotp("id").method());
        assertEquals("create-item", new VaultAction.CreateItem("t", null, null, null).method());
        assertEquals("get-password-config", new VaultAction.GetPasswordConfig().method());
        assertEquals("get-password-presets", new VaultAction.GetPasswordPresets().method());
        assertEquals("passkey-list", new VaultAction.PasskeyList("example.com").method());
    }

    @Test
    void getItems_requiresUrl()
    {
        assertThrows(IllegalArgumentException.class, () -> new VaultAction.GetItems(" ").validate());
        assertDoesNotThrow(() -> new VaultAction.GetItems("https://example.com", List.of("password")).validate());
    }

    @Test
    void createItem_requiresTitle()
    {
        assertThrows(IllegalArgumentException.class,
                () -> new VaultAction.CreateItem(null, "https://a", "u", "p").validate());
    }

    @Test
    void createItem_validatesOtpSettings()
    {
        VaultAction.CreateItem valid = new VaultAction.CreateItem(
                "Bank", null, null, null, "JBSWY3DPEHPK3PXP", 6, 30, "SHA256", null, null);
        assertDoesNotThrow(valid::validate);

        assertThrows(IllegalArgumentException.class, () -> new VaultAction.CreateItem(
                "Bank", null, null, null, "JBSWY3DPEHPK3PXP", 5, 30, "SHA1", null, null).validate());
        assertThrows(IllegalArgumentException.class, () -> new VaultAction.CreateItem(
                "Bank", null, null, null, "JBSWY3DPEHPK3PXP", 6, 0, "SHA1", null, null).validate());
        assertThrows(IllegalArgumentException.class, () -> new VaultAction.CreateItem(
                "Bank", null, null, null, "JBSWY3DPEHPK3PXP", 6, 30, "MD5", null, null).validate());
    }

    @Test
    void createItem_keyValuesNeedKeys()
    {
        assertThrows(IllegalArgumentException.class, () -> new VaultAction.CreateItem(
                "Bank", null, null, null, null, null, null, null, null,
                List.of(new VaultAction.KeyValue("", "value"))).validate());
    }

    @Test
    void passkeyGet_requiresRelyingPartyAndChallenge()
    {
        assertThrows(IllegalArgumentException.class,
                () -> new VaultAction.PasskeyGet("example.com", null, null).validate());
        assertDoesNotThrow(() -> new VaultAction.PasskeyGet("example.com", "Y2g=", null).validate());
    }
}
