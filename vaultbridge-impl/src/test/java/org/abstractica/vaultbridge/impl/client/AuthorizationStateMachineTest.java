package org.abstractica.vaultbridge.impl.client;

import org.abstractica.vaultbridge.ConnectionState;
import org.abstractica.vaultbridge.ConnectionStatus;
import org.abstractica.vaultbridge.Subscription;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AuthorizationStateMachine.
 */
class AuthorizationStateMachineTest
{
    private static final String CLIENT_ID = "0123456789abcdef0123456789abcdef";

    private AuthorizationStateMachine connectedMachine()
    {
        AuthorizationStateMachine machine = new AuthorizationStateMachine();
        machine.identityReady(CLIENT_ID);
        machine.connecting();
        return machine;
    }

    // ========== Handshake decision ==========

    @Test
    void decide_authorizedWinsOverPending()
    {
        assertEquals(ConnectionStatus.PAIRED, AuthorizationStateMachine.decide(true, true));
        assertEquals(ConnectionStatus.PAIRED, AuthorizationStateMachine.decide(true, false));
    }

    @Test
    void decide_pendingApproval()
    {
        assertEquals(ConnectionStatus.PENDING_APPROVAL, AuthorizationStateMachine.decide(false, true));
    }

    @Test
    void decide_neitherMeansConnected()
    {
        assertEquals(ConnectionStatus.CONNECTED, AuthorizationStateMachine.decide(false, false));
    }

    @Test
    void handshake_storesServerKey()
    {
        AuthorizationStateMachine machine = connectedMachine();

        machine.applyHandshake(false, true, "c2VydmVy");

        ConnectionState state = machine.current();
        assertEquals(ConnectionStatus.PENDING_APPROVAL, state.status());
        assertEquals("c2VydmVy", state.serverPublicKey());
        assertEquals(CLIENT_ID, state.clientId());
    }

    // ========== Authorization updates ==========

    @Test
    void update_approvalWhilePendingPairs()
    {
        AuthorizationStateMachine machine = connectedMachine();
        machine.applyHandshake(false, true, "a2V5");

        assertTrue(machine.applyAuthorizationUpdate(true));
        assertEquals(ConnectionStatus.PAIRED, machine.current().status());
    }

    @Test
    void update_denialWhilePendingGoesToConnectedNotDisconnected()
    {
        AuthorizationStateMachine machine = connectedMachine();
        machine.applyHandshake(false, true, "a2V5");

        assertTrue(machine.applyAuthorizationUpdate(false));
        assertEquals(ConnectionStatus.CONNECTED, machine.current().status());
        assertEquals("a2V5", machine.current().serverPublicKey());
    }

    @Test
    void update_revocationWhilePairedGoesToConnected()
    {
        AuthorizationStateMachine machine = connectedMachine();
        machine.applyHandshake(true, false, "a2V5");

        assertTrue(machine.applyAuthorizationUpdate(false));
        assertEquals(ConnectionStatus.CONNECTED, machine.current().status());
    }

    @Test
    void update_ignoredWhileDisconnectedOrConnecting()
    {
        AuthorizationStateMachine machine = new AuthorizationStateMachine();
        assertFalse(machine.applyAuthorizationUpdate(true));
        assertEquals(ConnectionStatus.DISCONNECTED, machine.current().status());

        machine.connecting();
        assertFalse(machine.applyAuthorizationUpdate(true));
        assertEquals(ConnectionStatus.CONNECTING, machine.current().status());
    }

    // ========== Errors and disconnect ==========

    @Test
    void recordError_keepsStatus()
    {
        AuthorizationStateMachine machine = connectedMachine();
        machine.applyHandshake(true, false, "a2V5");

        machine.recordError("Vault is locked");

        assertEquals(ConnectionStatus.PAIRED, machine.current().status());
        assertEquals("Vault is locked", machine.current().error());
    }

    @Test
    void disconnected_clearsServerKeyAndKeepsClientId()
    {
        AuthorizationStateMachine machine = connectedMachine();
        machine.applyHandshake(true, false, "a2V5");

        machine.disconnected("Connection error: reset");

        ConnectionState state = machine.current();
        assertEquals(ConnectionStatus.DISCONNECTED, state.status());
        assertNull(state.serverPublicKey());
        assertEquals(CLIENT_ID, state.clientId());
        assertEquals("Connection error: reset", state.error());
    }

    @Test
    void connecting_clearsPreviousError()
    {
        AuthorizationStateMachine machine = new AuthorizationStateMachine();
        machine.disconnected("Connection failed - is the vault running?");

        machine.connecting();

        assertTrue(machine.current().getError().isEmpty());
    }

    // ========== Listeners ==========

    @Test
    void subscribe_replaysCurrentState()
    {
        AuthorizationStateMachine machine = connectedMachine();
        List<ConnectionStatus> seen = new ArrayList<>();

        machine.subscribe(state -> seen.add(state.status()));

        assertEquals(List.of(ConnectionStatus.CONNECTING), seen);
    }

    @Test
    void subscribe_receivesEveryTransitionInOrder()
    {
        AuthorizationStateMachine machine = new AuthorizationStateMachine();
        List<ConnectionStatus> seen = new ArrayList<>();
        machine.subscribe(state -> seen.add(state.status()));

        machine.connecting();
        machine.applyHandshake(false, true, "a2V5");
        machine.applyAuthorizationUpdate(true);
        machine.disconnected(null);

        assertEquals(List.of(
                ConnectionStatus.DISCONNECTED,
                ConnectionStatus.CONNECTING,
                ConnectionStatus.PENDING_APPROVAL,
                ConnectionStatus.PAIRED,
                ConnectionStatus.DISCONNECTED), seen);
    }

    @Test
    void unsubscribe_stopsNotifications()
    {
        AuthorizationStateMachine machine = new AuthorizationStateMachine();
        List<ConnectionStatus> seen = new ArrayList<>();
        Subscription subscription = machine.subscribe(state -> seen.add(state.status()));

        subscription.close();
        machine.connecting();

        assertEquals(1, seen.size());
        assertEquals(0, machine.listenerCount());
    }

    @Test
    void listener_canUnsubscribeWhileBeingNotified()
    {
        AuthorizationStateMachine machine = new AuthorizationStateMachine();
        List<ConnectionStatus> seen = new ArrayList<>();
        Subscription[] holder = new Subscription[1];
        holder[0] = machine.subscribe(state ->
        {
            seen.add(state.status());
            if (state.status() == ConnectionStatus.CONNECTING)
            {
                holder[0].close();
            }
        });
        List<ConnectionStatus> other = new ArrayList<>();
        machine.subscribe(state -> other.add(state.status()));

        machine.connecting();
        machine.applyHandshake(true, false, "a2V5");

        assertEquals(List.of(ConnectionStatus.DISCONNECTED, ConnectionStatus.CONNECTING), seen);
        assertEquals(3, other.size());
    }

    @Test
    void failingListenerDoesNotBlockOthers()
    {
        AuthorizationStateMachine machine = new AuthorizationStateMachine();
        machine.subscribe(state ->
        {
            throw new IllegalStateException("boom");
        });
        List<ConnectionStatus> seen = new ArrayList<>();
        machine.subscribe(state -> seen.add(state.status()));

        machine.connecting();

        assertEquals(List.of(ConnectionStatus.DISCONNECTED, ConnectionStatus.CONNECTING), seen);
    }

    @Test
    void listener_transitionDuringNotificationIsDeliveredAfterCurrentRound()
    {
        AuthorizationStateMachine machine = connectedMachine();
        List<String> events = new ArrayList<>();
        machine.subscribe(state ->
        {
            events.add("first:" + state.status().name());
            if (state.status() == ConnectionStatus.CONNECTED)
            {
                machine.disconnected(null);
            }
        });
        List<ConnectionStatus> second = new ArrayList<>();
        machine.subscribe(state ->
        {
            events.add("second:" + state.status().name());
            second.add(state.status());
        });

        machine.applyHandshake(false, false, "a2V5");

        assertEquals(ConnectionStatus.DISCONNECTED, machine.current().status());
        assertEquals(List.of(
                ConnectionStatus.CONNECTING,
                ConnectionStatus.CONNECTED,
                ConnectionStatus.DISCONNECTED), second);
        assertEquals(List.of(
                "first:CONNECTING",
                "second:CONNECTING",
                "first:CONNECTED",
                "second:CONNECTED",
                "first:DISCONNECTED",
                "second:DISCONNECTED"), events);
    }

    @Test
    void identityReady_notifiesWithClientId()
    {
        AuthorizationStateMachine machine = new AuthorizationStateMachine();
        List<ConnectionState> seen = new ArrayList<>();
        machine.subscribe(seen::add);

        machine.identityReady(CLIENT_ID);

        assertEquals(2, seen.size());
        assertNull(seen.get(0).clientId());
        assertEquals(CLIENT_ID, seen.get(1).clientId());
        assertEquals(ConnectionStatus.DISCONNECTED, seen.get(1).status());
    }
}
