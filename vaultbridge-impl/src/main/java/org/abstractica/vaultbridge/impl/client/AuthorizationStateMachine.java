package org.abstractica.vaultbridge.impl.client;

import org.abstractica.vaultbridge.ConnectionState;
import org.abstractica.vaultbridge.ConnectionStatus;
import org.abstractica.vaultbridge.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Tracks the pairing status of a client and notifies listeners of changes.
 *
 * <p>Transitions:</p>
 * <pre>
 * disconnected     -> connecting                              connect()
 * connecting       -> connected | pending_approval | paired   handshakeResponse
 * pending_approval -> paired | connected                      authorizationUpdate
 * paired           -> connected                               authorizationUpdate (revoked)
 * any              -> disconnected                            close / error
 * </pre>
 *
 * <p>Listeners are held in a copy-on-write list, so each notification runs
 * over a stable snapshot even if listeners subscribe or unsubscribe while
 * being notified. Transitions and subscriptions are serialized so a new
 * listener never misses a change.</p>
 *
 * <p>A listener may itself cause a transition. The new state takes effect at
 * once, but its notification is queued until every listener has seen the
 * current one, so all listeners observe the same sequence and end on the
 * live state.</p>
 */
final class AuthorizationStateMachine
{
    private static final Logger LOG = LoggerFactory.getLogger(AuthorizationStateMachine.class);

    private final List<Consumer<ConnectionState>> listeners = new CopyOnWriteArrayList<>();
    private final Deque<ConnectionState> queued = new ArrayDeque<>();
    private volatile ConnectionState state = ConnectionState.initial(null);
    private boolean notifying;

    /**
     * Returns the current state.
     *
     * @return state snapshot
     */
    ConnectionState current()
    {
        return state;
    }

    /**
     * Registers a listener and immediately replays the current state to it.
     *
     * @param listener the listener
     * @return subscription removing the listener
     */
    synchronized Subscription subscribe(Consumer<ConnectionState> listener)
    {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        notify(listener, state);
        return () -> listeners.remove(listener);
    }

    int listenerCount()
    {
        return listeners.size();
    }

    /**
     * Records the client id once the identity exists. The status is unchanged,
     * but listeners receive the completed snapshot.
     */
    void identityReady(String clientId)
    {
        ConnectionState current = state;
        transition(new ConnectionState(current.status(), clientId, current.error(), current.serverPublicKey()));
    }

    /**
     * Enters {@code connecting} and clears the last error.
     */
    void connecting()
    {
        transition(state.withStatus(ConnectionStatus.CONNECTING).withError(null));
    }

    /**
     * Applies the handshake verdict.
     *
     * @param authorized      whether the peer authorized the client
     * @param pendingApproval whether approval is pending
     * @param serverPublicKey the peer key (base64) or null
     * @return the resulting status
     */
    ConnectionStatus applyHandshake(boolean authorized, boolean pendingApproval, String serverPublicKey)
    {
        ConnectionStatus status = decide(authorized, pendingApproval);
        ConnectionState current = state;
        transition(new ConnectionState(status, current.clientId(), current.error(), serverPublicKey));
        return status;
    }

    /**
     * Applies an approval decision from the peer.
     *
     * <p>Only meaningful once the handshake has been answered; ignored while
     * disconnected or connecting.</p>
     *
     * @param authorized the decision
     * @return true if the update was applied
     */
    boolean applyAuthorizationUpdate(boolean authorized)
    {
        ConnectionStatus status = state.status();
        if (status == ConnectionStatus.DISCONNECTED || status == ConnectionStatus.CONNECTING)
        {
            return false;
        }
        transition(state.withStatus(authorized ? ConnectionStatus.PAIRED : ConnectionStatus.CONNECTED));
        return true;
    }

    /**
     * Records a channel-level error without changing the status.
     *
     * @param error the error message
     */
    void recordError(String error)
    {
        transition(state.withError(error));
    }

    /**
     * Enters {@code disconnected} and forgets the peer key.
     *
     * @param error the error that closed the connection, or null for a normal close
     */
    void disconnected(String error)
    {
        ConnectionState current = state;
        String newError = error != null ? error : current.error();
        transition(new ConnectionState(ConnectionStatus.DISCONNECTED, current.clientId(), newError, null));
    }

    /**
     * Handshake decision rule, evaluated in order: authorized, then pending, then connected.
     *
     * @param authorized      the peer's authorized flag
     * @param pendingApproval the peer's pendingApproval flag
     * @return the target status
     */
    static ConnectionStatus decide(boolean authorized, boolean pendingApproval)
    {
        if (authorized)
        {
            return ConnectionStatus.PAIRED;
        }
        if (pendingApproval)
        {
            return ConnectionStatus.PENDING_APPROVAL;
        }
        return ConnectionStatus.CONNECTED;
    }

    private synchronized void transition(ConnectionState next)
    {
        ConnectionState previous = state;
        state = next;

        if (previous.status() != next.status())
        {
            LOG.debug("State {} -> {}", previous.status(), next.status());
        }

        queued.addLast(next);
        if (notifying)
        {
            return;
        }

        notifying = true;
        try
        {
            ConnectionState snapshot;
            while ((snapshot = queued.pollFirst()) != null)
            {
                for (Consumer<ConnectionState> listener : listeners)
                {
                    notify(listener, snapshot);
                }
            }
        }
        finally
        {
            notifying = false;
            queued.clear();
        }
    }

    private static void notify(Consumer<ConnectionState> listener, ConnectionState snapshot)
    {
        try
        {
            listener.accept(snapshot);
        }
        catch (Exception e)
        {
            LOG.error("State listener error", e);
        }
    }
}
