package org.abstractica.vaultbridge;

/**
 * Counters for a bridge client.
 */
public interface BridgeClientStats
{
    /**
     * Returns the number of encrypted requests handed to the transport.
     *
     * @return requests sent
     */
    long getRequestsSent();

    /**
     * Returns the number of responses matched to a pending request.
     *
     * @return matched responses
     */
    long getResponsesReceived();

    /**
     * Returns the number of requests that failed with a timeout.
     *
     * @return timed out requests
     */
    long getRequestsTimedOut();

    /**
     * Returns the number of inbound messages dropped because they could not be decrypted or parsed.
     *
     * @return dropped messages
     */
    long getDecryptionFailures();

    /**
     * Returns the number of decrypted responses without a matching pending request.
     *
     * @return stray or duplicate responses
     */
    long getStrayResponses();

    /**
     * Returns the number of error messages received from the peer.
     *
     * @return server errors
     */
    long getServerErrors();

    /**
     * Returns the number of requests currently awaiting a response.
     *
     * @return pending requests
     */
    int getPendingRequests();
}
