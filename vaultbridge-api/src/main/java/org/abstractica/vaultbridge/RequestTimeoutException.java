package org.abstractica.vaultbridge;

import java.time.Duration;

/**
 * No matching response arrived within the request's timeout.
 */
public class RequestTimeoutException extends BridgeException
{
    private final String requestId;

    public RequestTimeoutException(String requestId, Duration timeout)
    {
        super("Request timeout after " + timeout.toMillis() + "ms: " + requestId);
        this.requestId = requestId;
    }

    public String getRequestId()
    {
        return requestId;
    }
}
