package edu.brandeis.cosi103a.league.network;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Failure of a single remote call.
 *
 * Timeouts, connection failures and non-2xx statuses are transient and may be retried.
 * Error replies, malformed replies, unencodable requests and unusable endpoints are not.
 */
public class RpcException extends RuntimeException {

    public enum Kind {
        TIMEOUT,
        CONNECTION,
        HTTP_STATUS,
        REMOTE_ERROR,
        MALFORMED_RESPONSE,
        INVALID_REQUEST,
        INVALID_ENDPOINT
    }

    private final Kind kind;
    private final int code;

    public RpcException(Kind kind, int code, String message) {
        super(message);
        this.kind = kind;
        this.code = code;
    }

    public RpcException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.code = 0;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * The HTTP status for {@link Kind#HTTP_STATUS}, the JSON-RPC error code for
     * {@link Kind#REMOTE_ERROR}, otherwise 0.
     */
    public int code() {
        return code;
    }

    public boolean isTransient() {
        return kind == Kind.TIMEOUT || kind == Kind.CONNECTION || kind == Kind.HTTP_STATUS;
    }

    /**
     * Finds the RpcException behind a failed future, wrapping anything else as a connection failure.
     */
    public static RpcException unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        if (current instanceof RpcException) {
            return (RpcException) current;
        }
        return new RpcException(Kind.CONNECTION, String.valueOf(current.getMessage()), current);
    }
}
