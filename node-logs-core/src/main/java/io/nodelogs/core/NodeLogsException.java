package io.nodelogs.core;

/**
 * Base class for node log access exceptions.
 *
 * <p>Provides a common hierarchy for protocol-level and configuration errors.
 * Subclasses are specific to the error condition while preserving the original cause when applicable.
 */
public abstract class NodeLogsException extends RuntimeException {

    protected NodeLogsException(String message) {
        super(message);
    }

    protected NodeLogsException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when the node reported a failed request. The message is the node's error text, verbatim.
     */
    public static class RemoteFailure extends NodeLogsException {
        public RemoteFailure(String message) {
            super(message);
        }
    }

    /**
     * Raised when a response claims success but does not follow the expected format.
     */
    public static class MalformedResponse extends NodeLogsException {
        public MalformedResponse(String message) {
            super(message);
        }

        public MalformedResponse(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when configuration values are missing or out of range.
     */
    public static class InvalidConfiguration extends NodeLogsException {
        public InvalidConfiguration(String message) {
            super(message);
        }

        public InvalidConfiguration(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
