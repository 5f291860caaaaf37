package me.golemcore.agent.domain.model;

/**
 * Machine-readable classification of errors delivered as output messages.
 *
 * <p>
 * This exists to avoid relying on string matching in error messages.
 */
public enum OutputErrorKind {

    /**
     * The configured maximum number of turns was reached.
     */
    TURN_LIMIT_EXCEEDED,

    /**
     * A tool reported a failure.
     */
    TOOL_ERROR,

    /**
     * The model API rejected or failed the request.
     */
    MODEL_ERROR,

    /**
     * The event stream to the backend broke.
     */
    NETWORK_ERROR,

    AUTHENTICATION_ERROR,

    /**
     * The turn was aborted by cooperative cancellation.
     */
    INTERRUPTED,

    CONFIGURATION_ERROR,

    UNKNOWN
}
