package me.golemcore.agent.domain.model;

/**
 * Classification of {@link AgentException}.
 */
public enum AgentErrorKind {

    CONFIG_ERROR,

    /**
     * The backend conversation could not be opened.
     */
    CONNECTION_ERROR,

    /**
     * {@code execute} was called while the session is running or paused.
     */
    ALREADY_RUNNING,

    /**
     * A send was attempted before the session started.
     */
    NOT_RUNNING,

    /**
     * The session already reached a terminal phase and cannot be restarted.
     */
    SESSION_TERMINATED,

    /**
     * A caller-side channel was closed when a send was attempted.
     */
    CHANNEL_ERROR,

    /**
     * The output stream reported an error while a convenience call was waiting
     * for a result.
     */
    OUTPUT_ERROR,

    INTERNAL_ERROR
}
