package com.skillbridge.rootbot.model;

/**
 * Activity types the root bot distinguishes, keyed by their wire value.
 *
 * Anything the host does not recognise maps to {@link #UNKNOWN}; it is still
 * forwarded to an active skill, but ignored when no skill is active.
 */
public enum ActivityKind {
    MESSAGE("message"),
    CONVERSATION_UPDATE("conversationUpdate"),
    END_OF_CONVERSATION("endOfConversation"),
    EVENT("event"),
    INVOKE("invoke"),
    TYPING("typing"),
    MESSAGE_REACTION("messageReaction"),
    INSTALLATION_UPDATE("installationUpdate"),
    TRACE("trace"),
    UNKNOWN(null);

    private final String wireValue;

    ActivityKind(String wireValue) {
        this.wireValue = wireValue;
    }

    /** The value carried in the activity's {@code type} field. */
    public String wireValue() {
        return wireValue;
    }

    /** Exact, case-sensitive lookup; {@code null} and unrecognised types yield UNKNOWN. */
    public static ActivityKind of(String type) {
        if (type == null) return UNKNOWN;
        for (ActivityKind kind : values()) {
            if (type.equals(kind.wireValue)) {
                return kind;
            }
        }
        return UNKNOWN;
    }
}
