package com.skillbridge.rootbot.skill;

/**
 * Thrown when a skill returns a non-2xx status or cannot be reached.
 * Not retried; it propagates to the turn pipeline.
 */
public class SkillInvocationException extends RuntimeException {

    private final String skillId;
    private final int    statusCode;

    public SkillInvocationException(String skillId, int statusCode, String message) {
        super(message);
        this.skillId    = skillId;
        this.statusCode = statusCode;
    }

    public SkillInvocationException(String skillId, String message, Throwable cause) {
        super(message, cause);
        this.skillId    = skillId;
        this.statusCode = -1;
    }

    public String skillId()    { return skillId; }

    /** HTTP status returned by the skill, or -1 if no response was received. */
    public int    statusCode() { return statusCode; }
}
