package com.skillbridge.rootbot.skill;

public class SkillNotFoundException extends RuntimeException {
    public SkillNotFoundException(String id) {
        super("No skill configured with id: '" + id + "'");
    }
}
