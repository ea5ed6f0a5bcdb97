package com.skillbridge.rootbot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * Raw {@code skillbridge.*} settings as bound from application.yml.
 *
 * Only used at startup to build the immutable {@link RouterConfiguration};
 * nothing else should inject this type.
 */
@ConfigurationProperties(prefix = "skillbridge")
public record RootBotProperties(
        @DefaultValue Bot bot,
        String skillHostEndpoint,
        @DefaultValue Router router,
        List<Skill> skills
) {
    /** Identity of the root bot itself. An empty app id is allowed for local runs. */
    public record Bot(@DefaultValue("") String appId) {}

    /** Keyword that starts a skill session and the skill it starts. */
    public record Router(@DefaultValue("skill") String triggerKeyword,
                         @DefaultValue("EchoSkillBot") String targetSkillId) {}

    /** One known skill: its id, its app id, and the URL its messages endpoint listens on. */
    public record Skill(String id, @DefaultValue("") String appId, String endpoint) {}
}
