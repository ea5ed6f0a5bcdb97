package com.skillbridge.rootbot.config;

import com.skillbridge.rootbot.skill.SkillNotFoundException;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable routing configuration, built once at startup and passed to the
 * components that need it.
 *
 * @param botAppId          this bot's app id; sent to skills as the caller
 * @param skillHostEndpoint URL of this host's /api/skills endpoint, given to skills as serviceUrl
 * @param triggerKeyword    substring of a message that starts a skill session
 * @param targetSkillId     the skill that session is started with
 * @param skills            every configured skill, by id
 */
public record RouterConfiguration(
        String botAppId,
        URI skillHostEndpoint,
        String triggerKeyword,
        String targetSkillId,
        Map<String, SkillDescriptor> skills
) {
    public RouterConfiguration {
        Objects.requireNonNull(skillHostEndpoint, "skillHostEndpoint");
        Objects.requireNonNull(triggerKeyword, "triggerKeyword");
        Objects.requireNonNull(targetSkillId, "targetSkillId");
        botAppId = botAppId == null ? "" : botAppId;
        skills   = Map.copyOf(skills);
    }

    /**
     * @throws SkillNotFoundException if no skill with this id is configured
     */
    public SkillDescriptor skill(String id) {
        SkillDescriptor descriptor = skills.get(id);
        if (descriptor == null) {
            throw new SkillNotFoundException(id);
        }
        return descriptor;
    }

    public SkillDescriptor targetSkill() {
        return skill(targetSkillId);
    }

    /**
     * Validate the bound properties and freeze them.
     *
     * @throws IllegalStateException if the host endpoint or a skill endpoint is
     *         missing, a skill id is duplicated, or the target skill is not configured
     */
    public static RouterConfiguration from(RootBotProperties props) {
        if (props.skillHostEndpoint() == null || props.skillHostEndpoint().isBlank()) {
            throw new IllegalStateException("skillbridge.skill-host-endpoint must be set");
        }
        Map<String, SkillDescriptor> skills = new LinkedHashMap<>();
        if (props.skills() != null) {
            for (RootBotProperties.Skill s : props.skills()) {
                if (s.id() == null || s.id().isBlank()) {
                    throw new IllegalStateException("Every entry in skillbridge.skills needs an id");
                }
                if (s.endpoint() == null || s.endpoint().isBlank()) {
                    throw new IllegalStateException("Skill '" + s.id() + "' has no endpoint");
                }
                SkillDescriptor previous = skills.put(s.id(),
                        new SkillDescriptor(s.id(), s.appId(), URI.create(s.endpoint())));
                if (previous != null) {
                    throw new IllegalStateException("Skill '" + s.id() + "' is configured twice");
                }
            }
        }
        String target = props.router().targetSkillId();
        if (!skills.containsKey(target)) {
            throw new IllegalStateException(
                    "Target skill '" + target + "' is not among the configured skills " + skills.keySet());
        }
        if (props.router().triggerKeyword() == null || props.router().triggerKeyword().isEmpty()) {
            throw new IllegalStateException("skillbridge.router.trigger-keyword must not be empty");
        }
        return new RouterConfiguration(
                props.bot().appId(),
                URI.create(props.skillHostEndpoint()),
                props.router().triggerKeyword(),
                target,
                skills);
    }
}
