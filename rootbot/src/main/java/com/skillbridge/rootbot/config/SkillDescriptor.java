package com.skillbridge.rootbot.config;

import java.net.URI;

/**
 * A skill the root bot can forward conversations to.
 *
 * @param id            name used in conversation state and configuration
 * @param appId         the skill's app id, sent as the recipient id on forwarded activities
 * @param skillEndpoint the skill's messages endpoint
 */
public record SkillDescriptor(String id, String appId, URI skillEndpoint) {}
