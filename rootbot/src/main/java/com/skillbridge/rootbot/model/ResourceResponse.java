package com.skillbridge.rootbot.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Id of an activity accepted by a channel or by this host.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResourceResponse(String id) {}
