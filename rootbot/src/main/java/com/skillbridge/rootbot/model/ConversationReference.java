package com.skillbridge.rootbot.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Everything needed to address a conversation again after the turn that
 * produced it has finished: stored when a turn is forwarded to a skill, and
 * used to route the skill's replies back to the channel.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConversationReference(
        String              activityId,
        ChannelAccount      user,
        ChannelAccount      bot,
        ConversationAccount conversation,
        String              channelId,
        String              serviceUrl
) {
    /** Reference for the conversation an inbound activity arrived on. */
    public static ConversationReference from(Activity inbound) {
        return new ConversationReference(
                inbound.getId(),
                inbound.getFrom(),
                inbound.getRecipient(),
                inbound.getConversation(),
                inbound.getChannelId(),
                inbound.getServiceUrl());
    }
}
