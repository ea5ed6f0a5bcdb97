package com.skillbridge.rootbot.skill;

import com.skillbridge.rootbot.model.ConversationReference;

/**
 * A resolved skill conversation: which skill owns it and where its replies go.
 */
public record SkillConversationReference(String skillConversationId,
                                         String skillId,
                                         ConversationReference conversationReference) {}
