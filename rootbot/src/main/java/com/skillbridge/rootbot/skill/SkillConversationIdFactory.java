package com.skillbridge.rootbot.skill;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillbridge.rootbot.config.SkillDescriptor;
import com.skillbridge.rootbot.model.Activity;
import com.skillbridge.rootbot.model.ConversationReference;
import com.skillbridge.rootbot.model.SkillConversation;
import com.skillbridge.rootbot.repository.SkillConversationRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Issues the conversation ids skills see and remembers which channel
 * conversation each one belongs to.
 *
 * Ids are deterministic per (conversation, skill, channel), so every turn
 * forwarded from the same conversation to the same skill reuses one row and
 * the skill sees one continuous conversation.
 */
@Component
public class SkillConversationIdFactory {

    private final SkillConversationRepository repo;
    private final ObjectMapper                json;

    public SkillConversationIdFactory(SkillConversationRepository repo, ObjectMapper objectMapper) {
        this.repo = repo;
        this.json = objectMapper;
    }

    /**
     * Store the reference for the conversation activity arrived on and return
     * the id to use towards skill.
     */
    @Transactional
    public String createSkillConversationId(Activity activity, SkillDescriptor skill) {
        ConversationReference ref = ConversationReference.from(activity);
        if (ref.conversation() == null || ref.conversation().id() == null) {
            throw new IllegalArgumentException("Activity has no conversation id");
        }
        String id = skillConversationId(ref.conversation().id(), skill.id(), ref.channelId());
        String refJson = toJson(ref);

        SkillConversation row = repo.findById(id)
                .map(existing -> {
                    existing.setConversationReference(refJson);
                    return existing;
                })
                .orElseGet(() -> new SkillConversation(id, skill.id(), refJson));
        repo.save(row);
        return id;
    }

    @Transactional(readOnly = true)
    public Optional<SkillConversationReference> getSkillConversationReference(String skillConversationId) {
        return repo.findById(skillConversationId)
                .map(row -> new SkillConversationReference(
                        row.getId(), row.getSkillId(), fromJson(row.getConversationReference())));
    }

    /** Forget a skill conversation. Unknown ids are ignored. */
    @Transactional
    public void deleteConversationReference(String skillConversationId) {
        repo.deleteById(skillConversationId);
    }

    static String skillConversationId(String conversationId, String skillId, String channelId) {
        return conversationId + "-" + skillId + "-" + channelId + "-skillconvo";
    }

    private String toJson(ConversationReference ref) {
        try {
            return json.writeValueAsString(ref);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise conversation reference", e);
        }
    }

    private ConversationReference fromJson(String refJson) {
        try {
            return json.readValue(refJson, ConversationReference.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored conversation reference is not valid JSON", e);
        }
    }
}
