package com.skillbridge.rootbot.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Maps the conversation id a skill sees back to the channel conversation it
 * was forwarded from. The skill posts its replies to
 * /api/skills/v3/conversations/{id}/..., and the host looks the reference up
 * here to deliver them.
 *
 * DB table: skill_conversations  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "skill_conversations")
public class SkillConversation {

    @Id
    @Column(columnDefinition = "TEXT")
    private String id;

    @Column(name = "skill_id", nullable = false, columnDefinition = "TEXT")
    private String skillId;

    // ConversationReference serialised as JSON.
    @Column(name = "conversation_reference", nullable = false, columnDefinition = "TEXT")
    private String conversationReference;

    @Column(name = "created_at", nullable = false, updatable = false, columnDefinition = "TIMESTAMPTZ")
    private Instant createdAt = Instant.now();

    protected SkillConversation() {}   // required by JPA

    public SkillConversation(String id, String skillId, String conversationReference) {
        this.id                    = id;
        this.skillId               = skillId;
        this.conversationReference = conversationReference;
    }

    public String  getId()                    { return id; }
    public String  getSkillId()               { return skillId; }
    public String  getConversationReference() { return conversationReference; }
    public Instant getCreatedAt()             { return createdAt; }

    public void setConversationReference(String json) { this.conversationReference = json; }
}
