package com.skillbridge.rootbot.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Per-conversation routing state: which skill, if any, currently receives
 * this conversation's turns.
 *
 * Created on the first turn of a conversation, keyed by the conversation's
 * storage key ({channelId}/conversations/{conversationId}).
 *
 * DB table: conversation_sessions  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "conversation_sessions")
public class ConversationSession {

    @Id
    @Column(columnDefinition = "TEXT")
    private String id;

    // Null while the conversation is handled by the root bot itself.
    @Column(name = "active_skill_id", columnDefinition = "TEXT")
    private String activeSkillId;

    @Column(name = "created_at", nullable = false, updatable = false, columnDefinition = "TIMESTAMPTZ")
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false, columnDefinition = "TIMESTAMPTZ")
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected ConversationSession() {}   // required by JPA

    public ConversationSession(String id) {
        this.id = id;
    }

    public String  getId()            { return id; }
    public String  getActiveSkillId() { return activeSkillId; }
    public Instant getCreatedAt()     { return createdAt; }
    public Instant getUpdatedAt()     { return updatedAt; }

    public void setActiveSkillId(String activeSkillId) { this.activeSkillId = activeSkillId; }
}
