package com.skillbridge.rootbot.repository;

import com.skillbridge.rootbot.model.ConversationSession;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * CRUD for the conversation_sessions table.
 *
 * Spring Data JPA generates the implementation at startup.
 */
public interface ConversationSessionRepository extends JpaRepository<ConversationSession, String> {
}
