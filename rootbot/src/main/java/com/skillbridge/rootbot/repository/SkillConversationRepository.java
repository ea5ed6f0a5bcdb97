package com.skillbridge.rootbot.repository;

import com.skillbridge.rootbot.model.SkillConversation;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * CRUD for the skill_conversations table.
 */
public interface SkillConversationRepository extends JpaRepository<SkillConversation, String> {
}
