package com.skillbridge.rootbot.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillbridge.rootbot.bot.ConversationState;
import com.skillbridge.rootbot.bot.TurnContext;
import com.skillbridge.rootbot.config.SkillDescriptor;
import com.skillbridge.rootbot.model.Activity;
import com.skillbridge.rootbot.model.ChannelAccount;
import com.skillbridge.rootbot.model.ConversationAccount;
import com.skillbridge.rootbot.model.ConversationSession;
import com.skillbridge.rootbot.model.ResourceResponse;
import com.skillbridge.rootbot.skill.SkillConversationIdFactory;
import com.skillbridge.rootbot.skill.SkillConversationReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.net.URI;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the Flyway schema and the JPA mappings against a real PostgreSQL
 * (Testcontainers). Hibernate validates the mappings against the migrated
 * schema on startup.
 *
 * Transactions are disabled for the test methods so every repository call
 * commits on its own, the way one turn after another does in production.
 * Skipped when no Docker daemon is available.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Testcontainers(disabledWithoutDocker = true)
class ConversationPersistenceTest {

    @Container
    static final PostgreSQLContainer<?> POSTGRES =
            new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"))
                    .withDatabaseName("skillbridge_test")
                    .withUsername("skillbridge")
                    .withPassword("skillbridge");

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url",      POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
    }

    static final String STORAGE_KEY = "emulator/conversations/conv-1";

    static final SkillDescriptor ECHO = new SkillDescriptor(
            "EchoSkillBot", "echo-app-id", URI.create("http://localhost:39783/api/messages"));

    @Autowired ConversationSessionRepository sessionRepo;
    @Autowired SkillConversationRepository   skillConversationRepo;

    ConversationState          conversationState;
    SkillConversationIdFactory idFactory;

    @BeforeEach
    void setUp() {
        conversationState = new ConversationState(sessionRepo);
        idFactory         = new SkillConversationIdFactory(skillConversationRepo, new ObjectMapper());
    }

    @AfterEach
    void cleanUp() {
        sessionRepo.deleteAll();
        skillConversationRepo.deleteAll();
    }

    // ------------------------------------------------------------------
    // conversation_sessions
    // ------------------------------------------------------------------

    @Test
    void newSession_withAssignedId_isInsertedAndReadBack() {
        sessionRepo.save(new ConversationSession(STORAGE_KEY));

        Optional<ConversationSession> loaded = sessionRepo.findById(STORAGE_KEY);

        assertThat(loaded).isPresent();
        assertThat(loaded.get().getActiveSkillId()).isNull();
        assertThat(loaded.get().getCreatedAt()).isNotNull();
        assertThat(loaded.get().getUpdatedAt()).isNotNull();
    }

    @Test
    void activeSkill_setInOneTurn_clearedInTheNext() {
        TurnContext first = turn();
        conversationState.setActiveSkill(first, "EchoSkillBot");
        conversationState.saveChanges(first, true);

        assertThat(sessionRepo.findById(STORAGE_KEY))
                .get().extracting(ConversationSession::getActiveSkillId).isEqualTo("EchoSkillBot");

        TurnContext second = turn();
        assertThat(conversationState.getActiveSkill(second)).contains("EchoSkillBot");
        conversationState.deleteActiveSkill(second);
        conversationState.saveChanges(second, false);

        ConversationSession stored = sessionRepo.findById(STORAGE_KEY).orElseThrow();
        assertThat(stored.getActiveSkillId()).isNull();
        assertThat(stored.getUpdatedAt()).isAfterOrEqualTo(stored.getCreatedAt());
        assertThat(conversationState.getActiveSkill(turn())).isEmpty();
    }

    @Test
    void clear_deletesTheRow_andIgnoresAMissingOne() {
        TurnContext first = turn();
        conversationState.setActiveSkill(first, "EchoSkillBot");
        conversationState.saveChanges(first, true);

        conversationState.clear(turn());
        conversationState.clear(turn());

        assertThat(sessionRepo.existsById(STORAGE_KEY)).isFalse();
    }

    // ------------------------------------------------------------------
    // skill_conversations
    // ------------------------------------------------------------------

    @Test
    void skillConversation_roundTripsTheConversationReference() {
        String id = idFactory.createSkillConversationId(inbound(), ECHO);
        // The next turn of the same conversation reuses the row.
        assertThat(idFactory.createSkillConversationId(inbound(), ECHO)).isEqualTo(id);
        assertThat(skillConversationRepo.count()).isEqualTo(1);

        SkillConversationReference ref = idFactory.getSkillConversationReference(id).orElseThrow();
        assertThat(ref.skillId()).isEqualTo("EchoSkillBot");
        assertThat(ref.conversationReference().conversation().id()).isEqualTo("conv-1");
        assertThat(ref.conversationReference().serviceUrl()).isEqualTo("http://localhost:5000");
        assertThat(ref.conversationReference().user().id()).isEqualTo("user-1");

        idFactory.deleteConversationReference(id);
        assertThat(idFactory.getSkillConversationReference(id)).isEmpty();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static TurnContext turn() {
        return new TurnContext(inbound(), reply -> new ResourceResponse(null));
    }

    private static Activity inbound() {
        Activity activity = Activity.message("hi");
        activity.setId("act-1");
        activity.setChannelId("emulator");
        activity.setServiceUrl("http://localhost:5000");
        activity.setConversation(new ConversationAccount("conv-1"));
        activity.setFrom(new ChannelAccount("user-1"));
        activity.setRecipient(new ChannelAccount("root-bot"));
        return activity;
    }
}
