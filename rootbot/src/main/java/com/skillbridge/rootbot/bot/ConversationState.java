package com.skillbridge.rootbot.bot;

import com.skillbridge.rootbot.model.Activity;
import com.skillbridge.rootbot.model.ConversationSession;
import com.skillbridge.rootbot.repository.ConversationSessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Keyed accessor for per-conversation routing state.
 *
 * The session row is read at most once per turn and cached on the
 * {@link TurnContext}; get/set/delete only touch the cached copy.
 * Nothing reaches the database until {@link #saveChanges} is called.
 */
@Component
public class ConversationState {

    private static final Logger log = LoggerFactory.getLogger(ConversationState.class);

    private static final String CACHE_KEY = ConversationState.class.getName();

    private final ConversationSessionRepository repo;

    public ConversationState(ConversationSessionRepository repo) {
        this.repo = repo;
    }

    // ------------------------------------------------------------------
    // Active skill accessor
    // ------------------------------------------------------------------

    /** The skill currently handling this conversation; empty while the root bot handles it. */
    public Optional<String> getActiveSkill(TurnContext ctx) {
        return Optional.ofNullable(load(ctx).session.getActiveSkillId());
    }

    public void setActiveSkill(TurnContext ctx, String skillId) {
        CachedSession cached = load(ctx);
        cached.session.setActiveSkillId(skillId);
        cached.changed = true;
    }

    /** Clear the active skill. Clearing an already idle conversation changes nothing. */
    public void deleteActiveSkill(TurnContext ctx) {
        CachedSession cached = load(ctx);
        if (cached.session.getActiveSkillId() != null) {
            cached.session.setActiveSkillId(null);
            cached.changed = true;
        }
    }

    // ------------------------------------------------------------------
    // Persistence
    // ------------------------------------------------------------------

    /**
     * Write the cached session back to the store.
     *
     * @param force write even if nothing changed this turn (this also creates
     *              the row for a conversation seen for the first time)
     */
    public void saveChanges(TurnContext ctx, boolean force) {
        CachedSession cached = ctx.getTurnState(CACHE_KEY);
        if (cached == null) {
            if (!force) return;
            cached = load(ctx);
        }
        if (force || cached.changed) {
            repo.save(cached.session);
            cached.changed = false;
            log.debug("Saved conversation state {} (activeSkill={})",
                    cached.session.getId(), cached.session.getActiveSkillId());
        }
    }

    /** Delete everything stored for this conversation. */
    public void clear(TurnContext ctx) {
        String key = storageKey(ctx.getActivity());
        ctx.removeTurnState(CACHE_KEY);
        repo.deleteById(key);
        log.info("Cleared conversation state {}", key);
    }

    /**
     * {channelId}/conversations/{conversationId}
     *
     * @throws IllegalArgumentException if the activity has no channel or conversation id
     */
    public static String storageKey(Activity activity) {
        if (activity.getChannelId() == null || activity.getChannelId().isBlank()) {
            throw new IllegalArgumentException("Activity has no channelId");
        }
        if (activity.getConversation() == null || activity.getConversation().id() == null
                || activity.getConversation().id().isBlank()) {
            throw new IllegalArgumentException("Activity has no conversation id");
        }
        return activity.getChannelId() + "/conversations/" + activity.getConversation().id();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private CachedSession load(TurnContext ctx) {
        CachedSession cached = ctx.getTurnState(CACHE_KEY);
        if (cached == null) {
            String key = storageKey(ctx.getActivity());
            cached = new CachedSession(repo.findById(key).orElseGet(() -> new ConversationSession(key)));
            ctx.putTurnState(CACHE_KEY, cached);
        }
        return cached;
    }

    private static final class CachedSession {
        final ConversationSession session;
        boolean             changed;

        CachedSession(ConversationSession session) {
            this.session = session;
        }
    }
}
