package com.skillbridge.rootbot.bot;

import com.skillbridge.rootbot.config.RouterConfiguration;
import com.skillbridge.rootbot.connector.ConnectorClient;
import com.skillbridge.rootbot.model.Activity;
import com.skillbridge.rootbot.model.ChannelAccount;
import com.skillbridge.rootbot.model.ConversationReference;
import com.skillbridge.rootbot.model.ExpectedReplies;
import com.skillbridge.rootbot.model.ResourceResponse;
import com.skillbridge.rootbot.skill.SkillHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Turn pipeline between the HTTP endpoints and {@link ActiveSkillRouter}.
 *
 * Validates the activity, picks the reply sink, runs the router and, when the
 * turn throws, cleans up: tells the user, ends any active skill session with
 * code {@value #ROOT_SKILL_ERROR_CODE}, drops the conversation's state, and
 * fails the turn with {@link TurnFailedException}.
 */
@Component
public class BotAdapter {

    private static final Logger log = LoggerFactory.getLogger(BotAdapter.class);

    static final String ERROR_REPLY           = "The bot encountered an error or bug.";
    static final String FIX_SOURCE_REPLY      = "To continue to run this bot, please fix the bot source code.";
    static final String ROOT_SKILL_ERROR_CODE = "RootSkillError";

    static final String MDC_CONVERSATION_ID = "conversationId";
    static final String MDC_CHANNEL_ID      = "channelId";
    static final String MDC_ACTIVITY_TYPE   = "activityType";

    private final ActiveSkillRouter   router;
    private final ConversationState   conversationState;
    private final SkillHttpClient     skillClient;
    private final ConnectorClient     connector;
    private final RouterConfiguration config;

    public BotAdapter(ActiveSkillRouter router,
                      ConversationState conversationState,
                      SkillHttpClient skillClient,
                      ConnectorClient connector,
                      RouterConfiguration config) {
        this.router            = router;
        this.conversationState = conversationState;
        this.skillClient       = skillClient;
        this.connector         = connector;
        this.config            = config;
    }

    // ------------------------------------------------------------------
    // Entry points
    // ------------------------------------------------------------------

    /**
     * Run a turn for an activity a channel posted to /api/messages.
     *
     * @return the buffered replies when the activity asked for expectReplies
     *         delivery; empty when replies were posted to the channel
     * @throws IllegalArgumentException if the activity has no type, channel or conversation
     * @throws TurnFailedException      if the turn failed
     */
    public Optional<ExpectedReplies> processActivity(Activity activity) {
        validate(activity);
        if (activity.expectsReplies()) {
            List<Activity> buffered = new ArrayList<>();
            runTurn(activity, reply -> {
                buffered.add(reply);
                return new ResourceResponse(UUID.randomUUID().toString());
            });
            return Optional.of(new ExpectedReplies(buffered));
        }
        runTurn(activity, connector::sendActivity);
        return Optional.empty();
    }

    /**
     * Run a turn for an activity a skill sent back (endOfConversation, event),
     * already addressed to the original conversation. Replies always go to the channel.
     */
    public void processSkillActivity(Activity activity) {
        validate(activity);
        runTurn(activity, connector::sendActivity);
    }

    // ------------------------------------------------------------------
    // Turn execution
    // ------------------------------------------------------------------

    private void runTurn(Activity activity, ReplySink replySink) {
        MDC.put(MDC_CONVERSATION_ID, activity.getConversation().id());
        MDC.put(MDC_CHANNEL_ID,      activity.getChannelId());
        MDC.put(MDC_ACTIVITY_TYPE,   activity.getType());
        TurnContext ctx = new TurnContext(activity, logged(replySink));
        try {
            log.info("Inbound {} activity {} from {}",
                    activity.getType(), activity.getId(), accountId(activity.getFrom()));
            router.handleTurn(ctx);
        } catch (Exception e) {
            onTurnError(ctx, e);
            throw new TurnFailedException(
                    "Turn failed for conversation " + activity.getConversation().id(), e);
        } finally {
            // Only our keys: the request thread may carry MDC entries set upstream.
            MDC.remove(MDC_CONVERSATION_ID);
            MDC.remove(MDC_CHANNEL_ID);
            MDC.remove(MDC_ACTIVITY_TYPE);
        }
    }

    /** Logs every outgoing activity, whether it is posted to the channel or buffered. */
    private static ReplySink logged(ReplySink sink) {
        return reply -> {
            log.info("Outbound {} activity to {}: {}",
                    reply.getType(), accountId(reply.getRecipient()), reply.getText());
            return sink.send(reply);
        };
    }

    private static String accountId(ChannelAccount account) {
        return account == null ? null : account.id();
    }

    /**
     * Report the failure and reset the conversation. Each cleanup step is
     * attempted independently; a failure in one is logged and the rest still run.
     */
    void onTurnError(TurnContext ctx, Exception error) {
        log.error("Unhandled error in turn: {}", error.getMessage(), error);

        try {
            ctx.sendActivity(ERROR_REPLY);
            ctx.sendActivity(FIX_SOURCE_REPLY);
        } catch (Exception e) {
            log.warn("Could not send the error message to the user: {}", e.getMessage());
        }

        try {
            Optional<String> activeSkillId = conversationState.getActiveSkill(ctx);
            if (activeSkillId.isPresent()) {
                Activity endOfConversation = Activity.endOfConversation(ROOT_SKILL_ERROR_CODE);
                endOfConversation.applyConversationReference(
                        ConversationReference.from(ctx.getActivity()), true);
                skillClient.postActivity(config.botAppId(), config.skill(activeSkillId.get()),
                        config.skillHostEndpoint(), endOfConversation);
                log.info("Sent endOfConversation ({}) to skill '{}'",
                        ROOT_SKILL_ERROR_CODE, activeSkillId.get());
            }
        } catch (Exception e) {
            log.error("Exception caught on attempting to send endOfConversation to the active skill", e);
        }

        try {
            conversationState.clear(ctx);
        } catch (Exception e) {
            log.error("Could not clear conversation state after turn error", e);
        }
    }

    private static void validate(Activity activity) {
        if (activity == null) {
            throw new IllegalArgumentException("Request body must be an activity");
        }
        if (activity.getType() == null || activity.getType().isBlank()) {
            throw new IllegalArgumentException("Activity type is required");
        }
        // Also checks channelId and conversation.id.
        ConversationState.storageKey(activity);
    }
}
