package com.skillbridge.rootbot.bot;

import com.fasterxml.jackson.databind.JsonNode;
import com.skillbridge.rootbot.config.RouterConfiguration;
import com.skillbridge.rootbot.config.SkillDescriptor;
import com.skillbridge.rootbot.model.Activity;
import com.skillbridge.rootbot.model.ActivityKind;
import com.skillbridge.rootbot.model.ChannelAccount;
import com.skillbridge.rootbot.skill.SkillHttpClient;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides, per turn, whether the conversation belongs to a skill or to the
 * root bot.
 *
 * <pre>
 *   Idle        --message containing keyword-->  SkillActive   (reply, set state, forward)
 *   SkillActive --any non-endOfConversation--->  SkillActive   (forward unchanged)
 *   any         --endOfConversation----------->  Idle          (clear state, summarise)
 * </pre>
 *
 * Errors from the state store or the skill are not caught here; the
 * {@link BotAdapter} reports them and fails the turn.
 */
@Component
public class ActiveSkillRouter {

    private static final Logger log = LoggerFactory.getLogger(ActiveSkillRouter.class);

    static final String CONNECTING_REPLY = "Got it, connecting you to the skill...";
    static final String WELCOME_REPLY    = "Hello and welcome!";

    private final ConversationState   conversationState;
    private final SkillHttpClient     skillClient;
    private final RouterConfiguration config;
    private final MeterRegistry       meterRegistry;

    public ActiveSkillRouter(ConversationState conversationState,
                             SkillHttpClient skillClient,
                             RouterConfiguration config,
                             MeterRegistry meterRegistry) {
        this.conversationState = conversationState;
        this.skillClient       = skillClient;
        this.config            = config;
        this.meterRegistry     = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Entry point
    // ------------------------------------------------------------------

    public void handleTurn(TurnContext ctx) {
        Activity activity = ctx.getActivity();
        ActivityKind kind = activity.getKind();

        // endOfConversation is never forwarded: it is how control comes back.
        if (kind != ActivityKind.END_OF_CONVERSATION) {
            Optional<String> activeSkillId = conversationState.getActiveSkill(ctx);
            if (activeSkillId.isPresent()) {
                forwardToSkill(ctx, config.skill(activeSkillId.get()));
                return;
            }
        }

        switch (kind) {
            case MESSAGE             -> handleMessage(ctx);
            case END_OF_CONVERSATION -> handleEndOfConversation(ctx);
            case CONVERSATION_UPDATE -> {
                List<ChannelAccount> added = activity.getMembersAdded();
                if (added != null && !added.isEmpty()) {
                    handleMembersAdded(ctx, added);
                }
            }
            default -> log.debug("No handler for {} activity, ignoring", activity.getType());
        }
    }

    // ------------------------------------------------------------------
    // Handlers
    // ------------------------------------------------------------------

    void handleMessage(TurnContext ctx) {
        String text = ctx.getActivity().getText();
        if (text != null && text.contains(config.triggerKeyword())) {
            ctx.sendActivity(CONNECTING_REPLY);

            SkillDescriptor target = config.targetSkill();
            conversationState.setActiveSkill(ctx, target.id());
            log.info("Conversation handed to skill '{}'", target.id());

            forwardToSkill(ctx, target);
        } else {
            ctx.sendActivity(helpReply());
        }
    }

    void handleEndOfConversation(TurnContext ctx) {
        Activity activity = ctx.getActivity();
        Optional<String> endedSkill = conversationState.getActiveSkill(ctx);
        conversationState.deleteActiveSkill(ctx);
        log.info("endOfConversation received (code={}, activeSkill={})",
                activity.getCode(), endedSkill.orElse("none"));

        ctx.sendActivity(endOfConversationSummary(activity));
        ctx.sendActivity(backInRootReply());

        conversationState.saveChanges(ctx, true);
    }

    void handleMembersAdded(TurnContext ctx, List<ChannelAccount> membersAdded) {
        ChannelAccount recipient = ctx.getActivity().getRecipient();
        String botId = recipient == null ? null : recipient.id();
        for (ChannelAccount member : membersAdded) {
            // The bot joining the conversation is reported as a member too.
            if (!Objects.equals(member.id(), botId)) {
                ctx.sendActivity(WELCOME_REPLY);
            }
        }
    }

    /**
     * Save state, then post the turn's activity to skill. The save comes first
     * so the skill, which may read the same conversation state, sees this
     * turn's changes.
     */
    void forwardToSkill(TurnContext ctx, SkillDescriptor skill) {
        conversationState.saveChanges(ctx, true);

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            skillClient.postActivity(config.botAppId(), skill, config.skillHostEndpoint(), ctx.getActivity());
        } catch (RuntimeException e) {
            status = "error";
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("rootbot.skill.duration", "skill", skill.id()));
            meterRegistry.counter("rootbot.skill.forwards",
                    "skill", skill.id(), "status", status).increment();
        }
    }

    // ------------------------------------------------------------------
    // Reply text
    // ------------------------------------------------------------------

    String helpReply() {
        return "Me no nothin'. Say \"" + config.triggerKeyword() + "\" and I'll patch you through";
    }

    String backInRootReply() {
        return "Back in the root bot. Say \"" + config.triggerKeyword() + "\" and I'll patch you through";
    }

    /** "Received endOfConversation." plus Code / Text / Value lines for whichever are present. */
    static String endOfConversationSummary(Activity activity) {
        StringBuilder sb = new StringBuilder("Received ")
                .append(ActivityKind.END_OF_CONVERSATION.wireValue()).append('.');
        if (activity.getCode() != null && !activity.getCode().isEmpty()) {
            sb.append("\n\nCode: ").append(activity.getCode());
        }
        if (activity.getText() != null && !activity.getText().isEmpty()) {
            sb.append("\n\nText: ").append(activity.getText());
        }
        JsonNode value = activity.getValue();
        if (value != null && !value.isNull() && !value.isMissingNode()) {
            sb.append("\n\nValue: ").append(value.isTextual() ? value.asText() : value.toString());
        }
        return sb.toString();
    }
}
