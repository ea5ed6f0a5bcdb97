package com.skillbridge.rootbot.service;

import com.skillbridge.rootbot.bot.BotAdapter;
import com.skillbridge.rootbot.connector.ConnectorClient;
import com.skillbridge.rootbot.model.Activity;
import com.skillbridge.rootbot.model.ConversationReference;
import com.skillbridge.rootbot.model.ResourceResponse;
import com.skillbridge.rootbot.skill.SkillConversationIdFactory;
import com.skillbridge.rootbot.skill.SkillConversationReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Handles activities a skill posts back to this host.
 *
 * endOfConversation and event activities are run as root-bot turns in the
 * original conversation; endOfConversation also retires the skill
 * conversation id. Everything else (the skill's messages to the user) is
 * re-addressed and delivered to the channel.
 */
@Service
public class SkillCallbackService {

    private static final Logger log = LoggerFactory.getLogger(SkillCallbackService.class);

    private final SkillConversationIdFactory conversationIdFactory;
    private final BotAdapter                 adapter;
    private final ConnectorClient            connector;

    public SkillCallbackService(SkillConversationIdFactory conversationIdFactory,
                                BotAdapter adapter,
                                ConnectorClient connector) {
        this.conversationIdFactory = conversationIdFactory;
        this.adapter               = adapter;
        this.connector             = connector;
    }

    public Optional<SkillConversationReference> resolve(String skillConversationId) {
        return conversationIdFactory.getSkillConversationReference(skillConversationId);
    }

    /**
     * @param skillConversation the resolved conversation the skill posted to
     * @param replyToActivityId the activity the skill is replying to, or null
     * @param activity          the skill's activity
     */
    public ResourceResponse processActivity(SkillConversationReference skillConversation,
                                            String replyToActivityId,
                                            Activity activity) {
        ConversationReference ref = skillConversation.conversationReference();
        switch (activity.getKind()) {
            case END_OF_CONVERSATION -> {
                conversationIdFactory.deleteConversationReference(skillConversation.skillConversationId());
                log.info("Skill '{}' ended its conversation (code={})",
                        skillConversation.skillId(), activity.getCode());
                adapter.processSkillActivity(toRootTurn(ref, activity));
                return new ResourceResponse(UUID.randomUUID().toString());
            }
            case EVENT -> {
                adapter.processSkillActivity(toRootTurn(ref, activity));
                return new ResourceResponse(UUID.randomUUID().toString());
            }
            default -> {
                Activity outgoing = activity.copy();
                outgoing.applyConversationReference(ref, false);
                outgoing.setReplyToId(replyToActivityId);
                log.debug("Relaying {} activity from skill '{}' to the channel",
                        activity.getType(), skillConversation.skillId());
                return connector.sendActivity(outgoing);
            }
        }
    }

    /**
     * An activity carrying the skill's payload, addressed as if the user had
     * sent it to the root bot in the original conversation.
     */
    static Activity toRootTurn(ConversationReference ref, Activity fromSkill) {
        Activity turn = new Activity(fromSkill.getType());
        turn.applyConversationReference(ref, true);
        turn.setCode(fromSkill.getCode());
        turn.setText(fromSkill.getText());
        turn.setValue(fromSkill.getValue());
        turn.setName(fromSkill.getName());
        turn.setRelatesTo(fromSkill.getRelatesTo());
        turn.setTimestamp(fromSkill.getTimestamp());
        fromSkill.getProperties().forEach(turn::setProperty);
        return turn;
    }
}
