package com.skillbridge.rootbot.bot;

import com.skillbridge.rootbot.model.Activity;
import com.skillbridge.rootbot.model.ConversationReference;
import com.skillbridge.rootbot.model.ResourceResponse;

import java.util.HashMap;
import java.util.Map;

/**
 * One turn: the inbound activity, where replies go, and a scratch map for
 * state loaded during the turn.
 *
 * Not thread-safe; a turn runs on a single request thread.
 */
public class TurnContext {

    private final Activity            activity;
    private final ReplySink           replySink;
    private final Map<String, Object> turnState = new HashMap<>();
    private boolean                   responded;

    public TurnContext(Activity activity, ReplySink replySink) {
        this.activity  = activity;
        this.replySink = replySink;
    }

    public Activity getActivity() {
        return activity;
    }

    /** Reply to the inbound activity with a plain text message. */
    public ResourceResponse sendActivity(String text) {
        return sendActivity(activity.createReply(text));
    }

    /**
     * Send an activity in this turn's conversation. An activity with no
     * conversation set is addressed as a reply to the inbound activity.
     */
    public ResourceResponse sendActivity(Activity reply) {
        if (reply.getConversation() == null) {
            reply.applyConversationReference(ConversationReference.from(activity), false);
        }
        ResourceResponse response = replySink.send(reply);
        responded = true;
        return response;
    }

    /** True once any activity has been sent during this turn. */
    public boolean hasResponded() {
        return responded;
    }

    @SuppressWarnings("unchecked")
    <T> T getTurnState(String key) {
        return (T) turnState.get(key);
    }

    void putTurnState(String key, Object value) {
        turnState.put(key, value);
    }

    void removeTurnState(String key) {
        turnState.remove(key);
    }
}
