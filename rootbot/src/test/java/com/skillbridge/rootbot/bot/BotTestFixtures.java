package com.skillbridge.rootbot.bot;

import com.skillbridge.rootbot.config.RouterConfiguration;
import com.skillbridge.rootbot.config.SkillDescriptor;
import com.skillbridge.rootbot.model.Activity;
import com.skillbridge.rootbot.model.ChannelAccount;
import com.skillbridge.rootbot.model.ConversationAccount;
import com.skillbridge.rootbot.model.ResourceResponse;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Shared activities and configuration for the bot package tests.
 */
final class BotTestFixtures {

    static final String CHANNEL_ID      = "emulator";
    static final String CONVERSATION_ID = "conv-1";
    static final String STORAGE_KEY     = CHANNEL_ID + "/conversations/" + CONVERSATION_ID;
    static final String BOT_ID          = "root-bot";
    static final String USER_ID         = "user-1";
    static final String SERVICE_URL     = "http://localhost:5000";

    static final SkillDescriptor ECHO_SKILL = new SkillDescriptor(
            "EchoSkillBot", "echo-app-id", URI.create("http://localhost:39783/api/messages"));

    private BotTestFixtures() {}

    static RouterConfiguration config() {
        return new RouterConfiguration(
                "root-app-id",
                URI.create("http://localhost:3978/api/skills"),
                "skill",
                ECHO_SKILL.id(),
                Map.of(ECHO_SKILL.id(), ECHO_SKILL));
    }

    static Activity message(String text) {
        Activity activity = Activity.message(text);
        return addressed(activity);
    }

    static Activity endOfConversation(String code, String text) {
        Activity activity = Activity.endOfConversation(code);
        activity.setText(text);
        return addressed(activity);
    }

    static Activity membersAdded(String... memberIds) {
        Activity activity = addressed(new Activity("conversationUpdate"));
        activity.setMembersAdded(java.util.Arrays.stream(memberIds).map(ChannelAccount::new).toList());
        return activity;
    }

    static Activity addressed(Activity activity) {
        activity.setId(UUID.randomUUID().toString());
        activity.setChannelId(CHANNEL_ID);
        activity.setServiceUrl(SERVICE_URL);
        activity.setConversation(new ConversationAccount(CONVERSATION_ID));
        activity.setFrom(new ChannelAccount(USER_ID, "User", "user"));
        activity.setRecipient(new ChannelAccount(BOT_ID, "Root", "bot"));
        return activity;
    }

    /** A turn whose replies are collected into sent. */
    static TurnContext turn(Activity activity, List<Activity> sent) {
        return new TurnContext(activity, reply -> {
            sent.add(reply);
            return new ResourceResponse("reply-" + sent.size());
        });
    }
}
