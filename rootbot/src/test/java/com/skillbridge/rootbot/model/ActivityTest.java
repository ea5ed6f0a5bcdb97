package com.skillbridge.rootbot.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ActivityTest {

    final ObjectMapper json = new ObjectMapper();

    @Test
    void deserialize_unmappedFields_areWrittenBackUnchanged() throws Exception {
        String in = """
                {"type":"message","text":"hi","locale":"en-US",
                 "attachments":[{"contentType":"image/png","contentUrl":"http://x/y.png"}],
                 "channelData":{"tenant":{"id":"t1"}}}
                """;

        Activity activity = json.readValue(in, Activity.class);
        JsonNode out = json.readTree(json.writeValueAsString(activity));

        assertThat(activity.getText()).isEqualTo("hi");
        assertThat(out.path("locale").asText()).isEqualTo("en-US");
        assertThat(out.path("attachments").get(0).path("contentType").asText()).isEqualTo("image/png");
        assertThat(out.path("channelData").path("tenant").path("id").asText()).isEqualTo("t1");
        assertThat(out.has("kind")).isFalse();
        assertThat(out.has("replyToId")).isFalse();
    }

    @Test
    void getKind_matchesWireValueExactly() {
        assertThat(new Activity("endOfConversation").getKind()).isEqualTo(ActivityKind.END_OF_CONVERSATION);
        assertThat(new Activity("EndOfConversation").getKind()).isEqualTo(ActivityKind.UNKNOWN);
        assertThat(new Activity("somethingNew").getKind()).isEqualTo(ActivityKind.UNKNOWN);
        assertThat(new Activity().getKind()).isEqualTo(ActivityKind.UNKNOWN);
    }

    @Test
    void createReply_swapsParticipantsAndThreadsUnderOriginal() {
        Activity inbound = Activity.message("hello");
        inbound.setId("act-1");
        inbound.setChannelId("emulator");
        inbound.setServiceUrl("http://localhost:5000");
        inbound.setConversation(new ConversationAccount("conv-1"));
        inbound.setFrom(new ChannelAccount("user-1"));
        inbound.setRecipient(new ChannelAccount("root-bot"));

        Activity reply = inbound.createReply("hi back");

        assertThat(reply.getText()).isEqualTo("hi back");
        assertThat(reply.getFrom().id()).isEqualTo("root-bot");
        assertThat(reply.getRecipient().id()).isEqualTo("user-1");
        assertThat(reply.getConversation().id()).isEqualTo("conv-1");
        assertThat(reply.getReplyToId()).isEqualTo("act-1");
        assertThat(reply.getServiceUrl()).isEqualTo("http://localhost:5000");
    }

    @Test
    void copy_isIndependentOfOriginal() {
        Activity original = new Activity("conversationUpdate");
        original.setMembersAdded(new java.util.ArrayList<>(List.of(new ChannelAccount("user-1"))));
        original.setProperty("locale", "en-US");

        Activity copy = original.copy();
        copy.getMembersAdded().add(new ChannelAccount("user-2"));
        copy.setProperty("locale", "fr-FR");
        copy.setConversation(new ConversationAccount("other"));

        assertThat(original.getMembersAdded()).hasSize(1);
        assertThat(original.getProperties()).containsEntry("locale", "en-US");
        assertThat(original.getConversation()).isNull();
    }

    @Test
    void expectsReplies_onlyForExpectRepliesDeliveryMode() {
        Activity activity = Activity.message("hi");
        assertThat(activity.expectsReplies()).isFalse();

        activity.setDeliveryMode("expectReplies");
        assertThat(activity.expectsReplies()).isTrue();
    }

    @Test
    void copy_keepsChannelSpecificFieldsOfAccounts() throws Exception {
        String in = """
                {"type":"message","text":"hi","locale":"en-US",
                 "from":{"id":"u1","name":"U","aadObjectId":"aad-123"},
                 "recipient":{"id":"b1"},
                 "conversation":{"id":"c1","tenantId":"t-9","conversationType":"personal"}}
                """;

        Activity activity = json.readValue(in, Activity.class);
        JsonNode out = json.readTree(json.writeValueAsString(activity.copy()));

        assertThat(out.path("from").path("aadObjectId").asText()).isEqualTo("aad-123");
        assertThat(out.path("from").path("name").asText()).isEqualTo("U");
        assertThat(out.path("conversation").path("tenantId").asText()).isEqualTo("t-9");
        assertThat(out.path("conversation").path("conversationType").asText()).isEqualTo("personal");
        assertThat(out.path("locale").asText()).isEqualTo("en-US");
    }

    @Test
    void conversationWithId_keepsChannelSpecificFields() throws Exception {
        ConversationAccount conversation = json.readValue(
                "{\"id\":\"c1\",\"tenantId\":\"t-9\"}", ConversationAccount.class);

        ConversationAccount renamed = conversation.withId("c1-skill");

        assertThat(renamed.id()).isEqualTo("c1-skill");
        assertThat(renamed.properties()).containsEntry("tenantId", "t-9");
        assertThat(json.readTree(json.writeValueAsString(renamed)).path("tenantId").asText()).isEqualTo("t-9");
    }

    @Test
    @SuppressWarnings("unchecked")
    void copy_nestedExtraPropertiesAreNotShared() throws Exception {
        Activity original = json.readValue("""
                {"type":"message","channelData":{"tenant":{"id":"t1"}},
                 "entities":[{"type":"mention"}]}
                """, Activity.class);

        Activity copy = original.copy();
        ((Map<String, Object>) ((Map<String, Object>) copy.getProperties().get("channelData")).get("tenant"))
                .put("id", "changed");
        ((List<Object>) copy.getProperties().get("entities")).clear();

        JsonNode out = json.readTree(json.writeValueAsString(original));
        assertThat(out.path("channelData").path("tenant").path("id").asText()).isEqualTo("t1");
        assertThat(out.path("entities")).hasSize(1);
    }
}
