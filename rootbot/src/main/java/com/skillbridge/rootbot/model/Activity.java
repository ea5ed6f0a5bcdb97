package com.skillbridge.rootbot.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The activity envelope exchanged with channels and skills.
 *
 * Only the fields the host reads or rewrites are mapped explicitly. Every
 * other JSON property (attachments, entities, channelData, locale, ...) is kept
 * in {@link #getProperties()} and written back out unchanged, so an activity
 * forwarded to a skill carries the same content the channel sent.
 *
 * Mutable on purpose: the transport copies an activity and rewrites its
 * addressing fields before posting it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Activity {

    public static final String DELIVERY_MODE_EXPECT_REPLIES = "expectReplies";

    private String              type;
    private String              id;
    private String              timestamp;
    private String              serviceUrl;
    private String              channelId;
    private ChannelAccount      from;
    private ChannelAccount      recipient;
    private ConversationAccount conversation;
    private String              text;
    private String              code;
    private JsonNode            value;
    private String              name;
    private String              replyToId;
    private String              deliveryMode;
    private String              callerId;
    private String              inputHint;
    private List<ChannelAccount> membersAdded;
    private List<ChannelAccount> membersRemoved;
    private ConversationReference relatesTo;

    private final Map<String, Object> properties = new LinkedHashMap<>();

    public Activity() {}

    public Activity(String type) {
        this.type = type;
    }

    // ------------------------------------------------------------------
    // Factories
    // ------------------------------------------------------------------

    public static Activity message(String text) {
        Activity activity = new Activity(ActivityKind.MESSAGE.wireValue());
        activity.setText(text);
        return activity;
    }

    public static Activity endOfConversation(String code) {
        Activity activity = new Activity(ActivityKind.END_OF_CONVERSATION.wireValue());
        activity.setCode(code);
        return activity;
    }

    /**
     * A message addressed back to whoever sent this activity, threaded
     * under it via replyToId.
     */
    public Activity createReply(String replyText) {
        Activity reply = message(replyText);
        reply.setFrom(recipient);
        reply.setRecipient(from);
        reply.setConversation(conversation);
        reply.setChannelId(channelId);
        reply.setServiceUrl(serviceUrl);
        reply.setReplyToId(id);
        return reply;
    }

    /**
     * Address this activity to the conversation in ref.
     *
     * Incoming activities look as if the user sent them to the bot; outgoing
     * ones are sent by the bot to the user and thread under the referenced
     * activity when one is known.
     */
    public Activity applyConversationReference(ConversationReference ref, boolean incoming) {
        this.channelId    = ref.channelId();
        this.serviceUrl   = ref.serviceUrl();
        this.conversation = ref.conversation();
        if (incoming) {
            this.from      = ref.user();
            this.recipient = ref.bot();
        } else {
            this.from      = ref.bot();
            this.recipient = ref.user();
            if (ref.activityId() != null) {
                this.replyToId = ref.activityId();
            }
        }
        return this;
    }

    /**
     * Field-by-field copy. Accounts and references are immutable and shared;
     * lists, value and the extra properties (down to nested maps and lists)
     * are copied, so the copy can be edited without touching this activity.
     */
    public Activity copy() {
        Activity c = new Activity(type);
        c.id             = id;
        c.timestamp      = timestamp;
        c.serviceUrl     = serviceUrl;
        c.channelId      = channelId;
        c.from           = from;
        c.recipient      = recipient;
        c.conversation   = conversation;
        c.text           = text;
        c.code           = code;
        c.value          = value == null ? null : value.deepCopy();
        c.name           = name;
        c.replyToId      = replyToId;
        c.deliveryMode   = deliveryMode;
        c.callerId       = callerId;
        c.inputHint      = inputHint;
        c.membersAdded   = membersAdded == null ? null : new ArrayList<>(membersAdded);
        c.membersRemoved = membersRemoved == null ? null : new ArrayList<>(membersRemoved);
        c.relatesTo      = relatesTo;
        properties.forEach((key, v) -> c.properties.put(key, deepCopy(v)));
        return c;
    }

    @JsonIgnore
    public ActivityKind getKind() {
        return ActivityKind.of(type);
    }

    @JsonIgnore
    public boolean expectsReplies() {
        return DELIVERY_MODE_EXPECT_REPLIES.equals(deliveryMode);
    }

    // ------------------------------------------------------------------
    // Unmapped properties
    // ------------------------------------------------------------------

    @JsonAnyGetter
    public Map<String, Object> getProperties() { return properties; }

    @JsonAnySetter
    public void setProperty(String key, Object v) { properties.put(key, v); }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String               getType()           { return type; }
    public String               getId()             { return id; }
    public String               getTimestamp()      { return timestamp; }
    public String               getServiceUrl()     { return serviceUrl; }
    public String               getChannelId()      { return channelId; }
    public ChannelAccount       getFrom()           { return from; }
    public ChannelAccount       getRecipient()      { return recipient; }
    public ConversationAccount  getConversation()   { return conversation; }
    public String               getText()           { return text; }
    public String               getCode()           { return code; }
    public JsonNode             getValue()          { return value; }
    public String               getName()           { return name; }
    public String               getReplyToId()      { return replyToId; }
    public String               getDeliveryMode()   { return deliveryMode; }
    public String               getCallerId()       { return callerId; }
    public String               getInputHint()      { return inputHint; }
    public List<ChannelAccount> getMembersAdded()   { return membersAdded; }
    public List<ChannelAccount> getMembersRemoved() { return membersRemoved; }
    public ConversationReference getRelatesTo()     { return relatesTo; }

    public void setType(String type)                           { this.type = type; }
    public void setId(String id)                               { this.id = id; }
    public void setTimestamp(String timestamp)                 { this.timestamp = timestamp; }
    public void setServiceUrl(String serviceUrl)               { this.serviceUrl = serviceUrl; }
    public void setChannelId(String channelId)                 { this.channelId = channelId; }
    public void setFrom(ChannelAccount from)                   { this.from = from; }
    public void setRecipient(ChannelAccount recipient)         { this.recipient = recipient; }
    public void setConversation(ConversationAccount c)         { this.conversation = c; }
    public void setText(String text)                           { this.text = text; }
    public void setCode(String code)                           { this.code = code; }
    public void setValue(JsonNode value)                       { this.value = value; }
    public void setName(String name)                           { this.name = name; }
    public void setReplyToId(String replyToId)                 { this.replyToId = replyToId; }
    public void setDeliveryMode(String deliveryMode)           { this.deliveryMode = deliveryMode; }
    public void setCallerId(String callerId)                   { this.callerId = callerId; }
    public void setInputHint(String inputHint)                 { this.inputHint = inputHint; }
    public void setMembersAdded(List<ChannelAccount> m)        { this.membersAdded = m; }
    public void setMembersRemoved(List<ChannelAccount> m)      { this.membersRemoved = m; }
    public void setRelatesTo(ConversationReference relatesTo)  { this.relatesTo = relatesTo; }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    // Unmapped properties arrive as Jackson's untyped values: maps, lists and scalars.
    private static Object deepCopy(Object v) {
        if (v instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((key, item) -> copy.put(key, deepCopy(item)));
            return copy;
        }
        if (v instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(deepCopy(item)));
            return copy;
        }
        if (v instanceof JsonNode node) {
            return node.deepCopy();
        }
        return v;
    }
}
