package com.skillbridge.rootbot.skill;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillbridge.rootbot.config.SkillDescriptor;
import com.skillbridge.rootbot.model.Activity;
import com.skillbridge.rootbot.model.ChannelAccount;
import com.skillbridge.rootbot.model.ConversationReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * HTTP transport that posts activities to a skill's messages endpoint.
 *
 * The activity's content is sent unchanged; only its addressing is rewritten
 * so the skill replies to this host (serviceUrl) under a skill-side
 * conversation id that maps back to the channel conversation.
 *
 * No retries: a non-2xx status or an I/O failure is a {@link SkillInvocationException}.
 */
@Component
public class SkillHttpClient {

    private static final Logger log = LoggerFactory.getLogger(SkillHttpClient.class);

    static final String CALLER_ID_PREFIX = "urn:botframework:aadappid:";

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient                 http;
    private final ObjectMapper               json;
    private final SkillConversationIdFactory conversationIdFactory;

    public SkillHttpClient(ObjectMapper objectMapper, SkillConversationIdFactory conversationIdFactory) {
        this.json                  = objectMapper;
        this.conversationIdFactory = conversationIdFactory;
        this.http                  = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /**
     * Forward activity to skill.
     *
     * @param fromBotId    this bot's app id, sent as the caller id
     * @param skill        where to send it
     * @param hostEndpoint this host's skill callback URL, sent as serviceUrl
     * @param activity     the inbound activity; not modified
     * @return the skill's status and body
     * @throws SkillInvocationException if the skill answers non-2xx or is unreachable
     */
    public InvokeResponse postActivity(String fromBotId, SkillDescriptor skill,
                                       URI hostEndpoint, Activity activity) {
        String skillConversationId = conversationIdFactory.createSkillConversationId(activity, skill);

        Activity outbound = activity.copy();
        outbound.setRelatesTo(ConversationReference.from(activity));
        outbound.setConversation(activity.getConversation().withId(skillConversationId));
        outbound.setServiceUrl(hostEndpoint.toString());
        outbound.setRecipient(new ChannelAccount(skill.appId(), null, "skill"));
        if (fromBotId != null && !fromBotId.isBlank()) {
            outbound.setCallerId(CALLER_ID_PREFIX + fromBotId);
        }

        log.info("Posting {} activity to skill '{}' at {} (skill conversation {})",
                activity.getType(), skill.id(), skill.skillEndpoint(), skillConversationId);

        HttpResponse<String> resp;
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(skill.skillEndpoint())
                    .timeout(REQUEST_TIMEOUT)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(toJson(outbound)))
                    .build();
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SkillInvocationException(skill.id(), "Interrupted while posting to skill '" + skill.id() + "'", e);
        } catch (Exception e) {
            throw new SkillInvocationException(skill.id(), "Posting to skill '" + skill.id() + "' failed", e);
        }

        InvokeResponse result = new InvokeResponse(resp.statusCode(), parseBody(resp.body()));
        if (!result.isSuccessStatusCode()) {
            throw new SkillInvocationException(skill.id(), resp.statusCode(),
                    "Skill '" + skill.id() + "' returned HTTP " + resp.statusCode() + ": " + resp.body());
        }
        return result;
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    /** Skills usually answer 200/202 with an empty body; non-JSON bodies are dropped. */
    private JsonNode parseBody(String body) {
        if (body == null || body.isBlank()) return null;
        try {
            return json.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Ignoring non-JSON skill response body: {}", body);
            return null;
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON serialization failed", e);
        }
    }
}
