package com.skillbridge.rootbot.connector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillbridge.rootbot.model.Activity;
import com.skillbridge.rootbot.model.ResourceResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * HTTP client for a channel's connector service: delivers the bot's outgoing
 * activities to the serviceUrl the conversation arrived from.
 *
 * POST {serviceUrl}/v3/conversations/{conversationId}/activities              (new message)
 * POST {serviceUrl}/v3/conversations/{conversationId}/activities/{replyToId}  (threaded reply)
 */
@Component
public class ConnectorClient {

    private static final Logger log = LoggerFactory.getLogger(ConnectorClient.class);

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient   http;
    private final ObjectMapper json;

    public ConnectorClient(ObjectMapper objectMapper) {
        this.json = objectMapper;
        this.http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /**
     * Send activity to its conversation.
     *
     * @return the id the channel assigned, or a response with a null id if the
     *         channel returned no body
     * @throws ConnectorException on a non-2xx status or I/O failure
     */
    public ResourceResponse sendActivity(Activity activity) {
        URI uri = activityUri(activity);
        log.debug("Sending {} activity to {}", activity.getType(), uri);
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(uri)
                    .timeout(REQUEST_TIMEOUT)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(activity)))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new ConnectorException(
                        "Sending activity to " + uri + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
            }
            if (resp.body() == null || resp.body().isBlank()) {
                return new ResourceResponse(null);
            }
            return json.readValue(resp.body(), ResourceResponse.class);
        } catch (ConnectorException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectorException("Interrupted while sending activity to " + uri, e);
        } catch (Exception e) {
            throw new ConnectorException("Sending activity to " + uri + " failed", e);
        }
    }

    static URI activityUri(Activity activity) {
        if (activity.getServiceUrl() == null || activity.getServiceUrl().isBlank()) {
            throw new ConnectorException("Activity has no serviceUrl to reply to");
        }
        if (activity.getConversation() == null || activity.getConversation().id() == null) {
            throw new ConnectorException("Activity has no conversation id to reply to");
        }
        String base = activity.getServiceUrl().endsWith("/")
                ? activity.getServiceUrl()
                : activity.getServiceUrl() + "/";
        StringBuilder path = new StringBuilder(base)
                .append("v3/conversations/")
                .append(encode(activity.getConversation().id()))
                .append("/activities");
        if (activity.getReplyToId() != null) {
            path.append('/').append(encode(activity.getReplyToId()));
        }
        return URI.create(path.toString());
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
