package com.skillbridge.rootbot.api;

import com.skillbridge.rootbot.model.Activity;
import com.skillbridge.rootbot.model.ResourceResponse;
import com.skillbridge.rootbot.service.SkillCallbackService;
import com.skillbridge.rootbot.skill.SkillConversationReference;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

/**
 * Endpoint skills post their replies to. Its base URL is the serviceUrl the
 * host stamps on every forwarded activity.
 *
 * POST /api/skills/v3/conversations/{conversationId}/activities                send to conversation
 * POST /api/skills/v3/conversations/{conversationId}/activities/{activityId}   reply to an activity
 *
 * Returns 404 if the skill conversation id is unknown.
 */
@RestController
@RequestMapping("/api/skills/v3/conversations")
public class SkillCallbackController {

    private final SkillCallbackService callbackService;

    public SkillCallbackController(SkillCallbackService callbackService) {
        this.callbackService = callbackService;
    }

    @PostMapping("/{conversationId}/activities")
    public ResourceResponse sendToConversation(@PathVariable String conversationId,
                                               @RequestBody Activity activity) {
        return process(conversationId, null, activity);
    }

    @PostMapping("/{conversationId}/activities/{activityId}")
    public ResourceResponse replyToActivity(@PathVariable String conversationId,
                                            @PathVariable String activityId,
                                            @RequestBody Activity activity) {
        return process(conversationId, activityId, activity);
    }

    private ResourceResponse process(String conversationId, String activityId, Activity activity) {
        SkillConversationReference skillConversation = callbackService.resolve(conversationId)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Skill conversation not found: " + conversationId));
        return callbackService.processActivity(skillConversation, activityId, activity);
    }
}
