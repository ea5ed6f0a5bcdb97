package com.skillbridge.rootbot.api;

import com.skillbridge.rootbot.bot.BotAdapter;
import com.skillbridge.rootbot.model.Activity;
import com.skillbridge.rootbot.model.ExpectedReplies;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Messaging endpoint the channel posts user activities to.
 *
 * POST /api/messages   run one turn; 200 with {"activities": [...]} for
 *                       expectReplies delivery, 200 with no body otherwise
 */
@RestController
@RequestMapping("/api/messages")
public class BotController {

    private final BotAdapter adapter;

    public BotController(BotAdapter adapter) {
        this.adapter = adapter;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:3978/api/messages \
     *     -H "Content-Type: application/json" \
     *     -d '{"type":"message","text":"skill","channelId":"emulator",
     *          "conversation":{"id":"c1"},"from":{"id":"u1"},"recipient":{"id":"bot"},
     *          "serviceUrl":"http://localhost:5000"}'
     */
    @PostMapping
    public ResponseEntity<ExpectedReplies> receive(@RequestBody Activity activity) {
        return adapter.processActivity(activity)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.ok().build());
    }
}
