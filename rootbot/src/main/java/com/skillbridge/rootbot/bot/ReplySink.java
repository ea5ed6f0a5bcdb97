package com.skillbridge.rootbot.bot;

import com.skillbridge.rootbot.model.Activity;
import com.skillbridge.rootbot.model.ResourceResponse;

/**
 * Where a turn's outgoing activities go: the channel's connector, or a
 * buffer returned in the HTTP response.
 */
@FunctionalInterface
public interface ReplySink {

    ResourceResponse send(Activity activity);
}
