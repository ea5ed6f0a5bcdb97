package com.skillbridge.rootbot.model;

import java.util.List;

/**
 * Body returned for a turn sent with deliveryMode "expectReplies": the bot's
 * replies, in order, instead of posting them to the channel.
 */
public record ExpectedReplies(List<Activity> activities) {}
