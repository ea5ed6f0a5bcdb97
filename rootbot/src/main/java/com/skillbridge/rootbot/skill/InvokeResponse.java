package com.skillbridge.rootbot.skill;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Status and (optional) JSON body a skill answered a forwarded activity with.
 */
public record InvokeResponse(int status, JsonNode body) {

    public boolean isSuccessStatusCode() {
        return status >= 200 && status < 300;
    }
}
