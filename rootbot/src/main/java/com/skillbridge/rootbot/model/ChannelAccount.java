package com.skillbridge.rootbot.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A participant in a conversation (user, bot or skill).
 * role is "user", "bot" or "skill" when the sender sets it.
 *
 * Channel-specific fields (aadObjectId and the like) are kept in
 * {@link #properties()} and written back out unchanged.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ChannelAccount {

    private final String id;
    private final String name;
    private final String role;

    private final Map<String, Object> properties = new LinkedHashMap<>();

    @JsonCreator
    public ChannelAccount(@JsonProperty("id")   String id,
                          @JsonProperty("name") String name,
                          @JsonProperty("role") String role) {
        this.id   = id;
        this.name = name;
        this.role = role;
    }

    public ChannelAccount(String id) {
        this(id, null, null);
    }

    @JsonProperty("id")   public String id()   { return id; }
    @JsonProperty("name") public String name() { return name; }
    @JsonProperty("role") public String role() { return role; }

    @JsonAnyGetter
    public Map<String, Object> properties() { return Collections.unmodifiableMap(properties); }

    @JsonAnySetter
    private void setProperty(String key, Object value) { properties.put(key, value); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChannelAccount other)) return false;
        return Objects.equals(id, other.id) && Objects.equals(name, other.name)
                && Objects.equals(role, other.role) && properties.equals(other.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, role, properties);
    }

    @Override
    public String toString() {
        return "ChannelAccount[id=" + id + ", name=" + name + ", role=" + role + "]";
    }
}
