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
 * Identifies the conversation an activity belongs to.
 *
 * Channel-specific fields (tenantId, conversationType, ...) are kept in
 * {@link #properties()} and survive {@link #withId}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ConversationAccount {

    private final String  id;
    private final String  name;
    private final Boolean isGroup;

    private final Map<String, Object> properties = new LinkedHashMap<>();

    @JsonCreator
    public ConversationAccount(@JsonProperty("id")      String id,
                               @JsonProperty("name")    String name,
                               @JsonProperty("isGroup") Boolean isGroup) {
        this.id      = id;
        this.name    = name;
        this.isGroup = isGroup;
    }

    public ConversationAccount(String id) {
        this(id, null, null);
    }

    @JsonProperty("id")      public String  id()      { return id; }
    @JsonProperty("name")    public String  name()    { return name; }
    @JsonProperty("isGroup") public Boolean isGroup() { return isGroup; }

    /** Same conversation metadata under a different id. */
    public ConversationAccount withId(String newId) {
        ConversationAccount copy = new ConversationAccount(newId, name, isGroup);
        copy.properties.putAll(properties);
        return copy;
    }

    @JsonAnyGetter
    public Map<String, Object> properties() { return Collections.unmodifiableMap(properties); }

    @JsonAnySetter
    private void setProperty(String key, Object value) { properties.put(key, value); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConversationAccount other)) return false;
        return Objects.equals(id, other.id) && Objects.equals(name, other.name)
                && Objects.equals(isGroup, other.isGroup) && properties.equals(other.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, isGroup, properties);
    }

    @Override
    public String toString() {
        return "ConversationAccount[id=" + id + ", name=" + name + ", isGroup=" + isGroup + "]";
    }
}
