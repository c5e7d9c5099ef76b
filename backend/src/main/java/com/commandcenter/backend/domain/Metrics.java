package com.commandcenter.backend.domain;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Singleton usage metrics. Updated field by field, never replaced.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Metrics {

    private String provider;
    private String model;
    @JsonProperty("token_usage")
    private TokenUsage tokenUsage = new TokenUsage();

    private final Map<String, Object> extra = new LinkedHashMap<>();

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public TokenUsage getTokenUsage() { return tokenUsage; }
    public void setTokenUsage(TokenUsage tokenUsage) { this.tokenUsage = tokenUsage; }

    @JsonAnyGetter
    public Map<String, Object> getExtra() { return extra; }

    @JsonAnySetter
    public void putExtra(String key, Object value) { extra.put(key, value); }

    /** Never null, created on demand for documents written without it. */
    public TokenUsage tokenUsage() {
        if (tokenUsage == null) tokenUsage = new TokenUsage();
        return tokenUsage;
    }

    public static class TokenUsage {
        @JsonProperty("premium_remaining")
        private Number premiumRemaining;
        @JsonProperty("chat_remaining")
        private Number chatRemaining;
        @JsonProperty("last_updated")
        private String lastUpdated;

        private final Map<String, Object> extra = new LinkedHashMap<>();

        public Number getPremiumRemaining() { return premiumRemaining; }
        public void setPremiumRemaining(Number premiumRemaining) { this.premiumRemaining = premiumRemaining; }

        public Number getChatRemaining() { return chatRemaining; }
        public void setChatRemaining(Number chatRemaining) { this.chatRemaining = chatRemaining; }

        public String getLastUpdated() { return lastUpdated; }
        public void setLastUpdated(String lastUpdated) { this.lastUpdated = lastUpdated; }

        @JsonAnyGetter
        public Map<String, Object> getExtra() { return extra; }

        @JsonAnySetter
        public void putExtra(String key, Object value) { extra.put(key, value); }
    }
}
