package com.commandcenter.backend.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * PATCH /api/metrics body. Top-level {@code premium_remaining} / {@code chat_remaining}
 * are shorthands for the same keys inside {@code token_usage}.
 */
public class MetricsPatch {

    private boolean hasProvider;
    private boolean hasModel;
    private boolean hasPremium;
    private boolean hasChat;

    private String provider;
    private String model;
    private Number premiumRemaining;
    private Number chatRemaining;
    private Map<String, Object> tokenUsage;

    public void setProvider(String v) { provider = v; hasProvider = true; }
    public void setModel(String v) { model = v; hasModel = true; }

    @JsonProperty("premium_remaining")
    public void setPremiumRemaining(Number v) { premiumRemaining = v; hasPremium = true; }

    @JsonProperty("chat_remaining")
    public void setChatRemaining(Number v) { chatRemaining = v; hasChat = true; }

    @JsonProperty("token_usage")
    public void setTokenUsage(Map<String, Object> v) { tokenUsage = v; }

    public boolean hasProvider() { return hasProvider; }
    public boolean hasModel() { return hasModel; }
    public boolean hasPremiumRemaining() { return hasPremium; }
    public boolean hasChatRemaining() { return hasChat; }

    public String provider() { return provider; }
    public String model() { return model; }
    public Number premiumRemaining() { return premiumRemaining; }
    public Number chatRemaining() { return chatRemaining; }

    /** Nested token_usage keys to merge, or null. */
    public Map<String, Object> tokenUsage() { return tokenUsage; }
}
