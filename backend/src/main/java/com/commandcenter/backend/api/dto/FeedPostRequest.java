package com.commandcenter.backend.api.dto;

public class FeedPostRequest {
    public String message;
    public String type;
    public String timestamp;
}
