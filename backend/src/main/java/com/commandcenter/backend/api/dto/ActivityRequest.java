package com.commandcenter.backend.api.dto;

public class ActivityRequest {
    public String message;
}
