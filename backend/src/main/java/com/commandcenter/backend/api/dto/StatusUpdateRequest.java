package com.commandcenter.backend.api.dto;

public class StatusUpdateRequest {
    public String agent;
    public String status;
    public String detail;
}
