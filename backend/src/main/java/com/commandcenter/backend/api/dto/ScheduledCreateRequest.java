package com.commandcenter.backend.api.dto;

public class ScheduledCreateRequest {
    public String name;
    public String schedule;
    public String icon;
    public Boolean enabled;
}
