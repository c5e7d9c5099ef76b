package com.commandcenter.backend.api.dto;

public class NoteCreateRequest {
    public String content;
}
