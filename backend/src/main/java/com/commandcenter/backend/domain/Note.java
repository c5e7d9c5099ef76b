package com.commandcenter.backend.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Note(
        String id,
        String content,
        String createdAt,
        boolean read,
        String readAt     // set on the first read-mark only
) {
    public Note markedRead(String now) {
        return read ? this : new Note(id, content, createdAt, true, now);
    }
}
