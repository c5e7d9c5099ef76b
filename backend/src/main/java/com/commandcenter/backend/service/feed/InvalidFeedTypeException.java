package com.commandcenter.backend.service.feed;

import com.commandcenter.backend.domain.FeedType;

public class InvalidFeedTypeException extends RuntimeException {

    private final String rejected;

    public InvalidFeedTypeException(String type) {
        super("Invalid type. Must be one of: " + FeedType.validNames());
        this.rejected = type;
    }

    public String getRejected() {
        return rejected;
    }
}
