package com.commandcenter.backend.repo;

import java.util.Collection;
import java.util.UUID;

final class ShortIds {

    private ShortIds() {}

    /** 8-char opaque id, unique among {@code taken}. */
    static String next(Collection<String> taken) {
        String id;
        do {
            id = UUID.randomUUID().toString().substring(0, 8);
        } while (taken.contains(id));
        return id;
    }
}
