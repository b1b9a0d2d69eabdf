package com.debaterank.debaterank_api.controller.dto;

import com.debaterank.debaterank_api.model.Entrant;

import java.time.Instant;

public record EntrantResponse(Long id, String name, String provider, String slug, boolean active, Instant createdAt) {

    public static EntrantResponse from(Entrant e) {
        return new EntrantResponse(e.getId(), e.getName(), e.getProvider(), e.getSlug(), e.isActive(), e.getCreatedAt());
    }
}
