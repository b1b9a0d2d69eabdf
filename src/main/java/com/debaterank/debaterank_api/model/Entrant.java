package com.debaterank.debaterank_api.model;

import jakarta.persistence.*;
import lombok.Getter;

import java.time.Instant;

/**
 * An AI model taking part in debates. The slug is assigned once at
 * registration and never changes afterwards.
 */
@Getter
@Entity
@Table(name = "entrants")
public class Entrant {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false, length = 50)
    private String provider;

    @Column(nullable = false, unique = true, length = 120, updatable = false)
    private String slug;

    @Column(nullable = false)
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected Entrant() {}

    public Entrant(String name, String provider, String slug, Instant createdAt) {
        this.name = name;
        this.provider = provider;
        this.slug = slug;
        this.createdAt = createdAt;
    }

    /** Drops the entrant out of standings. History and ratings are kept. */
    public void deactivate() {
        this.active = false;
    }
}
