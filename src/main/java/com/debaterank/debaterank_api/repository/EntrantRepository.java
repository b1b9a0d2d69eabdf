package com.debaterank.debaterank_api.repository;

import com.debaterank.debaterank_api.model.Entrant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface EntrantRepository extends JpaRepository<Entrant, Long> {

    Optional<Entrant> findBySlug(String slug);

    List<Entrant> findByActiveTrueOrderByIdAsc();

    long countByActiveFalse();

    @Query("SELECT COALESCE(MAX(e.id), 0) FROM Entrant e")
    long findMaxId();

    /**
     * Slugs equal to {@code base} or derived from it ("base-2", "base-3", ...).
     * Used to pick the next free suffix on registration.
     */
    @Query("SELECT e.slug FROM Entrant e WHERE e.slug = :base OR e.slug LIKE CONCAT(:base, '-%')")
    List<String> findSlugsDerivedFrom(@Param("base") String base);
}
