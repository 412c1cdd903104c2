package com.example.linkservice.repository;

import com.example.linkservice.dto.RedirectRecord;
import com.example.linkservice.entity.Link;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for Link entity.
 * Also serves the full redirect snapshot consumed by the edge cache sync.
 */
@Repository
public interface LinkRepository extends JpaRepository<Link, Long> {

    Optional<Link> findByIdAndDeletedAtIsNull(Long id);

    boolean existsBySlug(String slug);

    /**
     * Full snapshot of live redirect records, ordered by id.
     * Projects straight into the DTO so no entities enter the persistence context.
     */
    @Query("SELECT new com.example.linkservice.dto.RedirectRecord(l.id, l.slug, l.originalUrl, l.expiresAt) " +
            "FROM Link l WHERE l.deletedAt IS NULL ORDER BY l.id ASC")
    @QueryHints(@QueryHint(name = "jakarta.persistence.query.timeout", value = "10000"))
    List<RedirectRecord> findAllRedirectRecords();

    Optional<Link> findFirstByDeletedAtIsNullOrderByIdDesc();
}
