package com.example.linkservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Short link owned by a user. Authoritative source for redirect records.
 * Every row with deleted_at IS NULL is mirrored into the edge cache under its slug.
 */
@Entity
@Table(name = "links",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_links_slug", columnNames = {"slug"})
        },
        indexes = {
                @Index(name = "idx_links_user_id", columnList = "user_id"),
                @Index(name = "idx_links_deleted_at", columnList = "deleted_at")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Link extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "slug", nullable = false, length = 128)
    private String slug;

    @Column(name = "original_url", nullable = false, columnDefinition = "TEXT")
    private String originalUrl;

    /**
     * Null means the link never expires.
     */
    @Column(name = "expires_at")
    private Instant expiresAt;

    @Builder.Default
    @Column(name = "clicks", nullable = false)
    private Long clicks = 0L;
}
