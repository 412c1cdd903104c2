package com.example.linkservice.service;

import com.example.linkservice.dto.EdgeCacheEntry;
import com.example.linkservice.dto.EdgeLinkPayload;
import com.example.linkservice.dto.RedirectRecord;
import com.example.linkservice.entity.Link;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Maps redirect records from the link table to edge cache entries keyed by slug.
 */
@Component
public class EdgeLinkMapper {

    public EdgeCacheEntry toCacheEntry(RedirectRecord record) {
        return new EdgeCacheEntry(record.slug(), toPayload(record.id(), record.targetUrl(), record.expiresAt()));
    }

    public List<EdgeCacheEntry> toCacheEntries(List<RedirectRecord> records) {
        return records.stream()
                .map(this::toCacheEntry)
                .toList();
    }

    public EdgeLinkPayload toPayload(Link link) {
        return toPayload(link.getId(), link.getOriginalUrl(), link.getExpiresAt());
    }

    private EdgeLinkPayload toPayload(Long id, String targetUrl, Instant expiresAt) {
        return new EdgeLinkPayload(id, targetUrl, expiresAt != null ? expiresAt.toEpochMilli() : null);
    }
}
