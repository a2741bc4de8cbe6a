package com.secondhand.state;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.secondhand.config.MarketConfig;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.Optional;

/**
 * Ids of listings and requests that left the live set, with how they ended.
 *
 * <p>Only the id and final status are kept, never the record, so a withdrawn listing
 * can't be brought back; the memory exists to answer a late request with "already
 * handled" instead of "no such listing".
 */
@Singleton
public class ResolvedListings {

    private final Cache<String, ListingStatus> resolved;

    @Inject
    public ResolvedListings(MarketConfig config) {
        this.resolved = CacheBuilder.newBuilder()
                .maximumSize(Math.max(1, config.resolvedIdMemory()))
                .build();
    }

    public void record(String id, ListingStatus finalStatus) {
        resolved.put(id, finalStatus);
    }

    public Optional<ListingStatus> lookup(String id) {
        return Optional.ofNullable(resolved.getIfPresent(id));
    }

    public boolean contains(String id) {
        return resolved.getIfPresent(id) != null;
    }

    public long size() {
        return resolved.size();
    }

    public void cleanUp() {
        resolved.cleanUp();
    }
}
