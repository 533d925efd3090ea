package com.dynop.routing.hybrid.cache;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Snapshot of the route cache size.
 */
public final class CacheStats {

    private final int count;
    private final long approximateByteSize;

    @JsonCreator
    public CacheStats(
            @JsonProperty("count") int count,
            @JsonProperty("approximateByteSize") long approximateByteSize) {
        this.count = count;
        this.approximateByteSize = approximateByteSize;
    }

    /**
     * @return number of live entries
     */
    public int getCount() {
        return count;
    }

    /**
     * @return summed size of the entries' JSON form in bytes
     */
    public long getApproximateByteSize() {
        return approximateByteSize;
    }

    @Override
    public String toString() {
        return "CacheStats{count=" + count + ", approximateByteSize=" + approximateByteSize + "}";
    }
}
