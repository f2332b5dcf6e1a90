package com.odata.writer.batch;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Maps entry data instances to content ids by reference identity. Two equal but distinct
 * maps are different entries.
 */
public class ContentIdMap {
    private final Map<Object, Integer> contentIds = new IdentityHashMap<>();

    public synchronized void put(Object entryData, int contentId) {
        contentIds.put(entryData, contentId);
    }

    public synchronized Integer get(Object entryData) {
        return entryData == null ? null : contentIds.get(entryData);
    }

    public synchronized int size() {
        return contentIds.size();
    }
}
