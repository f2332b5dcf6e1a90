package com.odata.writer.metadata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry data split into structural properties and navigation links, both in input order.
 */
public class EntryDetails {
    private final Map<String, Object> properties = new LinkedHashMap<>();
    private final List<ReferenceLink> links = new ArrayList<>();
    private final Integer contentId;

    public EntryDetails(Integer contentId) {
        this.contentId = contentId;
    }

    public void addProperty(String name, Object value) {
        properties.put(name, value);
    }

    public void addLink(String linkName, Object linkData) {
        links.add(new ReferenceLink(linkName, linkData));
    }

    public Map<String, Object> getProperties() {
        return Collections.unmodifiableMap(properties);
    }

    public List<ReferenceLink> getLinks() {
        return Collections.unmodifiableList(links);
    }

    /**
     * Content id of the entry when it is written inside a batch, null otherwise.
     */
    public Integer getContentId() {
        return contentId;
    }
}
