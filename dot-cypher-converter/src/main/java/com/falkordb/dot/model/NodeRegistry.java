package com.falkordb.dot.model;

import com.falkordb.dot.SourcePosition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Arena of node records keyed by identifier.
 *
 * <p>Records live in a list in first-appearance order and are addressed by
 * their index (the handle); a map from identifier to handle guarantees at
 * most one record per identifier.</p>
 */
public final class NodeRegistry {

    /** Records by handle. */
    private final List<NodeRecord> records = new ArrayList<>();

    /** Handles by identifier. */
    private final Map<String, Integer> handles = new HashMap<>();

    /**
     * Look up the record for an identifier, creating an empty one on first
     * sight.
     *
     * @param identifier the DOT identifier
     * @param position where the identifier appears
     * @return the record
     */
    public NodeRecord getOrCreate(final String identifier,
            final SourcePosition position) {
        Integer handle = handles.get(identifier);
        if (handle != null) {
            return records.get(handle);
        }
        NodeRecord record = new NodeRecord(identifier, records.size(),
            position);
        records.add(record);
        handles.put(identifier, record.getHandle());
        return record;
    }

    /**
     * Resolve a handle.
     *
     * @param handle the handle
     * @return the record, or null if the handle is out of range
     */
    public NodeRecord get(final int handle) {
        return handle >= 0 && handle < records.size()
            ? records.get(handle) : null;
    }

    /**
     * Look up an identifier without creating it.
     *
     * @param identifier the DOT identifier
     * @return the record, or null if never seen
     */
    public NodeRecord find(final String identifier) {
        Integer handle = handles.get(identifier);
        return handle == null ? null : records.get(handle);
    }

    /**
     * Get the number of distinct identifiers.
     *
     * @return the record count
     */
    public int size() {
        return records.size();
    }

    /**
     * Read-only view of all records in first-appearance order.
     *
     * @return the records
     */
    public List<NodeRecord> records() {
        return Collections.unmodifiableList(records);
    }
}
