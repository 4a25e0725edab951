package io.github.flameyossnowy.network.api.exceptions;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;

/**
 * Raised by id lookups that could not resolve every requested id.
 */
public class RecordNotFoundException extends RuntimeException {
    private final List<Object> requestedIds;

    public RecordNotFoundException(Collection<?> requestedIds) {
        super("Couldn't find all records with IDs (" + join(requestedIds) + ")");
        this.requestedIds = Collections.unmodifiableList(new ArrayList<>(requestedIds));
    }

    /**
     * The ids exactly as the caller passed them, duplicates included.
     */
    public List<Object> getRequestedIds() {
        return requestedIds;
    }

    private static String join(Collection<?> ids) {
        StringJoiner joiner = new StringJoiner(",");
        for (Object id : ids) joiner.add(String.valueOf(id));
        return joiner.toString();
    }
}
