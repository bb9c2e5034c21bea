package com.ralphtown.core.persistence;

/**
 * Thrown when a repo, session or other record does not exist.
 */
public class RecordNotFoundException extends StoreException {

    public RecordNotFoundException(String kind, String id) {
        super("%s not found: %s".formatted(kind, id));
    }
}
