package com.caltrade.backend.service.ledger;

import java.util.Optional;

/**
 * Durable string store shared by every invocation. Implementations throw
 * {@link com.caltrade.backend.exception.LedgerStoreException} when the backing store cannot be reached.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    void set(String key, String value);

    void delete(String key);
}
