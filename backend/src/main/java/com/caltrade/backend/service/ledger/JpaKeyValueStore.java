package com.caltrade.backend.service.ledger;

import com.caltrade.backend.exception.LedgerStoreException;
import com.caltrade.backend.model.KeyValueEntry;
import com.caltrade.backend.repository.KeyValueEntryRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class JpaKeyValueStore implements KeyValueStore {

    private final KeyValueEntryRepository repository;

    @Override
    @Transactional(readOnly = true)
    public Optional<String> get(String key) {
        try {
            return repository.findById(key).map(KeyValueEntry::getStoreValue);
        } catch (DataAccessException e) {
            throw new LedgerStoreException("Failed to read key " + key, e);
        }
    }

    @Override
    @Transactional
    public void set(String key, String value) {
        try {
            KeyValueEntry entry = repository.findById(key)
                    .orElseGet(() -> KeyValueEntry.builder().storeKey(key).build());
            entry.setStoreValue(value);
            entry.setUpdatedAt(Instant.now());
            repository.save(entry);
        } catch (DataAccessException e) {
            throw new LedgerStoreException("Failed to write key " + key, e);
        }
    }

    @Override
    @Transactional
    public void delete(String key) {
        try {
            if (repository.existsById(key)) {
                repository.deleteById(key);
            }
        } catch (DataAccessException e) {
            throw new LedgerStoreException("Failed to delete key " + key, e);
        }
    }
}
