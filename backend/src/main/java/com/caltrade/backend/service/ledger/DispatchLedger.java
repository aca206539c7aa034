package com.caltrade.backend.service.ledger;

import com.caltrade.backend.config.CalendarTradeProperties;
import com.caltrade.backend.exception.LedgerStoreException;
import com.caltrade.backend.model.ExecutionRecord;
import com.caltrade.backend.model.TriggerSource;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded record of calendar events already handed to the execution service.
 * <p>
 * The whole ledger is one JSON array under a single key of the {@link KeyValueStore}, oldest entry first.
 * Inserting past capacity evicts from the head. Reads fail open: if the store cannot be read the event is
 * reported as not yet dispatched so trading is never blocked by a storage outage.
 * <p>
 * Methods are synchronized so that invocations sharing this process do not interleave their
 * read-modify-write cycles. Invocations in other processes are only guarded by marking before dispatch.
 */
@Service
@Slf4j
public class DispatchLedger {

    private static final TypeReference<List<ExecutionRecord>> RECORDS = new TypeReference<>() {
    };

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String storeKey;
    private final int capacity;

    @Autowired
    public DispatchLedger(KeyValueStore store, ObjectMapper objectMapper, Clock clock,
                          CalendarTradeProperties properties) {
        this(store, objectMapper, clock,
                properties.getLedger().getStoreKey(), properties.getLedger().getCapacity());
    }

    public DispatchLedger(KeyValueStore store, ObjectMapper objectMapper, Clock clock, String storeKey, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Ledger capacity must be positive: " + capacity);
        }
        this.store = store;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.storeKey = storeKey;
        this.capacity = capacity;
    }

    public synchronized boolean has(String eventId) {
        try {
            return read().stream().anyMatch(entry -> Objects.equals(entry.eventId(), eventId));
        } catch (RuntimeException e) {
            log.warn("Ledger read failed, treating event {} as not dispatched: {}", eventId, e.getMessage());
            return false;
        }
    }

    public MarkResult markDispatched(String eventId) {
        return markDispatched(eventId, null, TriggerSource.MANUAL);
    }

    public synchronized MarkResult markDispatched(String eventId, String eventTitle, TriggerSource source) {
        Optional<String> payload;
        try {
            payload = store.get(storeKey);
        } catch (RuntimeException e) {
            log.warn("Ledger read failed, event {} not recorded: {}", eventId, e.getMessage());
            return MarkResult.UNAVAILABLE;
        }
        List<ExecutionRecord> records;
        try {
            records = new ArrayList<>(decode(payload));
        } catch (LedgerStoreException e) {
            // an unreadable payload would otherwise block every future mark
            log.warn("Ledger payload unreadable, starting a fresh ledger: {}", e.getMessage());
            records = new ArrayList<>();
        }
        if (records.stream().anyMatch(entry -> Objects.equals(entry.eventId(), eventId))) {
            return MarkResult.ALREADY_MARKED;
        }
        records.add(new ExecutionRecord(eventId, eventTitle, Instant.now(clock), source, ExecutionRecord.PRE_COMMITTED));
        int evicted = 0;
        while (records.size() > capacity) {
            records.remove(0);
            evicted++;
        }
        try {
            store.set(storeKey, serialize(records));
        } catch (RuntimeException e) {
            log.warn("Ledger write failed, event {} not recorded: {}", eventId, e.getMessage());
            return MarkResult.UNAVAILABLE;
        }
        if (evicted > 0) {
            log.debug("Ledger at capacity {}, evicted {} oldest entries", capacity, evicted);
        }
        log.info("Marked event as dispatched: {} (id={}, source={})", eventTitle, eventId, source);
        return MarkResult.MARKED;
    }

    public synchronized void clear() {
        store.delete(storeKey);
        log.info("Ledger cleared (key={})", storeKey);
    }

    /**
     * Current contents, oldest first. Unlike {@link #has(String)} this does not fail open.
     */
    public synchronized List<ExecutionRecord> list() {
        return read();
    }

    public int capacity() {
        return capacity;
    }

    private List<ExecutionRecord> read() {
        return decode(store.get(storeKey));
    }

    private List<ExecutionRecord> decode(Optional<String> payload) {
        if (payload.isEmpty() || payload.get().isBlank()) {
            return List.of();
        }
        try {
            List<ExecutionRecord> records = objectMapper.readValue(payload.get(), RECORDS);
            if (records == null) {
                return List.of();
            }
            return records.stream()
                    .filter(entry -> entry != null && entry.eventId() != null)
                    .toList();
        } catch (JsonProcessingException e) {
            throw new LedgerStoreException("Ledger payload under " + storeKey + " is unreadable", e);
        }
    }

    private String serialize(List<ExecutionRecord> records) {
        try {
            return objectMapper.writeValueAsString(records);
        } catch (JsonProcessingException e) {
            throw new LedgerStoreException("Failed to serialize ledger", e);
        }
    }
}
