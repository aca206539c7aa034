package com.caltrade.backend.repository;

import com.caltrade.backend.model.KeyValueEntry;
import org.springframework.data.jpa.repository.JpaRepository;

public interface KeyValueEntryRepository extends JpaRepository<KeyValueEntry, String> {
}
