package com.caltrade.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "key_value_store")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KeyValueEntry {

    @Id
    @Column(name = "store_key", length = 128)
    private String storeKey;

    @Column(name = "store_value", length = 65535)
    private String storeValue;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
