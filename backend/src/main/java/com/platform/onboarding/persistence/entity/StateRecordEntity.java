package com.platform.onboarding.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity holding one serialized state record.
 * Uses the record key (task/&lt;id&gt;, originalConfig/&lt;machineId&gt;) as natural primary key.
 */
@Entity
@Table(name = "onboarding_state_records")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StateRecordEntity {

    @Id
    @Column(name = "record_key", length = 200)
    private String recordKey;

    /**
     * JSON document.
     */
    @Lob
    @Column(name = "payload", nullable = false)
    private String payload;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Optimistic locking version for concurrent update safety.
     */
    @Version
    @Column(nullable = false)
    private Long version;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
        if (version == null) {
            version = 0L;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
