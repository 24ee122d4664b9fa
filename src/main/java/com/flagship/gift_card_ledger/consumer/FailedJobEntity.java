package com.flagship.gift_card_ledger.consumer;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * A job that used up all of its attempts. Kept for inspection and manual replay.
 */
@Entity
@Table(name = "failed_jobs")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FailedJobEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "job_kind", nullable = false, updatable = false, length = 50)
    private String jobKind;

    @Column(name = "job_key", nullable = false, updatable = false, length = 100)
    private String jobKey;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false, updatable = false, columnDefinition = "jsonb")
    private String payload;

    @Column(name = "error_message", updatable = false, columnDefinition = "TEXT")
    private String errorMessage;

    @Column(nullable = false, updatable = false)
    private int attempts;

    @Column(name = "failed_at", nullable = false, updatable = false)
    private Instant failedAt;

    @PrePersist
    void onCreate() {
        this.failedAt = Instant.now();
    }

    static FailedJobEntity record(String jobKind, String jobKey, String payload, String errorMessage, int attempts) {
        return new FailedJobEntity(UUID.randomUUID(), jobKind, jobKey, payload, errorMessage, attempts, null);
    }
}
