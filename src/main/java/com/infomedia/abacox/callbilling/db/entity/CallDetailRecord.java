package com.infomedia.abacox.callbilling.db.entity;

import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Final record of a call, written once at settlement.
 */
@Entity
@Immutable
@Table(
    name = "call_detail_record",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_call_detail_record_call_id", columnNames = "call_id")
    },
    indexes = {
        @Index(name = "idx_cdr_account", columnList = "account_id"),
        @Index(name = "idx_cdr_start_time", columnList = "start_time")
    }
)
@Getter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@SuperBuilder
public class CallDetailRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "call_id", length = 64, nullable = false)
    private String callId;

    @Column(name = "account_id")
    private Long accountId;

    @Column(name = "caller_number", length = 50)
    private String callerNumber;

    @Column(name = "callee_number", length = 50)
    private String calleeNumber;

    @Column(name = "direction", length = 16)
    private String direction;

    @Column(name = "start_time")
    private Instant startTime;

    @Column(name = "answer_time")
    private Instant answerTime;

    @Column(name = "end_time")
    private Instant endTime;

    @Column(name = "duration_seconds", nullable = false)
    private long durationSeconds;

    @Column(name = "billable_seconds", nullable = false)
    private long billableSeconds;

    @Column(name = "rate_entry_id")
    private Long rateEntryId;

    @Column(name = "destination_prefix", length = 32)
    private String destinationPrefix;

    @Column(name = "destination_name", length = 120)
    private String destinationName;

    @Column(name = "rate_per_minute", precision = 14, scale = 4)
    private BigDecimal ratePerMinute;

    @Column(name = "cost", precision = 14, scale = 4, nullable = false)
    private BigDecimal cost;

    @Column(name = "hangup_cause", length = 64)
    private String hangupCause;

    @Enumerated(EnumType.STRING)
    @Column(name = "disposition", length = 16, nullable = false)
    private CdrDisposition disposition;

    @Column(name = "disposition_reason", length = 255)
    private String dispositionReason;

    @Column(name = "connection_id", length = 64)
    private String connectionId;

    @Column(name = "created_date", nullable = false)
    private Instant createdDate;
}
