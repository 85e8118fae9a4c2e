package com.infomedia.abacox.callbilling.db.entity;

import com.infomedia.abacox.callbilling.db.entity.superclass.AuditedEntity;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;
import org.hibernate.annotations.ColumnDefault;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Hold against an account's available balance for one call. Leaves ACTIVE exactly once;
 * afterwards {@code reservedAmount == consumedAmount + releasedAmount}.
 */
@Entity
@Table(
    name = "reservation",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_reservation_call_id", columnNames = "call_id")
    },
    indexes = {
        @Index(name = "idx_reservation_account_status", columnList = "account_id, status"),
        @Index(name = "idx_reservation_status_expires", columnList = "status, expires_at")
    }
)
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@SuperBuilder(toBuilder = true)
public class Reservation extends AuditedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "account_id", nullable = false)
    private Long accountId;

    @Column(name = "call_id", length = 64, nullable = false)
    private String callId;

    @Column(name = "reserved_amount", precision = 14, scale = 4, nullable = false)
    private BigDecimal reservedAmount;

    @Column(name = "consumed_amount", precision = 14, scale = 4, nullable = false)
    @ColumnDefault("0")
    @Builder.Default
    private BigDecimal consumedAmount = BigDecimal.ZERO;

    @Column(name = "released_amount", precision = 14, scale = 4, nullable = false)
    @ColumnDefault("0")
    @Builder.Default
    private BigDecimal releasedAmount = BigDecimal.ZERO;

    /** Cost above the hold that could not be charged; kept for reconciliation. */
    @Column(name = "overage_amount", precision = 14, scale = 4, nullable = false)
    @ColumnDefault("0")
    @Builder.Default
    private BigDecimal overageAmount = BigDecimal.ZERO;

    /** Times the hold was grown while the call was running. */
    @Column(name = "extension_count", nullable = false)
    @ColumnDefault("0")
    @Builder.Default
    private int extensionCount = 0;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 16, nullable = false)
    @Builder.Default
    private ReservationStatus status = ReservationStatus.ACTIVE;

    @Column(name = "destination_prefix", length = 32)
    private String destinationPrefix;

    @Column(name = "rate_per_minute", precision = 14, scale = 4)
    private BigDecimal ratePerMinute;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "settled_at")
    private Instant settledAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;
}
