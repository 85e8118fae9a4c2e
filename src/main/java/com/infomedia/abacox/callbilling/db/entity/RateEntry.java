package com.infomedia.abacox.callbilling.db.entity;

import com.infomedia.abacox.callbilling.db.entity.superclass.AuditedEntity;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;
import org.hibernate.annotations.ColumnDefault;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One tariff row. Maintained by the administration side; read-only here.
 */
@Entity
@Table(
    name = "rate_entry",
    indexes = {
        @Index(name = "idx_rate_entry_prefix", columnList = "destination_prefix")
    }
)
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@SuperBuilder(toBuilder = true)
public class RateEntry extends AuditedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "destination_prefix", length = 32, nullable = false)
    private String destinationPrefix;

    @Column(name = "destination_name", length = 120, nullable = false)
    private String destinationName;

    @Column(name = "rate_per_minute", precision = 14, scale = 4, nullable = false)
    @ColumnDefault("0")
    private BigDecimal ratePerMinute;

    @Column(name = "billing_increment", nullable = false)
    @ColumnDefault("60")
    @Builder.Default
    private int billingIncrement = 60;

    @Column(name = "connection_fee", precision = 14, scale = 4, nullable = false)
    @ColumnDefault("0")
    @Builder.Default
    private BigDecimal connectionFee = BigDecimal.ZERO;

    @Column(name = "effective_start", nullable = false)
    private Instant effectiveStart;

    @Column(name = "effective_end")
    private Instant effectiveEnd;

    @Column(name = "priority", nullable = false)
    @ColumnDefault("0")
    private int priority;

    public boolean isEffectiveAt(Instant instant) {
        return !effectiveStart.isAfter(instant) && (effectiveEnd == null || effectiveEnd.isAfter(instant));
    }
}
