package com.infomedia.abacox.callbilling.db.entity;

import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Immutable
@Table(
    name = "balance_transaction",
    indexes = {
        @Index(name = "idx_balance_transaction_account", columnList = "account_id"),
        @Index(name = "idx_balance_transaction_call", columnList = "call_id")
    }
)
@Getter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@SuperBuilder
public class BalanceTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "account_id", nullable = false, updatable = false)
    private Long accountId;

    /** Signed: negative for consumption, positive for recharge and refund. */
    @Column(name = "amount", precision = 14, scale = 4, nullable = false, updatable = false)
    private BigDecimal amount;

    @Column(name = "previous_balance", precision = 14, scale = 4, nullable = false, updatable = false)
    private BigDecimal previousBalance;

    @Column(name = "new_balance", precision = 14, scale = 4, nullable = false, updatable = false)
    private BigDecimal newBalance;

    @Enumerated(EnumType.STRING)
    @Column(name = "transaction_type", length = 16, nullable = false, updatable = false)
    private TransactionType transactionType;

    @Column(name = "reason", length = 255, updatable = false)
    private String reason;

    @Column(name = "call_id", length = 64, updatable = false)
    private String callId;

    @Column(name = "created_date", nullable = false, updatable = false)
    private Instant createdDate;
}
