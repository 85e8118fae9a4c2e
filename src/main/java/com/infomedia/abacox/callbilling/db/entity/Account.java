package com.infomedia.abacox.callbilling.db.entity;

import com.infomedia.abacox.callbilling.db.entity.superclass.AuditedEntity;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;
import org.hibernate.annotations.ColumnDefault;

import java.math.BigDecimal;

/**
 * Billing account. {@code balance} is only ever changed together with an appended
 * {@link BalanceTransaction}, so it always equals {@code initialBalance} plus the signed sum of
 * the account's transactions.
 */
@Entity
@Table(
    name = "account",
    indexes = {
        @Index(name = "idx_account_customer_phone", columnList = "customer_phone")
    }
)
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@SuperBuilder(toBuilder = true)
public class Account extends AuditedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "account_number", length = 50, nullable = false, unique = true)
    private String accountNumber;

    @Column(name = "customer_phone", length = 50)
    private String customerPhone;

    @Enumerated(EnumType.STRING)
    @Column(name = "account_type", length = 16, nullable = false)
    @Builder.Default
    private AccountType accountType = AccountType.PREPAID;

    @Column(name = "balance", precision = 14, scale = 4, nullable = false)
    @ColumnDefault("0")
    @Builder.Default
    private BigDecimal balance = BigDecimal.ZERO;

    @Column(name = "initial_balance", precision = 14, scale = 4, nullable = false, updatable = false)
    @ColumnDefault("0")
    @Builder.Default
    private BigDecimal initialBalance = BigDecimal.ZERO;

    @Column(name = "credit_limit", precision = 14, scale = 4, nullable = false)
    @ColumnDefault("0")
    @Builder.Default
    private BigDecimal creditLimit = BigDecimal.ZERO;

    @Column(name = "currency", length = 3, nullable = false)
    @Builder.Default
    private String currency = "USD";

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 16, nullable = false)
    @Builder.Default
    private AccountStatus status = AccountStatus.ACTIVE;

    @Column(name = "max_concurrent_calls", nullable = false)
    @ColumnDefault("1")
    @Builder.Default
    private int maxConcurrentCalls = 1;

    @Version
    @Column(name = "version", nullable = false)
    private long version;
}
