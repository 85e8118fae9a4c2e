package com.infomedia.abacox.callbilling.service;

import com.infomedia.abacox.callbilling.component.settlement.SettlementLedgerService;
import com.infomedia.abacox.callbilling.db.entity.Account;
import com.infomedia.abacox.callbilling.db.entity.BalanceTransaction;
import com.infomedia.abacox.callbilling.db.entity.TransactionType;
import com.infomedia.abacox.callbilling.db.repository.AccountRepository;
import com.infomedia.abacox.callbilling.db.repository.BalanceTransactionRepository;
import com.infomedia.abacox.callbilling.dto.account.ReconciliationDto;
import com.infomedia.abacox.callbilling.exception.AccountNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

@Service
@Log4j2
@RequiredArgsConstructor
public class AccountService {

    private final AccountRepository accountRepository;
    private final BalanceTransactionRepository balanceTransactionRepository;
    private final SettlementLedgerService ledgerService;

    @Transactional(readOnly = true)
    public Account get(Long accountId) {
        return accountRepository.findById(accountId)
                .orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    public BigDecimal availableBalance(Long accountId) {
        return ledgerService.availableBalance(accountId);
    }

    public BalanceTransaction recharge(Long accountId, BigDecimal amount, String reason) {
        requirePositive(amount);
        return ledgerService.adjust(accountId, amount, TransactionType.RECHARGE,
                reason != null ? reason : "Recharge", null);
    }

    public BalanceTransaction refund(Long accountId, BigDecimal amount, String callId, String reason) {
        requirePositive(amount);
        String description = reason != null ? reason
                : callId != null ? "Refund for call " + callId : "Refund";
        return ledgerService.adjust(accountId, amount, TransactionType.REFUND, description, callId);
    }

    @Transactional(readOnly = true)
    public List<BalanceTransaction> transactions(Long accountId) {
        get(accountId);
        return balanceTransactionRepository.findByAccountIdOrderByIdAsc(accountId);
    }

    /**
     * Checks that the balance equals the initial balance plus every transaction of the account.
     */
    @Transactional(readOnly = true)
    public ReconciliationDto reconcile(Long accountId) {
        Account account = get(accountId);
        BigDecimal sum = balanceTransactionRepository.sumAmountByAccountId(accountId);
        BigDecimal expected = account.getInitialBalance().add(sum);
        boolean consistent = expected.compareTo(account.getBalance()) == 0;
        if (!consistent) {
            log.error("Account {} does not reconcile: balance {} but initial {} plus transactions {} is {}",
                    accountId, account.getBalance().toPlainString(), account.getInitialBalance().toPlainString(),
                    sum.toPlainString(), expected.toPlainString());
        }
        return ReconciliationDto.builder()
                .accountId(accountId)
                .initialBalance(account.getInitialBalance())
                .balance(account.getBalance())
                .transactionSum(sum)
                .transactionCount(balanceTransactionRepository.countByAccountId(accountId))
                .consistent(consistent)
                .build();
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
    }
}
