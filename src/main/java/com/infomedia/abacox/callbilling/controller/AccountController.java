package com.infomedia.abacox.callbilling.controller;

import com.infomedia.abacox.callbilling.component.modeltools.ModelConverter;
import com.infomedia.abacox.callbilling.dto.account.*;
import com.infomedia.abacox.callbilling.service.AccountService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RequiredArgsConstructor
@RestController
@Tag(name = "Account", description = "Account balance and ledger controller")
@RequestMapping("/api/account")
public class AccountController {

    private final AccountService accountService;
    private final ModelConverter modelConverter;

    @GetMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public AccountDto get(@PathVariable("id") Long id) {
        AccountDto dto = modelConverter.map(accountService.get(id), AccountDto.class);
        dto.setAvailableBalance(accountService.availableBalance(id));
        return dto;
    }

    @PostMapping(value = "/{id}/recharge", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Add funds to an account")
    public BalanceTransactionDto recharge(@PathVariable("id") Long id, @Valid @RequestBody RechargeRequest request) {
        return modelConverter.map(accountService.recharge(id, request.getAmount(), request.getReason()),
                BalanceTransactionDto.class);
    }

    @PostMapping(value = "/{id}/refund", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Credit an account back, optionally for a specific call")
    public BalanceTransactionDto refund(@PathVariable("id") Long id, @Valid @RequestBody RefundRequest request) {
        return modelConverter.map(accountService.refund(id, request.getAmount(), request.getCallId(), request.getReason()),
                BalanceTransactionDto.class);
    }

    @GetMapping(value = "/{id}/transactions", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<BalanceTransactionDto> transactions(@PathVariable("id") Long id) {
        return modelConverter.mapList(accountService.transactions(id), BalanceTransactionDto.class);
    }

    @GetMapping(value = "/{id}/reconciliation", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Check the balance against the transaction history")
    public ReconciliationDto reconciliation(@PathVariable("id") Long id) {
        return accountService.reconcile(id);
    }
}
