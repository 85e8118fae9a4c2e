package com.infomedia.abacox.callbilling.dto.account;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RefundRequest {

    @NotNull
    @Positive
    @Digits(integer = 10, fraction = 4)
    private BigDecimal amount;

    @Size(max = 64)
    @Schema(description = "call the refund relates to, if any")
    private String callId;

    @Size(max = 255)
    private String reason;
}
