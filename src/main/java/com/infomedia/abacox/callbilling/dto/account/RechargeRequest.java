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
public class RechargeRequest {

    @NotNull
    @Positive
    @Digits(integer = 10, fraction = 4)
    @Schema(example = "25.00")
    private BigDecimal amount;

    @Size(max = 255)
    @Schema(example = "Top-up at point of sale")
    private String reason;
}
