package com.fintech.analytics.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A single card transaction as loaded from the source data set.
 *
 * Instances are immutable once stored. A non-blank {@code errors} value marks
 * the transaction as fraudulent for summary and statistics purposes.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Transaction {

    @NotBlank
    String id;

    @NotNull
    LocalDateTime date;

    String clientId;
    String cardId;

    @NotNull
    @DecimalMin("0")
    BigDecimal amount;

    /** Payment channel, e.g. "Swipe Transaction", "Online Transaction", "Chip Transaction". */
    String useChip;

    String merchantId;
    String merchantCity;
    String merchantState;
    String zip;

    /** Merchant category code. */
    String mcc;

    String errors;

    @JsonIgnore
    public boolean isFlagged() {
        return errors != null && !errors.isBlank();
    }
}
