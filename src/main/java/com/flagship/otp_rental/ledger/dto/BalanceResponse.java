package com.flagship.otp_rental.ledger.dto;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class BalanceResponse {
    Long userId;
    BigDecimal balance;
}
