package com.solapi.sdk.cash;

import java.math.BigDecimal;

/**
 * Account balance in KRW plus promotional points.
 */
public record Balance(BigDecimal balance, BigDecimal point) {
}
