package com.commerce.saga.payment;

import java.math.BigDecimal;

public record GatewayRefund(String gatewayRefundId, String status, BigDecimal fee) {
}
