package com.fieldservice.sale.model;

public enum SaleOrderStatus {
    DRAFT, CONFIRMED, CANCELLED
}
