package com.fieldservice.sale.model;

public enum RecordType {
    SALE_ORDER, SERVICE_ORDER
}
