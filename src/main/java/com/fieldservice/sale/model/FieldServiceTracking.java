package com.fieldservice.sale.model;

/**
 * How selling a product triggers field service orders.
 */
public enum FieldServiceTracking {
    NO,
    // One service order for the whole sale order
    SALE,
    // One service order per sale order line
    LINE,
    // Generated when the goods are delivered
    DELIVERY
}
