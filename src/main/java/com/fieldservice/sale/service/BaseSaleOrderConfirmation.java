package com.fieldservice.sale.service;

import com.fieldservice.sale.model.SaleOrder;

/**
 * Plain sale order confirmation, before any field service behavior.
 */
public interface BaseSaleOrderConfirmation {

    SaleOrder confirm(SaleOrder order);
}
