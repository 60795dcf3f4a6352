package com.fieldservice.sale.service;

import com.fieldservice.sale.model.SaleOrder;

/**
 * Plain reaction of a sale order being edited to a new customer.
 */
public interface BaseCustomerChange {

    void apply(SaleOrder order);
}
