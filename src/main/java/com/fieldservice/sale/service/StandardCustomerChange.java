package com.fieldservice.sale.service;

import com.fieldservice.sale.model.Partner;
import com.fieldservice.sale.model.SaleOrder;
import org.springframework.stereotype.Service;

/**
 * Ships to the customer's delivery contact, or to the customer itself.
 */
@Service
public class StandardCustomerChange implements BaseCustomerChange {

    @Override
    public void apply(SaleOrder order) {
        Partner customer = order.getCustomer();
        if (customer == null) {
            order.setShippingPartner(null);
            return;
        }
        order.setShippingPartner(customer.getShippingAddress() != null ? customer.getShippingAddress() : customer);
    }
}
