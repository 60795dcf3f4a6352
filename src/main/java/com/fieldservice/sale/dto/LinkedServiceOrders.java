package com.fieldservice.sale.dto;

import com.fieldservice.sale.model.ServiceOrder;
import java.util.List;

public record LinkedServiceOrders(
        Long saleOrderId,
        List<ServiceOrder> serviceOrders) {

    public int serviceOrderCount() {
        return serviceOrders.size();
    }

    public List<Long> serviceOrderIds() {
        return serviceOrders.stream().map(ServiceOrder::getId).toList();
    }
}
