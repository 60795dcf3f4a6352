package com.fieldservice.sale.dto;

import com.fieldservice.sale.model.SaleOrder;
import java.time.LocalDateTime;
import java.util.List;

public record SaleOrderView(
        Long id,
        String name,
        String status,
        Long customerId,
        Long shippingPartnerId,
        Long serviceLocationId,
        LocalDateTime expectedDate,
        int lineCount,
        List<ServiceOrderSummary> serviceOrders,
        int serviceOrderCount) {

    public static SaleOrderView of(SaleOrder order, LinkedServiceOrders linked) {
        List<ServiceOrderSummary> summaries = linked.serviceOrders().stream()
                .map(ServiceOrderSummary::of)
                .toList();
        return new SaleOrderView(
                order.getId(),
                order.getName(),
                order.getStatus().name(),
                order.getCustomer() != null ? order.getCustomer().getId() : null,
                order.getShippingPartner() != null ? order.getShippingPartner().getId() : null,
                order.getServiceLocation() != null ? order.getServiceLocation().getId() : null,
                order.getExpectedDate(),
                order.getOrderLines().size(),
                summaries,
                linked.serviceOrderCount());
    }
}
