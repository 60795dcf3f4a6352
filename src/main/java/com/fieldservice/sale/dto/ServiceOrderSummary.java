package com.fieldservice.sale.dto;

import com.fieldservice.sale.model.ServiceOrder;
import java.math.BigDecimal;
import java.time.LocalDateTime;

public record ServiceOrderSummary(
        Long id,
        String name,
        Long saleOrderId,
        Long saleOrderLineId,
        String locationName,
        LocalDateTime scheduledDateStart,
        BigDecimal scheduledDuration) {

    public static ServiceOrderSummary of(ServiceOrder order) {
        return new ServiceOrderSummary(
                order.getId(),
                order.getName(),
                order.getSaleOrder() != null ? order.getSaleOrder().getId() : null,
                order.getSaleOrderLine() != null ? order.getSaleOrderLine().getId() : null,
                order.getLocation() != null ? order.getLocation().getName() : null,
                order.getScheduledDateStart(),
                order.getScheduledDuration());
    }
}
