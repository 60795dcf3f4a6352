package com.fieldservice.sale.dto;

import com.fieldservice.sale.model.Company;
import com.fieldservice.sale.model.Location;
import com.fieldservice.sale.model.ServiceCategory;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Set;

/**
 * Field values of a service order about to be generated.
 * {@code saleOrderLineId} is null for order-level service orders.
 */
public record ServiceOrderValues(
        Location location,
        String locationDirections,
        LocalDateTime requestEarly,
        LocalDateTime scheduledDateStart,
        String notes,
        Set<ServiceCategory> categories,
        BigDecimal scheduledDuration,
        Long saleOrderId,
        Long saleOrderLineId,
        Company company) {
}
