package com.fieldservice.sale.service;

import com.fieldservice.sale.dto.ServiceOrderValues;
import com.fieldservice.sale.model.FieldServiceTracking;
import com.fieldservice.sale.model.Location;
import com.fieldservice.sale.model.SaleOrder;
import com.fieldservice.sale.model.SaleOrderLine;
import com.fieldservice.sale.model.ServiceCategory;
import com.fieldservice.sale.model.ServiceOrder;
import com.fieldservice.sale.model.ServiceTemplate;
import com.fieldservice.sale.repository.ServiceOrderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Generates the order-level service order of a sale: the single service order that
 * covers every line whose product is tracked per sale.
 */
@Service
public class ServiceOrderGenerationService {

    private static final Logger logger = LoggerFactory.getLogger(ServiceOrderGenerationService.class);

    private final ServiceOrderRepository serviceOrderRepository;
    private final ServiceOrderService serviceOrderService;

    public ServiceOrderGenerationService(ServiceOrderRepository serviceOrderRepository,
            ServiceOrderService serviceOrderService) {
        this.serviceOrderRepository = serviceOrderRepository;
        this.serviceOrderService = serviceOrderService;
    }

    /**
     * Values of the order-level service order of one sale order. Templates of the lines
     * tracked per sale are aggregated: instructions concatenated in line order, durations
     * summed, categories merged. A template shared by several lines counts once.
     */
    public ServiceOrderValues buildServiceOrderValues(SaleOrder order) {
        if (order == null) {
            throw new IllegalArgumentException("Exactly one sale order is required");
        }

        List<ServiceTemplate> templates = new ArrayList<>();
        for (SaleOrderLine line : order.getOrderLines()) {
            if (line.getTrackingMode() != FieldServiceTracking.SALE)
                continue;
            ServiceTemplate template = line.getProduct().getServiceTemplate();
            if (template != null && templates.stream().noneMatch(t -> sameTemplate(t, template))) {
                templates.add(template);
            }
        }

        StringBuilder notes = new StringBuilder();
        BigDecimal hours = BigDecimal.ZERO;
        Set<ServiceCategory> categories = new LinkedHashSet<>();
        for (ServiceTemplate template : templates) {
            notes.append(template.getInstructions() != null ? template.getInstructions() : "");
            if (template.getDuration() != null)
                hours = hours.add(template.getDuration());
            categories.addAll(template.getCategories());
        }

        Location location = order.getServiceLocation();
        return new ServiceOrderValues(
                location,
                location != null ? location.getDirection() : null,
                order.getExpectedDate(),
                order.getExpectedDate(),
                notes.toString(),
                categories,
                hours,
                order.getId(),
                null,
                order.getCompany());
    }

    /**
     * Creates one service order per sale order and cross-references both records.
     * Does not look for existing ones, see {@link #findOrCreateServiceOrder(Collection)}.
     *
     * @return the new service order of each sale order, keyed by sale order id
     */
    @Transactional
    public Map<Long, ServiceOrder> createServiceOrder(Collection<SaleOrder> orders) {
        Map<Long, ServiceOrder> result = new LinkedHashMap<>();
        for (SaleOrder so : orders) {
            ServiceOrderValues values = buildServiceOrderValues(so);
            // Sales users do not need write access on service orders
            ServiceOrder serviceOrder = serviceOrderService.create(values, AccessMode.ELEVATED);
            serviceOrderService.postCreationMessages(so, serviceOrder);
            result.put(so.getId(), serviceOrder);
        }
        return result;
    }

    /**
     * Finds the order-level service order of each sale order, creating the missing ones.
     * A sale order confirmed, cancelled, set to draft and confirmed again keeps its
     * first service order.
     *
     * @return the service order of each sale order, keyed by sale order id
     */
    @Transactional
    public Map<Long, ServiceOrder> findOrCreateServiceOrder(Collection<SaleOrder> orders) {
        List<Long> ids = orders.stream().map(SaleOrder::getId).toList();
        Map<Long, ServiceOrder> existing = new LinkedHashMap<>();
        if (!ids.isEmpty()) {
            for (ServiceOrder serviceOrder : serviceOrderRepository.findBySaleOrderIdInAndSaleOrderLineIsNull(ids)) {
                existing.putIfAbsent(serviceOrder.getSaleOrder().getId(), serviceOrder);
            }
        }

        Map<Long, ServiceOrder> result = new LinkedHashMap<>();
        for (SaleOrder so : orders) {
            ServiceOrder serviceOrder = existing.get(so.getId());
            if (serviceOrder == null) {
                serviceOrder = createServiceOrder(List.of(so)).get(so.getId());
            } else {
                logger.debug("Reusing service order {} of sale order {}", serviceOrder.getName(), so.getName());
            }
            result.put(so.getId(), serviceOrder);
        }
        return result;
    }

    private static boolean sameTemplate(ServiceTemplate a, ServiceTemplate b) {
        if (a == b)
            return true;
        return a.getId() != null && Objects.equals(a.getId(), b.getId());
    }
}
