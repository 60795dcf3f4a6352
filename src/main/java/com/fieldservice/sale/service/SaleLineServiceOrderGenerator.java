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
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lines tracked per sale share the order-level service order of their sale; lines
 * tracked per line get one service order each. Delivery-tracked lines are left to
 * the delivery process.
 */
@Service
public class SaleLineServiceOrderGenerator implements LineServiceOrderGenerator {

    private static final Logger logger = LoggerFactory.getLogger(SaleLineServiceOrderGenerator.class);

    private final ServiceOrderRepository serviceOrderRepository;
    private final ServiceOrderService serviceOrderService;
    private final ServiceOrderGenerationService generationService;

    public SaleLineServiceOrderGenerator(ServiceOrderRepository serviceOrderRepository,
            ServiceOrderService serviceOrderService, ServiceOrderGenerationService generationService) {
        this.serviceOrderRepository = serviceOrderRepository;
        this.serviceOrderService = serviceOrderService;
        this.generationService = generationService;
    }

    @Override
    @Transactional
    public Map<Long, ServiceOrder> generateForLines(List<SaleOrderLine> lines) {
        Map<Long, SaleOrder> saleTracked = new LinkedHashMap<>();
        List<SaleOrderLine> lineTracked = lines.stream()
                .filter(l -> l.getTrackingMode() == FieldServiceTracking.LINE)
                .toList();
        for (SaleOrderLine line : lines) {
            if (line.getTrackingMode() == FieldServiceTracking.SALE) {
                saleTracked.putIfAbsent(line.getOrder().getId(), line.getOrder());
            }
        }

        Map<Long, ServiceOrder> byOrder = saleTracked.isEmpty()
                ? Map.of()
                : generationService.findOrCreateServiceOrder(saleTracked.values());
        Map<Long, ServiceOrder> byLine = findOrCreateForLines(lineTracked);

        Map<Long, ServiceOrder> result = new LinkedHashMap<>();
        for (SaleOrderLine line : lines) {
            switch (line.getTrackingMode()) {
                case SALE -> result.put(line.getId(), byOrder.get(line.getOrder().getId()));
                case LINE -> result.put(line.getId(), byLine.get(line.getId()));
                default -> {
                }
            }
        }
        return result;
    }

    /**
     * One service order per line; existing ones are looked up in a single query.
     */
    private Map<Long, ServiceOrder> findOrCreateForLines(List<SaleOrderLine> lines) {
        Map<Long, ServiceOrder> existing = new LinkedHashMap<>();
        if (!lines.isEmpty()) {
            List<Long> lineIds = lines.stream().map(SaleOrderLine::getId).toList();
            for (ServiceOrder serviceOrder : serviceOrderRepository.findBySaleOrderLineIdIn(lineIds)) {
                existing.putIfAbsent(serviceOrder.getSaleOrderLine().getId(), serviceOrder);
            }
        }

        Map<Long, ServiceOrder> result = new LinkedHashMap<>();
        for (SaleOrderLine line : lines) {
            ServiceOrder serviceOrder = existing.get(line.getId());
            if (serviceOrder == null) {
                serviceOrder = serviceOrderService.create(buildLineValues(line), AccessMode.ELEVATED);
                serviceOrderService.postCreationMessages(line.getOrder(), serviceOrder);
            } else {
                logger.debug("Reusing service order {} of sale order line {}", serviceOrder.getName(), line.getId());
            }
            result.put(line.getId(), serviceOrder);
        }
        return result;
    }

    ServiceOrderValues buildLineValues(SaleOrderLine line) {
        SaleOrder order = line.getOrder();
        ServiceTemplate template = line.getProduct().getServiceTemplate();

        String notes = "";
        BigDecimal hours = BigDecimal.ZERO;
        Set<ServiceCategory> categories = new LinkedHashSet<>();
        if (template != null) {
            notes = template.getInstructions() != null ? template.getInstructions() : "";
            if (template.getDuration() != null)
                hours = template.getDuration();
            categories.addAll(template.getCategories());
        }

        Location location = order.getServiceLocation();
        return new ServiceOrderValues(
                location,
                location != null ? location.getDirection() : null,
                order.getExpectedDate(),
                order.getExpectedDate(),
                notes,
                categories,
                hours,
                order.getId(),
                line.getId(),
                order.getCompany());
    }
}
