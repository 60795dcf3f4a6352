package com.fieldservice.sale.service;

import com.fieldservice.sale.dto.LinkedServiceOrders;
import com.fieldservice.sale.exception.ResourceNotFoundException;
import com.fieldservice.sale.model.SaleOrder;
import com.fieldservice.sale.model.SaleOrderLine;
import com.fieldservice.sale.model.ServiceOrder;
import com.fieldservice.sale.repository.SaleOrderRepository;
import com.fieldservice.sale.repository.ServiceOrderRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Service orders associated with sale orders, either through one of their lines or
 * directly. Computed on every call; nothing is cached or stored.
 */
@Service
public class ServiceOrderLinkService {

    private final SaleOrderRepository saleOrderRepository;
    private final ServiceOrderRepository serviceOrderRepository;

    public ServiceOrderLinkService(SaleOrderRepository saleOrderRepository,
            ServiceOrderRepository serviceOrderRepository) {
        this.saleOrderRepository = saleOrderRepository;
        this.serviceOrderRepository = serviceOrderRepository;
    }

    @Transactional(readOnly = true)
    public Map<Long, LinkedServiceOrders> computeLinkedServiceOrders(Collection<Long> saleOrderIds) {
        Map<Long, LinkedServiceOrders> result = new LinkedHashMap<>();
        for (Long id : saleOrderIds) {
            SaleOrder order = saleOrderRepository.findById(id)
                    .orElseThrow(() -> new ResourceNotFoundException("SaleOrder", "id", id));
            result.put(id, computeLinkedServiceOrders(order));
        }
        return result;
    }

    @Transactional(readOnly = true)
    public LinkedServiceOrders computeLinkedServiceOrders(SaleOrder order) {
        if (order.getId() == null) {
            return new LinkedServiceOrders(null, List.of());
        }

        // Keyed by id: a service order both line-linked and sale-linked is listed once
        Map<Long, ServiceOrder> linked = new TreeMap<>();

        List<Long> lineIds = order.getOrderLines().stream()
                .map(SaleOrderLine::getId)
                .filter(id -> id != null)
                .toList();
        if (!lineIds.isEmpty()) {
            for (ServiceOrder serviceOrder : serviceOrderRepository.findBySaleOrderLineIdIn(lineIds)) {
                linked.put(serviceOrder.getId(), serviceOrder);
            }
        }
        for (ServiceOrder serviceOrder : serviceOrderRepository.findBySaleOrderId(order.getId())) {
            linked.put(serviceOrder.getId(), serviceOrder);
        }

        return new LinkedServiceOrders(order.getId(), new ArrayList<>(linked.values()));
    }
}
