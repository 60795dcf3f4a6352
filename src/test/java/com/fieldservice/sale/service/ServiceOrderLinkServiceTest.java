package com.fieldservice.sale.service;

import com.fieldservice.sale.dto.LinkedServiceOrders;
import com.fieldservice.sale.exception.ResourceNotFoundException;
import com.fieldservice.sale.model.*;
import com.fieldservice.sale.repository.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import(ServiceOrderLinkService.class)
class ServiceOrderLinkServiceTest {

    @Autowired
    private ServiceOrderLinkService linkService;

    @Autowired
    private SaleOrderRepository saleOrderRepository;

    @Autowired
    private ServiceOrderRepository serviceOrderRepository;

    @Autowired
    private PartnerRepository partnerRepository;

    @Autowired
    private ProductRepository productRepository;

    private Partner customer;
    private Product product;

    @BeforeEach
    void setUp() {
        customer = new Partner();
        customer.setName("Acme Corp");
        partnerRepository.save(customer);

        product = new Product();
        product.setName("Boiler Install");
        product.setSku("BOIL-01");
        product.setFieldServiceTracking(FieldServiceTracking.LINE);
        productRepository.save(product);
    }

    @Test
    void computeLinkedServiceOrders_ShouldUnionLineAndOrderLinks() {
        SaleOrder order = order("SO-00001");
        SaleOrderLine line = order.getOrderLines().get(0);

        ServiceOrder lineLevel = serviceOrder("FSO-00001", order, line);
        ServiceOrder orderLevel = serviceOrder("FSO-00002", order, null);

        Map<Long, LinkedServiceOrders> result = linkService.computeLinkedServiceOrders(List.of(order.getId()));

        LinkedServiceOrders linked = result.get(order.getId());
        assertEquals(2, linked.serviceOrderCount());
        assertEquals(List.of(lineLevel.getId(), orderLevel.getId()), linked.serviceOrderIds());
    }

    @Test
    void computeLinkedServiceOrders_ShouldKeepOrdersSeparate() {
        SaleOrder first = order("SO-00001");
        SaleOrder second = order("SO-00002");
        serviceOrder("FSO-00001", first, null);

        Map<Long, LinkedServiceOrders> result = linkService
                .computeLinkedServiceOrders(List.of(first.getId(), second.getId()));

        assertEquals(1, result.get(first.getId()).serviceOrderCount());
        assertEquals(0, result.get(second.getId()).serviceOrderCount());
    }

    @Test
    void computeLinkedServiceOrders_ShouldBeRepeatable() {
        SaleOrder order = order("SO-00001");
        serviceOrder("FSO-00001", order, null);

        LinkedServiceOrders first = linkService.computeLinkedServiceOrders(order);
        LinkedServiceOrders second = linkService.computeLinkedServiceOrders(order);

        assertEquals(first.serviceOrderIds(), second.serviceOrderIds());
        assertEquals(1, serviceOrderRepository.count());
    }

    @Test
    void computeLinkedServiceOrders_ShouldBeEmpty_ForUnsavedOrder() {
        serviceOrder("FSO-00001", null, null);
        SaleOrder unsaved = new SaleOrder();
        unsaved.setName("SO-DRAFT");

        LinkedServiceOrders linked = linkService.computeLinkedServiceOrders(unsaved);

        assertEquals(0, linked.serviceOrderCount());
        assertEquals(1, serviceOrderRepository.count());
    }

    @Test
    void computeLinkedServiceOrders_ShouldFail_ForUnknownOrder() {
        assertThrows(ResourceNotFoundException.class,
                () -> linkService.computeLinkedServiceOrders(List.of(999L)));
    }

    private SaleOrder order(String name) {
        SaleOrder order = new SaleOrder();
        order.setName(name);
        order.setCustomer(customer);
        SaleOrderLine line = new SaleOrderLine();
        line.setProduct(product);
        order.addLine(line);
        return saleOrderRepository.save(order);
    }

    private ServiceOrder serviceOrder(String name, SaleOrder order, SaleOrderLine line) {
        ServiceOrder serviceOrder = new ServiceOrder();
        serviceOrder.setName(name);
        serviceOrder.setSaleOrder(order);
        serviceOrder.setSaleOrderLine(line);
        return serviceOrderRepository.save(serviceOrder);
    }
}
