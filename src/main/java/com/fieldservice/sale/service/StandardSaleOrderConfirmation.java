package com.fieldservice.sale.service;

import com.fieldservice.sale.exception.NotValidException;
import com.fieldservice.sale.model.SaleOrder;
import com.fieldservice.sale.model.SaleOrderStatus;
import com.fieldservice.sale.repository.SaleOrderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

@Service
public class StandardSaleOrderConfirmation implements BaseSaleOrderConfirmation {

    private static final Logger logger = LoggerFactory.getLogger(StandardSaleOrderConfirmation.class);

    private final SaleOrderRepository orderRepository;

    public StandardSaleOrderConfirmation(SaleOrderRepository orderRepository) {
        this.orderRepository = orderRepository;
    }

    @Override
    @Transactional
    public SaleOrder confirm(SaleOrder order) {
        if (order.getStatus() != SaleOrderStatus.DRAFT) {
            throw new NotValidException("Only draft orders can be confirmed (Status: " + order.getStatus() + ")");
        }
        if (order.getOrderLines().isEmpty()) {
            throw new NotValidException("Cannot confirm an order without lines");
        }

        order.setStatus(SaleOrderStatus.CONFIRMED);
        order.setConfirmedAt(LocalDateTime.now());
        SaleOrder saved = orderRepository.save(order);
        logger.info("Sale order {} confirmed", saved.getName());
        return saved;
    }
}
