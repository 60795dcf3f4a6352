package com.fieldservice.sale.service;

import com.fieldservice.sale.exception.MissingLocationException;
import com.fieldservice.sale.model.FieldServiceTracking;
import com.fieldservice.sale.model.SaleOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Sale order confirmation with field service generation on top of the base behavior.
 */
@Service
public class FieldServiceConfirmationService {

    private static final Logger logger = LoggerFactory.getLogger(FieldServiceConfirmationService.class);

    private final BaseSaleOrderConfirmation baseConfirmation;
    private final LineServiceOrderGenerator lineGenerator;
    private final FieldServiceMessages messages;

    public FieldServiceConfirmationService(BaseSaleOrderConfirmation baseConfirmation,
            LineServiceOrderGenerator lineGenerator, FieldServiceMessages messages) {
        this.baseConfirmation = baseConfirmation;
        this.lineGenerator = lineGenerator;
        this.messages = messages;
    }

    /**
     * Confirms the order, then generates the service orders of its lines. Runs as one
     * transaction: a missing service location rolls the confirmation back.
     *
     * @return the result of the base confirmation
     */
    @Transactional
    public SaleOrder onConfirm(SaleOrder order) {
        SaleOrder result = baseConfirmation.confirm(order);

        boolean needsFieldService = order.getOrderLines().stream()
                .anyMatch(line -> line.getTrackingMode() != FieldServiceTracking.NO);
        if (needsFieldService) {
            if (order.getServiceLocation() == null) {
                logger.warn("Sale order {} needs field service but has no service location", order.getName());
                throw new MissingLocationException(order.getId(), messages.locationRequired());
            }
            lineGenerator.generateForLines(order.getOrderLines());
        }
        return result;
    }
}
