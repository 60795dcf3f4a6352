package com.fieldservice.sale.service;

import com.fieldservice.sale.model.SaleOrderLine;
import com.fieldservice.sale.model.ServiceOrder;

import java.util.List;
import java.util.Map;

/**
 * Generates the service orders of confirmed sale order lines. Implementations must
 * find existing service orders before creating new ones.
 */
public interface LineServiceOrderGenerator {

    /**
     * @return the service order serving each line, keyed by line id; lines that do not
     *         generate a service order are absent
     */
    Map<Long, ServiceOrder> generateForLines(List<SaleOrderLine> lines);
}
