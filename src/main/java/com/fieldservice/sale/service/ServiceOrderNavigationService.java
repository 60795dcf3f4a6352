package com.fieldservice.sale.service;

import com.fieldservice.sale.dto.LinkedServiceOrders;
import com.fieldservice.sale.dto.NavigationDirective;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ServiceOrderNavigationService {

    private final ServiceOrderLinkService linkService;

    public ServiceOrderNavigationService(ServiceOrderLinkService linkService) {
        this.linkService = linkService;
    }

    /**
     * Close when the sale has no service order, open the record when it has one,
     * list them otherwise.
     */
    public NavigationDirective actionViewServiceOrders(Long saleOrderId) {
        LinkedServiceOrders linked = linkService.computeLinkedServiceOrders(List.of(saleOrderId)).get(saleOrderId);
        List<Long> ids = linked.serviceOrderIds();
        if (ids.size() > 1) {
            return NavigationDirective.list(ids);
        } else if (ids.size() == 1) {
            return NavigationDirective.form(ids.get(0));
        }
        return NavigationDirective.close();
    }
}
