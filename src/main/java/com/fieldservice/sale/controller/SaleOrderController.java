package com.fieldservice.sale.controller;

import com.fieldservice.sale.dto.LinkedServiceOrders;
import com.fieldservice.sale.dto.NavigationDirective;
import com.fieldservice.sale.dto.SaleOrderView;
import com.fieldservice.sale.dto.ServiceOrderSummary;
import com.fieldservice.sale.model.ActivityMessage;
import com.fieldservice.sale.model.RecordType;
import com.fieldservice.sale.model.SaleOrder;
import com.fieldservice.sale.model.SaleOrderLine;
import com.fieldservice.sale.service.ActivityService;
import com.fieldservice.sale.service.SaleOrderService;
import com.fieldservice.sale.service.ServiceOrderLinkService;
import com.fieldservice.sale.service.ServiceOrderNavigationService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@Controller
@RequestMapping("/sale-orders")
@PreAuthorize("hasAnyRole('SALES', 'ADMIN')")
public class SaleOrderController {

    private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(SaleOrderController.class);
    private final SaleOrderService saleOrderService;
    private final ServiceOrderLinkService linkService;
    private final ServiceOrderNavigationService navigationService;
    private final ActivityService activityService;

    public SaleOrderController(SaleOrderService saleOrderService, ServiceOrderLinkService linkService,
            ServiceOrderNavigationService navigationService, ActivityService activityService) {
        this.saleOrderService = saleOrderService;
        this.linkService = linkService;
        this.navigationService = navigationService;
        this.activityService = activityService;
    }

    @PostMapping
    @ResponseBody
    public ResponseEntity<SaleOrderView> create(@RequestParam Long customerId,
            @RequestParam(required = false) Long companyId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime expectedDate) {
        SaleOrder so = saleOrderService.createOrder(customerId, companyId, expectedDate);
        return ResponseEntity.ok(view(so));
    }

    @GetMapping("/{id}")
    @ResponseBody
    public ResponseEntity<SaleOrderView> detail(@PathVariable Long id) {
        return ResponseEntity.ok(view(saleOrderService.getOrder(id)));
    }

    @PostMapping("/{id}/lines")
    @ResponseBody
    public ResponseEntity<Map<String, Long>> addLine(@PathVariable Long id, @RequestParam Long productId,
            @RequestParam(required = false) BigDecimal quantity) {
        SaleOrderLine line = saleOrderService.addLine(id, productId, quantity);
        return ResponseEntity.ok(Map.of("lineId", line.getId()));
    }

    @PostMapping("/{id}/customer")
    @ResponseBody
    public ResponseEntity<SaleOrderView> changeCustomer(@PathVariable Long id, @RequestParam Long customerId) {
        return ResponseEntity.ok(view(saleOrderService.changeCustomer(id, customerId)));
    }

    @PostMapping("/{id}/service-location")
    @ResponseBody
    public ResponseEntity<SaleOrderView> setServiceLocation(@PathVariable Long id,
            @RequestParam(required = false) Long locationId) {
        return ResponseEntity.ok(view(saleOrderService.setServiceLocation(id, locationId)));
    }

    @PostMapping("/{id}/confirm")
    @ResponseBody
    public ResponseEntity<SaleOrderView> confirm(@PathVariable Long id) {
        SaleOrder so = saleOrderService.confirm(id);
        SaleOrderView view = view(so);
        logger.info("Sale order {} confirmed with {} service order(s)", so.getName(), view.serviceOrderCount());
        return ResponseEntity.ok(view);
    }

    @PostMapping("/{id}/cancel")
    @ResponseBody
    public ResponseEntity<SaleOrderView> cancel(@PathVariable Long id) {
        return ResponseEntity.ok(view(saleOrderService.cancel(id)));
    }

    @PostMapping("/{id}/draft")
    @ResponseBody
    public ResponseEntity<SaleOrderView> resetToDraft(@PathVariable Long id) {
        return ResponseEntity.ok(view(saleOrderService.resetToDraft(id)));
    }

    @GetMapping("/{id}/service-orders")
    @ResponseBody
    public ResponseEntity<List<ServiceOrderSummary>> serviceOrders(@PathVariable Long id) {
        LinkedServiceOrders linked = linkService.computeLinkedServiceOrders(List.of(id)).get(id);
        return ResponseEntity.ok(linked.serviceOrders().stream().map(ServiceOrderSummary::of).toList());
    }

    // Where the "Field Service Orders" button of the sale leads
    @GetMapping("/{id}/service-orders/action")
    @ResponseBody
    public ResponseEntity<NavigationDirective> viewServiceOrders(@PathVariable Long id) {
        return ResponseEntity.ok(navigationService.actionViewServiceOrders(id));
    }

    @GetMapping("/{id}/messages")
    @ResponseBody
    public ResponseEntity<List<ActivityMessage>> messages(@PathVariable Long id) {
        return ResponseEntity.ok(activityService.history(RecordType.SALE_ORDER, id));
    }

    private SaleOrderView view(SaleOrder so) {
        return SaleOrderView.of(so, linkService.computeLinkedServiceOrders(so));
    }
}
