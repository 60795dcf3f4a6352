package com.fieldservice.sale.service;

import com.fieldservice.sale.dto.ServiceOrderValues;
import com.fieldservice.sale.exception.ResourceNotFoundException;
import com.fieldservice.sale.model.RecordType;
import com.fieldservice.sale.model.SaleOrder;
import com.fieldservice.sale.model.SaleOrderLine;
import com.fieldservice.sale.model.ServiceOrder;
import com.fieldservice.sale.repository.SaleOrderLineRepository;
import com.fieldservice.sale.repository.SaleOrderRepository;
import com.fieldservice.sale.repository.ServiceOrderRepository;
import com.fieldservice.sale.util.DocumentNumbers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.Set;

@Service
public class ServiceOrderService {

    private static final Logger logger = LoggerFactory.getLogger(ServiceOrderService.class);

    static final Set<String> WRITER_AUTHORITIES = Set.of("ROLE_SERVICE", "ROLE_ADMIN");

    private final ServiceOrderRepository serviceOrderRepository;
    private final SaleOrderRepository saleOrderRepository;
    private final SaleOrderLineRepository lineRepository;
    private final SettingsService settingsService;
    private final ActivityService activityService;
    private final FieldServiceMessages messages;

    public ServiceOrderService(ServiceOrderRepository serviceOrderRepository, SaleOrderRepository saleOrderRepository,
            SaleOrderLineRepository lineRepository, SettingsService settingsService,
            ActivityService activityService, FieldServiceMessages messages) {
        this.serviceOrderRepository = serviceOrderRepository;
        this.saleOrderRepository = saleOrderRepository;
        this.lineRepository = lineRepository;
        this.settingsService = settingsService;
        this.activityService = activityService;
        this.messages = messages;
    }

    /**
     * Creates a service order. Under {@link AccessMode#USER} the current user needs a
     * service or admin role; {@link AccessMode#ELEVATED} skips that check.
     */
    @Transactional
    public ServiceOrder create(ServiceOrderValues values, AccessMode accessMode) {
        if (accessMode != AccessMode.ELEVATED) {
            checkWriteAccess();
        }

        ServiceOrder serviceOrder = new ServiceOrder();
        serviceOrder.setName(nextName());
        serviceOrder.setLocation(values.location());
        serviceOrder.setLocationDirections(values.locationDirections());
        serviceOrder.setRequestEarly(values.requestEarly());
        serviceOrder.setScheduledDateStart(values.scheduledDateStart());
        serviceOrder.setNotes(values.notes());
        serviceOrder.setCategories(values.categories() != null
                ? new LinkedHashSet<>(values.categories())
                : new LinkedHashSet<>());
        serviceOrder.setScheduledDuration(values.scheduledDuration() != null
                ? values.scheduledDuration()
                : BigDecimal.ZERO);
        serviceOrder.setCompany(values.company());

        if (values.saleOrderId() != null) {
            SaleOrder saleOrder = saleOrderRepository.findById(values.saleOrderId())
                    .orElseThrow(() -> new ResourceNotFoundException("SaleOrder", "id", values.saleOrderId()));
            serviceOrder.setSaleOrder(saleOrder);
        }
        if (values.saleOrderLineId() != null) {
            SaleOrderLine line = lineRepository.findById(values.saleOrderLineId())
                    .orElseThrow(() -> new ResourceNotFoundException("SaleOrderLine", "id", values.saleOrderLineId()));
            serviceOrder.setSaleOrderLine(line);
        }

        ServiceOrder saved = serviceOrderRepository.save(serviceOrder);
        logger.info("Service order {} created for sale order {} (line {})", saved.getName(),
                values.saleOrderId(), values.saleOrderLineId());
        return saved;
    }

    /**
     * Posts the cross-reference notes: one on the sale order pointing to the new service
     * order, one on the service order pointing back to the sale.
     */
    public void postCreationMessages(SaleOrder saleOrder, ServiceOrder serviceOrder) {
        activityService.postMessage(RecordType.SALE_ORDER, saleOrder.getId(),
                messages.serviceOrderCreated(serviceOrder));
        activityService.postMessage(RecordType.SERVICE_ORDER, serviceOrder.getId(),
                messages.createdFromSale(saleOrder));
    }

    private String nextName() {
        String prefix = settingsService.lockServiceOrderPrefix();
        String lastName = serviceOrderRepository.findTopByOrderByIdDesc()
                .map(ServiceOrder::getName)
                .orElse(null);
        return DocumentNumbers.next(prefix, lastName, serviceOrderRepository.count());
    }

    private void checkWriteAccess() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        boolean allowed = auth != null && auth.getAuthorities().stream()
                .map(GrantedAuthority::getAuthority)
                .anyMatch(WRITER_AUTHORITIES::contains);
        if (!allowed) {
            throw new AccessDeniedException("Creating service orders requires the service role");
        }
    }
}
