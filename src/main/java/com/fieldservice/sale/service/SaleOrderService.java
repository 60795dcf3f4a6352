package com.fieldservice.sale.service;

import com.fieldservice.sale.exception.NotValidException;
import com.fieldservice.sale.exception.ResourceNotFoundException;
import com.fieldservice.sale.model.*;
import com.fieldservice.sale.repository.*;
import com.fieldservice.sale.util.DocumentNumbers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Service
public class SaleOrderService {

    private static final Logger logger = LoggerFactory.getLogger(SaleOrderService.class);

    private final SaleOrderRepository orderRepository;
    private final SaleOrderLineRepository lineRepository;
    private final PartnerRepository partnerRepository;
    private final ProductRepository productRepository;
    private final CompanyRepository companyRepository;
    private final LocationRepository locationRepository;
    private final ServiceLocationService serviceLocationService;
    private final FieldServiceConfirmationService confirmationService;
    private final SettingsService settingsService;

    public SaleOrderService(SaleOrderRepository orderRepository, SaleOrderLineRepository lineRepository,
            PartnerRepository partnerRepository,
            ProductRepository productRepository, CompanyRepository companyRepository,
            LocationRepository locationRepository, ServiceLocationService serviceLocationService,
            FieldServiceConfirmationService confirmationService, SettingsService settingsService) {
        this.orderRepository = orderRepository;
        this.lineRepository = lineRepository;
        this.partnerRepository = partnerRepository;
        this.productRepository = productRepository;
        this.companyRepository = companyRepository;
        this.locationRepository = locationRepository;
        this.serviceLocationService = serviceLocationService;
        this.confirmationService = confirmationService;
        this.settingsService = settingsService;
    }

    @Transactional
    public SaleOrder createOrder(Long customerId, Long companyId, LocalDateTime expectedDate) {
        SaleOrder so = new SaleOrder();
        so.setName(nextName());
        so.setStatus(SaleOrderStatus.DRAFT);
        so.setExpectedDate(expectedDate);
        if (companyId != null) {
            so.setCompany(companyRepository.findById(companyId)
                    .orElseThrow(() -> new ResourceNotFoundException("Company", "id", companyId)));
        }
        so.setCustomer(findPartner(customerId));
        serviceLocationService.onCustomerChanged(so);

        SaleOrder saved = orderRepository.save(so);
        logger.info("Sale order {} created for customer {}", saved.getName(), so.getCustomer().getName());
        return saved;
    }

    @Transactional(readOnly = true)
    public SaleOrder getOrder(Long orderId) {
        return findOrder(orderId);
    }

    @Transactional
    public SaleOrderLine addLine(Long orderId, Long productId, BigDecimal quantity) {
        SaleOrder so = findOrder(orderId);
        requireDraft(so);
        if (quantity != null && quantity.compareTo(BigDecimal.ZERO) <= 0) {
            throw new NotValidException("Quantity must be positive.");
        }

        Product product = productRepository.findById(productId)
                .orElseThrow(() -> new ResourceNotFoundException("Product", "id", productId));
        SaleOrderLine line = new SaleOrderLine();
        line.setProduct(product);
        line.setQuantity(quantity != null ? quantity : BigDecimal.ONE);
        line.setSequence((so.getOrderLines().size() + 1) * 10);
        so.addLine(line);

        return lineRepository.save(line);
    }

    @Transactional
    public SaleOrder changeCustomer(Long orderId, Long customerId) {
        SaleOrder so = findOrder(orderId);
        requireDraft(so);
        so.setCustomer(findPartner(customerId));
        serviceLocationService.onCustomerChanged(so);
        return orderRepository.save(so);
    }

    @Transactional
    public SaleOrder setServiceLocation(Long orderId, Long locationId) {
        SaleOrder so = findOrder(orderId);
        requireDraft(so);
        if (locationId == null) {
            so.setServiceLocation(null);
        } else {
            so.setServiceLocation(locationRepository.findById(locationId)
                    .orElseThrow(() -> new ResourceNotFoundException("Location", "id", locationId)));
        }
        return orderRepository.save(so);
    }

    @Transactional
    public SaleOrder confirm(Long orderId) {
        SaleOrder so = orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("SaleOrder", "id", orderId));
        return confirmationService.onConfirm(so);
    }

    /**
     * Cancels a draft or confirmed order. Its service orders are kept.
     */
    @Transactional
    public SaleOrder cancel(Long orderId) {
        SaleOrder so = findOrder(orderId);
        if (so.getStatus() == SaleOrderStatus.CANCELLED) {
            throw new NotValidException("Order " + so.getName() + " is already cancelled.");
        }
        so.setStatus(SaleOrderStatus.CANCELLED);
        logger.info("Sale order {} cancelled", so.getName());
        return orderRepository.save(so);
    }

    @Transactional
    public SaleOrder resetToDraft(Long orderId) {
        SaleOrder so = findOrder(orderId);
        if (so.getStatus() != SaleOrderStatus.CANCELLED) {
            throw new NotValidException("Only cancelled orders can be set back to draft.");
        }
        so.setStatus(SaleOrderStatus.DRAFT);
        so.setConfirmedAt(null);
        return orderRepository.save(so);
    }

    private SaleOrder findOrder(Long orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("SaleOrder", "id", orderId));
    }

    private Partner findPartner(Long partnerId) {
        if (partnerId == null) {
            throw new NotValidException("Customer selection required");
        }
        return partnerRepository.findById(partnerId)
                .orElseThrow(() -> new ResourceNotFoundException("Partner", "id", partnerId));
    }

    private void requireDraft(SaleOrder so) {
        if (so.getStatus() != SaleOrderStatus.DRAFT) {
            throw new NotValidException("Cannot modify order " + so.getName() + " (Status: " + so.getStatus() + ")");
        }
    }

    private String nextName() {
        String prefix = settingsService.lockSaleOrderPrefix();
        String lastName = orderRepository.findTopByOrderByIdDesc()
                .map(SaleOrder::getName)
                .orElse(null);
        return DocumentNumbers.next(prefix, lastName, orderRepository.count());
    }
}
