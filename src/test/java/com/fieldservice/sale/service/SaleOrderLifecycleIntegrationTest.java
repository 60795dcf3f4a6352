package com.fieldservice.sale.service;

import com.fieldservice.sale.dto.LinkedServiceOrders;
import com.fieldservice.sale.exception.MissingLocationException;
import com.fieldservice.sale.exception.NotValidException;
import com.fieldservice.sale.model.*;
import com.fieldservice.sale.repository.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Transactional
class SaleOrderLifecycleIntegrationTest {

    @Autowired
    private SaleOrderService saleOrderService;
    @Autowired
    private ServiceOrderGenerationService generationService;
    @Autowired
    private ServiceOrderLinkService linkService;
    @Autowired
    private ActivityService activityService;

    @Autowired
    private PartnerRepository partnerRepository;
    @Autowired
    private LocationRepository locationRepository;
    @Autowired
    private ProductRepository productRepository;
    @Autowired
    private ServiceTemplateRepository templateRepository;
    @Autowired
    private ServiceCategoryRepository categoryRepository;
    @Autowired
    private CompanyRepository companyRepository;
    @Autowired
    private ServiceOrderRepository serviceOrderRepository;

    private Company company;
    private Partner customer;
    private Location site;
    private Product installA;
    private Product installB;
    private Product perLineRepair;
    private Product consumable;

    @BeforeEach
    void setUp() {
        company = new Company();
        company.setName("Field Co");
        companyRepository.save(company);

        customer = new Partner();
        customer.setName("Acme Corp");
        partnerRepository.save(customer);

        site = new Location();
        site.setName("Acme Plant");
        site.setPartner(customer);
        site.setDirection("Gate 4");
        site.setCompany(company);
        locationRepository.save(site);

        ServiceCategory installation = new ServiceCategory();
        installation.setName("Installation");
        categoryRepository.save(installation);

        installA = product("INST-A", FieldServiceTracking.SALE, template("A", "1.5", installation));
        installB = product("INST-B", FieldServiceTracking.SALE, template("B", "2.0", installation));
        perLineRepair = product("REP-1", FieldServiceTracking.LINE, template("Repair", "1.0", installation));
        consumable = product("FILTER", FieldServiceTracking.NO, null);
    }

    @Test
    void confirm_ShouldGenerateOneAggregatedServiceOrder() {
        SaleOrder so = draftWithLines(installA, installB, consumable);

        saleOrderService.confirm(so.getId());

        List<ServiceOrder> orderLevel = serviceOrderRepository
                .findBySaleOrderIdInAndSaleOrderLineIsNull(List.of(so.getId()));
        assertEquals(1, orderLevel.size());
        ServiceOrder fso = orderLevel.get(0);
        assertEquals(0, new BigDecimal("3.5").compareTo(fso.getScheduledDuration()));
        assertEquals("AB", fso.getNotes());
        assertEquals(site, fso.getLocation());
        assertEquals("Gate 4", fso.getLocationDirections());
        assertEquals(so.getExpectedDate(), fso.getScheduledDateStart());
        assertEquals(company, fso.getCompany());
        assertEquals(1, fso.getCategories().size());
        assertEquals(SaleOrderStatus.CONFIRMED, so.getStatus());
    }

    @Test
    void confirm_ShouldKeepFullNotes_WhenCombinedInstructionsAreLong() {
        ServiceCategory inspection = new ServiceCategory();
        inspection.setName("Inspection");
        categoryRepository.save(inspection);
        Product survey = product("SURVEY", FieldServiceTracking.SALE, template("s".repeat(3000), "1.0", inspection));
        Product commissioning = product("COMMISSION", FieldServiceTracking.SALE,
                template("c".repeat(3000), "1.0", inspection));
        SaleOrder so = draftWithLines(survey, commissioning);

        saleOrderService.confirm(so.getId());

        ServiceOrder fso = serviceOrderRepository.findBySaleOrderId(so.getId()).get(0);
        assertEquals(6000, fso.getNotes().length());
        assertEquals("s".repeat(3000) + "c".repeat(3000), fso.getNotes());
        assertEquals(SaleOrderStatus.CONFIRMED, so.getStatus());
    }

    @Test
    void confirm_ShouldPostCrossReferenceMessages() {
        SaleOrder so = draftWithLines(installA);

        saleOrderService.confirm(so.getId());

        ServiceOrder fso = serviceOrderRepository.findBySaleOrderId(so.getId()).get(0);
        List<ActivityMessage> onSale = activityService.history(RecordType.SALE_ORDER, so.getId());
        List<ActivityMessage> onService = activityService.history(RecordType.SERVICE_ORDER, fso.getId());
        assertEquals(1, onSale.size());
        assertTrue(onSale.get(0).getBody().contains(fso.getName()));
        assertTrue(onSale.get(0).getBody().contains("data-id=\"" + fso.getId() + "\""));
        assertEquals(1, onService.size());
        assertTrue(onService.get(0).getBody().contains(so.getName()));
    }

    @Test
    void confirm_ShouldNotDuplicate_AcrossCancelAndReconfirm() {
        SaleOrder so = draftWithLines(installA);

        saleOrderService.confirm(so.getId());
        ServiceOrder first = serviceOrderRepository.findBySaleOrderId(so.getId()).get(0);

        saleOrderService.cancel(so.getId());
        saleOrderService.resetToDraft(so.getId());
        saleOrderService.confirm(so.getId());

        List<ServiceOrder> orderLevel = serviceOrderRepository
                .findBySaleOrderIdInAndSaleOrderLineIsNull(List.of(so.getId()));
        assertEquals(1, orderLevel.size());
        assertEquals(first.getId(), orderLevel.get(0).getId());
    }

    @Test
    void findOrCreateServiceOrder_ShouldBeIdempotent() {
        SaleOrder so = draftWithLines(installA);

        Map<Long, ServiceOrder> first = generationService.findOrCreateServiceOrder(List.of(so));
        Map<Long, ServiceOrder> second = generationService.findOrCreateServiceOrder(List.of(so));

        assertEquals(first.get(so.getId()).getId(), second.get(so.getId()).getId());
        assertEquals(1, serviceOrderRepository.countBySaleOrderIdAndSaleOrderLineIsNull(so.getId()));
    }

    @Test
    void confirm_ShouldGenerateOneServiceOrderPerLineTrackedLine() {
        SaleOrder so = draftWithLines(perLineRepair, perLineRepair, installA);

        saleOrderService.confirm(so.getId());

        LinkedServiceOrders linked = linkService.computeLinkedServiceOrders(so);
        assertEquals(3, linked.serviceOrderCount());
        long lineLevel = linked.serviceOrders().stream().filter(f -> f.getSaleOrderLine() != null).count();
        assertEquals(2, lineLevel);
        assertEquals(1, serviceOrderRepository.countBySaleOrderIdAndSaleOrderLineIsNull(so.getId()));
    }

    @Test
    void confirm_ShouldNotCreateServiceOrders_WithoutServiceProducts() {
        SaleOrder so = draftWithLines(consumable);
        saleOrderService.setServiceLocation(so.getId(), null);

        assertDoesNotThrow(() -> saleOrderService.confirm(so.getId()));

        assertTrue(serviceOrderRepository.findBySaleOrderId(so.getId()).isEmpty());
    }

    @Test
    void confirm_ShouldFail_WhenServiceLocationMissing() {
        SaleOrder so = draftWithLines(installA);
        saleOrderService.setServiceLocation(so.getId(), null);

        MissingLocationException exception = assertThrows(MissingLocationException.class,
                () -> saleOrderService.confirm(so.getId()));

        assertEquals("Service location must be set", exception.getMessage());
        assertTrue(serviceOrderRepository.findBySaleOrderId(so.getId()).isEmpty());
    }

    @Test
    void createOrder_ShouldInferServiceLocation() {
        SaleOrder so = saleOrderService.createOrder(customer.getId(), company.getId(), null);

        assertEquals(site, so.getServiceLocation());
        assertEquals(customer, so.getShippingPartner());
    }

    @Test
    void addLine_ShouldRejectConfirmedOrder() {
        SaleOrder so = draftWithLines(consumable);
        saleOrderService.confirm(so.getId());

        assertThrows(NotValidException.class,
                () -> saleOrderService.addLine(so.getId(), consumable.getId(), BigDecimal.ONE));
    }

    private SaleOrder draftWithLines(Product... products) {
        SaleOrder so = saleOrderService.createOrder(customer.getId(), company.getId(),
                LocalDateTime.of(2026, 6, 1, 9, 0));
        for (Product product : products) {
            saleOrderService.addLine(so.getId(), product.getId(), BigDecimal.ONE);
        }
        return so;
    }

    private ServiceTemplate template(String instructions, String hours, ServiceCategory category) {
        ServiceTemplate template = new ServiceTemplate();
        template.setName("Template " + instructions);
        template.setInstructions(instructions);
        template.setDuration(new BigDecimal(hours));
        template.getCategories().add(category);
        return templateRepository.save(template);
    }

    private Product product(String sku, FieldServiceTracking tracking, ServiceTemplate template) {
        Product product = new Product();
        product.setName(sku);
        product.setSku(sku);
        product.setFieldServiceTracking(tracking);
        product.setServiceTemplate(template);
        return productRepository.save(product);
    }
}
