package com.fieldservice.sale.controller;

import com.fieldservice.sale.dto.LinkedServiceOrders;
import com.fieldservice.sale.dto.NavigationDirective;
import com.fieldservice.sale.exception.MissingLocationException;
import com.fieldservice.sale.exception.ResourceNotFoundException;
import com.fieldservice.sale.model.*;
import com.fieldservice.sale.service.SaleOrderService;
import com.fieldservice.sale.service.ServiceOrderLinkService;
import com.fieldservice.sale.service.ServiceOrderNavigationService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class SaleOrderControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SaleOrderService saleOrderService;
    @MockBean
    private ServiceOrderLinkService linkService;
    @MockBean
    private ServiceOrderNavigationService navigationService;

    @Test
    @WithMockUser(roles = "SALES")
    void confirm_ShouldReturnOrderWithServiceOrders() throws Exception {
        SaleOrder order = order(10L, SaleOrderStatus.CONFIRMED);
        ServiceOrder fso = new ServiceOrder();
        fso.setId(70L);
        fso.setName("FSO-00070");
        fso.setSaleOrder(order);
        when(saleOrderService.confirm(10L)).thenReturn(order);
        when(linkService.computeLinkedServiceOrders(any(SaleOrder.class)))
                .thenReturn(new LinkedServiceOrders(10L, List.of(fso)));

        mockMvc.perform(post("/sale-orders/10/confirm").with(csrf()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CONFIRMED"))
                .andExpect(jsonPath("$.serviceOrderCount").value(1))
                .andExpect(jsonPath("$.serviceOrders[0].name").value("FSO-00070"))
                .andExpect(jsonPath("$.serviceOrders[0].saleOrderId").value(10));
    }

    @Test
    @WithMockUser(roles = "SALES")
    void confirm_ShouldReturnBadRequest_WhenLocationMissing() throws Exception {
        when(saleOrderService.confirm(10L))
                .thenThrow(new MissingLocationException(10L, "Service location must be set"));

        mockMvc.perform(post("/sale-orders/10/confirm").with(csrf()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Service location must be set"))
                .andExpect(jsonPath("$.saleOrderId").value(10));
    }

    @Test
    @WithMockUser(roles = "SALES")
    void detail_ShouldReturnNotFound_ForUnknownOrder() throws Exception {
        when(saleOrderService.getOrder(99L)).thenThrow(new ResourceNotFoundException("SaleOrder", "id", 99L));

        mockMvc.perform(get("/sale-orders/99"))
                .andExpect(status().isNotFound());
    }

    @Test
    @WithMockUser(roles = "SALES")
    void viewServiceOrders_ShouldReturnDirective() throws Exception {
        when(navigationService.actionViewServiceOrders(10L)).thenReturn(NavigationDirective.form(70L));

        mockMvc.perform(get("/sale-orders/10/service-orders/action"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("FORM"))
                .andExpect(jsonPath("$.recordId").value(70));
    }

    @Test
    @WithMockUser(roles = "SALES")
    void serviceOrders_ShouldListLinkedOrders() throws Exception {
        ServiceOrder first = new ServiceOrder();
        first.setId(70L);
        first.setName("FSO-00070");
        ServiceOrder second = new ServiceOrder();
        second.setId(71L);
        second.setName("FSO-00071");
        when(linkService.computeLinkedServiceOrders(List.of(10L)))
                .thenReturn(Map.of(10L, new LinkedServiceOrders(10L, List.of(first, second))));

        mockMvc.perform(get("/sale-orders/10/service-orders"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[1].name").value("FSO-00071"));
    }

    @Test
    @WithMockUser(roles = "SALES")
    void addLine_ShouldReturnLineId() throws Exception {
        SaleOrderLine line = new SaleOrderLine();
        line.setId(5L);
        when(saleOrderService.addLine(eq(10L), eq(3L), any())).thenReturn(line);

        mockMvc.perform(post("/sale-orders/10/lines")
                .param("productId", "3")
                .param("quantity", "2")
                .with(csrf()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.lineId").value(5));
    }

    @Test
    @WithMockUser(roles = "SALES")
    void messages_ShouldReturnEmptyHistory_ForOrderWithoutActivity() throws Exception {
        mockMvc.perform(get("/sale-orders/12345/messages"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    @WithMockUser(roles = "SERVICE")
    void confirm_ShouldBeForbidden_ForServiceRole() throws Exception {
        mockMvc.perform(post("/sale-orders/10/confirm").with(csrf()))
                .andExpect(status().isForbidden());

        verifyNoInteractions(saleOrderService);
    }

    @Test
    void detail_ShouldRequireAuthentication() throws Exception {
        mockMvc.perform(get("/sale-orders/10"))
                .andExpect(status().isUnauthorized());
    }

    private static SaleOrder order(Long id, SaleOrderStatus status) {
        Partner customer = new Partner();
        customer.setId(1L);
        customer.setName("Acme Corp");
        SaleOrder order = new SaleOrder();
        order.setId(id);
        order.setName("SO-000" + id);
        order.setStatus(status);
        order.setCustomer(customer);
        return order;
    }
}
