package com.fieldservice.sale.service;

import com.fieldservice.sale.model.SaleOrder;
import com.fieldservice.sale.model.ServiceOrder;
import org.springframework.context.MessageSource;
import org.springframework.context.i18n.LocaleContextHolder;
import org.springframework.stereotype.Component;

/**
 * User-facing texts, resolved from {@code messages.properties}.
 */
@Component
public class FieldServiceMessages {

    public static final String SERVICE_ORDER_CREATED = "fieldservice.serviceorder.created";
    public static final String CREATED_FROM_SALE = "fieldservice.serviceorder.createdFrom";
    public static final String LOCATION_REQUIRED = "fieldservice.location.required";

    private final MessageSource messageSource;

    public FieldServiceMessages(MessageSource messageSource) {
        this.messageSource = messageSource;
    }

    public String serviceOrderCreated(ServiceOrder serviceOrder) {
        return get(SERVICE_ORDER_CREATED, String.valueOf(serviceOrder.getId()), serviceOrder.getName());
    }

    public String createdFromSale(SaleOrder saleOrder) {
        return get(CREATED_FROM_SALE, String.valueOf(saleOrder.getId()), saleOrder.getName());
    }

    public String locationRequired() {
        return get(LOCATION_REQUIRED);
    }

    private String get(String code, Object... args) {
        return messageSource.getMessage(code, args, LocaleContextHolder.getLocale());
    }
}
