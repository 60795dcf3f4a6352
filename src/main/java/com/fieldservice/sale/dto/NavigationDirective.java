package com.fieldservice.sale.dto;

import java.util.List;

/**
 * Where the client goes after asking for the service orders of a sale.
 */
public record NavigationDirective(
        Type type,
        Long recordId,
        List<Long> recordIds) {

    public enum Type {
        CLOSE, FORM, LIST
    }

    public static NavigationDirective close() {
        return new NavigationDirective(Type.CLOSE, null, List.of());
    }

    public static NavigationDirective form(Long recordId) {
        return new NavigationDirective(Type.FORM, recordId, List.of(recordId));
    }

    public static NavigationDirective list(List<Long> recordIds) {
        return new NavigationDirective(Type.LIST, null, List.copyOf(recordIds));
    }
}
