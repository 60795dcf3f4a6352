package com.fieldservice.sale.repository;

import com.fieldservice.sale.model.Location;
import com.fieldservice.sale.model.Partner;
import org.springframework.data.jpa.domain.Specification;

/**
 * Filters on service locations, combined with {@code and}/{@code or}/{@code not}.
 */
public final class LocationSpecifications {

    private LocationSpecifications() {
    }

    public static Specification<Location> ownedBy(Partner partner) {
        if (partner == null || partner.getId() == null) {
            // Matches nothing, like an equality against an empty reference
            return (root, query, cb) -> cb.disjunction();
        }
        Long partnerId = partner.getId();
        return (root, query, cb) -> cb.equal(root.get("partner").get("id"), partnerId);
    }
}
