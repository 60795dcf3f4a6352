package com.fieldservice.sale.service;

import com.fieldservice.sale.model.Location;
import com.fieldservice.sale.model.Partner;
import com.fieldservice.sale.model.SaleOrder;
import com.fieldservice.sale.repository.LocationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;

import java.util.List;

import static com.fieldservice.sale.repository.LocationSpecifications.ownedBy;

@Service
public class ServiceLocationService {

    private static final Logger logger = LoggerFactory.getLogger(ServiceLocationService.class);

    static final Sort LOCATION_ORDER = Sort.by("name", "id");

    private final LocationRepository locationRepository;
    private final BaseCustomerChange baseCustomerChange;

    public ServiceLocationService(LocationRepository locationRepository, BaseCustomerChange baseCustomerChange) {
        this.locationRepository = locationRepository;
        this.baseCustomerChange = baseCustomerChange;
    }

    /**
     * Runs the base customer change, then fills the service location from the locations
     * of the customer, its shipping partner or its commercial partner. A customer that is
     * itself a service location only matches its own locations. Only the given order
     * instance changes; nothing is saved.
     */
    public void onCustomerChanged(SaleOrder order) {
        baseCustomerChange.apply(order);

        List<Location> candidates = locationRepository.findAll(candidateFilter(order), LOCATION_ORDER);
        Location location = candidates.isEmpty() ? null : candidates.get(0);
        order.setServiceLocation(location);

        logger.debug("Service location of sale order {} inferred as {} ({} candidates)", order.getName(),
                location != null ? location.getName() : "none", candidates.size());
    }

    Specification<Location> candidateFilter(SaleOrder order) {
        Partner customer = order.getCustomer();
        if (customer != null && customer.isServiceLocation()) {
            return ownedBy(customer);
        }
        return Specification.where(ownedBy(customer))
                .or(ownedBy(order.getShippingPartner()))
                .or(ownedBy(customer != null ? customer.getCommercialEntity() : null));
    }
}
