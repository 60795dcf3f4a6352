package com.fieldservice.sale.repository;

import com.fieldservice.sale.model.ServiceOrder;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ServiceOrderRepository extends JpaRepository<ServiceOrder, Long> {
    List<ServiceOrder> findBySaleOrderLineIdIn(Collection<Long> lineIds);

    List<ServiceOrder> findBySaleOrderId(Long saleOrderId);

    // Order-level service orders only
    List<ServiceOrder> findBySaleOrderIdInAndSaleOrderLineIsNull(Collection<Long> saleOrderIds);

    long countBySaleOrderIdAndSaleOrderLineIsNull(Long saleOrderId);

    Optional<ServiceOrder> findTopByOrderByIdDesc();
}
