package com.fieldservice.sale.repository;

import com.fieldservice.sale.model.SaleOrder;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import java.util.Optional;

public interface SaleOrderRepository extends JpaRepository<SaleOrder, Long> {
    Optional<SaleOrder> findTopByOrderByIdDesc();

    // Serializes confirmations of the same order
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select o from SaleOrder o where o.id = :id")
    Optional<SaleOrder> findByIdForUpdate(@Param("id") Long id);
}
