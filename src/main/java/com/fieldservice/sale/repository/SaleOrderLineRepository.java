package com.fieldservice.sale.repository;

import com.fieldservice.sale.model.SaleOrderLine;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SaleOrderLineRepository extends JpaRepository<SaleOrderLine, Long> {
}
