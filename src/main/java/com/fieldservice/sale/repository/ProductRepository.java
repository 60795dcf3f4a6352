package com.fieldservice.sale.repository;

import com.fieldservice.sale.model.Product;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProductRepository extends JpaRepository<Product, Long> {
}
