package com.fieldservice.sale.repository;

import com.fieldservice.sale.model.Company;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CompanyRepository extends JpaRepository<Company, Long> {
}
