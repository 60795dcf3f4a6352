package com.fieldservice.sale.repository;

import com.fieldservice.sale.model.ServiceTemplate;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ServiceTemplateRepository extends JpaRepository<ServiceTemplate, Long> {
}
