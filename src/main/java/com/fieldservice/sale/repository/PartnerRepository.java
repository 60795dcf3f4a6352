package com.fieldservice.sale.repository;

import com.fieldservice.sale.model.Partner;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PartnerRepository extends JpaRepository<Partner, Long> {
}
