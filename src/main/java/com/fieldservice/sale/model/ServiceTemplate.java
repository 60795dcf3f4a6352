package com.fieldservice.sale.model;

import jakarta.persistence.*;
import lombok.Data;
import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Default content of the service orders generated for a product.
 */
@Entity
@Table(name = "service_templates")
@Data
public class ServiceTemplate {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Lob
    private String instructions;

    // Hours
    @Column(precision = 10, scale = 2, nullable = false)
    private BigDecimal duration = BigDecimal.ZERO;

    @ManyToMany(fetch = FetchType.EAGER)
    @JoinTable(name = "service_template_categories", joinColumns = @JoinColumn(name = "template_id"), inverseJoinColumns = @JoinColumn(name = "category_id"))
    private Set<ServiceCategory> categories = new LinkedHashSet<>();
}
