package com.fieldservice.sale.model;

import jakarta.persistence.*;
import lombok.Data;

@Entity
@Table(name = "products")
@Data
public class Product {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(unique = true, nullable = false)
    private String sku;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private FieldServiceTracking fieldServiceTracking = FieldServiceTracking.NO;

    @ManyToOne
    @JoinColumn(name = "service_template_id")
    private ServiceTemplate serviceTemplate;
}
