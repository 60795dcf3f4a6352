package com.fieldservice.sale.model;

import jakarta.persistence.*;
import lombok.Data;

@Entity
@Table(name = "service_locations")
@Data
public class Location {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @ManyToOne
    @JoinColumn(name = "partner_id", nullable = false)
    private Partner partner;

    // Access directions for technicians
    @Column(length = 1000)
    private String direction;

    @ManyToOne
    @JoinColumn(name = "company_id")
    private Company company;
}
