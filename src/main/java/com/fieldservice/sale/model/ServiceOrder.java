package com.fieldservice.sale.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Set;

@Entity
@Table(name = "service_orders")
@Data
public class ServiceOrder {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private String name;

    @ManyToOne
    @JoinColumn(name = "location_id")
    private Location location;

    @Column(length = 1000)
    private String locationDirections;

    private LocalDateTime requestEarly;

    private LocalDateTime scheduledDateStart;

    @Lob
    private String notes;

    @ManyToMany(fetch = FetchType.EAGER)
    @JoinTable(name = "service_order_categories", joinColumns = @JoinColumn(name = "service_order_id"), inverseJoinColumns = @JoinColumn(name = "category_id"))
    private Set<ServiceCategory> categories = new LinkedHashSet<>();

    // Hours
    @Column(precision = 10, scale = 2)
    private BigDecimal scheduledDuration = BigDecimal.ZERO;

    @ManyToOne
    @JoinColumn(name = "sale_order_id")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private SaleOrder saleOrder;

    // Only set when the order was generated for a single line
    @ManyToOne
    @JoinColumn(name = "sale_order_line_id")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private SaleOrderLine saleOrderLine;

    @ManyToOne
    @JoinColumn(name = "company_id")
    private Company company;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
