package com.fieldservice.sale.model;

import jakarta.persistence.*;
import lombok.Data;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "sale_orders")
@Data
public class SaleOrder {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private String name;

    @ManyToOne
    @JoinColumn(name = "customer_id", nullable = false)
    private Partner customer;

    @ManyToOne
    @JoinColumn(name = "shipping_partner_id")
    private Partner shippingPartner;

    @ManyToOne
    @JoinColumn(name = "company_id")
    private Company company;

    private LocalDateTime expectedDate;

    // Lines generating a service order will be for this location
    @ManyToOne
    @JoinColumn(name = "service_location_id")
    private Location serviceLocation;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SaleOrderStatus status;

    private LocalDateTime confirmedAt;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("sequence ASC, id ASC")
    private List<SaleOrderLine> orderLines = new ArrayList<>();

    @Column(updatable = false)
    private LocalDateTime createdAt;

    public void addLine(SaleOrderLine line) {
        line.setOrder(this);
        orderLines.add(line);
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        if (status == null)
            status = SaleOrderStatus.DRAFT;
    }
}
