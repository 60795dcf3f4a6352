package com.fieldservice.sale.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * A customer, contact or address. Contacts of the same business share a
 * commercial partner, the top-level company record of the group.
 */
@Entity
@Table(name = "partners")
@Data
public class Partner {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    private String email;

    @ManyToOne
    @JoinColumn(name = "commercial_partner_id")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Partner commercialPartner;

    // Default delivery contact
    @ManyToOne
    @JoinColumn(name = "shipping_address_id")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Partner shippingAddress;

    // Partner is itself a field service site
    private boolean serviceLocation = false;

    public Partner getCommercialEntity() {
        return commercialPartner != null ? commercialPartner : this;
    }
}
