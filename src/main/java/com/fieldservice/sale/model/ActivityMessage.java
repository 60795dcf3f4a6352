package com.fieldservice.sale.model;

import jakarta.persistence.*;
import lombok.Data;
import java.time.LocalDateTime;

/**
 * A note in the activity history of a sale order or a service order.
 */
@Entity
@Table(name = "activity_messages", indexes = @Index(name = "idx_activity_record", columnList = "recordType, recordId"))
@Data
public class ActivityMessage {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RecordType recordType;

    @Column(nullable = false)
    private Long recordId;

    @Column(length = 2000, nullable = false)
    private String body;

    private String author;

    private LocalDateTime postedAt;

    @PrePersist
    protected void onCreate() {
        postedAt = LocalDateTime.now();
    }
}
