package com.costtracker.costs.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "costs", indexes = @Index(name = "costs_user_created_idx", columnList = "user_id, created_at"))
public class CostEntity {
    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private long userId;

    @Column(name = "description", nullable = false, updatable = false)
    private String description;

    @Column(name = "category", nullable = false, updatable = false, length = 32)
    private String category;

    @Column(name = "amount", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    // Default constructor for JPA
    protected CostEntity() {}

    public CostEntity(UUID id, long userId, String description, String category, BigDecimal amount, Instant createdAt) {
        this.id = id;
        this.userId = userId;
        this.description = description;
        this.category = category;
        this.amount = amount;
        this.createdAt = createdAt;
    }

    public UUID getId() { return id; }
    public long getUserId() { return userId; }
    public String getDescription() { return description; }
    public String getCategory() { return category; }
    public BigDecimal getAmount() { return amount; }
    public Instant getCreatedAt() { return createdAt; }
}
