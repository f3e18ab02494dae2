package com.leadpipeline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Database entity for a prospective contact moving through the pipeline
 */
@Entity
@Table(name = "leads",
       indexes = {
           @Index(name = "idx_leads_status", columnList = "status")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Lead {
    @Id
    private String id;

    private String fullName;

    private String email;

    private String companyName;

    private String role;

    private String linkedinUrl;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private LeadStatus status;

    /**
     * Computed upstream, 0-100
     */
    private Integer confidenceScore;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant updatedAt;
}
