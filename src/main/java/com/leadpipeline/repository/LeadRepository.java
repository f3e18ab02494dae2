package com.leadpipeline.repository;

import com.leadpipeline.model.Lead;
import com.leadpipeline.model.LeadStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface LeadRepository extends JpaRepository<Lead, String> {
    /**
     * Count leads by status
     */
    long countByStatus(LeadStatus status);
}
