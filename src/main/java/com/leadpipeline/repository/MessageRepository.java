package com.leadpipeline.repository;

import com.leadpipeline.model.MessageStatus;
import com.leadpipeline.model.OutreachMessage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface MessageRepository extends JpaRepository<OutreachMessage, String>,
        JpaSpecificationExecutor<OutreachMessage> {
    /**
     * Find all messages with a status, oldest first
     */
    List<OutreachMessage> findByStatusOrderByCreatedAtAsc(MessageStatus status);

    /**
     * Find messages with a status among the given ids, oldest first
     */
    List<OutreachMessage> findByStatusAndIdInOrderByCreatedAtAsc(
            MessageStatus status, Collection<String> ids);

    /**
     * Count messages by status
     */
    long countByStatus(MessageStatus status);
}
