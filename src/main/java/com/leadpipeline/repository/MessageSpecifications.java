package com.leadpipeline.repository;

import com.leadpipeline.model.FetchCursor;
import com.leadpipeline.model.Lead;
import com.leadpipeline.model.MessageChannel;
import com.leadpipeline.model.MessageStatus;
import com.leadpipeline.model.OutreachMessage;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;

/**
 * Composable filters for picking delivery-eligible messages
 */
public final class MessageSpecifications {

    private MessageSpecifications() {
    }

    public static Specification<OutreachMessage> hasStatus(MessageStatus status) {
        return (root, query, cb) -> cb.equal(root.get("status"), status);
    }

    /**
     * No restriction when {@code channel} is null
     */
    public static Specification<OutreachMessage> onChannel(MessageChannel channel) {
        return (root, query, cb) -> channel == null
                ? cb.conjunction()
                : cb.equal(root.get("channel"), channel);
    }

    /**
     * Only messages whose lead still exists
     */
    public static Specification<OutreachMessage> withExistingLead() {
        return (root, query, cb) -> {
            Subquery<String> lead = query.subquery(String.class);
            Root<Lead> leads = lead.from(Lead.class);
            lead.select(leads.get("id")).where(cb.equal(leads.get("id"), root.get("leadId")));
            return cb.exists(lead);
        };
    }

    /**
     * Rows after {@code cursor} in {@code (createdAt, id)} order; no restriction when null
     */
    public static Specification<OutreachMessage> afterCursor(FetchCursor cursor) {
        return (root, query, cb) -> {
            if (cursor == null) {
                return cb.conjunction();
            }
            Path<Instant> createdAt = root.get("createdAt");
            Path<String> id = root.get("id");
            return cb.or(
                    cb.greaterThan(createdAt, cursor.getCreatedAt()),
                    cb.and(cb.equal(createdAt, cursor.getCreatedAt()),
                            cb.greaterThan(id, cursor.getMessageId())));
        };
    }
}
