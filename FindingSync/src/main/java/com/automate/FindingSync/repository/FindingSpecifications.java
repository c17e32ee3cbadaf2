package com.automate.FindingSync.repository;

import com.automate.FindingSync.dto.FindingFilter;
import com.automate.FindingSync.entity.FindingsEntity;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

public final class FindingSpecifications {

    private FindingSpecifications() {
    }

    public static Specification<FindingsEntity> matching(UUID projectId, FindingFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            predicates.add(cb.equal(root.get("project").get("projectId"), projectId));
            if (filter == null) {
                return cb.and(predicates.toArray(Predicate[]::new));
            }
            if (filter.severity() != null) predicates.add(cb.equal(root.get("severity"), filter.severity()));
            if (filter.type() != null) predicates.add(cb.equal(root.get("type"), filter.type()));
            if (hasText(filter.status())) predicates.add(cb.equal(root.get("status"), filter.status().trim()));
            if (filter.localStatus() != null) predicates.add(cb.equal(root.get("localStatus"), filter.localStatus()));
            if (hasText(filter.assignedTo())) predicates.add(cb.equal(root.get("assignedTo"), filter.assignedTo().trim()));
            if (hasText(filter.ruleKey())) predicates.add(cb.equal(root.get("ruleKey"), filter.ruleKey().trim()));
            if (hasText(filter.search())) {
                String like = "%" + filter.search().trim().toLowerCase(Locale.ROOT) + "%";
                predicates.add(cb.or(
                        cb.like(cb.lower(root.get("message")), like),
                        cb.like(cb.lower(root.get("ruleName")), like),
                        cb.like(cb.lower(root.get("component")), like)));
            }
            return cb.and(predicates.toArray(Predicate[]::new));
        };
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
