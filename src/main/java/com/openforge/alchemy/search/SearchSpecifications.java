package com.openforge.alchemy.search;

import com.openforge.alchemy.domain.PromptCandidate;
import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import org.springframework.data.jpa.domain.Specification;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Translates a {@link SearchFilter} into JPA criteria predicates shared by the
 * text and semantic search paths.
 */
final class SearchSpecifications {

    private SearchSpecifications() {}

    static Specification<PromptCandidate> matching(SearchFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (filter.phase() != null) {
                predicates.add(cb.equal(root.get("phase"), filter.phase()));
            }
            if (hasText(filter.provider())) {
                predicates.add(cb.equal(root.get("provider"), filter.provider().trim()));
            }
            if (hasText(filter.model())) {
                predicates.add(cb.equal(root.get("model"), filter.model().trim()));
            }
            if (filter.createdAfter() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.<LocalDateTime>get("createTime"), filter.createdAfter()));
            }
            if (filter.minRelevance() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.<Double>get("relevanceScore"), filter.minRelevance()));
            }
            if (hasText(filter.contentContains())) {
                String pattern = "%" + escapeLike(filter.contentContains().toLowerCase(Locale.ROOT)) + "%";
                predicates.add(cb.like(cb.lower(root.<String>get("content")), pattern, '\\'));
            }
            Set<String> tags = cleanTags(filter.tags());
            if (!tags.isEmpty()) {
                // id IN (select c.id from PromptCandidate c join c.tags t where t in :tags)
                Subquery<String> tagged = query.subquery(String.class);
                Root<PromptCandidate> c = tagged.from(PromptCandidate.class);
                Join<PromptCandidate, String> t = c.join("tags");
                tagged.select(c.<String>get("id")).where(t.in(tags));
                predicates.add(root.get("id").in(tagged));
            }
            return cb.and(predicates.toArray(Predicate[]::new));
        };
    }

    /** Records whose stored vector has exactly {@code dimensions} components. */
    static Specification<PromptCandidate> embeddedWith(int dimensions) {
        return (root, query, cb) -> cb.and(
                cb.isNotNull(root.get("embedding")),
                cb.equal(root.get("embeddingDimensions"), dimensions));
    }

    /** Keyset cursor: ids strictly after {@code lastId}. */
    static Specification<PromptCandidate> idAfter(String lastId) {
        return (root, query, cb) -> lastId == null ? cb.conjunction() : cb.greaterThan(root.<String>get("id"), lastId);
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }

    private static Set<String> cleanTags(Set<String> tags) {
        if (tags == null) return Set.of();
        return tags.stream()
                .filter(SearchSpecifications::hasText)
                .map(String::trim)
                .collect(Collectors.toSet());
    }

    private static String escapeLike(String raw) {
        return raw.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
