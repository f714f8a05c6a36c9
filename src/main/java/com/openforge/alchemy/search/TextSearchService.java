package com.openforge.alchemy.search;

import com.openforge.alchemy.prompt.PromptRecord;
import com.openforge.alchemy.repository.PromptCandidateRepository;
import com.openforge.alchemy.store.StoreException;
import com.openforge.alchemy.store.StoreTransactions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Metadata search: every filter predicate runs in SQL; results are newest
 * first with ties broken by id, bounded by the filter's effective limit.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TextSearchService {

    static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("createTime"), Sort.Order.asc("id"));

    private final PromptCandidateRepository repository;
    private final StoreTransactions         transactions;

    public List<PromptRecord> search(SearchFilter filter) {
        if (filter == null) throw StoreException.invalid("search filter must not be null");
        int limit = filter.effectiveLimit();

        List<PromptRecord> results = transactions.read("search", () -> repository
                .findAll(SearchSpecifications.matching(filter), PageRequest.of(0, limit, NEWEST_FIRST))
                .map(PromptRecord::from)
                .getContent());
        log.debug("[Search] text filter={} limit={} → {} result(s)", filter, limit, results.size());
        return results;
    }
}
