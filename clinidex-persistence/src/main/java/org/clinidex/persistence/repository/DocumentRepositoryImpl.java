package org.clinidex.persistence.repository;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Tuple;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Order;
import jakarta.persistence.criteria.Root;
import org.clinidex.core.config.ClinidexProperties;
import org.clinidex.core.exception.UnsupportedPredicateException;
import org.clinidex.core.reference.ReferenceNormalizer;
import org.clinidex.core.rules.ParameterKind;
import org.clinidex.core.rules.SearchRule;
import org.clinidex.core.rules.SearchRuleRegistry;
import org.clinidex.core.search.SearchRequest;
import org.clinidex.core.search.SortSpec;
import org.clinidex.persistence.entity.DocumentEntity;
import org.clinidex.persistence.entity.SearchIndexEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

/**
 * Custom repository implementation for document search with dynamic query building.
 * <p>
 * Sorting on {@code _id} and {@code _lastUpdated} runs in the database. Sorting on an
 * index parameter runs in two phases: the matching documents are collected up to
 * {@code clinidex.search.max-sort-candidates}, their sort values are read from the
 * index tables, and the ordering and paging are applied in memory.
 * </p>
 */
@Repository
public class DocumentRepositoryImpl implements DocumentRepositoryCustom {

    private static final Logger log = LoggerFactory.getLogger(DocumentRepositoryImpl.class);

    private static final int IN_CHUNK_SIZE = 500;

    private static final List<SortSpec> DEFAULT_SORT = List.of(
            SortSpec.descending(IndexPredicateBuilder.LAST_UPDATED_PARAM),
            SortSpec.ascending(IndexPredicateBuilder.ID_PARAM));

    @PersistenceContext
    private EntityManager entityManager;

    private final SearchRuleRegistry registry;
    private final ReferenceNormalizer normalizer;
    private final ClinidexProperties properties;

    public DocumentRepositoryImpl(SearchRuleRegistry registry, ReferenceNormalizer normalizer,
                                  ClinidexProperties properties) {
        this.registry = registry;
        this.normalizer = normalizer;
        this.properties = properties;
    }

    @Override
    public Page<DocumentEntity> search(SearchRequest request, int pageSize) {
        log.debug("Searching {} with {}", request.getType(), request);

        List<SortSpec> sort = request.getSort().isEmpty() ? DEFAULT_SORT : request.getSort();
        List<SortKey> keys = resolveSortKeys(request.getType(), sort);

        long total = count(request);
        if (pageSize == 0 || total == 0 || request.getOffset() >= total) {
            return new PageImpl<>(List.of(), Pageable.unpaged(), total);
        }

        List<DocumentEntity> content;
        if (keys.stream().allMatch(SortKey::onDocumentColumn)) {
            content = fetchOrdered(request, keys, pageSize);
        } else {
            content = fetchSortedByIndex(request, keys, pageSize, total);
        }
        return new PageImpl<>(content, Pageable.unpaged(), total);
    }

    private long count(SearchRequest request) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Long> countQuery = cb.createQuery(Long.class);
        Root<DocumentEntity> root = countQuery.from(DocumentEntity.class);
        countQuery.select(cb.count(root))
                .where(predicateBuilder(cb).forRequest(countQuery, root, request));
        return entityManager.createQuery(countQuery).getSingleResult();
    }

    private List<DocumentEntity> fetchOrdered(SearchRequest request, List<SortKey> keys, int pageSize) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<DocumentEntity> query = cb.createQuery(DocumentEntity.class);
        Root<DocumentEntity> root = query.from(DocumentEntity.class);
        query.select(root).where(predicateBuilder(cb).forRequest(query, root, request));

        List<Order> orders = new ArrayList<>();
        for (SortKey key : keys) {
            Expression<?> column = root.get(key.column());
            orders.add(key.descending() ? cb.desc(column) : cb.asc(column));
        }
        if (keys.stream().noneMatch(key -> "resourceId".equals(key.column()))) {
            orders.add(cb.asc(root.get("resourceId")));
        }
        query.orderBy(orders);

        return entityManager.createQuery(query)
                .setFirstResult(request.getOffset())
                .setMaxResults(pageSize)
                .getResultList();
    }

    private List<DocumentEntity> fetchSortedByIndex(SearchRequest request, List<SortKey> keys, int pageSize,
                                                    long total) {
        int cap = properties.getSearch().getMaxSortCandidates();
        if (total > cap) {
            SortKey first = keys.stream().filter(key -> !key.onDocumentColumn()).findFirst().orElseThrow();
            throw new UnsupportedPredicateException(request.getType(), first.parameter(), null, String.format(
                    "Sorting %d matches by an index parameter exceeds the limit of %d", total, cap));
        }

        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Tuple> query = cb.createTupleQuery();
        Root<DocumentEntity> root = query.from(DocumentEntity.class);
        query.multiselect(root.get("id"), root.get("resourceId"), root.get("lastUpdated"))
                .where(predicateBuilder(cb).forRequest(query, root, request));
        List<Candidate> candidates = entityManager.createQuery(query)
                .setMaxResults(cap + 1)
                .getResultList()
                .stream()
                .map(t -> new Candidate(t.get(0, UUID.class), t.get(1, String.class), t.get(2, Instant.class)))
                .toList();
        if (candidates.size() > cap) {
            throw new UnsupportedPredicateException(request.getType(), keys.get(0).parameter(), null,
                    "Too many matches to sort by an index parameter");
        }

        List<UUID> ids = candidates.stream().map(Candidate::id).toList();
        Comparator<Candidate> order = null;
        for (SortKey key : keys) {
            Comparator<Candidate> next = key.onDocumentColumn()
                    ? columnComparator(key)
                    : valueComparator(sortValues(request.getType(), key, ids), key.descending());
            order = order == null ? next : order.thenComparing(next);
        }
        order = order.thenComparing(Candidate::resourceId);

        List<UUID> page = candidates.stream()
                .sorted(order)
                .skip(request.getOffset())
                .limit(pageSize)
                .map(Candidate::id)
                .toList();
        return loadInOrder(page);
    }

    /**
     * Least value per document for ascending keys, greatest for descending ones.
     */
    private Map<UUID, Object> sortValues(String type, SortKey key, List<UUID> documentIds) {
        Map<UUID, Object> values = new HashMap<>();
        for (int from = 0; from < documentIds.size(); from += IN_CHUNK_SIZE) {
            List<UUID> chunk = documentIds.subList(from, Math.min(from + IN_CHUNK_SIZE, documentIds.size()));
            switch (key.kind()) {
                case NUMBER -> values.putAll(extremes(chunk, key, BigDecimal.class));
                case DATE -> values.putAll(extremes(chunk, key, Instant.class));
                default -> values.putAll(extremes(chunk, key, String.class));
            }
        }
        log.debug("Read {} sort values of {}.{} for {} candidates", values.size(), type, key.parameter(),
                documentIds.size());
        return values;
    }

    private <X extends Comparable<? super X>> Map<UUID, Object> extremes(List<UUID> documentIds, SortKey key,
                                                                          Class<X> javaType) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Tuple> query = cb.createTupleQuery();
        Root<SearchIndexEntity> idx = query.from(SearchIndexEntity.class);
        Expression<X> column = idx.get(key.column());
        query.multiselect(idx.get("documentId"), key.descending() ? cb.greatest(column) : cb.least(column))
                .where(idx.get("documentId").in(documentIds),
                        cb.equal(idx.get("paramName"), key.parameter()),
                        cb.isNull(idx.get("component")),
                        cb.isNotNull(idx.get(key.column())))
                .groupBy(idx.get("documentId"));

        Map<UUID, Object> values = new HashMap<>();
        for (Tuple tuple : entityManager.createQuery(query).getResultList()) {
            values.put(tuple.get(0, UUID.class), tuple.get(1, javaType));
        }
        return values;
    }

    private List<DocumentEntity> loadInOrder(List<UUID> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        Map<UUID, DocumentEntity> byId = new HashMap<>();
        entityManager.createQuery("SELECT d FROM DocumentEntity d WHERE d.id IN :ids", DocumentEntity.class)
                .setParameter("ids", ids)
                .getResultList()
                .forEach(entity -> byId.put(entity.getId(), entity));
        return ids.stream().map(byId::get).toList();
    }

    private List<SortKey> resolveSortKeys(String type, List<SortSpec> sort) {
        List<SortKey> keys = new ArrayList<>();
        for (SortSpec spec : sort) {
            String parameter = spec.parameter();
            if (IndexPredicateBuilder.ID_PARAM.equals(parameter)) {
                keys.add(new SortKey(parameter, null, "resourceId", spec.descending()));
            } else if (IndexPredicateBuilder.LAST_UPDATED_PARAM.equals(parameter)) {
                keys.add(new SortKey(parameter, null, "lastUpdated", spec.descending()));
            } else {
                SearchRule rule = registry.find(type, parameter).orElseThrow(() ->
                        new UnsupportedPredicateException(type, parameter, null, "Cannot sort on an unknown parameter"));
                String column = switch (rule.kind()) {
                    case STRING -> "valueStringLower";
                    case NUMBER -> "valueNumber";
                    case DATE -> "valueDateStart";
                    case TOKEN -> "valueTokenCode";
                    case REFERENCE -> "valueReferenceId";
                    case COMPOSITE -> throw new UnsupportedPredicateException(type, parameter, null,
                            "Cannot sort on a composite parameter");
                };
                keys.add(new SortKey(rule.name(), rule.kind(), column, spec.descending()));
            }
        }
        return keys;
    }

    private static Comparator<Candidate> columnComparator(SortKey key) {
        Comparator<Candidate> comparator = "resourceId".equals(key.column())
                ? Comparator.comparing(Candidate::resourceId)
                : Comparator.comparing(Candidate::lastUpdated);
        return key.descending() ? comparator.reversed() : comparator;
    }

    /**
     * Orders by the looked-up value; documents without one go last in either direction.
     */
    @SuppressWarnings("unchecked")
    private static Comparator<Candidate> valueComparator(Map<UUID, Object> values, boolean descending) {
        Function<Candidate, Comparable<Object>> value = candidate -> (Comparable<Object>) values.get(candidate.id());
        Comparator<Comparable<Object>> natural = descending ? Comparator.reverseOrder() : Comparator.naturalOrder();
        return Comparator.comparing(value, Comparator.nullsLast(natural));
    }

    private IndexPredicateBuilder predicateBuilder(CriteriaBuilder cb) {
        return new IndexPredicateBuilder(cb, registry, normalizer);
    }

    private record SortKey(String parameter, ParameterKind kind, String column, boolean descending) {

        boolean onDocumentColumn() {
            return kind == null;
        }
    }

    private record Candidate(UUID id, String resourceId, Instant lastUpdated) {
    }
}
