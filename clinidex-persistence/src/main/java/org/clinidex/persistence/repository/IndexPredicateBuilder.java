package org.clinidex.persistence.repository;

import jakarta.persistence.criteria.AbstractQuery;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.From;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import org.clinidex.core.exception.UnsupportedPredicateException;
import org.clinidex.core.extract.DateRange;
import org.clinidex.core.reference.CanonicalRef;
import org.clinidex.core.reference.ReferenceNormalizer;
import org.clinidex.core.rules.CompositeComponent;
import org.clinidex.core.rules.ParameterKind;
import org.clinidex.core.rules.SearchRule;
import org.clinidex.core.rules.SearchRuleRegistry;
import org.clinidex.core.search.ParameterPath;
import org.clinidex.core.search.PrefixedValue;
import org.clinidex.core.search.SearchComparator;
import org.clinidex.core.search.SearchModifier;
import org.clinidex.core.search.SearchPredicate;
import org.clinidex.core.search.SearchRequest;
import org.clinidex.core.search.TokenQuery;
import org.clinidex.persistence.entity.DocumentEntity;
import org.clinidex.persistence.entity.ReferenceEdgeEntity;
import org.clinidex.persistence.entity.SearchIndexEntity;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Translates search predicates into Criteria predicates over the index tables.
 * <p>
 * Every parameter test is an {@code EXISTS} subquery correlated with the document row,
 * so a document matches once however many of its rows satisfy the test. Chains descend
 * through a reference row into the target document; reverse chains climb back through
 * reference edges into the documents that point at it.
 * </p>
 */
class IndexPredicateBuilder {

    static final String ID_PARAM = "_id";
    static final String LAST_UPDATED_PARAM = "_lastUpdated";

    private final CriteriaBuilder cb;
    private final SearchRuleRegistry registry;
    private final ReferenceNormalizer normalizer;

    IndexPredicateBuilder(CriteriaBuilder cb, SearchRuleRegistry registry, ReferenceNormalizer normalizer) {
        this.cb = cb;
        this.registry = registry;
        this.normalizer = normalizer;
    }

    /**
     * Builds the full where clause of a search over {@code root}.
     */
    Predicate[] forRequest(AbstractQuery<?> query, Root<DocumentEntity> root, SearchRequest request) {
        List<Predicate> predicates = new ArrayList<>();
        predicates.add(cb.equal(root.get("resourceType"), request.getType()));
        if (!request.isIncludeDeleted()) {
            predicates.add(cb.isFalse(root.get("isDeleted")));
        }
        for (SearchPredicate predicate : request.getPredicates()) {
            predicates.add(build(query, root, request.getType(), predicate));
        }
        return predicates.toArray(new Predicate[0]);
    }

    Predicate build(AbstractQuery<?> query, From<?, DocumentEntity> doc, String type, SearchPredicate predicate) {
        ParameterPath path;
        try {
            path = ParameterPath.parse(predicate.parameter());
        } catch (IllegalArgumentException e) {
            throw unsupported(type, predicate, e.getMessage());
        }
        if (predicate.values().isEmpty()) {
            throw unsupported(type, predicate, "No value supplied");
        }

        if (path instanceof ParameterPath.Has has) {
            return reverseChain(query, doc, type, has, predicate);
        }
        if (path instanceof ParameterPath.Chain chain) {
            return chain(query, doc, type, chain, predicate);
        }
        return simple(query, doc, type, ((ParameterPath.Simple) path).name(), predicate);
    }

    // ==================== Simple parameters ====================

    private Predicate simple(AbstractQuery<?> query, From<?, DocumentEntity> doc, String type,
                             String name, SearchPredicate predicate) {
        SearchModifier modifier = parseModifier(type, predicate);

        if (ID_PARAM.equals(name)) {
            return idPredicate(doc, type, predicate, modifier);
        }
        if (LAST_UPDATED_PARAM.equals(name)) {
            return lastUpdatedPredicate(doc, type, predicate, modifier);
        }

        SearchRule rule = registry.find(type, name)
                .orElseThrow(() -> unsupported(type, predicate, "Not a search parameter of " + type));
        checkModifier(type, predicate, rule.kind(), modifier);
        checkComparator(type, predicate, rule.kind());

        if (modifier == SearchModifier.MISSING) {
            return missing(query, doc, type, rule.name(), predicate);
        }
        if (rule.kind() == ParameterKind.COMPOSITE) {
            return composite(query, doc, type, rule, predicate);
        }

        // Reject malformed values before building any subquery
        for (String value : predicate.values()) {
            valueCondition(null, type, predicate, rule.kind(), modifier, value);
        }

        if (modifier == SearchModifier.NOT) {
            // A document without the parameter has no value to negate, and does not match
            Subquery<Long> any = rowsOf(query, doc, rule.name(), null);
            Subquery<Long> matching = rowsOf(query, doc, rule.name(), null);
            matching.where(cb.and(matching.getRestriction(),
                    anyValue(rootOf(matching), type, predicate, rule.kind(), modifier)));
            return cb.and(cb.exists(any), cb.not(cb.exists(matching)));
        }

        Subquery<Long> rows = rowsOf(query, doc, rule.name(), null);
        rows.where(cb.and(rows.getRestriction(),
                anyValue(rootOf(rows), type, predicate, rule.kind(), modifier)));
        return cb.exists(rows);
    }

    private Predicate anyValue(Root<SearchIndexEntity> idx, String type, SearchPredicate predicate,
                               ParameterKind kind, SearchModifier modifier) {
        List<Predicate> alternatives = new ArrayList<>();
        for (String value : predicate.values()) {
            alternatives.add(valueCondition(idx, type, predicate, kind, modifier, value));
        }
        return cb.or(alternatives.toArray(new Predicate[0]));
    }

    private Predicate missing(AbstractQuery<?> query, From<?, DocumentEntity> doc, String type,
                              String paramName, SearchPredicate predicate) {
        boolean shouldBeMissing = parseMissingFlag(type, predicate);
        Subquery<Long> rows = query.subquery(Long.class);
        Root<SearchIndexEntity> idx = rows.from(SearchIndexEntity.class);
        rows.select(idx.get("id"))
                .where(cb.equal(idx.get("documentId"), doc.get("id")),
                        cb.equal(idx.get("paramName"), paramName));
        return shouldBeMissing ? cb.not(cb.exists(rows)) : cb.exists(rows);
    }

    private Predicate idPredicate(From<?, DocumentEntity> doc, String type, SearchPredicate predicate,
                                  SearchModifier modifier) {
        checkComparator(type, predicate, ParameterKind.TOKEN);
        return switch (modifier) {
            case NONE -> doc.get("resourceId").in(predicate.values());
            case NOT -> cb.not(doc.get("resourceId").in(predicate.values()));
            case MISSING -> parseMissingFlag(type, predicate) ? cb.disjunction() : cb.conjunction();
            default -> throw unsupported(type, predicate, "Modifier not supported on _id");
        };
    }

    private Predicate lastUpdatedPredicate(From<?, DocumentEntity> doc, String type, SearchPredicate predicate,
                                           SearchModifier modifier) {
        if (modifier == SearchModifier.MISSING) {
            return parseMissingFlag(type, predicate) ? cb.disjunction() : cb.conjunction();
        }
        if (modifier != SearchModifier.NONE) {
            throw unsupported(type, predicate, "Modifier not supported on _lastUpdated");
        }
        Path<Instant> point = doc.get("lastUpdated");
        List<Predicate> alternatives = new ArrayList<>();
        for (String value : predicate.values()) {
            PrefixedValue prefixed = PrefixedValue.parse(value, predicate.comparator());
            DateRange range = parseDate(type, predicate, prefixed.value());
            Predicate within = cb.and(cb.greaterThanOrEqualTo(point, range.start()), cb.lessThan(point, range.end()));
            alternatives.add(switch (prefixed.comparator()) {
                case EQ -> within;
                case NE -> cb.not(within);
                case GT -> cb.greaterThanOrEqualTo(point, range.end());
                case LT -> cb.lessThan(point, range.start());
                case GE -> cb.greaterThanOrEqualTo(point, range.start());
                case LE -> cb.lessThan(point, range.end());
            });
        }
        return cb.or(alternatives.toArray(new Predicate[0]));
    }

    // ==================== Value conditions ====================

    /**
     * Condition on one index row for one query value. With a null root only validates the value.
     */
    private Predicate valueCondition(Root<SearchIndexEntity> idx, String type, SearchPredicate predicate,
                                     ParameterKind kind, SearchModifier modifier, String value) {
        return switch (kind) {
            case STRING -> stringCondition(idx, modifier, value);
            case NUMBER -> numberCondition(idx, type, predicate, value);
            case DATE -> dateCondition(idx, type, predicate, value);
            case TOKEN -> tokenCondition(idx, type, predicate, value);
            case REFERENCE -> referenceCondition(idx, type, predicate, modifier, value);
            case COMPOSITE -> throw new IllegalStateException("Composite values are matched per component");
        };
    }

    private Predicate stringCondition(Root<SearchIndexEntity> idx, SearchModifier modifier, String value) {
        if (idx == null) {
            return null;
        }
        if (modifier == SearchModifier.EXACT) {
            return cb.equal(idx.get("valueString"), value);
        }
        String pattern = "%" + escapeLike(value.toLowerCase(Locale.ROOT)) + "%";
        return cb.like(idx.get("valueStringLower"), pattern, '\\');
    }

    private Predicate numberCondition(Root<SearchIndexEntity> idx, String type, SearchPredicate predicate,
                                      String value) {
        PrefixedValue prefixed = PrefixedValue.parse(value, predicate.comparator());
        BigDecimal number;
        try {
            number = new BigDecimal(prefixed.value());
        } catch (NumberFormatException e) {
            throw unsupported(type, predicate, "Not a number: " + value);
        }
        if (idx == null) {
            return null;
        }
        Path<BigDecimal> column = idx.get("valueNumber");
        return switch (prefixed.comparator()) {
            case EQ -> cb.equal(column, number);
            case NE -> cb.notEqual(column, number);
            case GT -> cb.greaterThan(column, number);
            case LT -> cb.lessThan(column, number);
            case GE -> cb.greaterThanOrEqualTo(column, number);
            case LE -> cb.lessThanOrEqualTo(column, number);
        };
    }

    private Predicate dateCondition(Root<SearchIndexEntity> idx, String type, SearchPredicate predicate,
                                    String value) {
        PrefixedValue prefixed = PrefixedValue.parse(value, predicate.comparator());
        DateRange query = parseDate(type, predicate, prefixed.value());
        if (idx == null) {
            return null;
        }
        Path<Instant> start = idx.get("valueDateStart");
        Path<Instant> end = idx.get("valueDateEnd");
        Predicate contained = cb.and(cb.greaterThanOrEqualTo(start, query.start()), cb.lessThanOrEqualTo(end, query.end()));
        return switch (prefixed.comparator()) {
            case EQ -> contained;
            case NE -> cb.not(contained);
            case GT -> cb.greaterThan(end, query.end());
            case LT -> cb.lessThan(start, query.start());
            case GE -> cb.greaterThan(end, query.start());
            case LE -> cb.lessThan(start, query.end());
        };
    }

    private Predicate tokenCondition(Root<SearchIndexEntity> idx, String type, SearchPredicate predicate,
                                     String value) {
        TokenQuery token = TokenQuery.parse(value);
        if (token.code() == null && token.system() == null) {
            throw unsupported(type, predicate, "Token value names neither system nor code: " + value);
        }
        if (idx == null) {
            return null;
        }
        List<Predicate> parts = new ArrayList<>();
        if (token.code() != null) {
            parts.add(cb.equal(idx.get("valueTokenCode"), token.code()));
        }
        if (token.system() != null) {
            parts.add(cb.equal(idx.get("valueTokenSystem"), token.system()));
        } else if (token.requireNoSystem()) {
            parts.add(cb.isNull(idx.get("valueTokenSystem")));
        }
        return cb.and(parts.toArray(new Predicate[0]));
    }

    private Predicate referenceCondition(Root<SearchIndexEntity> idx, String type, SearchPredicate predicate,
                                         SearchModifier modifier, String value) {
        CanonicalRef ref = normalizer.normalize(value)
                .orElseThrow(() -> unsupported(type, predicate, "Not a reference: " + value));
        String targetType = ref.typeOrNull();
        if (modifier == SearchModifier.TYPE) {
            if (targetType != null && !targetType.equals(predicate.modifier())) {
                return idx == null ? null : cb.disjunction();
            }
            targetType = predicate.modifier();
        }
        if (idx == null) {
            return null;
        }
        Predicate idMatches = cb.equal(idx.get("valueReferenceId"), ref.id());
        if (targetType == null) {
            return idMatches;
        }
        // Untyped stored references match a typed query on id alone
        return cb.and(idMatches, cb.or(
                cb.isNull(idx.get("valueReferenceType")),
                cb.equal(idx.get("valueReferenceType"), targetType)));
    }

    // ==================== Composite ====================

    private Predicate composite(AbstractQuery<?> query, From<?, DocumentEntity> doc, String type,
                                SearchRule rule, SearchPredicate predicate) {
        List<CompositeComponent> components = rule.components();
        List<Predicate> alternatives = new ArrayList<>();

        for (String value : predicate.values()) {
            String[] parts = value.split("\\$", -1);
            if (parts.length != components.size()) {
                throw unsupported(type, predicate, String.format(
                        "Composite %s takes %d values separated by '$', got '%s'",
                        rule.name(), components.size(), value));
            }
            SearchPredicate componentPredicate = new SearchPredicate(
                    predicate.parameter(), null, SearchComparator.EQ, List.of(parts));
            for (int i = 0; i < parts.length; i++) {
                valueCondition(null, type, componentPredicate, components.get(i).kind(), SearchModifier.NONE, parts[i]);
            }

            CompositeComponent first = components.get(0);
            Subquery<Long> anchor = rowsOf(query, doc, rule.name(), first.name());
            Root<SearchIndexEntity> anchorRow = rootOf(anchor);
            List<Predicate> conditions = new ArrayList<>();
            conditions.add(anchor.getRestriction());
            conditions.add(valueCondition(anchorRow, type, componentPredicate, first.kind(), SearchModifier.NONE, parts[0]));

            for (int i = 1; i < components.size(); i++) {
                CompositeComponent component = components.get(i);
                Subquery<Long> sibling = anchor.subquery(Long.class);
                Root<SearchIndexEntity> siblingRow = sibling.from(SearchIndexEntity.class);
                sibling.select(siblingRow.get("id")).where(
                        cb.equal(siblingRow.get("documentId"), anchorRow.get("documentId")),
                        cb.equal(siblingRow.get("paramName"), rule.name()),
                        cb.equal(siblingRow.get("component"), component.name()),
                        cb.equal(siblingRow.get("occurrence"), anchorRow.get("occurrence")),
                        valueCondition(siblingRow, type, componentPredicate, component.kind(), SearchModifier.NONE, parts[i]));
                conditions.add(cb.exists(sibling));
            }

            anchor.where(conditions.toArray(new Predicate[0]));
            alternatives.add(cb.exists(anchor));
        }
        return cb.or(alternatives.toArray(new Predicate[0]));
    }

    // ==================== Chains ====================

    private Predicate chain(AbstractQuery<?> query, From<?, DocumentEntity> doc, String type,
                            ParameterPath.Chain chain, SearchPredicate predicate) {
        SearchRule rule = referenceRule(type, chain.referenceParameter(), predicate);
        List<String> targets = chainTargets(type, rule, chain, predicate);

        Subquery<Long> sub = query.subquery(Long.class);
        Root<SearchIndexEntity> ref = sub.from(SearchIndexEntity.class);
        Root<DocumentEntity> target = sub.from(DocumentEntity.class);
        SearchPredicate rest = predicate.withParameter(chain.rest());

        List<Predicate> branches = new ArrayList<>();
        for (String targetType : targets) {
            branches.add(cb.and(
                    cb.equal(target.get("resourceType"), targetType),
                    build(sub, target, targetType, rest)));
        }

        sub.select(ref.get("id")).where(
                cb.equal(ref.get("documentId"), doc.get("id")),
                cb.equal(ref.get("paramName"), rule.name()),
                cb.isNull(ref.get("component")),
                cb.equal(target.get("resourceId"), ref.get("valueReferenceId")),
                cb.or(cb.isNull(ref.get("valueReferenceType")),
                        cb.equal(ref.get("valueReferenceType"), target.get("resourceType"))),
                cb.isFalse(target.get("isDeleted")),
                cb.or(branches.toArray(new Predicate[0])));
        return cb.exists(sub);
    }

    private List<String> chainTargets(String type, SearchRule rule, ParameterPath.Chain chain,
                                      SearchPredicate predicate) {
        List<String> candidates;
        if (chain.targetType() != null) {
            candidates = List.of(chain.targetType());
        } else if (!rule.targets().isEmpty()) {
            candidates = rule.targets();
        } else {
            candidates = new ArrayList<>(registry.types());
        }

        List<String> targets = new ArrayList<>();
        for (String candidate : candidates) {
            if (defines(candidate, chain.rest())) {
                targets.add(candidate);
            }
        }
        if (targets.isEmpty()) {
            throw unsupported(type, predicate, String.format(
                    "No target of %s.%s defines '%s'", type, rule.name(), chain.rest()));
        }
        return targets;
    }

    private boolean defines(String type, String parameter) {
        ParameterPath path;
        try {
            path = ParameterPath.parse(parameter);
        } catch (IllegalArgumentException e) {
            return false;
        }
        if (path instanceof ParameterPath.Simple simple) {
            return ID_PARAM.equals(simple.name()) || LAST_UPDATED_PARAM.equals(simple.name())
                    || registry.find(type, simple.name()).isPresent();
        }
        if (path instanceof ParameterPath.Chain next) {
            return registry.find(type, next.referenceParameter()).isPresent();
        }
        return true;
    }

    private Predicate reverseChain(AbstractQuery<?> query, From<?, DocumentEntity> doc, String type,
                                   ParameterPath.Has has, SearchPredicate predicate) {
        SearchRule rule = referenceRule(has.sourceType(), has.referenceParameter(), predicate);
        Set<String> fieldPaths = rule.path().fieldPaths();

        Subquery<Long> sub = query.subquery(Long.class);
        Root<ReferenceEdgeEntity> edge = sub.from(ReferenceEdgeEntity.class);
        Root<DocumentEntity> source = sub.from(DocumentEntity.class);

        sub.select(edge.get("id")).where(
                cb.equal(edge.get("documentId"), source.get("id")),
                cb.equal(source.get("resourceType"), has.sourceType()),
                cb.isFalse(source.get("isDeleted")),
                edge.get("fieldPath").in(fieldPaths),
                cb.equal(edge.get("targetId"), doc.get("resourceId")),
                cb.or(cb.isNull(edge.get("targetType")), cb.equal(edge.get("targetType"), doc.get("resourceType"))),
                build(sub, source, has.sourceType(), predicate.withParameter(has.rest())));
        return cb.exists(sub);
    }

    private SearchRule referenceRule(String type, String name, SearchPredicate predicate) {
        Optional<SearchRule> rule = registry.find(type, name);
        if (rule.isEmpty() || rule.get().kind() != ParameterKind.REFERENCE) {
            throw unsupported(type, predicate, String.format("'%s' is not a reference parameter of %s", name, type));
        }
        return rule.get();
    }

    // ==================== Helpers ====================

    /**
     * Subquery over index rows of one parameter of the document; component null means plain rows.
     */
    private Subquery<Long> rowsOf(AbstractQuery<?> query, From<?, DocumentEntity> doc, String paramName,
                                  String component) {
        Subquery<Long> sub = query.subquery(Long.class);
        Root<SearchIndexEntity> idx = sub.from(SearchIndexEntity.class);
        sub.select(idx.get("id")).where(
                cb.equal(idx.get("documentId"), doc.get("id")),
                cb.equal(idx.get("paramName"), paramName),
                component == null ? cb.isNull(idx.get("component")) : cb.equal(idx.get("component"), component));
        return sub;
    }

    @SuppressWarnings("unchecked")
    private static Root<SearchIndexEntity> rootOf(Subquery<Long> sub) {
        return (Root<SearchIndexEntity>) sub.getRoots().iterator().next();
    }

    private SearchModifier parseModifier(String type, SearchPredicate predicate) {
        try {
            return SearchModifier.parse(predicate.modifier());
        } catch (IllegalArgumentException e) {
            throw unsupported(type, predicate, e.getMessage());
        }
    }

    private void checkModifier(String type, SearchPredicate predicate, ParameterKind kind, SearchModifier modifier) {
        boolean allowed = switch (modifier) {
            case NONE, MISSING -> true;
            case EXACT, CONTAINS -> kind == ParameterKind.STRING;
            case NOT -> kind == ParameterKind.TOKEN;
            case TYPE -> kind == ParameterKind.REFERENCE;
        };
        if (!allowed) {
            throw unsupported(type, predicate, String.format(
                    "Modifier '%s' does not apply to %s parameters", predicate.modifier(), kind.getCode()));
        }
    }

    private void checkComparator(String type, SearchPredicate predicate, ParameterKind kind) {
        if (predicate.comparator() != SearchComparator.EQ
                && kind != ParameterKind.NUMBER && kind != ParameterKind.DATE) {
            throw unsupported(type, predicate, String.format(
                    "Comparator '%s' does not apply to %s parameters", predicate.comparator().getPrefix(), kind.getCode()));
        }
    }

    private boolean parseMissingFlag(String type, SearchPredicate predicate) {
        String flag = predicate.values().get(0);
        if ("true".equalsIgnoreCase(flag)) {
            return true;
        }
        if ("false".equalsIgnoreCase(flag)) {
            return false;
        }
        throw unsupported(type, predicate, ":missing takes true or false, got " + flag);
    }

    private DateRange parseDate(String type, SearchPredicate predicate, String value) {
        try {
            return DateRange.parse(value);
        } catch (DateTimeParseException e) {
            throw unsupported(type, predicate, "Not a date: " + value);
        }
    }

    static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static UnsupportedPredicateException unsupported(String type, SearchPredicate predicate, String reason) {
        return new UnsupportedPredicateException(type, predicate.parameter(), predicate.modifier(), reason);
    }
}
