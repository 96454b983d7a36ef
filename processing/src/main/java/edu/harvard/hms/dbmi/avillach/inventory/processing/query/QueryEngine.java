package edu.harvard.hms.dbmi.avillach.inventory.processing.query;

import edu.harvard.hms.dbmi.avillach.inventory.data.query.*;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.SchemaVersion;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.VariableDefinition;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.VariableType;
import edu.harvard.hms.dbmi.avillach.inventory.data.store.VariableValue;
import edu.harvard.hms.dbmi.avillach.inventory.exception.QueryCancelledException;
import edu.harvard.hms.dbmi.avillach.inventory.processing.identity.IdentityResolver;
import edu.harvard.hms.dbmi.avillach.inventory.processing.schema.SchemaRegistry;
import edu.harvard.hms.dbmi.avillach.inventory.processing.store.VariableStore;
import edu.harvard.hms.dbmi.avillach.inventory.processing.util.SetUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.BooleanSupplier;

/**
 * Evaluates cohort queries against current variable values.
 *
 * A query reads the store as of the snapshot taken when evaluation starts, so rows merged while it runs are either wholly visible or
 * wholly invisible. AND groups evaluate their children most selective first and only test later children against the participants that
 * are still candidates.
 */
@Component
public class QueryEngine {

    private static final Logger log = LoggerFactory.getLogger(QueryEngine.class);

    private final SchemaRegistry schemaRegistry;

    private final VariableStore variableStore;

    private final IdentityResolver identityResolver;

    private final PredicateValidator predicateValidator;

    @Autowired
    public QueryEngine(
        SchemaRegistry schemaRegistry, VariableStore variableStore, IdentityResolver identityResolver, PredicateValidator predicateValidator
    ) {
        this.schemaRegistry = schemaRegistry;
        this.variableStore = variableStore;
        this.identityResolver = identityResolver;
        this.predicateValidator = predicateValidator;
    }

    /**
     * Validates a query against the current schema version.
     *
     * @throws edu.harvard.hms.dbmi.avillach.inventory.exception.InvalidPredicateException if any predicate is invalid
     */
    public CompiledQuery compile(CohortQuery query) {
        CohortQuery identified = query.generateId();
        if (identified.clause() == null) {
            return new CompiledQuery(identified, schemaRegistry.latest().orElse(null));
        }
        SchemaVersion schema = schemaRegistry.current();
        predicateValidator.validate(identified.clause(), schema);
        return new CompiledQuery(identified, schema);
    }

    public CohortResult evaluate(CohortQuery query) {
        return evaluate(compile(query), () -> false);
    }

    /**
     * @param cancelled polled between predicate evaluations
     * @throws QueryCancelledException if {@code cancelled} turns true before evaluation completes
     */
    public CohortResult evaluate(CompiledQuery compiled, BooleanSupplier cancelled) {
        CohortQuery query = compiled.query();
        long snapshot = variableStore.snapshot();
        Set<Integer> universe = variableStore.visibleParticipants(identityResolver.participantIds(), snapshot);
        Evaluation evaluation = new Evaluation(compiled, snapshot, universe, cancelled);

        Set<Integer> matched = query.clause() == null
            ? evaluation.universe
            : evaluation.evaluate(query.clause(), null);
        evaluation.checkCancelled();

        List<Integer> participants = new ArrayList<>(new TreeSet<>(matched));
        List<ParticipantExplanation> explanation = explain(participants, query, evaluation);
        Map<String, Integer> predicateCounts = new LinkedHashMap<>();
        evaluation.leafMatches.forEach((predicate, matches) -> predicateCounts.put(predicate.describe(), matches.size()));

        log.info(
            "Query {} matched {} participants (snapshot {}, {} predicates evaluated)", query.id(), participants.size(), evaluation.snapshot,
            evaluation.leafMatches.size()
        );
        return new CohortResult(
            query.id(), participants.size(), query.wantsParticipants() ? participants : null, explanation, predicateCounts,
            evaluation.snapshot
        );
    }

    private List<ParticipantExplanation> explain(List<Integer> participants, CohortQuery query, Evaluation evaluation) {
        List<Predicate> predicates = query.allPredicates().stream().distinct().toList();
        List<ParticipantExplanation> explanation = new ArrayList<>(participants.size());
        for (Integer participantId : participants) {
            List<PredicateMatch> matches = new ArrayList<>();
            for (Predicate predicate : predicates) {
                Map<Integer, VariableValue> leaf = evaluation.leafMatches.get(predicate);
                if (leaf == null || !leaf.containsKey(participantId)) {
                    continue;
                }
                VariableValue value = leaf.get(participantId);
                matches.add(
                    value == null
                        ? new PredicateMatch(predicate.describe(), predicate.variable(), null, null, null)
                        : new PredicateMatch(predicate.describe(), predicate.variable(), value.valueId(), value.value(), value.batchId())
                );
            }
            explanation.add(new ParticipantExplanation(participantId, matches));
        }
        return explanation;
    }

    /**
     * State of one query evaluation. Leaf matches keep the value that satisfied each predicate for each participant so the explanation
     * cites exactly what the evaluation used.
     */
    private class Evaluation {

        private final CompiledQuery compiled;
        private final long snapshot;
        private final Set<Integer> universe;
        private final BooleanSupplier cancelled;
        private final Map<Predicate, Map<Integer, VariableValue>> leafMatches = new LinkedHashMap<>();

        Evaluation(CompiledQuery compiled, long snapshot, Set<Integer> universe, BooleanSupplier cancelled) {
            this.compiled = compiled;
            this.snapshot = snapshot;
            this.universe = universe;
            this.cancelled = cancelled;
        }

        void checkCancelled() {
            if (cancelled.getAsBoolean()) {
                log.info("Query {} cancelled", compiled.query().id());
                throw new QueryCancelledException(compiled.query().id());
            }
        }

        /**
         * @param within candidates the clause is restricted to, null for every participant
         */
        Set<Integer> evaluate(CohortClause clause, Set<Integer> within) {
            if (clause instanceof Predicate predicate) {
                checkCancelled();
                Map<Integer, VariableValue> matches = evaluatePredicate(predicate, within);
                leafMatches.merge(predicate, matches, (previous, added) -> {
                    Map<Integer, VariableValue> merged = new HashMap<>(previous);
                    merged.putAll(added);
                    return merged;
                });
                return new HashSet<>(matches.keySet());
            }
            PredicateGroup group = (PredicateGroup) clause;
            if (group.combinator() == Combinator.OR) {
                Set<Integer> union = new HashSet<>();
                for (CohortClause child : group.clauses()) {
                    union = SetUtils.union(union, evaluate(child, within));
                }
                return union;
            }
            List<CohortClause> ordered = new ArrayList<>(group.clauses());
            ordered.sort(Comparator.comparingInt(this::estimate));
            Set<Integer> candidates = within;
            for (CohortClause child : ordered) {
                Set<Integer> matched = evaluate(child, candidates);
                candidates = candidates == null ? matched : SetUtils.intersection(candidates, matched);
                if (candidates.isEmpty()) {
                    break;
                }
            }
            return candidates;
        }

        /**
         * Upper bound of the number of participants a clause can match, from current coverage.
         */
        int estimate(CohortClause clause) {
            if (clause instanceof Predicate predicate) {
                int coverage = variableStore.coverage(predicate.variable());
                return predicate.operator() == PredicateOperator.MISSING ? Math.max(universe.size() - coverage, 0) : coverage;
            }
            PredicateGroup group = (PredicateGroup) clause;
            if (group.combinator() == Combinator.OR) {
                long total = group.clauses().stream().mapToLong(this::estimate).sum();
                return (int) Math.min(total, universe.size());
            }
            return group.clauses().stream().mapToInt(this::estimate).min().orElse(0);
        }

        private Map<Integer, VariableValue> evaluatePredicate(Predicate predicate, Set<Integer> within) {
            VariableDefinition definition = compiled.schema().definition(predicate.variable()).orElseThrow();
            VariableType type = definition.type();
            Map<Integer, VariableValue> values = currentValues(predicate.variable(), within);

            Map<Integer, VariableValue> matches = new HashMap<>();
            switch (predicate.operator()) {
                case MISSING -> {
                    for (Integer participantId : within == null ? universe : within) {
                        if (!values.containsKey(participantId)) {
                            matches.put(participantId, null);
                        }
                    }
                }
                case HAS_VALUE -> matches.putAll(values);
                case EQUALS -> {
                    String operand = type.canonicalize(predicate.value());
                    values.forEach((participantId, value) -> {
                        if (type.isEqual(value.value(), operand)) {
                            matches.put(participantId, value);
                        }
                    });
                }
                case IN -> {
                    Set<String> operands = new HashSet<>();
                    predicate.values().forEach(operand -> operands.add(type.canonicalize(operand)));
                    values.forEach((participantId, value) -> {
                        if (operands.contains(value.value())) {
                            matches.put(participantId, value);
                        }
                    });
                }
                case RANGE -> {
                    String min = predicate.min() == null ? null : type.canonicalize(predicate.min());
                    String max = predicate.max() == null ? null : type.canonicalize(predicate.max());
                    values.forEach((participantId, value) -> {
                        if ((min == null || type.compare(value.value(), min) >= 0) && (max == null || type.compare(value.value(), max) <= 0)) {
                            matches.put(participantId, value);
                        }
                    });
                }
            }
            log.debug("{} matched {} participants", predicate.describe(), matches.size());
            return matches;
        }

        private Map<Integer, VariableValue> currentValues(String variable, Set<Integer> within) {
            if (within == null || within.size() >= variableStore.coverage(variable)) {
                Map<Integer, VariableValue> values = variableStore.currentValues(variable, snapshot);
                if (within != null) {
                    values.keySet().retainAll(within);
                }
                return values;
            }
            Map<Integer, VariableValue> values = new HashMap<>();
            for (Integer participantId : within) {
                variableStore.current(participantId, variable, snapshot).ifPresent(value -> values.put(participantId, value));
            }
            return values;
        }
    }
}
