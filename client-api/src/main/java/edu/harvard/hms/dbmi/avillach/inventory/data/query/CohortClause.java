package edu.harvard.hms.dbmi.avillach.inventory.data.query;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

@JsonTypeInfo(use = JsonTypeInfo.Id.DEDUCTION)
@JsonSubTypes({
        @JsonSubTypes.Type(PredicateGroup.class),
        @JsonSubTypes.Type(Predicate.class) }
)
public sealed interface CohortClause permits PredicateGroup, Predicate {

}
