package edu.harvard.hms.dbmi.avillach.inventory.service.query;

import edu.harvard.hms.dbmi.avillach.inventory.data.query.CohortQuery;
import edu.harvard.hms.dbmi.avillach.inventory.data.query.CohortResult;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RequestMapping(value = "query", produces = "application/json")
@RestController
public class QueryController {

    private final QueryService queryService;

    @Autowired
    public QueryController(QueryService queryService) {
        this.queryService = queryService;
    }

    @PostMapping
    public CohortResult query(@RequestBody CohortQuery query) {
        return queryService.runQuery(query);
    }

    @PostMapping("/{queryId}/cancel")
    public ResponseEntity<Void> cancel(@PathVariable UUID queryId) {
        return queryService.cancel(queryId) ? ResponseEntity.accepted().build() : ResponseEntity.notFound().build();
    }
}
