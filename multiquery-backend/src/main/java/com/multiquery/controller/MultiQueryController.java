package com.multiquery.controller;

import com.multiquery.api.BackendsResponse;
import com.multiquery.api.QueryRequest;
import com.multiquery.model.AggregateResult;
import com.multiquery.model.SelectionMask;
import com.multiquery.service.QueryOrchestrator;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/v1")
public class MultiQueryController {

    private static final Logger log = LoggerFactory.getLogger(MultiQueryController.class);

    private final QueryOrchestrator queryOrchestrator;

    public MultiQueryController(QueryOrchestrator queryOrchestrator) {
        this.queryOrchestrator = queryOrchestrator;
    }

    /**
     * Run a query on the selected backends.
     *
     * POST /v1/query
     *
     * <p>Always 200 once dispatched, even if every backend failed; callers inspect each entry of
     * {@code results}. An invalid selection is rejected with 400 before any backend is contacted.
     *
     * @param request query text and backend selection
     * @return per-backend outcomes and total duration
     */
    @PostMapping("/query")
    public ResponseEntity<AggregateResult> query(@Valid @RequestBody QueryRequest request) {
        SelectionMask selection = request.getSelection().toMask();
        AggregateResult result = queryOrchestrator.execute(request.getQuery(), selection);
        log.info("Query completed: selection={}, successes={}, failures={}, total_duration_ms={}",
                selection, result.getSuccessCount(), result.getFailureCount(), result.getTotalDurationMs());
        return ResponseEntity.ok(result);
    }

    /**
     * List registered backends.
     *
     * GET /v1/backends
     */
    @GetMapping("/backends")
    public ResponseEntity<BackendsResponse> backends() {
        List<BackendsResponse.BackendInfo> infos = queryOrchestrator.getRegistry().getConnectors().stream()
                .map(c -> new BackendsResponse.BackendInfo(c.getBackendId().getValue(), c.getKind().label()))
                .collect(Collectors.toList());
        return ResponseEntity.ok(new BackendsResponse(infos));
    }
}
