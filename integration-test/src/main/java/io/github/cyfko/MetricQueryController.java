package io.github.cyfko;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.cyfko.metricql.core.alias.AliasFamily;
import io.github.cyfko.metricql.core.exception.DSLSyntaxException;
import io.github.cyfko.metricql.core.exception.MetricDefinitionException;
import io.github.cyfko.metricql.core.exception.UnknownAliasException;
import io.github.cyfko.metricql.spring.service.MetricQlService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * HTTP front of the metric query compiler.
 */
@RestController
@RequestMapping("/api/v1/metrics")
public class MetricQueryController {

    private final MetricQlService service;

    public MetricQueryController(MetricQlService service) {
        this.service = service;
    }

    public record CommandRequest(String command) {}

    public record StructuredRequest(List<String> kpis, String filter, List<String> distributions, boolean stats, String group) {}

    public record EntityRequest(String message, JsonNode entities) {}

    public record QueryResponse(String query) {}

    public record ErrorResponse(String error, String hint) {}

    @PostMapping("/command")
    public QueryResponse command(@RequestBody CommandRequest request) {
        return new QueryResponse(service.fromCommand(request.command()));
    }

    @PostMapping("/query")
    public QueryResponse query(@RequestBody StructuredRequest request) {
        return new QueryResponse(service.compile(
                request.kpis(), request.filter(), request.distributions(), request.stats(), request.group()));
    }

    @PostMapping("/entities")
    public QueryResponse entities(@RequestBody EntityRequest request) {
        String json = request.entities() == null ? "null" : request.entities().toString();
        return new QueryResponse(service.fromEntityJson(json, request.message()));
    }

    @GetMapping("/aliases/{family}")
    public ResponseEntity<String> aliases(@PathVariable String family) {
        return AliasFamily.fromKey(family)
                .map(f -> ResponseEntity.ok(service.describe(f)))
                .orElse(ResponseEntity.notFound().build());
    }

    @ExceptionHandler(UnknownAliasException.class)
    public ResponseEntity<ErrorResponse> unknownAlias(UnknownAliasException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage(), service.describe(e.getFamily())));
    }

    @ExceptionHandler({DSLSyntaxException.class, MetricDefinitionException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> invalidRequest(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(new ErrorResponse(e.getMessage(), null));
    }
}
