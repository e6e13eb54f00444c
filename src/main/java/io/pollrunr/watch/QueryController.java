package io.pollrunr.watch;

import io.pollrunr.channel.RenderableItem;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * REST API for on-demand lookups. Extra request parameters are passed to the query as arguments.
 */
@RestController
@RequestMapping("/api/queries")
public class QueryController {

    private final List<Query> queries;

    public QueryController(List<Query> queries) {
        this.queries = queries;
    }

    @GetMapping
    public ResponseEntity<List<Map<String, Object>>> listQueries() {
        return ResponseEntity.ok(queries.stream()
                .map(q -> Map.<String, Object>of(
                        "name", q.name(),
                        "requiredArgs", List.copyOf(new TreeSet<>(q.requiredArgs()))))
                .toList());
    }

    /**
     * Runs a query for a target. Results and errors are delivered to that target.
     */
    @PostMapping("/{name}")
    public ResponseEntity<Map<String, Object>> run(@PathVariable String name, @RequestParam String target,
                                                   @RequestParam Map<String, String> params) {
        if (target.isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        Optional<Query> query = queries.stream().filter(q -> q.name().equals(name)).findFirst();
        if (query.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        Map<String, String> args = new HashMap<>(params);
        args.remove("target");
        try {
            List<RenderableItem> delivered = query.get().run(new Requester(target), args);
            return ResponseEntity.ok(Map.of(
                    "query", name,
                    "target", target,
                    "delivered", delivered.stream().map(RenderableItem::asText).toList()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("query", name, "error", String.valueOf(e.getMessage())));
        }
    }
}
