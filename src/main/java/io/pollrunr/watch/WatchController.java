package io.pollrunr.watch;

import io.pollrunr.channel.RenderableItem;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST API for running watches on demand and adjusting request parameters.
 */
@RestController
@RequestMapping("/api/watches")
public class WatchController {

    private final List<Watch> watches;
    private final ApiEndpoint endpoint;

    public WatchController(List<Watch> watches, ApiEndpoint endpoint) {
        this.watches = watches;
        this.endpoint = endpoint;
    }

    /**
     * Lists the available watches.
     */
    @GetMapping
    public ResponseEntity<List<Map<String, Object>>> listWatches() {
        return ResponseEntity.ok(watches.stream()
                .map(w -> Map.<String, Object>of(
                        "name", w.name(),
                        "defaultCron", w.defaultCron(),
                        "enabledByDefault", w.enabledByDefault()))
                .toList());
    }

    /**
     * Runs a watch now on behalf of a target. Results and errors are delivered to that target.
     */
    @PostMapping("/{name}/query")
    public ResponseEntity<Map<String, Object>> query(@PathVariable String name, @RequestParam String target) {
        if (target.isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        Optional<Watch> watch = watches.stream().filter(w -> w.name().equals(name)).findFirst();
        if (watch.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        List<RenderableItem> delivered = watch.get().poll(new Requester(target));
        return ResponseEntity.ok(Map.of(
                "watch", name,
                "target", target,
                "delivered", delivered.stream().map(RenderableItem::asText).toList()));
    }

    /**
     * Replaces a request parameter sent with every API call (for example a renewed ticket).
     */
    @PutMapping("/params/{key}")
    public ResponseEntity<Map<String, String>> updateParam(@PathVariable String key,
                                                           @RequestBody UpdateParamRequest request) {
        if (request.value() == null || request.value().isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        endpoint.updateParam(key, request.value());
        return ResponseEntity.ok(Map.of("status", "updated", "key", key));
    }

    /**
     * Request body for updating a parameter.
     */
    public record UpdateParamRequest(String value) {}
}
