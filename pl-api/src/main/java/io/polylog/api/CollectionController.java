package io.polylog.api;

import com.fasterxml.jackson.databind.JsonNode;
import io.polylog.core.AccessToken;
import io.polylog.core.CollectionPath;
import io.polylog.core.Envelope;
import io.polylog.core.OrderingKey;
import io.polylog.store.DeletionPool;
import io.polylog.store.MultiTypeCollection;
import io.polylog.store.MutationPool;
import io.polylog.store.StoredItem;
import io.polylog.store.TypedSequences;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/collections")
public class CollectionController {
    private static final Logger log = LoggerFactory.getLogger(CollectionController.class);

    private final TypedSequences sequences;
    private final PolylogProperties props;

    public CollectionController(TypedSequences sequences, PolylogProperties props) {
        this.sequences = sequences;
        this.props = props;
    }

    /** {@code type} is optional; without it the payload is stored untyped. */
    record AddReq(String type, JsonNode payload, String user) {}

    @PostMapping("/values")
    public ResponseEntity<Map<String, String>> add(@RequestParam("path") String path, @RequestBody AddReq req) {
        var token = tokenFor(req.user());
        var key = MultiTypeCollection.staticAdd(sequences, CollectionPath.of(path), token,
                valueOf(req, token), null, null, null);
        return ResponseEntity.accepted().body(Map.of("key", key.toString()));
    }

    /** Adds all values in one batch; nothing is written if any of them is rejected. */
    @PostMapping("/values/batch")
    public ResponseEntity<Map<String, List<String>>> addAll(@RequestParam("path") String path,
                                                            @RequestBody List<AddReq> reqs) {
        var collection = CollectionPath.of(path);
        var keys = new ArrayList<String>();
        var pool = new MutationPool(sequences.store());
        for (var req : reqs) {
            var token = tokenFor(req.user());
            keys.add(MultiTypeCollection.staticAdd(sequences, collection, token, valueOf(req, token),
                    null, null, pool).toString());
        }
        pool.flush();
        return ResponseEntity.accepted().body(Map.of("keys", keys));
    }

    @GetMapping("/types")
    public List<String> types(@RequestParam("path") String path) {
        return open(path).listStoredTypes().stream().sorted().toList();
    }

    @GetMapping("/values")
    public List<ItemView> values(@RequestParam("path") String path,
                                 @RequestParam(name = "type", required = false) String type,
                                 @RequestParam(name = "after", required = false) String after,
                                 @RequestParam(name = "limit", required = false) Integer limit,
                                 @RequestParam(name = "includeSuffix", defaultValue = "false") boolean includeSuffix) {
        var collection = open(path);
        int max = props.api().maxLimit();
        int effective = (limit == null || limit <= 0) ? max : Math.min(limit, max);

        if (type == null || type.isBlank()) {
            if (after != null) throw new IllegalArgumentException("'after' needs a 'type'");
            return collection.stream()
                    .limit(effective)
                    .map(i -> includeSuffix ? i : new StoredItem(i.key().withoutSuffix(), i.value()))
                    .map(ItemView::of)
                    .toList();
        }

        var afterKey = after == null ? null : OrderingKey.parse(after);
        return collection.scanByType(type, afterKey, includeSuffix, effective)
                .map(ItemView::of)
                .toList();
    }

    @GetMapping("/count")
    public Map<String, Long> count(@RequestParam("path") String path,
                                   @RequestParam(name = "type", required = false) String type) {
        var collection = open(path);
        long n = (type == null || type.isBlank()) ? collection.size() : collection.lengthByType(type);
        return Map.of("count", n);
    }

    @DeleteMapping
    public ResponseEntity<Void> delete(@RequestParam("path") String path) {
        var pool = new DeletionPool(sequences.store());
        open(path).onDelete(pool);
        pool.flush();
        return ResponseEntity.noContent().build();
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
    }

    private MultiTypeCollection open(String path) {
        return new MultiTypeCollection(sequences, CollectionPath.of(path), AccessToken.of("api"));
    }

    private static AccessToken tokenFor(String user) {
        return AccessToken.of(user == null || user.isBlank() ? "api" : user);
    }

    // JSON null arrives as a NullNode; it is passed on as null so the collection rejects it
    private static Object valueOf(AddReq req, AccessToken token) {
        if (req.payload() == null || req.payload().isNull()) return null;
        if (req.type() == null || req.type().isBlank()) return req.payload();
        return new Envelope(req.type(), req.payload(), token.username());
    }
}
