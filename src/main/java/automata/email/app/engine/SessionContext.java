package automata.email.app.engine;

import automata.email.app.mailbox.LabelHandle;
import automata.email.app.mailbox.LabelResolver;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * State shared by every entity of one run: bookkeeping label names, the
 * message age cutoff and the label cache.
 * Not thread-safe; a run owns its session exclusively.
 */
@Slf4j
public class SessionContext {
    @Getter
    private final String processedLabel;
    @Getter
    private final String unprocessedLabel;
    @Getter
    private final Instant oldestToProcess;
    private final LabelResolver labelResolver;
    private final Map<String, LabelHandle> labelCache = new HashMap<>();

    @Builder
    public SessionContext(String processedLabel, String unprocessedLabel, Instant oldestToProcess,
                          LabelResolver labelResolver) {
        if (unprocessedLabel == null || unprocessedLabel.isBlank()) {
            throw new IllegalArgumentException("Unprocessed label must be configured");
        }
        if (labelResolver == null) {
            throw new IllegalArgumentException("Label resolver is required");
        }
        this.processedLabel = processedLabel == null ? "" : processedLabel;
        this.unprocessedLabel = unprocessedLabel;
        this.oldestToProcess = oldestToProcess == null ? Instant.EPOCH : oldestToProcess;
        this.labelResolver = labelResolver;
    }

    public boolean hasProcessedLabel() {
        return !processedLabel.isEmpty();
    }

    /**
     * Returns the label with the given name, creating it on first request.
     * Repeated requests for the same name return the same handle.
     *
     * @throws MalformedActionException if the mailbox rejects the label name
     */
    public LabelHandle getOrCreateLabel(String name) throws Exception {
        LabelHandle cached = labelCache.get(name);
        if (cached != null) {
            return cached;
        }
        LabelHandle resolved;
        try {
            resolved = labelResolver.resolve(name);
        } catch (IllegalArgumentException e) {
            throw new MalformedActionException("Label name '" + name + "' rejected: " + e.getMessage());
        }
        labelCache.put(name, resolved);
        log.debug("Resolved label '{}' to {}", name, resolved.getId());
        return resolved;
    }

    /**
     * Returns the label with the given name if the mailbox already has it.
     */
    public Optional<LabelHandle> findLabel(String name) throws Exception {
        LabelHandle cached = labelCache.get(name);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<LabelHandle> found = labelResolver.find(name);
        found.ifPresent(label -> labelCache.put(name, label));
        return found;
    }
}
