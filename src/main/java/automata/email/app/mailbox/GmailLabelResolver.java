package automata.email.app.mailbox;

import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.services.gmail.Gmail;
import com.google.api.services.gmail.model.Label;
import com.google.api.services.gmail.model.ListLabelsResponse;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves label names against the user's Gmail labels. The label list is
 * fetched once, on first use; missing user labels are created.
 */
@Slf4j
public class GmailLabelResolver implements LabelResolver {
    private final Gmail gmail;
    private final String userId;
    private static final int BAD_REQUEST = 400;

    private Map<String, LabelHandle> labelsByName;

    public GmailLabelResolver(Gmail gmail, String userId) {
        this.gmail = gmail;
        this.userId = userId;
    }

    @Override
    public LabelHandle resolve(String name) throws Exception {
        Optional<LabelHandle> existing = find(name);
        if (existing.isPresent()) {
            return existing.get();
        }

        Label created;
        try {
            created = gmail.users().labels().create(userId, new Label()
                    .setName(name)
                    .setLabelListVisibility("labelShow")
                    .setMessageListVisibility("show"))
                .execute();
        } catch (GoogleJsonResponseException e) {
            if (e.getStatusCode() == BAD_REQUEST) {
                throw new IllegalArgumentException("labels.create returned " + e.getStatusCode(), e);
            }
            throw e;
        }
        log.info("Created label '{}' with id {}", name, created.getId());
        LabelHandle handle = new LabelHandle(created.getId(), name);
        labelsByName.put(name, handle);
        return handle;
    }

    @Override
    public Optional<LabelHandle> find(String name) throws Exception {
        if (labelsByName == null) {
            labelsByName = loadLabels();
        }
        return Optional.ofNullable(labelsByName.get(name));
    }

    private Map<String, LabelHandle> loadLabels() throws Exception {
        Map<String, LabelHandle> labels = new HashMap<>();
        ListLabelsResponse response = gmail.users().labels().list(userId).execute();
        if (response.getLabels() != null) {
            for (Label label : response.getLabels()) {
                labels.put(label.getName(), new LabelHandle(label.getId(), label.getName()));
            }
        }
        log.debug("Loaded {} labels for {}", labels.size(), userId);
        return labels;
    }
}
