package automata.email.app.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of a batch request. Label names left null fall back to the
 * {@code mail.actions.*} defaults.
 */
@Data
public class BatchActionRequest {
    private String processedLabel;
    private String unprocessedLabel;
    private List<EntityActionRequest> entries = new ArrayList<>();
}
