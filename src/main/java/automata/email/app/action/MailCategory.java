package automata.email.app.action;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;

/**
 * Gmail inbox tabs. A message belongs to at most one of them, so assigning
 * categories always removes every category that was not asked for.
 */
@Getter
@RequiredArgsConstructor
public enum MailCategory {
    PRIMARY("CATEGORY_PERSONAL"),
    SOCIAL("CATEGORY_SOCIAL"),
    PROMOTIONS("CATEGORY_PROMOTIONS"),
    UPDATES("CATEGORY_UPDATES"),
    FORUMS("CATEGORY_FORUMS");

    /** System label id Gmail uses for this tab. */
    private final String labelId;

    /**
     * Categories in declaration order that are part of {@code requested}.
     */
    public static List<MailCategory> orderedOf(Collection<MailCategory> requested) {
        return new ArrayList<>(requested.isEmpty() ? EnumSet.noneOf(MailCategory.class) : EnumSet.copyOf(requested));
    }

    /**
     * Categories in declaration order that are NOT part of {@code requested}.
     */
    public static List<MailCategory> complementOf(Collection<MailCategory> requested) {
        EnumSet<MailCategory> rest = EnumSet.allOf(MailCategory.class);
        rest.removeAll(requested);
        return new ArrayList<>(rest);
    }

    public static List<String> labelIdsOf(Collection<MailCategory> categories) {
        List<String> ids = new ArrayList<>(categories.size());
        for (MailCategory category : categories) {
            ids.add(category.getLabelId());
        }
        return ids;
    }
}
