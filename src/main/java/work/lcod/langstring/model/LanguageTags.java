package work.lcod.langstring.model;

import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.langstring.shared.TextOps;

/**
 * Reconciles language tags that differ only by letter case.
 */
final class LanguageTags {
    private LanguageTags() {}

    /**
     * Maps each case-folded tag to the tag to use: the single observed casing, or the case-folded form
     * when several casings were seen. Keys keep first-seen order.
     */
    static Map<String, String> reconcile(Iterable<String> tags) {
        Map<String, String> chosen = new LinkedHashMap<>();
        for (String tag : tags) {
            String key = TextOps.casefold(tag);
            String previous = chosen.putIfAbsent(key, tag);
            if (previous != null && !previous.equals(tag)) {
                chosen.put(key, key);
            }
        }
        return chosen;
    }

    static boolean matches(String left, String right) {
        return TextOps.casefold(left).equals(TextOps.casefold(right));
    }
}
