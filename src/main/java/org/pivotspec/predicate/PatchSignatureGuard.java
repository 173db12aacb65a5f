package org.pivotspec.predicate;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Suppresses re-emitting a field's patch when it is identical to the last one emitted.
 * <p>
 * Rule editors recompile on every keystroke and re-render; only a changed signature should
 * reach the where clause and trigger downstream recomputation.
 */
public class PatchSignatureGuard {

    private static final Logger log = LoggerFactory.getLogger(PatchSignatureGuard.class);

    private final Map<String, String> lastSignatures = new ConcurrentHashMap<>();

    /**
     * Records the patch and reports whether it differs from the previous one for the field.
     *
     * @param field base field name
     * @param patch the freshly compiled patch
     * @return true if the patch should be applied
     */
    public boolean shouldEmit(String field, WherePatch patch) {
        if (isUnchanged(field, patch)) {
            return false;
        }
        record(field, patch);
        return true;
    }

    /**
     * Checks the patch against the last recorded one without recording it.
     *
     * @param field base field name
     * @param patch the freshly compiled patch
     * @return true if the patch equals the last recorded patch of the field
     */
    public boolean isUnchanged(String field, WherePatch patch) {
        if (patch.signature().equals(lastSignatures.get(field))) {
            log.debug("Suppressing unchanged patch for field '{}'", field);
            return true;
        }
        return false;
    }

    /**
     * Records a patch once it has actually reached the where clause.
     *
     * @param field base field name
     * @param patch the applied patch
     */
    public void record(String field, WherePatch patch) {
        lastSignatures.put(field, patch.signature());
    }

    /**
     * Forgets the last signature of a field, e.g. when its filter chip is removed.
     *
     * @param field base field name
     */
    public void reset(String field) {
        lastSignatures.remove(field);
    }
}
