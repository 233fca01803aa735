package im.arun.taxonomy.exception;

import java.util.List;
import java.util.Map;

/**
 * One or more critical QA checks failed and no override was supplied.
 * The run log has already been written when this is thrown.
 */
public class QaFailureException extends TaxonomyEtlException {
    private final List<String> failedChecks;

    public QaFailureException(List<String> failedChecks, Map<String, ?> context) {
        super(EtlErrorCode.QA_CRITICAL_FAILURE,
            "Critical QA checks failed: " + String.join(", ", failedChecks), context);
        this.failedChecks = List.copyOf(failedChecks);
    }

    public List<String> getFailedChecks() {
        return failedChecks;
    }
}
