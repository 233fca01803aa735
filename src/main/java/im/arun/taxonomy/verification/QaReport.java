package im.arun.taxonomy.verification;

import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Outcome of a validation run: check name to pass/fail in check order,
 * the failed checks designated critical, and any duplicated full paths.
 */
@Value
public class QaReport {
    Map<String, Boolean> results;
    List<String> failedCritical;
    List<String> duplicatePaths;

    public boolean passed() {
        return failedCritical.isEmpty();
    }

    public List<String> failedChecks() {
        return results.entrySet().stream()
            .filter(e -> !e.getValue())
            .map(Map.Entry::getKey)
            .collect(Collectors.toList());
    }
}
