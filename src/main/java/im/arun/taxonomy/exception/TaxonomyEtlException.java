package im.arun.taxonomy.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base runtime exception for the taxonomy ETL with a stable {@link EtlErrorCode}
 * and optional diagnostic context (which key, which file, which check).
 */
public class TaxonomyEtlException extends RuntimeException {
    private final EtlErrorCode code;
    private final Map<String, Object> context;

    public TaxonomyEtlException(EtlErrorCode code, String message, Map<String, ?> context) {
        this(code, message, context, null);
    }

    public TaxonomyEtlException(EtlErrorCode code, String message, Map<String, ?> context, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
        this.context = copy(context);
    }

    public EtlErrorCode getCode() {
        return code;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    private static Map<String, Object> copy(Map<String, ?> input) {
        if (input == null || input.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(input));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()
            + "{code=" + code
            + ", message=" + getMessage()
            + (context.isEmpty() ? "" : ", context=" + context)
            + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
            + '}';
    }
}
