package im.arun.taxonomy.exception;

import java.util.Map;

/** An output table, tree or run log file could not be written. */
public class OutputException extends TaxonomyEtlException {

    public OutputException(String message, Map<String, ?> context, Throwable cause) {
        super(EtlErrorCode.OUTPUT_ERROR, message, context, cause);
    }
}
