package im.arun.taxonomy.exception;

import java.util.Map;

/** The source workbook, sheet or a required column is missing or unreadable. */
public class InputDataException extends TaxonomyEtlException {

    public InputDataException(String message, Map<String, ?> context) {
        super(EtlErrorCode.INPUT_ERROR, message, context);
    }

    public InputDataException(String message, Map<String, ?> context, Throwable cause) {
        super(EtlErrorCode.INPUT_ERROR, message, context, cause);
    }
}
