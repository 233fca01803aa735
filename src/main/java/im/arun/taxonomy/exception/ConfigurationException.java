package im.arun.taxonomy.exception;

import java.util.Map;

/** A required configuration file, key or value is missing or invalid. */
public class ConfigurationException extends TaxonomyEtlException {

    public ConfigurationException(String message, Map<String, ?> context) {
        super(EtlErrorCode.CONFIGURATION_ERROR, message, context);
    }

    public ConfigurationException(String message, Map<String, ?> context, Throwable cause) {
        super(EtlErrorCode.CONFIGURATION_ERROR, message, context, cause);
    }
}
