package im.arun.taxonomy.exception;

/**
 * Stable error codes surfaced by the ETL pipeline.
 */
public enum EtlErrorCode {
    CONFIGURATION_ERROR,
    INPUT_ERROR,
    QA_CRITICAL_FAILURE,
    OUTPUT_ERROR
}
