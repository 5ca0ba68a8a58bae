package space.ketterling.hydro.error;

/**
 * Failure categories recorded while ingesting. Each one is contained at the
 * smallest unit it affects (page, chunk, row or key).
 */
public enum ErrorKind {
    /** Network or HTTP failure for one request. */
    FETCH,
    /** Malformed payload, line or cell. */
    PARSE,
    /** Timestamp that matched no known encoding. */
    NORMALIZATION,
    /** Write failure for one storage key. */
    STORAGE
}
