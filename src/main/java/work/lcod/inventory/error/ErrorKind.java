package work.lcod.inventory.error;

/**
 * Failure taxonomy shared by the loader, merge engine and builder. An unknown environment is not a
 * failure: it builds an empty inventory.
 */
public enum ErrorKind {
    UNSUPPORTED_SCHEME,
    NOT_FOUND,
    RETRIEVAL_FAILED,
    UNSUPPORTED_FORMAT,
    PARSE_ERROR,
    TYPE_MISMATCH,
    BAD_KEY,
    CORRUPT_BLOB
}
