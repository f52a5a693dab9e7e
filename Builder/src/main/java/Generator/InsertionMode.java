package Generator;

/**
 * What a failed construction leaves behind in the test case.
 */
public enum InsertionMode {
    /* statements built for already satisfied parameters stay */
    BEST_EFFORT,
    /* every statement inserted by the failed call is removed again */
    TRANSACTIONAL
}
