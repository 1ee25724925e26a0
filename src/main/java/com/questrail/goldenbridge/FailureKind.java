package com.questrail.goldenbridge;

/**
 * FailureKind
 * -----------------------------------------------------------------------------
 * Attribution of a bridge failure, used by test reports to separate broken
 * infrastructure from data drift and from misuse of the bridge itself.
 */
public enum FailureKind
{
    /** Oracle could not be launched, exited abnormally, or spoke a malformed protocol. */
    INFRASTRUCTURE,

    /** Oracle output no longer matches the declared schema of its module. */
    SCHEMA_DRIFT,

    /** The bridge broke its own contract (e.g. a request was looked up but never batched). */
    FRAMEWORK_DEFECT,

    /** A test declaration or API call is malformed. */
    USAGE
}
