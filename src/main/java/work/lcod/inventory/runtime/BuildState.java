package work.lcod.inventory.runtime;

/**
 * Stages of one inventory build, in order. Any stage may end in {@link #FAILED}.
 */
public enum BuildState {
    INIT,
    LOAD_ROOT,
    RESOLVE_ENVIRONMENT,
    MERGE_HOSTS,
    MERGE_GROUP_VARS,
    MERGE_HOST_VARS,
    NORMALIZE,
    DONE,
    FAILED
}
