package work.lcod.inventory.runtime;

import work.lcod.inventory.tree.MergePolicy;

/**
 * The three ordered reference lists of an environment, in processing order.
 */
public enum FragmentCategory {
    HOSTS("include_hosts", MergePolicy.UNION),
    GROUP_VARS("include_group_vars", MergePolicy.OVERLAY),
    HOST_VARS("include_host_vars", MergePolicy.OVERLAY);

    /**
     * Older single-list layout, processed as host fragments ahead of {@code include_hosts}, keyed
     * references included. Its entries therefore merge with {@link MergePolicy#UNION}: two legacy
     * fragments that set the same variable to different values fail with {@code TYPE_MISMATCH} instead
     * of the later one silently winning. Configurations that relied on overriding should move their
     * variables to {@code include_group_vars} or {@code include_host_vars}.
     */
    public static final String LEGACY_INCLUDE = "include";

    private final String configKey;
    private final MergePolicy policy;

    FragmentCategory(String configKey, MergePolicy policy) {
        this.configKey = configKey;
        this.policy = policy;
    }

    public String configKey() {
        return configKey;
    }

    public MergePolicy policy() {
        return policy;
    }
}
