package work.lcod.inventory.tree;

/**
 * How two fragments combine when they meet at the same key.
 */
public enum MergePolicy {
    /** Host collections: recursive mapping merge, sequence set union, conflicting leaves rejected. */
    UNION {
        @Override
        public Object merge(Object base, Object incoming, String context) {
            return TreeMerger.union(base, incoming, context);
        }
    },
    /** Variables: recursive mapping update, last writer wins everywhere else. */
    OVERLAY {
        @Override
        public Object merge(Object base, Object incoming, String context) {
            return TreeMerger.overlay(base, incoming);
        }
    };

    public abstract Object merge(Object base, Object incoming, String context);
}
