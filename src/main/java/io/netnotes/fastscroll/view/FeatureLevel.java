package io.netnotes.fastscroll.view;

/**
 * Platform feature levels the widgets check at runtime.
 */
public final class FeatureLevel {
    public static final int MINIMUM          = 14;
    /** First level where views support nested scrolling natively. */
    public static final int NESTED_SCROLLING = 21;
    public static final int CURRENT          = 34;

    private FeatureLevel() {}

    public static boolean supportsNestedScrolling(int featureLevel) {
        return featureLevel >= NESTED_SCROLLING;
    }
}
