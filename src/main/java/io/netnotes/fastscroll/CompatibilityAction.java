package io.netnotes.fastscroll;

import io.netnotes.fastscroll.view.FeatureLevel;
import io.netnotes.fastscroll.view.ViewGroup;
import io.netnotes.fastscroll.widget.RefreshLayout;

/**
 * What a fast scroll view does at attach time so a drag on the handle does
 * not also pull its refresh parent.
 */
public enum CompatibilityAction {
    /** The platform coordinates nested scrolling; enable it on the container. */
    ENABLE_NATIVE_NESTED_SCROLL,
    /** Older platform inside a refresh layout; the scroller suspends the parent while dragging. */
    DELEGATE_TO_PARENT_REFRESH,
    /** Older platform, any other parent. */
    NONE;

    public static CompatibilityAction resolve(int featureLevel, ViewGroup parent) {
        if (FeatureLevel.supportsNestedScrolling(featureLevel)) {
            return ENABLE_NATIVE_NESTED_SCROLL;
        }
        if (parent instanceof RefreshLayout) {
            return DELEGATE_TO_PARENT_REFRESH;
        }
        return NONE;
    }
}
