package io.netnotes.fastscroll.view;

/**
 * Stable ids assigned to the views a fast scroll view creates, so host
 * layouts and tests can look them up with {@link ViewGroup#findViewById(String)}.
 */
public final class ViewIds {
    public static final String FASTSCROLL_VIEW = "fastscroll_view";
    public static final String RECYCLER_VIEW   = "recycler_view";
    public static final String FAST_SCROLLER   = "fast_scroller";

    private ViewIds() {}
}
