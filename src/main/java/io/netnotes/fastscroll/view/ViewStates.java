package io.netnotes.fastscroll.view;

import java.util.Map;

/**
 * ViewStates - State flags shared by every view
 *
 * Lifecycle:
 * DETACHED (no ATTACHED bit) → ATTACHED → DETACHED
 *
 * Views own bits 0-9. Subclasses put their own flags at 10 and up.
 */
public class ViewStates {

    public static final int ATTACHED                 = 0;
    public static final int ENABLED                  = 1;
    public static final int VISIBLE                  = 2;
    public static final int NESTED_SCROLLING_ENABLED = 3;

    public static final Map<Integer, String> NAMES = Map.of(
        ATTACHED, "ATTACHED",
        ENABLED, "ENABLED",
        VISIBLE, "VISIBLE",
        NESTED_SCROLLING_ENABLED, "NESTED_SCROLLING_ENABLED"
    );
}
