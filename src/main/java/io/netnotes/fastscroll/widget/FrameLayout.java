package io.netnotes.fastscroll.widget;

import io.netnotes.fastscroll.view.ViewContext;
import io.netnotes.fastscroll.view.ViewGroup;

/**
 * A view group that stacks its children on top of each other.
 */
public class FrameLayout extends ViewGroup {

    public FrameLayout(ViewContext context) {
        super(context);
    }
}
