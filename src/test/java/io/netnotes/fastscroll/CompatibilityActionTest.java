package io.netnotes.fastscroll;

import org.junit.Test;

import io.netnotes.fastscroll.view.FeatureLevel;
import io.netnotes.fastscroll.view.ViewContext;
import io.netnotes.fastscroll.widget.FrameLayout;
import io.netnotes.fastscroll.widget.RefreshLayout;

import static org.junit.Assert.assertEquals;

public class CompatibilityActionTest {

    private final ViewContext context = new ViewContext();

    @Test
    public void testNativeFromNestedScrollingLevel() {
        RefreshLayout refresh = new RefreshLayout(context);
        FrameLayout frame = new FrameLayout(context);

        for (int level : new int[] { FeatureLevel.NESTED_SCROLLING, 28, FeatureLevel.CURRENT }) {
            assertEquals(CompatibilityAction.ENABLE_NATIVE_NESTED_SCROLL, CompatibilityAction.resolve(level, refresh));
            assertEquals(CompatibilityAction.ENABLE_NATIVE_NESTED_SCROLL, CompatibilityAction.resolve(level, frame));
            assertEquals(CompatibilityAction.ENABLE_NATIVE_NESTED_SCROLL, CompatibilityAction.resolve(level, null));
        }
    }

    @Test
    public void testLegacyRefreshParentDelegates() {
        RefreshLayout refresh = new RefreshLayout(context);
        assertEquals(CompatibilityAction.DELEGATE_TO_PARENT_REFRESH,
            CompatibilityAction.resolve(FeatureLevel.NESTED_SCROLLING - 1, refresh));
        assertEquals(CompatibilityAction.DELEGATE_TO_PARENT_REFRESH,
            CompatibilityAction.resolve(FeatureLevel.MINIMUM, refresh));
    }

    @Test
    public void testLegacyOtherParentDoesNothing() {
        assertEquals(CompatibilityAction.NONE,
            CompatibilityAction.resolve(FeatureLevel.MINIMUM, new FrameLayout(context)));
        assertEquals(CompatibilityAction.NONE,
            CompatibilityAction.resolve(FeatureLevel.NESTED_SCROLLING - 1, null));
    }
}
