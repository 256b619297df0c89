package io.netnotes.fastscroll;

import io.netnotes.fastscroll.scroller.FastScrollListener;
import io.netnotes.fastscroll.scroller.FastScroller;
import io.netnotes.fastscroll.scroller.SectionIndexer;
import io.netnotes.fastscroll.utils.LoggingHelpers.Log;
import io.netnotes.fastscroll.utils.LoggingHelpers.LogLevel;
import io.netnotes.fastscroll.view.LayoutParams;
import io.netnotes.fastscroll.view.StyleAttr;
import io.netnotes.fastscroll.view.StyleAttributes;
import io.netnotes.fastscroll.view.ViewContext;
import io.netnotes.fastscroll.view.ViewIds;
import io.netnotes.fastscroll.widget.FrameLayout;
import io.netnotes.fastscroll.widget.RecyclerList;
import io.netnotes.fastscroll.widget.RefreshLayout;
import javafx.beans.property.ReadOnlyObjectProperty;
import javafx.beans.property.ReadOnlyObjectWrapper;
import javafx.scene.paint.Color;

/**
 * A layout that contains and manages a {@link RecyclerList} with a {@link FastScroller}.
 *
 * FastScrollView creates the list and the scroller once, and binds the
 * scroller to the list while the view is attached. It is also useful when
 * the parent requires a single child, for example a {@link RefreshLayout}.
 *
 * LIFECYCLE:
 * - attach: super → add list (fills the view) → bind scroller → compatibility action
 * - detach: unbind scroller → remove children → super
 */
public class FastScrollView extends FrameLayout {

    /**
     * Creates the two children. Both receive the container's context,
     * attributes and default style.
     */
    interface ChildFactory {
        FastScroller createFastScroller(ViewContext context, StyleAttributes attrs, String defStyle);
        RecyclerList createRecyclerView(ViewContext context, StyleAttributes attrs, String defStyle);
    }

    static final ChildFactory DEFAULT_CHILDREN = new ChildFactory() {
        @Override
        public FastScroller createFastScroller(ViewContext context, StyleAttributes attrs, String defStyle) {
            return new FastScroller(context, attrs, defStyle);
        }

        @Override
        public RecyclerList createRecyclerView(ViewContext context, StyleAttributes attrs, String defStyle) {
            return new RecyclerList(context, attrs, defStyle);
        }
    };

    private final Layout layout;
    private final ReadOnlyObjectWrapper<AttachmentState> attachmentState =
        new ReadOnlyObjectWrapper<>(this, "attachmentState", AttachmentState.DETACHED);
    private CompatibilityAction compatibilityAction = null;

    public FastScrollView(ViewContext context) {
        this(context, null, null);
    }

    public FastScrollView(ViewContext context, StyleAttributes attrs) {
        this(context, attrs, null);
    }

    public FastScrollView(ViewContext context, StyleAttributes attrs, String defStyle) {
        this(context, attrs, defStyle, DEFAULT_CHILDREN);
    }

    FastScrollView(ViewContext context, StyleAttributes attrs, String defStyle, ChildFactory children) {
        super(context);
        layout = createLayout(context, attrs, defStyle, children);

        if (attrs == null) {
            setLayoutParams(new LayoutParams(LayoutParams.MATCH_PARENT, LayoutParams.WRAP_CONTENT));
            setId(ViewIds.FASTSCROLL_VIEW);
        } else {
            applyDeclaredLayout(attrs);
            setId(attrs.has(StyleAttr.ID) ? attrs.getString(StyleAttr.ID) : ViewIds.FASTSCROLL_VIEW);
        }
    }

    private static Layout createLayout(ViewContext context, StyleAttributes attrs, String defStyle, ChildFactory children) {
        FastScroller fastScroller = children.createFastScroller(context, attrs, defStyle);
        fastScroller.setId(ViewIds.FAST_SCROLLER);

        RecyclerList recyclerList = children.createRecyclerView(context, attrs, defStyle);
        recyclerList.setId(ViewIds.RECYCLER_VIEW);

        return new Layout(fastScroller, recyclerList);
    }

    private void applyDeclaredLayout(StyleAttributes attrs) {
        if (!attrs.has(StyleAttr.LAYOUT_WIDTH) || !attrs.has(StyleAttr.LAYOUT_HEIGHT)) {
            return;
        }
        String width = attrs.getString(StyleAttr.LAYOUT_WIDTH);
        String height = attrs.getString(StyleAttr.LAYOUT_HEIGHT);
        try {
            setLayoutParams(new LayoutParams(
                LayoutParams.parseSize(width, context.getDensity(), context.getScaledDensity()),
                LayoutParams.parseSize(height, context.getDensity(), context.getScaledDensity())
            ));
        } catch (IllegalArgumentException e) {
            Log.logError("[FastScrollView]", "layout " + width + " x " + height + " ignored", e);
        }
    }

    /**
     * The current {@link FastScroller} for this view.
     */
    public FastScroller getFastScroller() {
        return layout.fastScroller;
    }

    /**
     * The current {@link RecyclerList} for this view.
     */
    public RecyclerList getRecyclerView() {
        return layout.recyclerList;
    }

    public AttachmentState getAttachmentState() {
        return attachmentState.get();
    }

    public ReadOnlyObjectProperty<AttachmentState> attachmentStateProperty() {
        return attachmentState.getReadOnlyProperty();
    }

    /**
     * @return the action taken at the last attach, or null if never attached
     */
    public CompatibilityAction getCompatibilityAction() {
        return compatibilityAction;
    }

    // ===== ADAPTER / LAYOUT MANAGER =====

    public RecyclerList.Adapter getAdapter() {
        return layout.recyclerList.getAdapter();
    }

    public ReadOnlyObjectProperty<RecyclerList.Adapter> adapterProperty() {
        return layout.recyclerList.adapterProperty();
    }

    /**
     * Sets the adapter that provides the list's items. An adapter that also
     * implements {@link SectionIndexer} provides the scroller's bubble text;
     * any other adapter, or null, clears it.
     */
    public void setAdapter(RecyclerList.Adapter adapter) {
        layout.recyclerList.setAdapter(adapter);
        if (adapter instanceof SectionIndexer) {
            layout.fastScroller.setSectionIndexer((SectionIndexer) adapter);
        } else {
            layout.fastScroller.setSectionIndexer(null);
        }
    }

    public RecyclerList.LayoutManager getLayoutManager() {
        return layout.recyclerList.getLayoutManager();
    }

    public void setLayoutManager(RecyclerList.LayoutManager layoutManager) {
        layout.recyclerList.setLayoutManager(layoutManager);
    }

    // ===== LIFECYCLE =====

    @Override
    protected void onAttachedToWindow() {
        super.onAttachedToWindow();

        RecyclerList recyclerList = layout.recyclerList;
        addView(recyclerList);
        recyclerList.setLayoutParams(new LayoutParams(LayoutParams.MATCH_PARENT, LayoutParams.MATCH_PARENT));
        layout.fastScroller.attachRecyclerView(recyclerList);

        compatibilityAction = CompatibilityAction.resolve(context.getFeatureLevel(), getParent());
        switch (compatibilityAction) {
            case ENABLE_NATIVE_NESTED_SCROLL:
                setNestedScrollingEnabled(true);
                break;
            case DELEGATE_TO_PARENT_REFRESH:
                layout.fastScroller.setSwipeRefreshLayout((RefreshLayout) getParent());
                break;
            default:
                Log.log("[FastScrollView:" + getId() + "]",
                    "no nested scrolling at feature level " + context.getFeatureLevel(), LogLevel.GENERAL);
                break;
        }

        attachmentState.set(AttachmentState.ATTACHED);
        Log.logMsg("[FastScrollView:" + getId() + "] attached, " + compatibilityAction);
    }

    @Override
    protected void onDetachedFromWindow() {
        layout.fastScroller.detachRecyclerView();
        removeAllViews();
        super.onDetachedFromWindow();

        attachmentState.set(AttachmentState.DETACHED);
        Log.logMsg("[FastScrollView:" + getId() + "] detached");
    }

    // ===== FAST SCROLLER =====

    /**
     * Set a new {@link FastScrollListener} that will listen to fast scroll events.
     *
     * @param fastScrollListener the listener to set, or null to set none
     */
    public void setFastScrollListener(FastScrollListener fastScrollListener) {
        layout.fastScroller.setFastScrollListener(fastScrollListener);
    }

    /**
     * Set the enabled state of fast scrolling.
     */
    public void setFastScrollEnabled(boolean enabled) {
        layout.fastScroller.setEnabled(enabled);
    }

    /**
     * Hide the scrollbar when not scrolling.
     */
    public void setHideScrollbar(boolean hideScrollbar) {
        layout.fastScroller.setHideScrollbar(hideScrollbar);
    }

    /**
     * Show the scroll track while scrolling.
     */
    public void setTrackVisible(boolean visible) {
        layout.fastScroller.setTrackVisible(visible);
    }

    public void setTrackColor(Color color) {
        layout.fastScroller.setTrackColor(color);
    }

    public void setHandleColor(Color color) {
        layout.fastScroller.setHandleColor(color);
    }

    /**
     * Show the section bubble while dragging the handle.
     */
    public void setBubbleVisible(boolean visible) {
        layout.fastScroller.setBubbleVisible(visible, false);
    }

    /**
     * Show the section bubble while scrolling.
     *
     * @param visible true to show the bubble, false to hide
     * @param always  true to always show the bubble, false to only show on handle touch
     */
    public void setBubbleVisible(boolean visible, boolean always) {
        layout.fastScroller.setBubbleVisible(visible, always);
    }

    public void setBubbleColor(Color color) {
        layout.fastScroller.setBubbleColor(color);
    }

    public void setBubbleTextColor(Color color) {
        layout.fastScroller.setBubbleTextColor(color);
    }

    /**
     * Set the scaled pixel text size of the section bubble.
     */
    public void setBubbleTextSize(int size) {
        layout.fastScroller.setBubbleTextSize(size);
    }

    private static final class Layout {
        final FastScroller fastScroller;
        final RecyclerList recyclerList;

        Layout(FastScroller fastScroller, RecyclerList recyclerList) {
            this.fastScroller = fastScroller;
            this.recyclerList = recyclerList;
        }
    }
}
