package io.netnotes.fastscroll.scroller;

import java.util.Objects;
import java.util.Optional;

import io.netnotes.fastscroll.utils.LoggingHelpers.Log;
import io.netnotes.fastscroll.utils.MathHelpers;
import io.netnotes.fastscroll.view.LayoutParams;
import io.netnotes.fastscroll.view.ResolvedStyle;
import io.netnotes.fastscroll.view.StyleAttr;
import io.netnotes.fastscroll.view.StyleAttributes;
import io.netnotes.fastscroll.view.View;
import io.netnotes.fastscroll.view.ViewContext;
import io.netnotes.fastscroll.view.ViewGroup;
import io.netnotes.fastscroll.widget.RecyclerList;
import io.netnotes.fastscroll.widget.RefreshLayout;
import javafx.scene.paint.Color;

/**
 * FastScroller - draggable handle, optional track and section bubble for a
 * {@link RecyclerList}
 *
 * STATE MODEL:
 * - BOUND: observing a list (between attachRecyclerView and detachRecyclerView)
 * - DRAGGING: the handle is held; scroll events from the list are ignored.
 *   Adding and removing it notifies the {@link FastScrollListener}
 * - SCROLLBAR_SHOWN / BUBBLE_SHOWN: what the host should draw
 *
 * Once bound, the scroller sits next to the list in the list's parent.
 */
public class FastScroller extends View {

    public static final int STATE_BOUND           = 10;
    public static final int STATE_DRAGGING        = 11;
    public static final int STATE_SCROLLBAR_SHOWN = 12;
    public static final int STATE_BUBBLE_SHOWN    = 13;

    /** Handle positions this close to the bottom snap to the last item. */
    public static final int TRACK_SNAP_RANGE = 5;

    public static final int DEFAULT_HANDLE_HEIGHT_DP = 48;

    public static final Color DEFAULT_BUBBLE_COLOR      = Color.web("#757575");
    public static final Color DEFAULT_BUBBLE_TEXT_COLOR = Color.WHITE;
    public static final Color DEFAULT_HANDLE_COLOR      = Color.web("#9e9e9e");
    public static final Color DEFAULT_TRACK_COLOR       = Color.web("#dddddd");

    private Color bubbleColor;
    private Color bubbleTextColor;
    private Color handleColor;
    private Color trackColor;
    private BubbleSize bubbleSize;
    private int bubbleTextSizeSp;
    private int handleHeight;
    private boolean hideScrollbar;
    private boolean showBubble;
    private boolean showBubbleAlways;
    private boolean showTrack;

    private RecyclerList recyclerList = null;
    private SectionIndexer sectionIndexer = null;
    private FastScrollListener fastScrollListener = null;
    private RefreshLayout refreshLayout = null;
    private boolean refreshLayoutSuspended = false;

    private float handleY = 0f;
    private String bubbleText = null;

    private final RecyclerList.OnScrollListener scrollListener = new RecyclerList.OnScrollListener() {
        @Override
        public void onScrolled(RecyclerList list, int dx, int dy) {
            if (isDragging() || !isEnabled()) {
                return;
            }
            updateHandlePosition();
            if (dy != 0) {
                stateMachine.addState(STATE_SCROLLBAR_SHOWN);
            }
        }

        @Override
        public void onScrollStateChanged(RecyclerList list, int newState) {
            if (!isEnabled()) {
                return;
            }
            switch (newState) {
                case RecyclerList.SCROLL_STATE_DRAGGING:
                    stateMachine.addState(STATE_SCROLLBAR_SHOWN);
                    if (showBubbleAlways && sectionIndexer != null) {
                        showBubble();
                    }
                    break;
                case RecyclerList.SCROLL_STATE_IDLE:
                    if (!isDragging()) {
                        if (hideScrollbar) {
                            stateMachine.removeState(STATE_SCROLLBAR_SHOWN);
                        }
                        if (!showBubbleAlways) {
                            hideBubble();
                        }
                    }
                    break;
                default:
                    break;
            }
        }
    };

    public FastScroller(ViewContext context) {
        this(context, null, null);
    }

    public FastScroller(ViewContext context, StyleAttributes attrs) {
        this(context, attrs, null);
    }

    public FastScroller(ViewContext context, StyleAttributes attrs, String defStyle) {
        super(context);
        ResolvedStyle style = context.obtainStyledAttributes(attrs, defStyle);

        bubbleColor = style.getColor(StyleAttr.BUBBLE_COLOR, DEFAULT_BUBBLE_COLOR);
        bubbleTextColor = style.getColor(StyleAttr.BUBBLE_TEXT_COLOR, DEFAULT_BUBBLE_TEXT_COLOR);
        handleColor = style.getColor(StyleAttr.HANDLE_COLOR, DEFAULT_HANDLE_COLOR);
        trackColor = style.getColor(StyleAttr.TRACK_COLOR, DEFAULT_TRACK_COLOR);
        bubbleSize = style.getEnum(StyleAttr.BUBBLE_SIZE, BubbleSize.class, BubbleSize.NORMAL);
        bubbleTextSizeSp = style.getInt(StyleAttr.BUBBLE_TEXT_SIZE, bubbleSize.getDefaultTextSizeSp());
        handleHeight = style.getDimensionPx(StyleAttr.HANDLE_HEIGHT,
            MathHelpers.dpToPx(DEFAULT_HANDLE_HEIGHT_DP, context.getDensity()));
        hideScrollbar = style.getBoolean(StyleAttr.HIDE_SCROLLBAR, true);
        showBubble = style.getBoolean(StyleAttr.SHOW_BUBBLE, true);
        showBubbleAlways = showBubble && style.getBoolean(StyleAttr.SHOW_BUBBLE_ALWAYS, false);
        showTrack = style.getBoolean(StyleAttr.SHOW_TRACK, false);

        setEnabled(style.getBoolean(StyleAttr.ENABLED, true));
        setLayoutParams(new LayoutParams(LayoutParams.WRAP_CONTENT, LayoutParams.MATCH_PARENT));

        if (!hideScrollbar) {
            stateMachine.addState(STATE_SCROLLBAR_SHOWN);
        }

        stateMachine.onStateAdded(STATE_DRAGGING, (oldState, newState, bit) -> {
            if (fastScrollListener != null) {
                fastScrollListener.onFastScrollStart(this);
            }
        });
        stateMachine.onStateRemoved(STATE_DRAGGING, (oldState, newState, bit) -> {
            if (fastScrollListener != null) {
                fastScrollListener.onFastScrollStop(this);
            }
        });
    }

    // ===== BINDING =====

    /**
     * Starts observing a list. A scroller bound to another list releases it first.
     */
    public void attachRecyclerView(RecyclerList list) {
        Objects.requireNonNull(list, "recyclerList");
        if (recyclerList == list) {
            return;
        }
        if (recyclerList != null) {
            detachRecyclerView();
        }

        recyclerList = list;
        list.addOnScrollListener(scrollListener);

        ViewGroup listParent = list.getParent();
        if (listParent != null && getParent() == null) {
            listParent.addView(this);
        }

        stateMachine.addState(STATE_BOUND);
        updateHandlePosition();
        Log.logMsg("[FastScroller] bound to " + list);
    }

    /**
     * Stops observing the current list and ends any drag in progress.
     */
    public void detachRecyclerView() {
        if (recyclerList == null) {
            return;
        }
        if (isDragging()) {
            endDrag();
        }

        recyclerList.removeOnScrollListener(scrollListener);

        ViewGroup parent = getParent();
        if (parent != null && parent == recyclerList.getParent()) {
            parent.removeView(this);
        }

        restoreRefreshLayout();
        refreshLayout = null;
        recyclerList = null;
        hideBubble();
        stateMachine.removeState(STATE_BOUND);
        Log.logMsg("[FastScroller] unbound");
    }

    public boolean isBound() {
        return stateMachine.hasState(STATE_BOUND);
    }

    public RecyclerList getRecyclerView() {
        return recyclerList;
    }

    // ===== SECTIONS =====

    public void setSectionIndexer(SectionIndexer sectionIndexer) {
        this.sectionIndexer = sectionIndexer;
        bubbleText = null;
        if (sectionIndexer == null) {
            hideBubble();
        } else {
            updateHandlePosition();
        }
    }

    public SectionIndexer getSectionIndexer() {
        return sectionIndexer;
    }

    /**
     * @return the section label for an adapter position; empty when unbound,
     *         when no indexer is set, or when the position is out of range
     */
    public Optional<String> findSectionText(int position) {
        if (!isBound() || position < 0 || position >= recyclerList.getItemCount()) {
            return Optional.empty();
        }
        return Optional.ofNullable(sectionTextAt(position));
    }

    /**
     * Reads the indexer only while it labels the list's current items. An
     * indexer that is itself an adapter must be the list's adapter.
     */
    private String sectionTextAt(int position) {
        if (sectionIndexer == null || recyclerList == null) {
            return null;
        }
        if (sectionIndexer instanceof RecyclerList.Adapter && sectionIndexer != recyclerList.getAdapter()) {
            return null;
        }
        CharSequence text = sectionIndexer.getSectionText(position);
        return text != null ? text.toString() : null;
    }

    public String getBubbleText() {
        return bubbleText;
    }

    // ===== LISTENERS =====

    public void setFastScrollListener(FastScrollListener fastScrollListener) {
        this.fastScrollListener = fastScrollListener;
    }

    public FastScrollListener getFastScrollListener() {
        return fastScrollListener;
    }

    /**
     * Pull-to-refresh parent to suspend while the handle is dragged.
     */
    public void setSwipeRefreshLayout(RefreshLayout refreshLayout) {
        restoreRefreshLayout();
        this.refreshLayout = refreshLayout;
    }

    public RefreshLayout getSwipeRefreshLayout() {
        return refreshLayout;
    }

    private void restoreRefreshLayout() {
        if (refreshLayout != null && refreshLayoutSuspended) {
            refreshLayout.setEnabled(true);
        }
        refreshLayoutSuspended = false;
    }

    // ===== TOUCH =====

    /**
     * Handles a pointer event at {@code y}, in this view's coordinates.
     *
     * @return true if the event was consumed
     */
    public boolean onTouchEvent(MotionAction action, float y) {
        if (!isEnabled() || !isBound() || getHeight() == 0) {
            return false;
        }

        switch (action) {
            case DOWN:
                if (y < handleY || y > handleY + handleHeight) {
                    return false;
                }
                startDrag();
                moveTo(y);
                return true;
            case MOVE:
                if (!isDragging()) {
                    return false;
                }
                moveTo(y);
                return true;
            case UP:
            case CANCEL:
                if (!isDragging()) {
                    return false;
                }
                endDrag();
                return true;
            default:
                return false;
        }
    }

    public boolean isDragging() {
        return stateMachine.hasState(STATE_DRAGGING);
    }

    private void startDrag() {
        stateMachine.addState(STATE_SCROLLBAR_SHOWN);

        if (refreshLayout != null && refreshLayout.isEnabled()) {
            refreshLayout.setEnabled(false);
            refreshLayoutSuspended = true;
        }
        if (showBubble && sectionIndexer != null) {
            showBubble();
        }
        stateMachine.addState(STATE_DRAGGING);
    }

    private void endDrag() {
        restoreRefreshLayout();

        if (!showBubbleAlways) {
            hideBubble();
        }
        if (hideScrollbar) {
            stateMachine.removeState(STATE_SCROLLBAR_SHOWN);
        }
        stateMachine.removeState(STATE_DRAGGING);
    }

    private void moveTo(float y) {
        setHandlePosition(y / getHeight());
        setRecyclerViewPosition(y);
    }

    private void setHandlePosition(float proportion) {
        int travel = Math.max(getHeight() - handleHeight, 0);
        handleY = MathHelpers.clamp((int) (travel * proportion), 0, travel);
    }

    private void setRecyclerViewPosition(float y) {
        int itemCount = recyclerList.getItemCount();
        if (itemCount == 0) {
            return;
        }

        float proportion;
        if (handleY == 0) {
            proportion = 0f;
        } else if (handleY + handleHeight >= getHeight() - TRACK_SNAP_RANGE) {
            proportion = 1f;
        } else {
            proportion = y / (float) getHeight();
        }

        int targetPos = MathHelpers.clamp((int) (proportion * itemCount), 0, itemCount - 1);
        recyclerList.scrollToPositionWithOffset(targetPos, 0);
        bubbleText = sectionTextAt(targetPos);
    }

    private void updateHandlePosition() {
        if (recyclerList == null || isDragging()) {
            return;
        }
        int offset = recyclerList.computeVerticalScrollOffset();
        int range = recyclerList.computeVerticalScrollRange();
        int extent = recyclerList.computeVerticalScrollExtent();
        int offsetRange = Math.max(range - extent, 1);
        float proportion = (float) MathHelpers.clamp(offset, 0, offsetRange) / offsetRange;
        setHandlePosition(proportion);

        if (isBubbleShown()) {
            int itemCount = recyclerList.getItemCount();
            if (itemCount > 0) {
                int position = MathHelpers.clamp((int) (proportion * itemCount), 0, itemCount - 1);
                bubbleText = sectionTextAt(position);
            }
        }
    }

    public float getHandlePosition() {
        return handleY;
    }

    @Override
    protected void onSizeChanged(int w, int h, int oldw, int oldh) {
        updateHandlePosition();
    }

    // ===== VISIBILITY =====

    @Override
    public void setEnabled(boolean enabled) {
        if (!enabled && isDragging()) {
            endDrag();
        }
        super.setEnabled(enabled);
        setVisible(enabled);
    }

    public boolean isScrollbarShown() {
        return stateMachine.hasState(STATE_SCROLLBAR_SHOWN);
    }

    public boolean isBubbleShown() {
        return stateMachine.hasState(STATE_BUBBLE_SHOWN);
    }

    private void showBubble() {
        stateMachine.addState(STATE_BUBBLE_SHOWN);
    }

    private void hideBubble() {
        stateMachine.removeState(STATE_BUBBLE_SHOWN);
    }

    // ===== STYLE =====

    /**
     * Hide the scrollbar when not scrolling.
     */
    public void setHideScrollbar(boolean hideScrollbar) {
        this.hideScrollbar = hideScrollbar;
        if (hideScrollbar && !isDragging()) {
            stateMachine.removeState(STATE_SCROLLBAR_SHOWN);
        } else {
            stateMachine.addState(STATE_SCROLLBAR_SHOWN);
        }
    }

    public boolean isHideScrollbar() {
        return hideScrollbar;
    }

    public void setTrackVisible(boolean visible) {
        this.showTrack = visible;
    }

    public boolean isTrackVisible() {
        return showTrack;
    }

    public void setTrackColor(Color color) {
        this.trackColor = Objects.requireNonNull(color, "color");
    }

    public Color getTrackColor() {
        return trackColor;
    }

    public void setHandleColor(Color color) {
        this.handleColor = Objects.requireNonNull(color, "color");
    }

    public Color getHandleColor() {
        return handleColor;
    }

    public int getHandleHeight() {
        return handleHeight;
    }

    public void setBubbleVisible(boolean visible) {
        setBubbleVisible(visible, false);
    }

    /**
     * @param visible true to show the bubble
     * @param always  true to keep the bubble up while the list is scrolled,
     *                false to show it only while the handle is dragged
     */
    public void setBubbleVisible(boolean visible, boolean always) {
        this.showBubble = visible;
        this.showBubbleAlways = visible && always;

        if (showBubbleAlways && sectionIndexer != null && isScrollbarShown()) {
            showBubble();
        } else if (!visible || !isDragging()) {
            hideBubble();
        }
    }

    public boolean isBubbleVisible() {
        return showBubble;
    }

    public boolean isBubbleAlwaysVisible() {
        return showBubbleAlways;
    }

    public void setBubbleColor(Color color) {
        this.bubbleColor = Objects.requireNonNull(color, "color");
    }

    public Color getBubbleColor() {
        return bubbleColor;
    }

    public void setBubbleTextColor(Color color) {
        this.bubbleTextColor = Objects.requireNonNull(color, "color");
    }

    public Color getBubbleTextColor() {
        return bubbleTextColor;
    }

    /**
     * @param size text size in scaled pixels
     */
    public void setBubbleTextSize(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Invalid bubble text size: " + size);
        }
        this.bubbleTextSizeSp = size;
    }

    public int getBubbleTextSize() {
        return bubbleTextSizeSp;
    }

    public int getBubbleTextSizePx() {
        return MathHelpers.spToPx(bubbleTextSizeSp, context.getScaledDensity());
    }

    public BubbleSize getBubbleSize() {
        return bubbleSize;
    }

    public void setBubbleSize(BubbleSize bubbleSize) {
        this.bubbleSize = Objects.requireNonNull(bubbleSize, "bubbleSize");
    }
}
