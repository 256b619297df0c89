package io.netnotes.fastscroll.view;

import io.netnotes.fastscroll.state.BitFlagStateMachine;
import io.netnotes.fastscroll.utils.LoggingHelpers.Log;

/**
 * View - base class of the widget tree
 *
 * STATE MODEL:
 * - Flags live in a {@link BitFlagStateMachine} (see {@link ViewStates})
 * - ATTACHED is owned by the platform: it is set and cleared only through
 *   {@link #dispatchAttachedToWindow()} and {@link #dispatchDetachedFromWindow()}
 * - Subclasses hook the transitions by overriding {@link #onAttachedToWindow()}
 *   and {@link #onDetachedFromWindow()} and must call super
 */
public abstract class View {

    protected final ViewContext context;
    protected final BitFlagStateMachine stateMachine;

    private String id = null;
    private ViewGroup parent = null;
    private LayoutParams layoutParams = null;
    private int width = 0;
    private int height = 0;

    protected View(ViewContext context) {
        if (context == null) {
            throw new NullPointerException("context");
        }
        this.context = context;
        this.stateMachine = new BitFlagStateMachine(getClass().getSimpleName() + "@" + Integer.toHexString(System.identityHashCode(this)));
        this.stateMachine.addState(ViewStates.ENABLED);
        this.stateMachine.addState(ViewStates.VISIBLE);
    }

    public ViewContext getContext() {
        return context;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public ViewGroup getParent() {
        return parent;
    }

    void assignParent(ViewGroup parent) {
        this.parent = parent;
    }

    public LayoutParams getLayoutParams() {
        return layoutParams;
    }

    public void setLayoutParams(LayoutParams params) {
        if (params == null) {
            throw new NullPointerException("Layout parameters cannot be null");
        }
        this.layoutParams = params;
    }

    // ===== SIZE =====

    public int getWidth() { return width; }
    public int getHeight() { return height; }

    /**
     * Assigns the view's measured size, as the host's layout pass would.
     */
    public final void layout(int width, int height) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Negative size: " + width + "x" + height);
        }
        int oldWidth = this.width;
        int oldHeight = this.height;
        this.width = width;
        this.height = height;
        if (oldWidth != width || oldHeight != height) {
            onSizeChanged(width, height, oldWidth, oldHeight);
        }
    }

    protected void onSizeChanged(int w, int h, int oldw, int oldh) {}

    // ===== FLAGS =====

    public boolean isEnabled() {
        return stateMachine.hasState(ViewStates.ENABLED);
    }

    public void setEnabled(boolean enabled) {
        stateMachine.setState(ViewStates.ENABLED, enabled);
    }

    public boolean isVisible() {
        return stateMachine.hasState(ViewStates.VISIBLE);
    }

    public void setVisible(boolean visible) {
        stateMachine.setState(ViewStates.VISIBLE, visible);
    }

    public boolean isNestedScrollingEnabled() {
        return stateMachine.hasState(ViewStates.NESTED_SCROLLING_ENABLED);
    }

    public void setNestedScrollingEnabled(boolean enabled) {
        stateMachine.setState(ViewStates.NESTED_SCROLLING_ENABLED, enabled);
    }

    // ===== LIFECYCLE =====

    public boolean isAttachedToWindow() {
        return stateMachine.hasState(ViewStates.ATTACHED);
    }

    /**
     * Called by the platform (or a parent view group) when this view joins
     * the visible tree. Repeated calls while attached are ignored.
     */
    public final void dispatchAttachedToWindow() {
        if (isAttachedToWindow()) {
            Log.logMsg("[" + this + "] already attached");
            return;
        }
        onAttachedToWindow();
        if (!isAttachedToWindow()) {
            throw new IllegalStateException(getClass().getName() + " did not call through to super.onAttachedToWindow()");
        }
    }

    /**
     * Called by the platform (or a parent view group) when this view leaves
     * the visible tree. Ignored when not attached.
     */
    public final void dispatchDetachedFromWindow() {
        if (!isAttachedToWindow()) {
            return;
        }
        onDetachedFromWindow();
        if (isAttachedToWindow()) {
            throw new IllegalStateException(getClass().getName() + " did not call through to super.onDetachedFromWindow()");
        }
    }

    protected void onAttachedToWindow() {
        stateMachine.addState(ViewStates.ATTACHED);
    }

    protected void onDetachedFromWindow() {
        stateMachine.removeState(ViewStates.ATTACHED);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + (id != null ? "#" + id : "") + stateMachine.getStateString(ViewStates.NAMES);
    }
}
