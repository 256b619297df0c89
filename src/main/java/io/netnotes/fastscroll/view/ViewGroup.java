package io.netnotes.fastscroll.view;

import java.util.ArrayList;
import java.util.List;

/**
 * A view that holds child views. Attach and detach dispatch flow to the
 * children: attached after this group, detached before it.
 */
public abstract class ViewGroup extends View {

    /**
     * Notified when a child joins or leaves this group.
     */
    public interface OnHierarchyChangeListener {
        void onChildViewAdded(ViewGroup parent, View child);
        void onChildViewRemoved(ViewGroup parent, View child);
    }

    private final List<View> children = new ArrayList<>();
    private OnHierarchyChangeListener hierarchyListener = null;

    protected ViewGroup(ViewContext context) {
        super(context);
    }

    public void setOnHierarchyChangeListener(OnHierarchyChangeListener listener) {
        this.hierarchyListener = listener;
    }

    public int getChildCount() {
        return children.size();
    }

    public View getChildAt(int index) {
        return index >= 0 && index < children.size() ? children.get(index) : null;
    }

    public int indexOfChild(View child) {
        return children.indexOf(child);
    }

    public List<View> getChildren() {
        return new ArrayList<>(children);
    }

    public void addView(View child) {
        addView(child, -1);
    }

    public void addView(View child, LayoutParams params) {
        child.setLayoutParams(params);
        addView(child);
    }

    public void addView(View child, int index) {
        if (child == null) {
            throw new IllegalArgumentException("Cannot add a null child view to a ViewGroup");
        }
        if (child.getParent() != null) {
            throw new IllegalStateException("The specified child already has a parent. "
                + "You must call removeView() on the child's parent first.");
        }
        if (child == this) {
            throw new IllegalArgumentException("Cannot add a view to itself");
        }
        if (index < 0 || index > children.size()) {
            children.add(child);
        } else {
            children.add(index, child);
        }
        child.assignParent(this);

        if (isAttachedToWindow()) {
            child.dispatchAttachedToWindow();
        }
        if (hierarchyListener != null) {
            hierarchyListener.onChildViewAdded(this, child);
        }
    }

    public void removeView(View child) {
        int index = children.indexOf(child);
        if (index >= 0) {
            removeViewAt(index);
        }
    }

    public void removeViewAt(int index) {
        View child = children.get(index);
        if (child.isAttachedToWindow()) {
            child.dispatchDetachedFromWindow();
        }
        children.remove(index);
        child.assignParent(null);
        if (hierarchyListener != null) {
            hierarchyListener.onChildViewRemoved(this, child);
        }
    }

    public void removeAllViews() {
        for (int i = children.size() - 1; i >= 0; i--) {
            removeViewAt(i);
        }
    }

    /**
     * Depth-first search of this group and its descendants.
     *
     * @return the first view with the given id, or null
     */
    public View findViewById(String id) {
        if (id == null) {
            return null;
        }
        if (id.equals(getId())) {
            return this;
        }
        for (View child : children) {
            if (id.equals(child.getId())) {
                return child;
            }
            if (child instanceof ViewGroup) {
                View found = ((ViewGroup) child).findViewById(id);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }

    @Override
    protected void onAttachedToWindow() {
        super.onAttachedToWindow();
        for (View child : getChildren()) {
            child.dispatchAttachedToWindow();
        }
    }

    @Override
    protected void onDetachedFromWindow() {
        for (View child : getChildren()) {
            child.dispatchDetachedFromWindow();
        }
        super.onDetachedFromWindow();
    }
}
