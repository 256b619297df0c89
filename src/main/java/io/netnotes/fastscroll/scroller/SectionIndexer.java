package io.netnotes.fastscroll.scroller;

/**
 * Implemented by list adapters that can label the section an item belongs
 * to. The label is shown in the fast scroller's bubble while dragging.
 */
public interface SectionIndexer {

    /**
     * @param position an adapter position
     * @return a short label for the section containing the item, typically one or two characters
     */
    CharSequence getSectionText(int position);
}
