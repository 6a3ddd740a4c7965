package com.webparser.prettify;

import java.util.List;

/**
 * A composite item that can also lay itself out across several lines.
 */
public interface RenderFlex extends RenderInline {

    /**
     * Render the item, breaking lines as needed to respect the remaining width.
     */
    void renderFlex(Prettifier dest);

    /**
     * Inline if it fits at the current position, flexible otherwise.
     */
    default void renderFitting(Prettifier dest) {
        if (dest.fits(measureInline())) {
            renderInline(dest);
        } else {
            renderFlex(dest);
        }
    }

    /**
     * Like {@link #renderFitting(Prettifier)}, keeping room on the last line for
     * {@code suffixWidth} characters the caller appends afterwards.
     */
    default void renderFitting(Prettifier dest, int suffixWidth) {
        int outer = dest.reserveTrailing(dest.reservedTrailing() + suffixWidth);
        renderFitting(dest);
        dest.reserveTrailing(outer);
    }

    /**
     * Render {@code open items close}: inline if everything fits, otherwise the
     * items go on their own lines one small step deeper, all together if they fit
     * there, else one per line, each followed by a comma.
     */
    static void renderDelimited(String open, List<? extends RenderInline> items, String close, Prettifier dest) {
        int wi = RenderInline.measureInlineSeq(items, 2);

        dest.noscopePush(open);

        if (items.isEmpty() || dest.fits(wi + close.length())) {
            RenderInline.renderInlineSeq(items, ", ", dest);
            dest.noscopePush(close);
            return;
        }

        // Item lines end in a comma, never in what follows the closing delimiter.
        int outer = dest.reserveTrailing(0);
        dest.indentSmall();

        if (dest.wouldFitOnNewLine(wi + 1)) {
            dest.newlineNeeded();
            RenderInline.renderInlineSeq(items, ", ", dest);
            dest.noscopePush(',');
        } else {
            for (RenderInline item : items) {
                dest.newlineNeeded();
                if (item instanceof RenderFlex flex) {
                    flex.renderFitting(dest, 1);
                } else {
                    item.renderInline(dest);
                }
                dest.noscopePush(',');
            }
        }

        dest.dedentSmall();
        dest.reserveTrailing(outer);
        dest.newlineNeeded();
        dest.noscopePush(close);
    }
}
