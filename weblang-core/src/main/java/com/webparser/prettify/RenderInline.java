package com.webparser.prettify;

import java.util.List;

/**
 * Something that can measure and render itself on a single line.
 */
public interface RenderInline {

    /**
     * Width of the item when rendered on one line, or {@link Prettifier#NOT_INLINE}
     * if it should never be rendered inline.
     */
    int measureInline();

    /**
     * Render the item without any line breaks.
     */
    void renderInline(Prettifier dest);

    /**
     * Width of a sequence rendered inline with separators of width {@code sepWidth}.
     */
    static int measureInlineSeq(List<? extends RenderInline> seq, int sepWidth) {
        int n = 0;
        boolean first = true;

        for (RenderInline item : seq) {
            if (first) {
                first = false;
            } else {
                n += sepWidth;
            }
            n += item.measureInline();
        }

        return n;
    }

    static void renderInlineSeq(List<? extends RenderInline> seq, String sep, Prettifier dest) {
        boolean first = true;

        for (RenderInline item : seq) {
            if (first) {
                first = false;
            } else {
                dest.noscopePush(sep);
            }
            item.renderInline(dest);
        }
    }
}
