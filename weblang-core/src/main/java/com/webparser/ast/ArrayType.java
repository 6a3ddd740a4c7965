package com.webparser.ast;

import com.webparser.prettify.Prettifier;
import com.webparser.prettify.RenderInline;

import java.util.List;

public record ArrayType(boolean packed, List<WebType> axes, WebType element) implements WebType {

    public ArrayType {
        axes = List.copyOf(axes);
    }

    @Override
    public int measureInline() {
        int w = packed ? 7 : 0;
        w += 7; // "array ["
        w += RenderInline.measureInlineSeq(axes, 2);
        w += 5; // "] of "
        w += element.measureInline();
        return w;
    }

    @Override
    public void renderInline(Prettifier dest) {
        if (packed) {
            dest.noscopePush("packed ");
        }
        dest.noscopePush("array [");
        RenderInline.renderInlineSeq(axes, ", ", dest);
        dest.noscopePush("] of ");
        element.renderInline(dest);
    }

    @Override
    public void renderFlex(Prettifier dest) {
        int wx = RenderInline.measureInlineSeq(axes, 2);
        int we = element.measureInline();

        if (packed) {
            dest.noscopePush("packed ");
        }
        dest.noscopePush("array [");

        if (dest.fits(wx + we + 5)) {
            RenderInline.renderInlineSeq(axes, ", ", dest);
            dest.noscopePush("] of ");
            element.renderInline(dest);
        } else if (dest.fits(wx + 4)) {
            RenderInline.renderInlineSeq(axes, ", ", dest);
            dest.noscopePush("] of");
            dest.indentSmall();
            dest.newlineNeeded();
            element.renderFitting(dest);
            dest.dedentSmall();
        } else {
            int outer = dest.reserveTrailing(0);
            dest.indentSmall();
            for (WebType axis : axes) {
                dest.newlineIndent();
                axis.renderFitting(dest, 1);
                dest.noscopePush(',');
            }
            dest.dedentSmall();
            dest.reserveTrailing(outer);
            dest.newlineIndent();
            dest.noscopePush("] of ");
            element.renderFitting(dest);
        }
    }
}
