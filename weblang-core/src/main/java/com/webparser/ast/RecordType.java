package com.webparser.ast;

import com.webparser.prettify.Prettifier;
import com.webparser.prettify.RenderInline;

import java.util.List;

/**
 * A record type. Always laid out one field per line.
 */
public record RecordType(boolean packed, List<RecordField> fields) implements WebType {

    public RecordType {
        fields = List.copyOf(fields);
    }

    @Override
    public int measureInline() {
        return Prettifier.NOT_INLINE;
    }

    @Override
    public void renderInline(Prettifier dest) {
        renderFlex(dest);
    }

    @Override
    public void renderFlex(Prettifier dest) {
        if (packed) {
            dest.noscopePush("packed ");
        }
        dest.noscopePush("record {");
        dest.indentBlock();

        for (RecordField f : fields) {
            dest.newlineNeeded();

            int wc = f.comment() != null ? f.comment().measureInline() + 1 : 0;
            int wn = RenderInline.measureInlineSeq(f.names(), 2);
            int wt = f.fieldType().measureInline();

            if (dest.fits(wn + wt + wc + 3)) {
                RenderInline.renderInlineSeq(f.names(), ", ", dest);
                dest.noscopePush(": ");
                f.fieldType().renderInline(dest);
                dest.noscopePush(',');

                if (f.comment() != null) {
                    dest.space();
                    f.comment().renderInline(dest);
                }
            } else {
                if (f.comment() != null) {
                    f.comment().renderInline(dest);
                    dest.newlineNeeded();
                }

                RenderInline.renderInlineSeq(f.names(), ", ", dest);
                dest.noscopePush(": ");
                f.fieldType().renderFitting(dest);
                dest.noscopePush(',');
            }
        }

        dest.dedentBlock();
        dest.newlineIndent();
        dest.noscopePush('}');
    }
}
