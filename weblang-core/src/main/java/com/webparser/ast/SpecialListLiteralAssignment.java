package com.webparser.ast;

import com.webparser.prettify.Prettifier;
import com.webparser.prettify.RenderFlex;
import com.webparser.prettify.RenderInline;

import java.util.List;

/**
 * {@code (terms) := (terms)}.
 */
public record SpecialListLiteralAssignment(List<ListLiteralTerm> lhs, List<ListLiteralTerm> rhs)
    implements WebToplevel {

    public SpecialListLiteralAssignment {
        lhs = List.copyOf(lhs);
        rhs = List.copyOf(rhs);
    }

    @Override
    public void prettify(Prettifier dest) {
        int wr = RenderInline.measureInlineSeq(rhs, 2) + 2;

        RenderFlex.renderDelimited("(", lhs, ")", dest);
        dest.noscopePush(" :=");

        if (dest.fits(wr + 1)) {
            dest.space();
            RenderFlex.renderDelimited("(", rhs, ")", dest);
        } else {
            dest.indentSmall();
            dest.newlineNeeded();
            RenderFlex.renderDelimited("(", rhs, ")", dest);
            dest.dedentSmall();
        }
    }
}
