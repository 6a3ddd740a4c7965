package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;
import com.webparser.prettify.RenderInline;

import java.util.List;

/**
 * One arm of a case statement.
 */
public sealed interface CaseItem extends SyntaxNode {

    void render(Prettifier dest);

    /** A module supplying further arms. */
    record ModuleReference(Token module) implements CaseItem {
        @Override
        public void render(Prettifier dest) {
            module.renderInline(dest);
        }
    }

    /** {@code label, label: stmt}. */
    record Standard(List<WebExpr> matches, WebStatement statement, Token comment) implements CaseItem {
        public Standard {
            matches = List.copyOf(matches);
        }

        @Override
        public void render(Prettifier dest) {
            renderArm(dest, matches, statement, comment);
        }
    }

    /** The catch-all arm, tagged by a formatted identifier acting like {@code else}. */
    record OtherCases(Token tag, WebStatement statement, Token comment) implements CaseItem {
        @Override
        public void render(Prettifier dest) {
            tag.renderInline(dest);
            armBody(dest, statement, comment);
        }
    }

    private static void renderArm(Prettifier dest, List<WebExpr> matches, WebStatement statement, Token comment) {
        int wl = RenderInline.measureInlineSeq(matches, 2) + 1;

        if (dest.fits(wl)) {
            RenderInline.renderInlineSeq(matches, ", ", dest);
        } else {
            for (int i = 0; i < matches.size(); i++) {
                if (i > 0) {
                    dest.noscopePush(',');
                    dest.newlineNeeded();
                }
                matches.get(i).renderFitting(dest);
            }
        }

        dest.noscopePush(':');
        armBody(dest, statement, comment);
    }

    private static void armBody(Prettifier dest, WebStatement statement, Token comment) {
        int wc = comment != null ? comment.measureInline() + 1 : 0;
        int ws = StatementLayout.nestedWidth(statement) + 1;

        if (!(statement instanceof Block) && dest.fits(1 + ws + wc)) {
            dest.space();
            StatementLayout.render(statement, dest, true);
        } else {
            StatementLayout.renderNested(statement, dest, true);
        }

        StatementLayout.renderTrailingComment(comment, dest);
    }
}
