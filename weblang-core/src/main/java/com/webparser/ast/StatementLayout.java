package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;

/**
 * Places statements together with their semicolons and trailing comments.
 */
public final class StatementLayout {

    private StatementLayout() {
        // Utility class
    }

    /**
     * Width of a statement nested inside another one on a single line. A nested
     * statement with a comment never goes inline.
     */
    public static int nestedWidth(WebStatement stmt) {
        return stmt.comment() != null ? Prettifier.NOT_INLINE : stmt.measureInline();
    }

    /**
     * Render a statement at the current position, then a semicolon if
     * {@code semicolon} is set and the statement takes one, then its comment.
     * If the comment doesn't fit after the statement it goes on the line before.
     *
     * <p>A statement in a list ({@code semicolon} set) keeps room for its own
     * semicolon on its last line; a nested one keeps whatever room the enclosing
     * statement reserved.</p>
     */
    public static void render(WebStatement stmt, Prettifier dest, boolean semicolon) {
        boolean semi = semicolon && stmt.wantsSemicolon();
        int reserve = semicolon ? (semi ? 1 : 0) : dest.reservedTrailing();
        int outer = dest.reserveTrailing(reserve);
        Token comment = stmt.comment();
        int wc = comment != null ? comment.measureInline() + 1 : 0;
        int w = stmt.measureInline();

        if (dest.fits(w + wc)) {
            stmt.renderInline(dest);
            dest.reserveTrailing(outer);
            if (semi) {
                dest.noscopePush(';');
            }
            renderTrailingComment(comment, dest);
            return;
        }

        if (comment != null) {
            comment.renderInline(dest);
            dest.newlineNeeded();
        }

        stmt.renderFitting(dest);
        dest.reserveTrailing(outer);
        if (semi) {
            dest.noscopePush(';');
        }
    }

    /**
     * Render the body of a compound statement after its introducing keyword.
     * A block stays on the keyword's line ({@code then begin}); anything else
     * goes on its own line one block step deeper.
     */
    public static void renderNested(WebStatement body, Prettifier dest, boolean semicolon) {
        if (body instanceof Block block) {
            dest.space();
            block.renderFlex(dest);
            if (semicolon) {
                dest.noscopePush(';');
            }
            renderTrailingComment(block.comment(), dest);
        } else {
            dest.indentBlock();
            dest.newlineNeeded();
            render(body, dest, semicolon);
            dest.dedentBlock();
        }
    }

    static void renderTrailingComment(Token comment, Prettifier dest) {
        if (comment == null) {
            return;
        }
        if (!dest.fits(comment.measureInline() + 1)) {
            dest.newlineNeeded();
        }
        dest.space();
        comment.renderInline(dest);
    }
}
