package com.webparser.prettify;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * The finished output of a {@link Prettifier}.
 *
 * @param text    rendered text
 * @param ops     scope push/pop operations in offset order
 * @param inserts zero-width TeX inserts in offset order
 */
public record PrettifiedCode(String text, List<ScopeOp> ops, List<PositionedInsert> inserts) {

    public PrettifiedCode {
        ops = List.copyOf(ops);
        inserts = List.copyOf(inserts);
    }

    /**
     * Whether the array-table macro idiom is in use, signalled by a marker at offset zero.
     */
    public boolean usesArrayMacro() {
        return !inserts.isEmpty()
            && inserts.get(0).offset() == 0
            && inserts.get(0).insert() instanceof TexInsert.ArrayMacroMarker;
    }

    /**
     * Splits the text into runs, each tagged with the innermost active scope.
     */
    public List<StyledSpan> spans(ScopeTable table) {
        List<StyledSpan> spans = new ArrayList<>();
        Deque<Scope> stack = new ArrayDeque<>();
        stack.push(table.initial());
        int pos = 0;

        for (ScopeOp op : ops) {
            if (op.offset() > pos) {
                spans.add(new StyledSpan(stack.peek(), text.substring(pos, op.offset())));
                pos = op.offset();
            }
            if (op.kind() == ScopeOp.Kind.PUSH) {
                stack.push(op.scope());
            } else if (stack.size() > 1) {
                stack.pop();
            }
        }

        if (pos < text.length()) {
            spans.add(new StyledSpan(stack.peek(), text.substring(pos)));
        }

        return spans;
    }
}
