package com.webparser.prettify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.OptionalInt;

/**
 * Width-constrained rendering context.
 *
 * <p>Accumulates output text in a single forward pass, together with style scope
 * push/pop operations and zero-width TeX inserts, both keyed by character offset.
 * Newlines are deferred: {@link #newlineNeeded()} only records that the next
 * append must start on a fresh line.</p>
 *
 * <p>A prettifier is used once; {@link #finish()} hands over the result and
 * closes it.</p>
 */
public class Prettifier {
    private static final Logger log = LoggerFactory.getLogger(Prettifier.class);

    /** Width reported by items that must never be rendered inline. */
    public static final int NOT_INLINE = 9999;

    public static final int BLOCK_STEP = 4;
    public static final int SMALL_STEP = 2;

    private final int fullWidth;
    private final ScopeTable scopes;
    private final ModuleIdResolver resolver;

    private final StringBuilder text = new StringBuilder();
    private final List<ScopeOp> ops = new ArrayList<>();
    private final List<PositionedInsert> inserts = new ArrayList<>();

    // Steps actually applied by indent calls, so refused indents are not undone by dedents.
    private final Deque<Integer> steps = new ArrayDeque<>();

    private int indent = 0;
    private int remainingWidth;
    // Columns kept free at the end of the line for text that follows the item being laid out.
    private int reservedTrailing = 0;
    private boolean newlineNeeded = false;
    private boolean finished = false;

    public Prettifier() {
        this(PrettifierConfig.defaults(), ModuleIdResolver.NONE);
    }

    public Prettifier(PrettifierConfig config) {
        this(config, ModuleIdResolver.NONE);
    }

    public Prettifier(PrettifierConfig config, ModuleIdResolver resolver) {
        this.fullWidth = config.fullWidth();
        this.scopes = config.scopes();
        this.resolver = resolver != null ? resolver : ModuleIdResolver.NONE;
        this.remainingWidth = fullWidth;
    }

    // ========================================================================
    // State
    // ========================================================================

    public ScopeTable scopes() {
        return scopes;
    }

    public int fullWidth() {
        return fullWidth;
    }

    public int indent() {
        return indent;
    }

    public int remainingWidth() {
        return remainingWidth;
    }

    public int reservedTrailing() {
        return reservedTrailing;
    }

    /**
     * Keep {@code width} columns free for text that will follow what is rendered
     * next, such as a semicolon. Width checks count the reservation until it is
     * replaced.
     *
     * @return the previous reservation, to be restored afterwards
     */
    public int reserveTrailing(int width) {
        if (width < 0) {
            throw new IllegalArgumentException("Negative reservation: " + width);
        }
        int previous = reservedTrailing;
        reservedTrailing = width;
        return previous;
    }

    public boolean isNewlinePending() {
        return newlineNeeded;
    }

    /**
     * Whether an item of the given width fits. If a newline is pending, the
     * item will start on a fresh line, so the whole line minus the indent counts.
     */
    public boolean fits(int width) {
        if (newlineNeeded) {
            return width + reservedTrailing <= fullWidth - indent;
        }
        return width + reservedTrailing <= remainingWidth;
    }

    /**
     * Whether an item of the given width would fit on a fresh line at the current indent.
     */
    public boolean wouldFitOnNewLine(int width) {
        return width + reservedTrailing <= fullWidth - indent;
    }

    // ========================================================================
    // Indentation
    // ========================================================================

    public void indentBlock() {
        indent(BLOCK_STEP);
    }

    public void dedentBlock() {
        dedent(BLOCK_STEP);
    }

    public void indentSmall() {
        indent(SMALL_STEP);
    }

    public void dedentSmall() {
        dedent(SMALL_STEP);
    }

    private void indent(int step) {
        ensureOpen();
        if (fullWidth - indent > step) {
            indent += step;
            steps.push(step);
        } else {
            log.trace("Refusing indent by {} at indent {} (width {})", step, indent, fullWidth);
            steps.push(0);
        }
    }

    private void dedent(int step) {
        ensureOpen();
        Integer applied = steps.poll();
        if (applied == null || indent < step) {
            log.trace("Refusing dedent by {} at indent {}", step, indent);
            return;
        }
        if (applied != 0 && applied != step) {
            throw new IllegalStateException("Dedent by " + step + " does not match indent by " + applied);
        }
        indent -= applied;
    }

    // ========================================================================
    // Line breaks
    // ========================================================================

    /**
     * Emit a newline and the current indent right away.
     */
    public void newlineIndent() {
        ensureOpen();
        text.append('\n');
        text.append(" ".repeat(indent));
        newlineNeeded = false;
        remainingWidth = fullWidth - indent;
    }

    /**
     * Request that the next output starts on a new line.
     */
    public void newlineNeeded() {
        ensureOpen();
        newlineNeeded = true;
    }

    private void maybeNewline() {
        if (newlineNeeded) {
            newlineIndent();
        }
    }

    /**
     * A blank line between toplevel items.
     */
    public void toplevelSeparator() {
        ensureOpen();
        text.append('\n');
        newlineIndent();
    }

    // ========================================================================
    // Output
    // ========================================================================

    public void noscopePush(String s) {
        ensureOpen();
        maybeNewline();
        append(s);
    }

    public void noscopePush(char c) {
        noscopePush(String.valueOf(c));
    }

    /**
     * A single space, unless a newline is pending.
     */
    public void space() {
        ensureOpen();
        if (newlineNeeded) {
            return;
        }
        append(" ");
    }

    public void scopePush(Scope scope, String s) {
        ensureOpen();
        maybeNewline();
        addOp(ScopeOp.push(text.length(), scope));
        append(s);
        addOp(ScopeOp.pop(text.length()));
    }

    public void keyword(String s) {
        scopePush(scopes.keyword(), s);
    }

    /**
     * Run {@code body} with {@code scope} pushed around everything it emits.
     */
    public void withScope(Scope scope, Runnable body) {
        ensureOpen();
        maybeNewline();
        addOp(ScopeOp.push(text.length(), scope));
        body.run();
        addOp(ScopeOp.pop(text.length()));
    }

    /**
     * Record a zero-width insert at the current position.
     *
     * @param textNext whether text follows immediately, in which case a pending
     *                 newline is flushed first so the insert lands after it
     */
    public void insert(TexInsert insert, boolean textNext) {
        ensureOpen();
        if (textNext) {
            maybeNewline();
        }
        int offset = text.length();
        if (!inserts.isEmpty() && inserts.get(inserts.size() - 1).offset() > offset) {
            throw new IllegalStateException("Insert offset regressed to " + offset);
        }
        inserts.add(new PositionedInsert(offset, insert));
    }

    /**
     * Render a module reference, wrapped in cross-reference markup when the
     * module's ID is known.
     */
    public void moduleReference(String name) {
        OptionalInt id = resolver.resolve(name);
        if (id.isPresent()) {
            insert(new TexInsert.ModuleReferenceStart(id.getAsInt()), true);
            noscopePush("<" + name + ">");
            insert(new TexInsert.MacroEnd(), false);
        } else {
            noscopePush("<" + name + ">");
        }
    }

    private void append(String s) {
        text.append(s);
        remainingWidth = Math.max(0, remainingWidth - s.length());
    }

    private void addOp(ScopeOp op) {
        if (!ops.isEmpty() && ops.get(ops.size() - 1).offset() > op.offset()) {
            throw new IllegalStateException("Scope op offset regressed to " + op.offset());
        }
        ops.add(op);
    }

    // ========================================================================
    // Result
    // ========================================================================

    public PrettifiedCode finish() {
        ensureOpen();
        finished = true;
        return new PrettifiedCode(text.toString(), List.copyOf(ops), List.copyOf(inserts));
    }

    private void ensureOpen() {
        if (finished) {
            throw new IllegalStateException("Prettifier already finished");
        }
    }
}
