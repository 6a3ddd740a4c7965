package com.webparser.ast;

import com.webparser.prettify.ModuleIdResolver;
import com.webparser.prettify.PrettifiedCode;
import com.webparser.prettify.Prettifier;
import com.webparser.prettify.PrettifierConfig;

import java.util.List;

/**
 * A parsed code section: the sequence of toplevels.
 */
public record WebCode(List<WebToplevel> toplevels) {

    public WebCode {
        toplevels = List.copyOf(toplevels);
    }

    public void prettify(Prettifier dest) {
        boolean first = true;
        for (WebToplevel tl : toplevels) {
            if (first) {
                first = false;
            } else {
                dest.newlineNeeded();
            }
            tl.prettify(dest);
        }
    }

    /**
     * Lay out the whole section with a fresh prettifier.
     */
    public PrettifiedCode render(PrettifierConfig config, ModuleIdResolver resolver) {
        Prettifier dest = new Prettifier(config, resolver);
        prettify(dest);
        return dest.finish();
    }
}
