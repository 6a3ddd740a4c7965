package com.webparser.jackson;

import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.webparser.Token;
import com.webparser.ast.CaseItem;
import com.webparser.ast.IndexTerm;
import com.webparser.ast.ListLiteralTerm;
import com.webparser.ast.RangeBound;
import com.webparser.ast.SyntaxNode;
import com.webparser.ast.WebExpr;
import com.webparser.ast.WebStatement;
import com.webparser.ast.WebToplevel;
import com.webparser.ast.WebType;
import com.webparser.jackson.mixins.NodeMixin;
import com.webparser.jackson.mixins.ScopeMixin;
import com.webparser.jackson.mixins.TokenMixin;
import com.webparser.prettify.Scope;
import com.webparser.prettify.TexInsert;

/**
 * Jackson module that configures serialization for the syntax tree and layout classes.
 *
 * This module handles:
 * - Polymorphic type tags on nodes and TeX inserts via NodeMixin
 * - Scopes written as plain strings
 * - Tokens read through their canonical constructor
 */
public class SyntaxModule extends SimpleModule {

    public SyntaxModule() {
        super("SyntaxModule", new Version(1, 0, 0, null, "com.webparser", "weblang-jackson"));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        // Mixin inheritance from interfaces is not consistent, so each sealed root gets its own
        context.setMixInAnnotations(SyntaxNode.class, NodeMixin.class);
        context.setMixInAnnotations(WebToplevel.class, NodeMixin.class);
        context.setMixInAnnotations(WebStatement.class, NodeMixin.class);
        context.setMixInAnnotations(WebExpr.class, NodeMixin.class);
        context.setMixInAnnotations(WebType.class, NodeMixin.class);
        context.setMixInAnnotations(IndexTerm.class, NodeMixin.class);
        context.setMixInAnnotations(RangeBound.class, NodeMixin.class);
        context.setMixInAnnotations(ListLiteralTerm.class, NodeMixin.class);
        context.setMixInAnnotations(CaseItem.class, NodeMixin.class);
        context.setMixInAnnotations(TexInsert.class, NodeMixin.class);

        context.setMixInAnnotations(Scope.class, ScopeMixin.class);
        context.setMixInAnnotations(Token.class, TokenMixin.class);
    }
}
