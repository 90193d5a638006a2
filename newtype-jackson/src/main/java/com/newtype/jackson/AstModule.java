package com.newtype.jackson;

import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.newtype.ast.*;
import com.newtype.jackson.mixins.ConditionMixin;
import com.newtype.jackson.mixins.ExpressionMixin;
import com.newtype.jackson.mixins.ImportClauseMixin;
import com.newtype.jackson.mixins.ImportSpecifierMixin;
import com.newtype.jackson.mixins.StatementMixin;

/**
 * Gives each sealed AST family a {@code "type"} discriminator so that a
 * {@code Statement}, {@code Expression}, {@code Condition} or import clause can be
 * read back as the right record.
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("NewtypeAstModule", new Version(1, 0, 0, null, "com.newtype", "newtype-jackson"));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Statement.class, StatementMixin.class);
        context.setMixInAnnotations(Expression.class, ExpressionMixin.class);
        context.setMixInAnnotations(Condition.class, ConditionMixin.class);
        context.setMixInAnnotations(ImportClause.class, ImportClauseMixin.class);
        context.setMixInAnnotations(ImportSpecifier.class, ImportSpecifierMixin.class);
    }
}
