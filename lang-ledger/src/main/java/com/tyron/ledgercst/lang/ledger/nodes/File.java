package com.tyron.ledgercst.lang.ledger.nodes;

import com.tyron.ledgercst.core.comments.RepeatedWithComments;
import com.tyron.ledgercst.core.fields.FieldDescriptor;
import com.tyron.ledgercst.core.fields.NodeLayout;
import com.tyron.ledgercst.core.fields.RepeatedList;
import com.tyron.ledgercst.core.model.CstNode;
import com.tyron.ledgercst.core.model.Repeated;
import com.tyron.ledgercst.core.model.TokenTransformer;
import com.tyron.ledgercst.core.model.TreeNode;
import com.tyron.ledgercst.core.parser.ParsedChildren;
import com.tyron.ledgercst.core.spacing.Newline;
import com.tyron.ledgercst.core.store.Token;
import com.tyron.ledgercst.core.store.TokenStore;
import com.tyron.ledgercst.lang.ledger.parser.LedgerGrammarParser;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * Root of a parsed ledger. Spans the whole store, so text before the first directive and
 * after the last one is printed with the file.
 */
public final class File extends TreeNode {

    public static final FieldDescriptor DIRECTIVES = FieldDescriptor.repeated("directives", Newline::fromDefault, Newline::fromDefault)
            .withSeparatorsBefore();

    public static final NodeLayout LAYOUT = NodeLayout.of(LedgerGrammarParser.FILE, DIRECTIVES);

    private Repeated<CstNode> directives;
    private final RepeatedWithComments<Directive> directivesWithComments;

    public File(@NotNull TokenStore tokenStore, @NotNull Repeated<CstNode> directives) {
        super(tokenStore);
        this.directives = Objects.requireNonNull(directives, "directives");
        this.directivesWithComments = new RepeatedWithComments<>(directives, DIRECTIVES, this, Directive.class);
    }

    public static @NotNull File fromParsed(@NotNull TokenStore store, @NotNull ParsedChildren children) {
        return new File(store, children.repeated(DIRECTIVES.name(), CstNode.class));
    }

    /**
     * Builds a file from directives (and block comments), separated by blank lines.
     */
    public static @NotNull File fromChildren(@NotNull List<? extends CstNode> directives) {
        Repeated<CstNode> repeated = Repeated.fromChildren(directives, DIRECTIVES::newSeparators, DIRECTIVES::newSeparatorsBefore, null);
        return new File(repeated.getTokenStore(), repeated);
    }

    /**
     * Directives with the block comments claimed between them.
     */
    public @NotNull RepeatedWithComments<Directive> getDirectives() {
        return directivesWithComments;
    }

    public @NotNull RepeatedList<CstNode> getRawDirectives() {
        return directivesWithComments.raw();
    }

    @Override
    public @NotNull Token getFirstToken() {
        Token first = tokenStore.getFirst();
        return first != null ? first : directives.getFirstToken();
    }

    @Override
    public @NotNull Token getLastToken() {
        Token last = tokenStore.getLast();
        return last != null ? last : directives.getLastToken();
    }

    @Override
    public void autoClaimComments() {
        directivesWithComments.autoClaimComments();
    }

    @Override
    protected @NotNull File cloneNode(@NotNull TokenStore store, @NotNull TokenTransformer transformer) {
        return new File(store, cloneChild(directives, store, transformer));
    }

    @Override
    protected void reattachChildren(@NotNull TokenStore store, @NotNull TokenTransformer transformer) {
        directives = reattachChild(directives, store, transformer);
    }

    @Override
    protected @NotNull List<?> getChildren() {
        return List.of(directives);
    }
}
