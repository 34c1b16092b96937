package com.tyron.ledgercst.core.print;

import com.tyron.ledgercst.core.model.CstNode;
import com.tyron.ledgercst.core.store.Token;
import com.tyron.ledgercst.core.store.TokenStore;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Renders nodes back to text by concatenating the raw text of their span.
 */
public final class CstPrinter {

    private CstPrinter() {
    }

    public static @NotNull String print(@NotNull CstNode node) {
        StringBuilder sb = new StringBuilder();
        try {
            print(node, sb);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return sb.toString();
    }

    public static void print(@NotNull CstNode node, @NotNull Appendable out) throws IOException {
        TokenStore store = node.getTokenStore();
        if (store == null) {
            out.append(node.getFirstToken().getRawText());
            return;
        }
        for (Token token : store.range(node.getFirstToken(), node.getLastToken())) {
            out.append(token.getRawText());
        }
    }
}
