package com.tyron.ledgercst.core.comments;

import com.tyron.ledgercst.core.model.CstNode;
import com.tyron.ledgercst.core.model.TokenNode;
import com.tyron.ledgercst.core.model.TokenTransformer;
import com.tyron.ledgercst.core.store.TokenStore;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * One or more consecutive full-line comments sharing an indentation:
 * <pre>
 *     ; first line
 *     ; second line
 * </pre>
 * The value is the text after {@code ;} on every line, joined by newlines. Changing the
 * value or indent re-renders the raw text.
 * <p>
 * {@link #isClaimed()} records whether a node owns the comment as a leading, trailing or
 * interleaved comment. The flag is not part of the text. {@link #copy()} drops it; cloning a
 * tree keeps it on the cloned comment.
 */
public final class BlockComment extends TokenNode {

    public static final String TYPE = "BLOCK_COMMENT";

    private String indent;
    private String value;
    private boolean claimed;

    public BlockComment(@NotNull String rawText) {
        super(rawText);
        String[] parsed = parse(rawText);
        this.indent = parsed[0];
        this.value = parsed[1];
    }

    public static @NotNull BlockComment fromValue(@NotNull String value) {
        return fromValue(value, "");
    }

    public static @NotNull BlockComment fromValue(@NotNull String value, @NotNull String indent) {
        return new BlockComment(format(indent, value));
    }

    public @NotNull String getValue() {
        return value;
    }

    public void setValue(@NotNull String value) {
        Objects.requireNonNull(value, "value");
        super.setRawText(format(indent, value));
        this.value = value;
    }

    public @NotNull String getIndent() {
        return indent;
    }

    public void setIndent(@NotNull String indent) {
        Objects.requireNonNull(indent, "indent");
        super.setRawText(format(indent, value));
        this.indent = indent;
    }

    @Override
    public void setRawText(@NotNull String rawText) {
        String[] parsed = parse(rawText);
        super.setRawText(rawText);
        this.indent = parsed[0];
        this.value = parsed[1];
    }

    public boolean isClaimed() {
        return claimed;
    }

    public void setClaimed(boolean claimed) {
        this.claimed = claimed;
    }

    @Override
    public @NotNull CstNode cloneInto(@NotNull TokenStore store, @NotNull TokenTransformer transformer) {
        BlockComment clone = transformer.transform(this);
        clone.setClaimed(claimed);
        return clone;
    }

    @Override
    public @NotNull BlockComment copy() {
        return new BlockComment(getRawText());
    }

    private static String[] parse(String rawText) {
        String[] lines = rawText.split("\n", -1);
        String indent = null;
        StringBuilder value = new StringBuilder();
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            int semicolon = line.indexOf(';');
            if (semicolon < 0) {
                throw new IllegalArgumentException("not a block comment line: '" + line + "'");
            }
            if (indent == null) {
                indent = line.substring(0, semicolon);
            }
            int start = semicolon + 1;
            while (start < line.length() && (line.charAt(start) == ' ' || line.charAt(start) == '\t')) {
                start++;
            }
            if (i > 0) {
                value.append('\n');
            }
            value.append(line, start, line.length());
        }
        return new String[]{indent, value.toString()};
    }

    private static String format(String indent, String value) {
        String[] lines = value.split("\n", -1);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(indent).append(';');
            if (!lines[i].isEmpty()) {
                sb.append(' ').append(lines[i]);
            }
        }
        return sb.toString();
    }
}
