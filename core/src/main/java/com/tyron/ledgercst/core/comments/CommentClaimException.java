package com.tyron.ledgercst.core.comments;

/**
 * Thrown when a comment cannot be claimed or unclaimed by a node.
 */
public class CommentClaimException extends RuntimeException {

    public CommentClaimException(String message) {
        super(message);
    }
}
