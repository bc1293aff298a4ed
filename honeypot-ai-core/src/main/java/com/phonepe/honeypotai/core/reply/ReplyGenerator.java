package com.phonepe.honeypotai.core.reply;

import com.phonepe.honeypotai.core.model.ReplyContext;

/**
 * Produces the text of the next agent reply
 */
@FunctionalInterface
public interface ReplyGenerator {
    String generate(final ReplyContext context);
}
