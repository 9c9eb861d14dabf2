package com.ryuqq.workpool.core.channel;

/**
 * 닫힌 채널에 원소를 보내려 할 때 발생.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ChannelClosedException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public ChannelClosedException(String message) {
        super(message);
    }
}
