package com.example.roadcare.exception;

import lombok.Getter;

/**
 * 写入阶段失败，事务回滚
 */
@Getter
public class ObsolescenceWriteException extends ObsolescenceRunException {

    public enum Phase {
        RESET, MARK
    }

    private final Phase phase;

    public ObsolescenceWriteException(Phase phase, Throwable cause) {
        super("写入阶段 " + phase + " 失败: " + cause.getMessage(), cause);
        this.phase = phase;
    }
}
