package com.example.roadcare.exception;

import lombok.Getter;

/**
 * 某条轴线的分区处理失败，整次运行随之中止
 */
@Getter
public class PartitionProcessingException extends ObsolescenceRunException {

    private final String axis;

    public PartitionProcessingException(String axis, Throwable cause) {
        super("轴线分区处理失败: " + axis + " (" + cause.getMessage() + ")", cause);
        this.axis = axis;
    }
}
