package org.example.kbsync.common;

import org.example.kbsync.entity.ProcessingStatus;

/**
 * 状态机不允许的迁移，对调用方表现为 409
 */
public class IllegalStateTransitionException extends BusinessException {

    public IllegalStateTransitionException(Long docId, ProcessingStatus from, String transition) {
        super(ResultCode.CONFLICT, "文档 " + docId + " 当前状态为 " + from.getValue() + "，不允许执行: " + transition);
    }
}
