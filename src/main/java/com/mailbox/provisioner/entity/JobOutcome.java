package com.mailbox.provisioner.entity;

public enum JobOutcome {
    SUCCEEDED,
    /**
     * 需要人工处理
     */
    FLAGGED,
    FAILED,
    /**
     * 收到停止信号，在步骤之间中止
     */
    INTERRUPTED
}
