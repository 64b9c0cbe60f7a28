package com.mailbox.provisioner.driver;

/**
 * Result of one browser-driver step.
 */
public enum StepOutcome {
    SUCCESS,
    /**
     * 网络超时、代理被拒等，可换代理重试
     */
    TRANSIENT_FAILURE,
    /**
     * 出现验证码等无法自动处理的挑战
     */
    NEEDS_MANUAL_INTERVENTION,
    /**
     * 远端拒绝，重试无意义
     */
    FATAL_FAILURE
}
