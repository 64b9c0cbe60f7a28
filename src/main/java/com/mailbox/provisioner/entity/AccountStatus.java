package com.mailbox.provisioner.entity;

import java.util.EnumSet;
import java.util.Set;

public enum AccountStatus {
    /**
     * 已生成身份信息，尚未提交注册表单
     */
    INITIATED,
    /**
     * 注册表单已提交
     */
    FORM_SUBMITTED,
    /**
     * 等待验证
     */
    VERIFICATION_PENDING,
    /**
     * 验证通过
     */
    VERIFIED,
    /**
     * TOTP 已绑定
     */
    TOTP_BOUND,
    /**
     * 可用账号
     */
    ACTIVE,
    /**
     * 已请求修改密码
     */
    PASSWORD_CHANGE_REQUESTED,
    /**
     * 密码已修改
     */
    PASSWORD_CHANGED,
    /**
     * 失败（终态）
     */
    FAILED;

    public boolean isTerminal() {
        return this == FAILED;
    }

    public boolean canTransitionTo(AccountStatus next) {
        return next != null && successors().contains(next);
    }

    public Set<AccountStatus> successors() {
        return switch (this) {
            case INITIATED -> EnumSet.of(FORM_SUBMITTED, FAILED);
            case FORM_SUBMITTED -> EnumSet.of(VERIFICATION_PENDING, FAILED);
            case VERIFICATION_PENDING -> EnumSet.of(VERIFIED, FAILED);
            case VERIFIED -> EnumSet.of(TOTP_BOUND, FAILED);
            case TOTP_BOUND -> EnumSet.of(ACTIVE, FAILED);
            case ACTIVE -> EnumSet.of(PASSWORD_CHANGE_REQUESTED, FAILED);
            case PASSWORD_CHANGE_REQUESTED -> EnumSet.of(PASSWORD_CHANGED, FAILED);
            case PASSWORD_CHANGED -> EnumSet.of(ACTIVE, FAILED);
            case FAILED -> EnumSet.noneOf(AccountStatus.class);
        };
    }

    /**
     * TOTP_BOUND 及之后的状态必须持有密钥。
     */
    public boolean requiresTotpSecret() {
        return this == TOTP_BOUND
                || this == ACTIVE
                || this == PASSWORD_CHANGE_REQUESTED
                || this == PASSWORD_CHANGED;
    }
}
