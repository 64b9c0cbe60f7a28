package com.mailbox.provisioner.entity;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

@Getter
@ToString
public class Job {
    private final JobKind kind;
    /**
     * 修改密码时必填，创建时为空
     */
    private final String targetEmail;
    /**
     * 可选的新密码，为空时自动生成
     */
    @ToString.Exclude
    private final String newPassword;
    @Setter
    private ProxyHandle assignedProxy;
    /**
     * 当前步骤的尝试次数，派发前为 0
     */
    @Setter
    private int attempt;
    /**
     * 每个步骤的尝试上限，由引擎按重试策略填入
     */
    @Setter
    private int maxAttempts;

    private Job(JobKind kind, String targetEmail, String newPassword) {
        this.kind = kind;
        this.targetEmail = targetEmail;
        this.newPassword = newPassword;
    }

    public static Job create() {
        return new Job(JobKind.CREATE, null, null);
    }

    public static Job changePassword(String targetEmail) {
        return changePassword(targetEmail, null);
    }

    public static Job changePassword(String targetEmail, String newPassword) {
        if (targetEmail == null || targetEmail.isBlank()) {
            throw new IllegalArgumentException("targetEmail required for password change");
        }
        return new Job(JobKind.CHANGE_PASSWORD, targetEmail.trim(), newPassword);
    }
}
