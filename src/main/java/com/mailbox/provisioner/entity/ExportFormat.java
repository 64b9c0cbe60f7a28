package com.mailbox.provisioner.entity;

public enum ExportFormat {
    /**
     * email—-password—-totpSecret
     */
    TEXT,
    CSV
}
