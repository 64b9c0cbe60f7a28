package com.mailbox.provisioner.entity;

public enum JobKind {
    CREATE,
    CHANGE_PASSWORD
}
