package com.mailbox.provisioner.service;

import com.mailbox.provisioner.entity.AccountStatus;
import com.mailbox.provisioner.entity.JobOutcome;

import java.util.List;

/**
 * @param path every status the record passed through, starting with the status it entered the run in
 * @param reason why the job did not succeed, {@code null} on success
 */
public record WorkflowResult(JobOutcome outcome, AccountStatus finalStatus, List<AccountStatus> path, String reason) {

    public WorkflowResult {
        path = List.copyOf(path);
    }
}
