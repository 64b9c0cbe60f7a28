package com.mailbox.provisioner.driver;

import com.mailbox.provisioner.entity.Identity;
import com.mailbox.provisioner.entity.ProxyHandle;

/**
 * Implementations report expected results through {@link StepOutcome}; a thrown
 * {@link RuntimeException} is handled as {@link StepOutcome#TRANSIENT_FAILURE}.
 */
public interface BrowserDriver extends AutoCloseable {

    StepOutcome submitSignupForm(Identity identity, ProxyHandle proxy);

    StepOutcome submitVerification(String challengeResponse, ProxyHandle proxy);

    StepOutcome bindTotp(String secret, ProxyHandle proxy);

    StepOutcome submitPasswordChange(String email, String oldPassword, String newPassword, ProxyHandle proxy);

    @Override
    void close();
}
