package com.mailbox.provisioner.entity;

import java.time.LocalDate;
import java.time.Period;

/**
 * 注册时提交的身份信息。
 */
public record Identity(
        String email,
        String password,
        String firstName,
        String lastName,
        LocalDate birthDate
) {
    public static final int MINIMUM_AGE = 18;

    public String displayName() {
        return firstName + " " + lastName;
    }

    public int ageOn(LocalDate date) {
        return Period.between(birthDate, date).getYears();
    }

    @Override
    public String toString() {
        return "Identity[email=" + email + ", name=" + displayName() + ", birthDate=" + birthDate + "]";
    }
}
