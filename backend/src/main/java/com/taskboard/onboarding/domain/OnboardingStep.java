package com.taskboard.onboarding.domain;

import com.taskboard.exception.InvalidRequestException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

@Getter
@RequiredArgsConstructor
public enum OnboardingStep {
    WELCOME("welcome"),
    PROFILE("profile"),
    TOUR("tour"),
    ROLES("roles"),
    GETTING_STARTED("getting-started");

    public static final int TOTAL_STEPS = values().length;

    private final String value;

    /**
     * 1-based step number.
     */
    public int number() {
        return ordinal() + 1;
    }

    public static OnboardingStep fromNumber(int number) {
        if (number < 1 || number > TOTAL_STEPS) {
            throw new InvalidRequestException("Invalid step. Must be between 1 and " + TOTAL_STEPS);
        }
        return values()[number - 1];
    }

    public static OnboardingStep fromValue(String value) {
        return Arrays.stream(values())
                .filter(step -> step.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new InvalidRequestException("Invalid step. Must be between 1 and " + TOTAL_STEPS));
    }

    public static List<String> names() {
        return Arrays.stream(values()).map(OnboardingStep::getValue).collect(Collectors.toList());
    }
}
