package com.taskboard.task.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

@Getter
@RequiredArgsConstructor
public enum TaskPriority {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    URGENT("urgent");

    @JsonValue
    private final String value;

    @JsonCreator
    public static TaskPriority fromValue(String value) {
        return Arrays.stream(values())
                .filter(priority -> priority.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Invalid priority. Must be: low, medium, high, or urgent"));
    }
}
