package com.lesson.dedup.rest.dto;

import java.util.List;

/**
 * Request DTO naming a set of lessons.
 */
public record LessonIdsRequest(List<String> lessonIds) {
    public LessonIdsRequest {
        lessonIds = lessonIds != null ? lessonIds : List.of();
    }
}
