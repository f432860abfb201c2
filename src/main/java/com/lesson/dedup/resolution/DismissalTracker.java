package com.lesson.dedup.resolution;

import com.lesson.dedup.core.model.DetectionMethod;
import com.lesson.dedup.core.model.DismissalRecord;
import com.lesson.dedup.core.model.LessonIdSet;
import com.lesson.dedup.store.StoreSession;

import java.time.Instant;
import java.util.UUID;

/**
 * Records that an exact set of lessons are distinct. No lesson is modified.
 */
public class DismissalTracker {

    public DismissalRecord dismiss(StoreSession session, LessonIdSet lessonIds, DetectionMethod detectionMethod,
                                   String notes, String actorId, Instant now) {
        if (lessonIds.size() < 2) {
            throw ResolutionException.invalidArgument("A dismissal needs at least two distinct lesson ids");
        }
        for (String id : lessonIds.ids()) {
            if (session.findLesson(id).isPresent()) {
                continue;
            }
            if (session.findArchive(id).isPresent()) {
                throw ResolutionException.conflict("Lesson " + id + " has already been archived",
                        "Re-run duplicate detection; the group has changed");
            }
            throw ResolutionException.notFound("Lesson not found: " + id);
        }
        for (DismissalRecord existing : session.findDismissals()) {
            if (existing.matches(lessonIds)) {
                throw ResolutionException.conflict("Group " + lessonIds.key() + " was already dismissed",
                        "No action needed");
            }
        }

        DismissalRecord record = new DismissalRecord(UUID.randomUUID().toString(), lessonIds, actorId, now,
                detectionMethod, notes);
        session.appendDismissal(record);
        return record;
    }
}
