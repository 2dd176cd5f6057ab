package com.poultry.review.engine;

import com.poultry.review.engine.checks.ProgramTrackCheck;
import com.poultry.review.model.ApplicantSnapshot;
import com.poultry.review.model.Application;
import com.poultry.review.model.QueueEntry;
import org.springframework.stereotype.Component;

import java.util.Comparator;

/**
 * Computes how soon a queue entry should be reviewed. Higher is sooner.
 *
 * <p>Score components:
 * <ul>
 *   <li>sponsored program track: +50</li>
 *   <li>verified email: +25, verified phone: +25</li>
 *   <li>two or more years of poultry experience: +10</li>
 *   <li>existing program beneficiary: +10</li>
 *   <li>days waited since submission: +1 per day, at most +30</li>
 *   <li>SLA urgency: +15 within two days of the deadline, +30 within one day, +40 once overdue</li>
 * </ul>
 * Nothing here is stored as the authoritative order; listings recompute it.
 */
@Component
public class PriorityRanker {

    static final long DAY_MS = 24L * 60 * 60 * 1000;

    static final int SPONSORED_TRACK_BONUS = 50;
    static final int VERIFIED_EMAIL_BONUS = 25;
    static final int VERIFIED_PHONE_BONUS = 25;
    static final int EXPERIENCE_BONUS = 10;
    static final int EXPERIENCE_MIN_YEARS = 2;
    static final int BENEFICIARY_BONUS = 10;
    static final int MAX_WAIT_BONUS = 30;
    static final int URGENCY_TWO_DAYS = 15;
    static final int URGENCY_ONE_DAY = 30;
    static final int URGENCY_OVERDUE = 40;

    /**
     * Queue order: score descending, then earliest submission, then entry id.
     */
    public static final Comparator<QueueEntry> QUEUE_ORDER = Comparator
            .comparingInt(QueueEntry::getPriorityScore).reversed()
            .thenComparingLong(QueueEntry::getSubmittedAt)
            .thenComparing(QueueEntry::getEntryId);

    public int rank(Application application, QueueEntry entry, long now) {
        int score = 0;

        if (application.getEligibilityFlags() != null
                && application.getEligibilityFlags().contains(ProgramTrackCheck.FLAG)) {
            score += SPONSORED_TRACK_BONUS;
        }

        ApplicantSnapshot snapshot = application.getSnapshot();
        if (snapshot != null) {
            if (snapshot.isEmailVerified()) score += VERIFIED_EMAIL_BONUS;
            if (snapshot.isPhoneVerified()) score += VERIFIED_PHONE_BONUS;
            if (snapshot.getYearsExperience() >= EXPERIENCE_MIN_YEARS) score += EXPERIENCE_BONUS;
            if (snapshot.isExistingBeneficiary()) score += BENEFICIARY_BONUS;
        }

        long submittedAt = application.getSubmittedAt() > 0 ? application.getSubmittedAt() : entry.getSubmittedAt();
        if (submittedAt > 0 && now > submittedAt) {
            score += (int) Math.min(MAX_WAIT_BONUS, (now - submittedAt) / DAY_MS);
        }

        score += urgency(entry.getSlaDeadline(), now);
        return score;
    }

    private int urgency(long slaDeadline, long now) {
        if (slaDeadline <= 0) return 0;
        long remaining = slaDeadline - now;
        if (remaining < 0) return URGENCY_OVERDUE;
        if (remaining <= DAY_MS) return URGENCY_ONE_DAY;
        if (remaining <= 2 * DAY_MS) return URGENCY_TWO_DAYS;
        return 0;
    }
}
