package com.interviewpilot.orchestrator.model;

/**
 * A queued follow-up prompt and the point it asks about.
 *
 * @param point  the missing point this follow-up addresses (null for a judge
 *               suggestion that is not tied to one point)
 * @param prompt text shown to the candidate
 */
public record FollowUp(String point, String prompt) {

    public static FollowUp forPoint(String point) {
        return new FollowUp(point,
                "You didn't mention “" + point + "”. Could you add details regarding " + point + "?");
    }
}
