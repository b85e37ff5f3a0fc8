package quest.gekko.dcr.service.challenge;

/**
 * How halftime substitutions draw down a team's budget.
 */
public enum SubstitutionBudgetMode {
    /** One unit per distinct position; changing the same position again is free. */
    PER_POSITION,
    /** One unit per accepted change, including repeats on the same position. */
    PER_CHANGE
}
