package quest.gekko.dcr.domain;

public enum ChallengePhase {
    FIRST_HALF,
    HALFTIME_WINDOW,
    SECOND_HALF,
    OVERTIME,
    COMPLETE
}
