package quest.gekko.dcr.domain;

public enum ChallengeStatus {
    OPEN,
    ACTIVE,
    COMPLETE
}
