package quest.gekko.dcr.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;

@Entity
@Table(name = "daily_team_score",
        uniqueConstraints = @UniqueConstraint(columnNames = { "challenge_id", "team_id", "stat_date" }))
@Getter @Setter
public class DailyTeamScore {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "challenge_id", nullable = false)
    Long challengeId;

    @Column(name = "team_id", nullable = false)
    Long teamId;

    @Column(name = "stat_date", nullable = false)
    LocalDate statDate;

    int totalPoints;
}
