package quest.gekko.dcr.web.dto;

import java.time.Instant;

/**
 * @param durationHours defaults to a full day when omitted
 */
public record TimingsRequest(Instant startTime, Integer durationHours) {}
