package quest.gekko.dcr.service.integration;

import java.util.List;

/** Cumulative brand ratings; brands are ranked on engagement rather than orders. */
public interface BrandRatingSource {
    List<BrandRating> fetchRatings();
}
