package quest.gekko.dcr.service.integration;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import quest.gekko.dcr.config.RankerProperties;

import java.util.List;

@Service
@RequiredArgsConstructor
public class MetabaseBrandRatingSource implements BrandRatingSource {
    private final MetabaseClient metabase;
    private final RankerProperties.Metabase props;

    @Override
    public List<BrandRating> fetchRatings() {
        return metabase.executeCard(props.cards().brandRatings()).stream()
                .map(row -> new BrandRating(
                        MetabaseRows.string(row, "brandName", "BrandName", "name"),
                        (int) MetabaseRows.longValue(row, "totalRatings", "TotalRatings"),
                        MetabaseRows.doubleValue(row, "averageRating", "AverageRating"),
                        MetabaseRows.doubleValue(row, "bayesianAverage", "BayesianAverage")))
                .toList();
    }
}
