package quest.gekko.dcr.service.integration;

public record BrandRating(String name, int totalRatings, double averageRating, double bayesianAverage) {
}
