package org.planet.core.mapping;

import org.planet.core.climate.BiomeType;
import org.planet.core.climate.Classification;
import org.planet.core.climate.ClimateType;
import org.planet.core.climate.EcologyType;
import org.planet.core.climate.HumidityType;
import org.planet.core.climate.TemperatureModel;
import org.planet.core.climate.TemperatureRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Result of one map run: every grid shares the projection's (x, y) indexing.
 * Grids are frozen on {@link Builder#build()}; layers whose stage was disabled are null.
 */
public final class SurfaceMaps {

    private final String planetId;
    private final MapProjection projection;
    private final int seasonCount;
    private final double maxElevation;
    private final double seaLevel;
    private final boolean hydrosphere;

    private final FloatGrid elevation;
    private final RangeGrid temperature;
    private final FloatGrid winterTemperature;
    private final FloatGrid summerTemperature;
    private final List<SeasonMaps> seasons;
    private final FloatGrid totalPrecipitation;
    private final FloatGrid averagePrecipitation;
    private final FloatGrid totalSnowfall;
    private final HydrologyMaps hydrology;
    private final EnumGrid<HumidityType> humidity;
    private final EnumGrid<ClimateType> climate;
    private final EnumGrid<EcologyType> ecology;
    private final EnumGrid<BiomeType> biome;
    private final CoverGrid seaIce;
    private final CoverGrid snowCover;
    private final Map<String, FloatGrid> resources;

    private final double averageElevation;
    private final int landCellCount;
    private final TemperatureRange overallTemperature;
    private final ValueRange totalPrecipitationRange;
    private final ValueRange totalSnowfallRange;
    private final Classification overallClassification;
    private final double maxPrecipitation;

    private SurfaceMaps(Builder b) {
        if (b.projection == null) throw new IllegalArgumentException("projection is required");
        if (b.elevation == null) throw new IllegalArgumentException("elevation grid is required");
        this.planetId = b.planetId;
        this.projection = b.projection;
        this.seasonCount = b.seasonCount;
        this.maxElevation = b.maxElevation;
        this.seaLevel = b.seaLevel;
        this.hydrosphere = b.hydrosphere;

        this.elevation = b.elevation.freeze();
        this.temperature = b.temperature == null ? null : b.temperature.freeze();
        this.winterTemperature = freeze(b.winterTemperature);
        this.summerTemperature = freeze(b.summerTemperature);
        List<SeasonMaps> s = new ArrayList<>();
        for (SeasonMaps m : b.seasons) s.add(m.freeze());
        this.seasons = Collections.unmodifiableList(s);
        this.totalPrecipitation = freeze(b.totalPrecipitation);
        this.averagePrecipitation = freeze(b.averagePrecipitation);
        this.totalSnowfall = freeze(b.totalSnowfall);
        this.hydrology = b.hydrology == null ? null : b.hydrology.freeze();
        this.humidity = b.humidity == null ? null : b.humidity.freeze();
        this.climate = b.climate == null ? null : b.climate.freeze();
        this.ecology = b.ecology == null ? null : b.ecology.freeze();
        this.biome = b.biome == null ? null : b.biome.freeze();
        this.seaIce = b.seaIce == null ? null : b.seaIce.freeze();
        this.snowCover = b.snowCover == null ? null : b.snowCover.freeze();
        Map<String, FloatGrid> r = new TreeMap<>();
        b.resources.forEach((k, v) -> r.put(k, v.freeze()));
        this.resources = Collections.unmodifiableMap(r);

        this.averageElevation = b.averageElevation;
        this.landCellCount = b.landCellCount;
        this.overallTemperature = b.overallTemperature;
        this.totalPrecipitationRange = b.totalPrecipitationRange;
        this.totalSnowfallRange = b.totalSnowfallRange;
        this.overallClassification = b.overallClassification;
        this.maxPrecipitation = b.maxPrecipitation;
    }

    private static FloatGrid freeze(FloatGrid g) {
        return g == null ? null : g.freeze();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String planetId() { return planetId; }
    public MapProjection projection() { return projection; }
    public int width() { return projection.width(); }
    public int height() { return projection.height(); }
    public int seasonCount() { return seasonCount; }
    public double maxElevation() { return maxElevation; }
    public double seaLevel() { return seaLevel; }
    public boolean hasHydrosphere() { return hydrosphere; }

    /** Normalized elevation, sea-level relative, in [-1, 1]. */
    public FloatGrid elevation() { return elevation; }
    public RangeGrid temperature() { return temperature; }
    /** Temperature at the northern winter solstice, K. */
    public FloatGrid winterTemperature() { return winterTemperature; }
    /** Temperature at the northern summer solstice, K. */
    public FloatGrid summerTemperature() { return summerTemperature; }
    public List<SeasonMaps> seasons() { return seasons; }
    /** Annual precipitation, mm: the sum of the season grids. */
    public FloatGrid totalPrecipitation() { return totalPrecipitation; }
    /** Mean of the season grids. */
    public FloatGrid averagePrecipitation() { return averagePrecipitation; }
    public FloatGrid totalSnowfall() { return totalSnowfall; }
    public HydrologyMaps hydrology() { return hydrology; }
    public EnumGrid<HumidityType> humidity() { return humidity; }
    public EnumGrid<ClimateType> climate() { return climate; }
    public EnumGrid<EcologyType> ecology() { return ecology; }
    public EnumGrid<BiomeType> biome() { return biome; }
    public CoverGrid seaIce() { return seaIce; }
    public CoverGrid snowCover() { return snowCover; }
    public Map<String, FloatGrid> resources() { return resources; }

    public double averageElevation() { return averageElevation; }
    public int landCellCount() { return landCellCount; }
    public TemperatureRange overallTemperature() { return overallTemperature; }
    public ValueRange totalPrecipitationRange() { return totalPrecipitationRange; }
    public ValueRange totalSnowfallRange() { return totalSnowfallRange; }
    public Classification overallClassification() { return overallClassification; }
    public double maxPrecipitation() { return maxPrecipitation; }

    /**
     * Temperature of season {@code index} at a cell, interpolated from the winter toward the
     * summer solstice value. Requires the solstice grids.
     */
    public double seasonTemperatureAt(int x, int y, int index) {
        if (winterTemperature == null || summerTemperature == null) {
            throw new IllegalStateException("No solstice temperature grids in " + this);
        }
        return TemperatureModel.seasonTemperature(winterTemperature.get(x, y), summerTemperature.get(x, y),
                index, seasonCount);
    }

    public double elevationMetersAt(int x, int y) {
        return elevation.get(x, y) * maxElevation;
    }

    /** Land iff above sea level; every cell is land on a body without a hydrosphere. */
    public boolean isLand(int x, int y) {
        return !hydrosphere || elevationMetersAt(x, y) > 0;
    }

    /** Share of the mapped surface that is land, weighted by cell area. */
    public double landFraction() {
        double land = 0;
        double total = 0;
        for (int y = 0; y < height(); y++) {
            double a = projection.cellArea(y, 1.0);
            for (int x = 0; x < width(); x++) {
                total += a;
                if (isLand(x, y)) land += a;
            }
        }
        return total == 0 ? 0 : land / total;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SurfaceMaps)) return false;
        SurfaceMaps that = (SurfaceMaps) o;
        return seasonCount == that.seasonCount
                && Double.compare(maxElevation, that.maxElevation) == 0
                && Double.compare(seaLevel, that.seaLevel) == 0
                && hydrosphere == that.hydrosphere
                && Double.compare(averageElevation, that.averageElevation) == 0
                && landCellCount == that.landCellCount
                && Double.compare(maxPrecipitation, that.maxPrecipitation) == 0
                && Objects.equals(planetId, that.planetId)
                && projection.equals(that.projection)
                && elevation.equals(that.elevation)
                && Objects.equals(temperature, that.temperature)
                && Objects.equals(winterTemperature, that.winterTemperature)
                && Objects.equals(summerTemperature, that.summerTemperature)
                && Objects.equals(hydrology, that.hydrology)
                && seasons.equals(that.seasons)
                && Objects.equals(totalPrecipitation, that.totalPrecipitation)
                && Objects.equals(averagePrecipitation, that.averagePrecipitation)
                && Objects.equals(totalSnowfall, that.totalSnowfall)
                && Objects.equals(humidity, that.humidity)
                && Objects.equals(climate, that.climate)
                && Objects.equals(ecology, that.ecology)
                && Objects.equals(biome, that.biome)
                && Objects.equals(seaIce, that.seaIce)
                && Objects.equals(snowCover, that.snowCover)
                && resources.equals(that.resources)
                && Objects.equals(overallTemperature, that.overallTemperature)
                && Objects.equals(totalPrecipitationRange, that.totalPrecipitationRange)
                && Objects.equals(totalSnowfallRange, that.totalSnowfallRange)
                && Objects.equals(overallClassification, that.overallClassification);
    }

    @Override
    public int hashCode() {
        return Objects.hash(planetId, projection, seasonCount, elevation, temperature, seasons, totalPrecipitation);
    }

    @Override
    public String toString() {
        return "SurfaceMaps{" + planetId + ", " + projection + ", seasons=" + seasonCount + "}";
    }

    public static final class Builder {
        private String planetId;
        private MapProjection projection;
        private int seasonCount;
        private double maxElevation;
        private double seaLevel;
        private boolean hydrosphere;

        private FloatGrid elevation;
        private RangeGrid temperature;
        private FloatGrid winterTemperature;
        private FloatGrid summerTemperature;
        private HydrologyMaps hydrology;
        private final List<SeasonMaps> seasons = new ArrayList<>();
        private FloatGrid totalPrecipitation;
        private FloatGrid averagePrecipitation;
        private FloatGrid totalSnowfall;
        private EnumGrid<HumidityType> humidity;
        private EnumGrid<ClimateType> climate;
        private EnumGrid<EcologyType> ecology;
        private EnumGrid<BiomeType> biome;
        private CoverGrid seaIce;
        private CoverGrid snowCover;
        private final Map<String, FloatGrid> resources = new TreeMap<>();

        private double averageElevation;
        private int landCellCount;
        private TemperatureRange overallTemperature;
        private ValueRange totalPrecipitationRange;
        private ValueRange totalSnowfallRange;
        private Classification overallClassification;
        private double maxPrecipitation;

        private Builder() {}

        public Builder planetId(String v) { this.planetId = v; return this; }
        public Builder projection(MapProjection v) { this.projection = v; return this; }
        public Builder seasonCount(int v) { this.seasonCount = v; return this; }
        public Builder maxElevation(double v) { this.maxElevation = v; return this; }
        public Builder seaLevel(double v) { this.seaLevel = v; return this; }
        public Builder hydrosphere(boolean v) { this.hydrosphere = v; return this; }
        public Builder elevation(FloatGrid v) { this.elevation = v; return this; }
        public Builder temperature(RangeGrid v) { this.temperature = v; return this; }
        public Builder winterTemperature(FloatGrid v) { this.winterTemperature = v; return this; }
        public Builder summerTemperature(FloatGrid v) { this.summerTemperature = v; return this; }
        public Builder hydrology(HydrologyMaps v) { this.hydrology = v; return this; }
        public Builder season(SeasonMaps v) { this.seasons.add(v); return this; }
        public Builder seasons(List<SeasonMaps> v) { this.seasons.clear(); this.seasons.addAll(v); return this; }
        public Builder totalPrecipitation(FloatGrid v) { this.totalPrecipitation = v; return this; }
        public Builder averagePrecipitation(FloatGrid v) { this.averagePrecipitation = v; return this; }
        public Builder totalSnowfall(FloatGrid v) { this.totalSnowfall = v; return this; }
        public Builder humidity(EnumGrid<HumidityType> v) { this.humidity = v; return this; }
        public Builder climate(EnumGrid<ClimateType> v) { this.climate = v; return this; }
        public Builder ecology(EnumGrid<EcologyType> v) { this.ecology = v; return this; }
        public Builder biome(EnumGrid<BiomeType> v) { this.biome = v; return this; }
        public Builder seaIce(CoverGrid v) { this.seaIce = v; return this; }
        public Builder snowCover(CoverGrid v) { this.snowCover = v; return this; }
        public Builder resource(String name, FloatGrid v) { this.resources.put(name, v); return this; }
        public Builder averageElevation(double v) { this.averageElevation = v; return this; }
        public Builder landCellCount(int v) { this.landCellCount = v; return this; }
        public Builder overallTemperature(TemperatureRange v) { this.overallTemperature = v; return this; }
        public Builder totalPrecipitationRange(ValueRange v) { this.totalPrecipitationRange = v; return this; }
        public Builder totalSnowfallRange(ValueRange v) { this.totalSnowfallRange = v; return this; }
        public Builder overallClassification(Classification v) { this.overallClassification = v; return this; }
        public Builder maxPrecipitation(double v) { this.maxPrecipitation = v; return this; }

        public SurfaceMaps build() {
            if (seasons.size() != seasonCount && !seasons.isEmpty()) {
                throw new IllegalArgumentException("seasonCount=" + seasonCount + " but " + seasons.size() + " season grids");
            }
            return new SurfaceMaps(this);
        }
    }
}
