package com.egressoptimizer.cost;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Region code to pricing zone table.
 *
 * PRICING MODEL:
 * Each zone holds brackets with cumulative limits (first 10 TB, up to 50 TB,
 * up to 150 TB, beyond). Regions not in the map, and a null region, are priced
 * with the {@value #DEFAULT_ZONE} zone.
 *
 * Validated on construction; an invalid table raises {@link PricingConfigurationException}.
 */
public final class RegionPricing {

    public static final String DEFAULT_ZONE = "default";
    public static final String UNKNOWN_REGION = "unknown";

    private static final double TB = 1024;

    private final Map<String, PricingZone> zones;
    private final Map<String, String> regionMap;

    public RegionPricing(Map<String, PricingZone> zones, Map<String, String> regionMap) {
        if (zones == null || zones.isEmpty()) {
            throw new PricingConfigurationException("No pricing zones configured");
        }
        if (!zones.containsKey(DEFAULT_ZONE)) {
            throw new PricingConfigurationException("Missing '" + DEFAULT_ZONE + "' pricing zone");
        }
        zones.forEach(RegionPricing::validateZone);

        Map<String, String> normalized = new LinkedHashMap<>();
        if (regionMap != null) {
            regionMap.forEach((region, zone) -> {
                if (!zones.containsKey(zone)) {
                    throw new PricingConfigurationException(
                            "Region '" + region + "' mapped to unknown pricing zone '" + zone + "'");
                }
                normalized.put(region.toLowerCase(Locale.ROOT), zone);
            });
        }

        this.zones = Map.copyOf(zones);
        this.regionMap = Map.copyOf(normalized);
    }

    /**
     * Azure egress list prices, in USD per GB.
     */
    public static RegionPricing defaults() {
        Map<String, PricingZone> zones = new LinkedHashMap<>();
        zones.put("zone1", new PricingZone("North America & Europe", List.of(
                new PricingTier(10 * TB, 0.087),
                new PricingTier(50 * TB, 0.083),
                new PricingTier(150 * TB, 0.07),
                PricingTier.unbounded(0.05))));
        zones.put("zone2", new PricingZone("Asia Pacific", List.of(
                new PricingTier(10 * TB, 0.12),
                new PricingTier(50 * TB, 0.11),
                new PricingTier(150 * TB, 0.08),
                PricingTier.unbounded(0.06))));
        zones.put("zone3", new PricingZone("Brazil, South America", List.of(
                new PricingTier(10 * TB, 0.181),
                new PricingTier(50 * TB, 0.175),
                new PricingTier(150 * TB, 0.17),
                PricingTier.unbounded(0.16))));
        zones.put(DEFAULT_ZONE, new PricingZone("Default", List.of(PricingTier.unbounded(0.087))));

        return new RegionPricing(zones, defaultRegionMap());
    }

    public static Map<String, String> defaultRegionMap() {
        Map<String, String> map = new LinkedHashMap<>();
        for (String region : List.of("eastus", "eastus2", "westus", "westus2", "centralus", "northcentralus",
                "southcentralus", "westcentralus", "canadacentral", "canadaeast", "northeurope", "westeurope",
                "uksouth", "ukwest", "francecentral", "francesouth", "germanywestcentral", "germanynorth")) {
            map.put(region, "zone1");
        }
        for (String region : List.of("eastasia", "southeastasia", "australiaeast", "australiasoutheast",
                "australiacentral", "japaneast", "japanwest", "koreacentral", "koreasouth", "centralindia",
                "southindia", "westindia")) {
            map.put(region, "zone2");
        }
        map.put("brazilsouth", "zone3");
        map.put("brazilsoutheast", "zone3");
        map.put(UNKNOWN_REGION, DEFAULT_ZONE);
        return map;
    }

    public String zoneFor(String region) {
        String normalized = region != null ? region.toLowerCase(Locale.ROOT) : UNKNOWN_REGION;
        return regionMap.getOrDefault(normalized, DEFAULT_ZONE);
    }

    public double cost(double gb, String region) {
        return zones.get(zoneFor(region)).cost(gb);
    }

    public Map<String, PricingZone> getZones() {
        return zones;
    }

    public Map<String, String> getRegionMap() {
        return regionMap;
    }

    private static void validateZone(String zoneId, PricingZone zone) {
        if (zone == null || zone.tiers().isEmpty()) {
            throw new PricingConfigurationException("Pricing zone '" + zoneId + "' has no tiers");
        }
        double previousLimit = 0;
        List<PricingTier> tiers = zone.tiers();
        for (int i = 0; i < tiers.size(); i++) {
            PricingTier tier = tiers.get(i);
            if (tier.pricePerGb() < 0 || Double.isNaN(tier.pricePerGb())) {
                throw new PricingConfigurationException(
                        "Pricing zone '" + zoneId + "' has a negative price in tier " + (i + 1));
            }
            if (!(tier.limitGb() > previousLimit)) {
                throw new PricingConfigurationException(
                        "Pricing zone '" + zoneId + "' tier limits must be strictly increasing");
            }
            previousLimit = tier.limitGb();
        }
        if (!tiers.get(tiers.size() - 1).isUnbounded()) {
            throw new PricingConfigurationException(
                    "Pricing zone '" + zoneId + "' must end with an unbounded tier");
        }
    }
}
