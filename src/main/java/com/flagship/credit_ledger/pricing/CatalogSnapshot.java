package com.flagship.credit_ledger.pricing;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable view of the whole catalog at one version.
 */
@Value
public class CatalogSnapshot {
    long version;
    Map<String, PackagePrice> packages;

    public static CatalogSnapshot of(long version, List<PackagePrice> prices) {
        List<PackagePrice> sorted = new ArrayList<>(prices);
        sorted.sort(Comparator.comparingInt(PackagePrice::getSortOrder).thenComparing(PackagePrice::getPackageId));

        Map<String, PackagePrice> byId = new LinkedHashMap<>();
        for (PackagePrice price : sorted) {
            if (byId.putIfAbsent(price.getPackageId(), price) != null) {
                throw new IllegalArgumentException("Duplicate package id " + price.getPackageId());
            }
        }
        return new CatalogSnapshot(version, Collections.unmodifiableMap(byId));
    }

    /**
     * @throws UnknownPackageException if the package is not in this snapshot
     */
    public PackagePrice price(String packageId) {
        PackagePrice price = packageId == null ? null : packages.get(packageId);
        if (price == null) {
            throw new UnknownPackageException(packageId);
        }
        return price;
    }

    public List<PackagePrice> list() {
        return List.copyOf(packages.values());
    }
}
