/*
 * Click nbfs://nbhost/SystemFileSystem/Templates/Licenses/license-default.txt to change this license
 * Click nbfs://nbhost/SystemFileSystem/Templates/Classes/Class.java to edit this template
 */
package com.clustercost.pricing;

/**
 *
 * @author rachanakeshav
 */
import java.util.Locale;
import java.util.Objects;

public final class PricingModels {

  private PricingModels() {
  }

  public enum ResourceKind {
    COMPUTE,   // USD per hour
    STORAGE    // USD per GB-month
  }

  // Cache key and catalog query in one
  public record PriceKey(ResourceKind kind, String typeId, String region) {

    public PriceKey {
      Objects.requireNonNull(kind, "kind");
      typeId = Objects.requireNonNull(typeId, "typeId").trim();
      region = Objects.requireNonNull(region, "region").trim();
    }

    public static PriceKey compute(String instanceType, String region) {
      return new PriceKey(ResourceKind.COMPUTE, instanceType, region);
    }

    public static PriceKey storage(String volumeType, String region) {
      return new PriceKey(ResourceKind.STORAGE, volumeType, region);
    }

    /** Stable string form used by durable stores: {@code kind|typeId|region}. */
    public String canonical() {
      return kind.name().toLowerCase(Locale.ROOT) + "|" + typeId + "|" + region;
    }
  }

  // Resolver reply. price is 0.0 whenever available is false.
  public record PriceLookup(
      double price,
      boolean available,
      String note
  ) {

    public static PriceLookup ok(double price) {
      if (!Double.isFinite(price) || price < 0.0) {
        return unavailable("invalid price " + price);
      }
      return new PriceLookup(price, true, "ok");
    }

    public static PriceLookup cached(double price) {
      return new PriceLookup(Math.max(0.0, price), true, "cached");
    }

    public static PriceLookup unavailable(String note) {
      return new PriceLookup(0.0, false, note);
    }
  }
}
