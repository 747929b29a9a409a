/*
 * Click nbfs://nbhost/SystemFileSystem/Templates/Licenses/license-default.txt to change this license
 * Click nbfs://nbhost/SystemFileSystem/Templates/Classes/Class.java to edit this template
 */
package com.clustercost.pricing;

/**
 *
 * @author rachanakeshav
 */
import com.amazonaws.services.pricing.AWSPricing;
import com.amazonaws.services.pricing.AWSPricingClientBuilder;
import com.amazonaws.services.pricing.model.Filter;
import com.amazonaws.services.pricing.model.FilterType;
import com.amazonaws.services.pricing.model.GetProductsRequest;
import com.amazonaws.services.pricing.model.GetProductsResult;
import com.clustercost.pricing.PricingModels.PriceKey;
import com.clustercost.pricing.PricingModels.PriceLookup;
import com.clustercost.pricing.PricingModels.ResourceKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

public class AwsPricingProvider implements PricingProvider {

  static final String SERVICE_CODE = "AmazonEC2";

  private final AWSPricing pricing;
  private final ObjectMapper mapper = new ObjectMapper();
  private final String capacityStatus;

  public AwsPricingProvider(AWSPricing pricing, String capacityStatus) {
    this.pricing = pricing;
    this.capacityStatus = capacityStatus;
  }

  // The Price List API is only served from a few regions (us-east-1, ap-south-1, eu-central-1)
  public static AwsPricingProvider create(String endpointRegion, String capacityStatus) {
    AWSPricing client = AWSPricingClientBuilder.standard()
        .withRegion(endpointRegion)
        .build();
    return new AwsPricingProvider(client, capacityStatus);
  }

  @Override
  public String name() {
    return "aws-pricing";
  }

  @Override
  public PriceLookup fetch(PriceKey key) {
    try {
      GetProductsRequest req = new GetProductsRequest()
          .withServiceCode(SERVICE_CODE)
          .withFilters(filtersFor(key, capacityStatus))
          .withMaxResults(1);

      GetProductsResult resp = pricing.getProducts(req);
      List<String> priceList = resp.getPriceList();
      if (priceList == null || priceList.isEmpty()) {
        return PriceLookup.unavailable("no products for " + key.canonical());
      }
      return parseOnDemandUsd(mapper, priceList.get(0));
    } catch (Exception e) {
      return PriceLookup.unavailable("aws pricing error: " + e.getMessage());
    }
  }

  static List<Filter> filtersFor(PriceKey key, String capacityStatus) {
    List<Filter> filters = new ArrayList<>();
    if (key.kind() == ResourceKind.COMPUTE) {
      filters.add(term("instanceType", key.typeId()));
      filters.add(term("location", key.region()));
      filters.add(term("preInstalledSw", "NA"));
      filters.add(term("operatingSystem", "Linux"));
      filters.add(term("tenancy", "Shared"));
      if (capacityStatus != null && !capacityStatus.isBlank()) {
        filters.add(term("capacitystatus", capacityStatus));
      }
    } else {
      filters.add(term("location", key.region()));
      filters.add(term("productFamily", "Storage"));
      filters.add(term("volumeApiName", key.typeId()));
    }
    return filters;
  }

  /**
   * Reads terms.OnDemand.{first}.priceDimensions.{first}.pricePerUnit.USD out of one
   * price list document.
   */
  static PriceLookup parseOnDemandUsd(ObjectMapper mapper, String priceDocument) {
    try {
      JsonNode root = mapper.readTree(priceDocument);
      JsonNode term = first(root.path("terms").path("OnDemand"));
      if (term == null) {
        return PriceLookup.unavailable("no on-demand term");
      }
      JsonNode dimension = first(term.path("priceDimensions"));
      if (dimension == null) {
        return PriceLookup.unavailable("no price dimension");
      }
      JsonNode usd = dimension.path("pricePerUnit").path("USD");
      if (usd.isMissingNode() || usd.isNull()) {
        return PriceLookup.unavailable("no USD price");
      }
      // the catalog sends prices as strings, e.g. "0.0960000000"
      return PriceLookup.ok(Double.parseDouble(usd.asText()));
    } catch (Exception e) {
      return PriceLookup.unavailable("parse error: " + e.getMessage());
    }
  }

  private static JsonNode first(JsonNode obj) {
    if (obj == null || !obj.isObject() || obj.size() == 0) return null;
    Iterator<JsonNode> it = obj.elements();
    return it.hasNext() ? it.next() : null;
  }

  private static Filter term(String field, String value) {
    return new Filter().withType(FilterType.TERM_MATCH).withField(field).withValue(value);
  }
}
