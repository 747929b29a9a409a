/*
 * Click nbfs://nbhost/SystemFileSystem/Templates/Licenses/license-default.txt to change this license
 * Click nbfs://nbhost/SystemFileSystem/Templates/Classes/Interface.java to edit this template
 */
package com.clustercost.pricing;

/**
 *
 * @author rachanakeshav
 */

import com.clustercost.pricing.PricingModels.PriceKey;
import com.clustercost.pricing.PricingModels.PriceLookup;

public interface PricingProvider {
  String name();
  // Never throws; failures come back as PriceLookup.unavailable
  PriceLookup fetch(PriceKey key);
}
