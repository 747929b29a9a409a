/*
 * Click nbfs://nbhost/SystemFileSystem/Templates/Licenses/license-default.txt to change this license
 * Click nbfs://nbhost/SystemFileSystem/Templates/Classes/Interface.java to edit this template
 */
package com.clustercost.metrics;

/**
 *
 * @author rachanakeshav
 */
public interface MetricSink {

    /** Best effort: never throws, a failed push is simply missing from the next scrape. */
    void emit(String name, double value);
}
