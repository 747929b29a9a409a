/*
 * Click nbfs://nbhost/SystemFileSystem/Templates/Licenses/license-default.txt to change this license
 * Click nbfs://nbhost/SystemFileSystem/Templates/Classes/Interface.java to edit this template
 */
package com.clustercost.inspect;

/**
 *
 * @author rachanakeshav
 */
import java.util.List;

public interface SchedulerClient {

    /** Header-free node-state lines for one partition. */
    List<String> partitionStatus(String partition) throws SchedulerQueryException;
}
