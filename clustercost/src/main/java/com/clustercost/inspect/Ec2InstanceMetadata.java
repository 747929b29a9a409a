/*
 * Click nbfs://nbhost/SystemFileSystem/Templates/Licenses/license-default.txt to change this license
 * Click nbfs://nbhost/SystemFileSystem/Templates/Classes/Class.java to edit this template
 */
package com.clustercost.inspect;

/**
 *
 * @author rachanakeshav
 */
import com.amazonaws.util.EC2MetadataUtils;

/**
 * Reads the current host's identity from the EC2 instance metadata service.
 */
public class Ec2InstanceMetadata implements InstanceMetadata {

    @Override
    public String instanceId() {
        return required("instance-id", EC2MetadataUtils.getInstanceId());
    }

    @Override
    public String instanceType() {
        return required("instance-type", EC2MetadataUtils.getInstanceType());
    }

    private static String required(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Instance metadata returned no " + field);
        }
        return value;
    }
}
