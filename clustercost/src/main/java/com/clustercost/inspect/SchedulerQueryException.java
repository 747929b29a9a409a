/*
 * Click nbfs://nbhost/SystemFileSystem/Templates/Licenses/license-default.txt to change this license
 * Click nbfs://nbhost/SystemFileSystem/Templates/Classes/Class.java to edit this template
 */
package com.clustercost.inspect;

import java.io.IOException;

public class SchedulerQueryException extends IOException {

    public SchedulerQueryException(String message) {
        super(message);
    }

    public SchedulerQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
