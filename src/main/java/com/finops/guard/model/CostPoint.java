package com.finops.guard.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class CostPoint {

    LocalDate day;
    String account;
    String service;
    String tag;
    double costUsd;

    public String getDimension() {
        return Dimension.key(account, service);
    }
}
