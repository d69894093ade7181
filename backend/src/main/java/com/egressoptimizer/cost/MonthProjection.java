package com.egressoptimizer.cost;

public record MonthProjection(int month, double egressGb, double cost, double cumulativeCost) {}
