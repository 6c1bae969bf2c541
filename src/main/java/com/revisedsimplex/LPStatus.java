package com.revisedsimplex;

/** Lifecycle of a solve. Infeasible and unbounded are answers, not errors. */
public enum LPStatus { RUNNING, OPTIMAL, UNBOUNDED, INFEASIBLE }
